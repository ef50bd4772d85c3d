package com.example.registryexport.config;

import com.example.registryexport.layout.FieldLayout;
import com.example.registryexport.layout.LayoutException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RegistryConfigTest {

    private final RegistryConfig config = new RegistryConfig();

    private static RegistryProperties.Column column(String name, int width) {
        RegistryProperties.Column column = new RegistryProperties.Column();
        column.setName(name);
        column.setWidth(width);
        return column;
    }

    @Test
    @DisplayName("should fall back to the cordata layout when no head fields are configured")
    void defaultLayout() {
        FieldLayout layout = config.fieldLayout(new RegistryProperties());

        assertThat(layout.totalWidth()).isEqualTo(1440);
        assertThat(layout.headEnd()).isEqualTo(668);
        assertThat(layout.maxOfficers()).isEqualTo(6);
    }

    @Test
    @DisplayName("should build the layout declared under app.layout")
    void configuredLayout() {
        RegistryProperties properties = new RegistryProperties();
        RegistryProperties.Layout declared = properties.getLayout();
        declared.setTotalWidth(60);
        declared.setMaxOfficers(2);
        declared.getHeadFields().add(column("documentNumber", 10));
        declared.getHeadFields().add(column("name", 20));
        declared.getOfficerFields().add(column("title", 4));
        declared.getOfficerFields().add(column("name", 10));

        FieldLayout layout = config.fieldLayout(properties);

        assertThat(layout.headEnd()).isEqualTo(30);
        assertThat(layout.strideWidth()).isEqualTo(14);
        assertThat(layout.officerOffset(1)).isEqualTo(44);
        assertThat(layout.offsetOf("name")).isEqualTo(10);
    }

    @Test
    @DisplayName("should reject a declared layout wider than its record")
    void overflowingLayout() {
        RegistryProperties properties = new RegistryProperties();
        properties.getLayout().setTotalWidth(20);
        properties.getLayout().setMaxOfficers(0);
        properties.getLayout().getHeadFields().add(column("name", 30));

        assertThatThrownBy(() -> config.fieldLayout(properties))
                .isInstanceOf(LayoutException.class);
    }
}
