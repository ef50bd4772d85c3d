package com.example.registryexport.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Contents of the {@code status.json} document written after every run. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"last_update", "status", "message"})
public class RunStatus {

    public static final String SUCCESS = "success";
    public static final String FAILURE = "failure";

    @JsonProperty("last_update")
    private String lastUpdate;
    private String status;
    private String message;
}
