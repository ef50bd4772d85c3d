package com.example.registryexport.runner;

import com.example.registryexport.tasklet.ExportTasklet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.ExitStatus;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobParameters;
import org.springframework.batch.core.JobParametersBuilder;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

import java.util.Date;

/**
 * Runs the registry export once on start-up and exits with 0 when the job
 * completed, 1 otherwise.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.runner.enabled", havingValue = "true", matchIfMissing = true)
public class JobRunner implements CommandLineRunner, ExitCodeGenerator {

    private final JobLauncher jobLauncher;
    private final Job registryExportJob;
    private final ApplicationContext applicationContext;
    private int exitCode = 0;

    @Autowired
    public JobRunner(JobLauncher jobLauncher, Job registryExportJob, ApplicationContext applicationContext) {
        this.jobLauncher = jobLauncher;
        this.registryExportJob = registryExportJob;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(String... args) {
        exitCode = launch();
        log.info("Shutting down with exit code {}", exitCode);
        System.exit(SpringApplication.exit(applicationContext, this));
    }

    /** Launches the job and maps its outcome to a process exit code. */
    int launch() {
        JobParameters parameters = new JobParametersBuilder()
                .addDate("startTime", new Date())
                .toJobParameters();
        JobExecution execution;
        try {
            execution = jobLauncher.run(registryExportJob, parameters);
        } catch (Exception e) {
            log.error("Could not launch {}", registryExportJob.getName(), e);
            return 1;
        }

        String summary = execution.getExecutionContext().getString(ExportTasklet.SUMMARY_KEY, "");
        if (ExitStatus.COMPLETED.getExitCode().equals(execution.getExitStatus().getExitCode())) {
            log.info("Registry export completed: {}", summary.isEmpty() ? "no summary recorded" : summary);
            return 0;
        }
        log.error("Registry export ended with {}", execution.getExitStatus().getExitCode());
        for (Throwable failure : execution.getAllFailureExceptions()) {
            log.error("Failure: {}", failure.getMessage());
        }
        return 1;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
