package com.example.registryexport.listener;

import com.example.registryexport.model.RunStatus;
import com.example.registryexport.tasklet.ExportTasklet;
import com.example.registryexport.writer.JsonDocumentWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobExecutionListener;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

/** Records the outcome of every run in {@code status.json}. */
@Slf4j
public class RunStatusListener implements JobExecutionListener {

    private final Path statusFile;
    private final JsonDocumentWriter jsonWriter;

    public RunStatusListener(Path statusFile, JsonDocumentWriter jsonWriter) {
        this.statusFile = statusFile;
        this.jsonWriter = jsonWriter;
    }

    @Override
    public void beforeJob(JobExecution jobExecution) {
        log.info("Starting {} (execution {})", jobExecution.getJobInstance().getJobName(), jobExecution.getId());
    }

    @Override
    public void afterJob(JobExecution jobExecution) {
        String status;
        String message;
        if (jobExecution.getStatus() == BatchStatus.COMPLETED) {
            status = RunStatus.SUCCESS;
            message = jobExecution.getExecutionContext().getString(ExportTasklet.SUMMARY_KEY, "Data fetch completed");
        } else {
            status = RunStatus.FAILURE;
            List<Throwable> failures = jobExecution.getAllFailureExceptions();
            message = failures.isEmpty()
                    ? "Job ended with status " + jobExecution.getStatus()
                    : failures.get(0).getMessage();
        }
        try {
            jsonWriter.writeStatus(statusFile, status, message);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write " + statusFile, e);
        }
    }
}
