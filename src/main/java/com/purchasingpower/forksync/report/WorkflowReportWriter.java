package com.purchasingpower.forksync.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.forksync.configuration.ForkSyncProperties;
import com.purchasingpower.forksync.exception.ForkSyncException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serializes run reports. JSON goes to stdout, logs go to stderr, so the two never mix.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WorkflowReportWriter {

    private final ObjectMapper reportObjectMapper;
    private final ForkSyncProperties props;

    public String toJson(Object report) {
        try {
            return reportObjectMapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new ForkSyncException("Failed to serialize report", e);
        }
    }

    /**
     * Print the report and, when {@code forksync.report-file} is set, write it there too.
     */
    public void publish(Object report, PrintStream out) {
        String json = toJson(report);
        out.println(json);
        out.flush();

        if (props.getReportFile() != null && !props.getReportFile().isBlank()) {
            Path file = Path.of(props.getReportFile());
            try {
                if (file.getParent() != null) {
                    Files.createDirectories(file.getParent());
                }
                Files.writeString(file, json, StandardCharsets.UTF_8);
                log.info("Report written to {}", file.toAbsolutePath());
            } catch (IOException e) {
                throw new ForkSyncException("Failed to write report to " + file, e);
            }
        }
    }
}
