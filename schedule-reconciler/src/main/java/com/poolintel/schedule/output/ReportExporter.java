package com.poolintel.schedule.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.poolintel.schedule.config.ReconcilerProperties;
import com.poolintel.schedule.model.RefreshReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.format.DateTimeFormatter;

/**
 * Serialises the run report to {reportDir}/refresh_report_{yyyyMMdd_HHmmss}.json.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ReportExporter {

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ObjectMapper objectMapper;
    private final ReconcilerProperties properties;

    public Path export(RefreshReport report) {
        Path dir = Paths.get(properties.getOutput().getReportDir());
        Path path = dir.resolve("refresh_report_" + report.getGeneratedAt().format(STAMP) + ".json");
        try {
            Files.createDirectories(dir);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), report);
            log.info("Report exported to {}", path);
            return path;
        } catch (IOException e) {
            throw new UncheckedIOException("Report export failed: " + path, e);
        }
    }
}
