package com.poolintel.schedule.output;

import com.opencsv.CSVWriter;
import com.poolintel.schedule.config.ReconcilerProperties;
import com.poolintel.schedule.model.CanonicalSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.util.List;

/**
 * Writes accepted sessions to CSV.
 *
 * Output path pattern: {outputDir}/sessions_{runDate}.csv
 * e.g. /data/output/sessions_2025-11-03.csv
 *
 * Columns mirror pool_intel.sessions, so a file can be loaded with
 *   INSERT INTO pool_intel.sessions FROM INFILE '...' FORMAT CSVWithNames
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SessionCsvWriter {

    private final ReconcilerProperties properties;

    static final String[] HEADERS = {
            "content_hash", "facility_id", "swim_type",
            "session_date", "start_time", "end_time",
            "program_name", "location_name", "notes",
            "source", "source_url", "match_confidence"
    };

    public Path write(List<CanonicalSession> sessions, LocalDate runDate) {
        Path outputDir = Paths.get(properties.getOutput().getCsv().getOutputDir());
        ensureDirectory(outputDir);

        Path outputPath = outputDir.resolve(String.format("sessions_%s.csv", runDate));

        try (Writer out = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(out,
                     CSVWriter.DEFAULT_SEPARATOR,
                     CSVWriter.DEFAULT_QUOTE_CHARACTER,
                     CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                     CSVWriter.DEFAULT_LINE_END)) {

            if (properties.getOutput().getCsv().isIncludeHeader()) {
                writer.writeNext(HEADERS);
            }
            for (CanonicalSession s : sessions) {
                writer.writeNext(toRow(s));
            }
            log.info("Written {} sessions to CSV: {}", sessions.size(), outputPath);
            return outputPath;

        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", outputPath, e.getMessage(), e);
            throw new UncheckedIOException("CSV write failed", e);
        }
    }

    private String[] toRow(CanonicalSession s) {
        return new String[]{
                str(s.getContentHash()),
                str(s.getFacilityId()),
                str(s.getSwimType()),
                str(s.getDate()),
                str(s.getStartTime()),
                str(s.getEndTime()),
                str(s.getProgramName()),
                str(s.getLocationName()),
                str(s.getNotes()),
                str(s.getSource()),
                str(s.getSourceUrl()),
                String.format("%.2f", s.getMatchConfidence())
        };
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create output directory: " + dir, e);
        }
    }
}
