package com.poolintel.schedule.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;
import com.poolintel.schedule.config.ReconcilerProperties;
import com.poolintel.schedule.model.RawCourseRecord;
import com.poolintel.schedule.model.RunParameters;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringReader;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Bulk "drop-in programs" dump joined to the "locations" dump by location id.
 *
 * Both dumps may be CSV (header row first), an XLSX workbook (first sheet, header row first)
 * or a JSON array of objects, optionally wrapped in a {"result": {"records": [...]}} envelope. Column names vary between releases and
 * are resolved through {@link FieldSynonyms}.
 *
 * A failed locations dump is counted but does not stop program parsing: records then carry
 * only the location fields present on the program row.
 */
@Component
@Order(1)
@Slf4j
@RequiredArgsConstructor
public class TabularDumpAdapter extends AbstractSourceAdapter {

    static final String SOURCE = "tabular-dump";

    private final UpstreamClient client;
    private final ObjectMapper objectMapper;
    private final ReconcilerProperties properties;

    @Override
    public String name() {
        return SOURCE;
    }

    @Override
    public boolean isEnabled() {
        ReconcilerProperties.Sources.Tabular tabular = properties.getSources().getTabular();
        return tabular.isEnabled() && tabular.getProgramsUrl() != null && !tabular.getProgramsUrl().isBlank();
    }

    @Override
    protected List<RawCourseRecord> doFetch(RunParameters parameters) throws IOException {
        ReconcilerProperties.Sources.Tabular tabular = properties.getSources().getTabular();

        Map<String, RecordAccessor> locations = Map.of();
        if (tabular.getLocationsUrl() != null && !tabular.getLocationsUrl().isBlank()) {
            try {
                locations = indexLocations(load(tabular.getLocationsUrl()));
                log.info("Indexed {} locations", locations.size());
            } catch (IOException e) {
                recordFailure("locations dump", e);
            }
        }

        List<RecordAccessor> programs = load(tabular.getProgramsUrl());
        log.info("Fetched {} program rows", programs.size());

        List<RawCourseRecord> records = new ArrayList<>(programs.size());
        for (RecordAccessor program : programs) {
            RawCourseRecord record = toRecord(program, locations, tabular.getProgramsUrl());
            if (record != null) records.add(record);
        }
        return records;
    }

    // ── Mapping ──────────────────────────────────────────────────────────────

    RawCourseRecord toRecord(RecordAccessor program, Map<String, RecordAccessor> locations, String sourceUrl) {
        String title = program.get(FieldSynonyms.COURSE_TITLE);
        if (title == null) {
            log.debug("Skipping program row without a title");
            return null;
        }

        String locationId = program.get(FieldSynonyms.LOCATION_ID);
        RecordAccessor location = locationId != null ? locations.get(locationId) : null;

        String locationName = program.get(FieldSynonyms.LOCATION_NAME);
        String address = program.get(FieldSynonyms.ADDRESS);
        String postalCode = program.get(FieldSynonyms.POSTAL_CODE);
        if (location != null) {
            locationName = firstNonNull(location.get(FieldSynonyms.LOCATION_NAME), locationName);
            address = firstNonNull(location.get(FieldSynonyms.ADDRESS), address);
            postalCode = firstNonNull(location.get(FieldSynonyms.POSTAL_CODE), postalCode);
        }

        String category = program.get(FieldSynonyms.CATEGORY);
        String ageText = ageText(program.get(FieldSynonyms.AGE_MIN), program.get(FieldSynonyms.AGE_MAX));

        return RawCourseRecord.builder()
                .title(title)
                .category(category)
                .ageText(ageText)
                .scheduleText(program.get(FieldSynonyms.SCHEDULE))
                .startTimeText(program.get(FieldSynonyms.START_TIME))
                .endTimeText(program.get(FieldSynonyms.END_TIME))
                .startDateText(program.get(FieldSynonyms.START_DATE))
                .endDateText(program.get(FieldSynonyms.END_DATE))
                .locationId(locationId)
                .locationName(locationName)
                .address(address)
                .postalCode(postalCode)
                .notes(notes(ageText, category))
                .source(SOURCE)
                .sourceUrl(sourceUrl)
                .build();
    }

    static String ageText(String min, String max) {
        if (min == null && max == null) return null;
        String lower = min == null ? "" : min;
        return max != null ? "Age: " + lower + "-" + max : "Age: " + lower + "+";
    }

    static String notes(String ageText, String category) {
        List<String> parts = new ArrayList<>();
        if (ageText != null) parts.add(ageText);
        if (category != null) parts.add("Category: " + category);
        return parts.isEmpty() ? null : String.join("; ", parts);
    }

    private static Map<String, RecordAccessor> indexLocations(List<RecordAccessor> rows) {
        Map<String, RecordAccessor> index = new HashMap<>();
        for (RecordAccessor row : rows) {
            String id = row.get(FieldSynonyms.LOCATION_ID);
            if (id != null) index.put(id, row);
        }
        return index;
    }

    // ── Payload parsing ──────────────────────────────────────────────────────

    private List<RecordAccessor> load(String url) throws IOException {
        byte[] payload = client.fetchBytes(url);
        if (isWorkbook(url, payload)) {
            log.debug("Reading {} as an XLSX workbook", url);
            return parseWorkbook(payload);
        }
        return parse(PayloadDecoder.decode(payload));
    }

    /** XLSX is a ZIP container, so the local file header magic is enough to tell it from text. */
    static boolean isWorkbook(String url, byte[] payload) {
        if (payload.length >= 4 && payload[0] == 0x50 && payload[1] == 0x4B && payload[2] == 0x03 && payload[3] == 0x04) {
            return true;
        }
        int query = url.indexOf('?');
        String path = query >= 0 ? url.substring(0, query) : url;
        return path.toLowerCase(Locale.ROOT).endsWith(".xlsx");
    }

    List<RecordAccessor> parse(String payload) throws IOException {
        String trimmed = payload.stripLeading();
        if (trimmed.startsWith("[") || trimmed.startsWith("{")) {
            return parseJson(trimmed);
        }
        return parseCsv(payload);
    }

    private List<RecordAccessor> parseJson(String payload) throws IOException {
        JsonNode root = objectMapper.readTree(payload);
        JsonNode rows = root;
        if (root.isObject()) {
            rows = root.path("result").path("records");
            if (rows.isMissingNode()) rows = root.path("records");
        }
        List<RecordAccessor> records = new ArrayList<>();
        for (JsonNode row : rows) {
            if (row.isObject()) records.add(new JsonRecordAccessor(row));
        }
        return records;
    }

    private List<RecordAccessor> parseCsv(String payload) throws IOException {
        List<RecordAccessor> records = new ArrayList<>();
        int malformed = 0;

        try (CSVReader reader = new CSVReaderBuilder(new StringReader(payload)).build()) {
            String[] header = reader.readNext();
            if (header == null) return records;
            for (int i = 0; i < header.length; i++) {
                header[i] = header[i].replace("\uFEFF", "").trim();
            }

            String[] cols;
            while ((cols = reader.readNext()) != null) {
                if (cols.length == 1 && cols[0].isBlank()) continue;
                if (cols.length != header.length) {
                    malformed++;
                    continue;
                }
                Map<String, String> row = new LinkedHashMap<>();
                for (int i = 0; i < header.length; i++) {
                    row.put(header[i], cols[i]);
                }
                records.add(new MapRecordAccessor(row));
            }
        } catch (CsvValidationException e) {
            throw new IOException("Malformed CSV payload: " + e.getMessage(), e);
        }

        if (malformed > 0) {
            log.warn("Skipped {} malformed CSV rows", malformed);
        }
        return records;
    }

    List<RecordAccessor> parseWorkbook(byte[] payload) throws IOException {
        List<RecordAccessor> records = new ArrayList<>();
        DataFormatter formatter = new DataFormatter();

        try (Workbook workbook = new XSSFWorkbook(new ByteArrayInputStream(payload))) {
            if (workbook.getNumberOfSheets() == 0) return records;
            Sheet sheet = workbook.getSheetAt(0);
            Row headerRow = sheet.getRow(sheet.getFirstRowNum());
            if (headerRow == null) return records;

            String[] header = new String[Math.max(headerRow.getLastCellNum(), 0)];
            for (int i = 0; i < header.length; i++) {
                header[i] = cellText(headerRow.getCell(i), formatter).replace("\uFEFF", "").trim();
            }

            for (int r = sheet.getFirstRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                if (row == null) continue;
                Map<String, String> values = new LinkedHashMap<>();
                boolean blank = true;
                for (int i = 0; i < header.length; i++) {
                    if (header[i].isEmpty()) continue;
                    String value = cellText(row.getCell(i), formatter);
                    if (!value.isBlank()) blank = false;
                    values.put(header[i], value);
                }
                if (!blank) records.add(new MapRecordAccessor(values));
            }
        } catch (RuntimeException e) {
            // POI reports a corrupt or non-OOXML container with unchecked exceptions
            throw new IOException("Malformed XLSX payload: " + e.getMessage(), e);
        }
        return records;
    }

    /** Date cells render as ISO dates, or as HH:mm when they hold only a time of day. */
    private static String cellText(Cell cell, DataFormatter formatter) {
        if (cell == null) return "";
        if (cell.getCellType() == CellType.NUMERIC && DateUtil.isCellDateFormatted(cell)) {
            LocalDateTime value = cell.getLocalDateTimeCellValue();
            return cell.getNumericCellValue() < 1 ? value.toLocalTime().toString() : value.toLocalDate().toString();
        }
        return formatter.formatCellValue(cell).trim();
    }

    private static String firstNonNull(String a, String b) {
        return a != null ? a : b;
    }
}
