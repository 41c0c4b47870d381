package com.insightreport.generator.service.profile;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.insightreport.generator.dto.report.StructuredInput;
import com.insightreport.generator.exception.ReportValidationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parses structured input blocks into flat key/value records.
 */
@Component
@Slf4j
public class InputNormalizer {

    private static final Pattern INTEGER = Pattern.compile("^[-+]?\\d{1,18}$");
    private static final Pattern DECIMAL = Pattern.compile("^[-+]?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][-+]?\\d+)?$");

    private final ObjectMapper objectMapper;
    private final CsvMapper csvMapper;

    public InputNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.csvMapper = CsvMapper.builder()
                .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
                .enable(CsvParser.Feature.TRIM_SPACES)
                .build();
    }

    /**
     * Parse one structured block. Malformed payloads are rejected as validation errors.
     */
    public List<Map<String, Object>> parse(StructuredInput input) {
        if (input.getFormat() == null || input.getData() == null || input.getData().isNull()) {
            throw new ReportValidationException("Structured input requires format and data");
        }
        return switch (input.getFormat()) {
            case JSON -> parseJson(input.getData());
            case CSV -> parseCsv(textOf(input.getData(), "csv"));
            case XLSX -> parseXlsx(textOf(input.getData(), "xlsx"), input.getSheetName());
        };
    }

    List<Map<String, Object>> parseJson(JsonNode data) {
        JsonNode array = data;
        if (data.isTextual()) {
            try {
                array = objectMapper.readTree(data.asText());
            } catch (JsonProcessingException e) {
                throw ReportValidationException.malformedInput("json", e);
            }
        }
        if (array == null || !array.isArray()) {
            throw new ReportValidationException("JSON input must be an array of objects");
        }

        List<Map<String, Object>> records = new ArrayList<>(array.size());
        for (JsonNode element : array) {
            if (!element.isObject()) {
                throw new ReportValidationException("JSON input must be an array of objects");
            }
            Map<String, Object> record = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = element.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                record.put(field.getKey(), jsonValue(field.getValue()));
            }
            records.add(record);
        }
        return records;
    }

    List<Map<String, Object>> parseCsv(String csv) {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<Map<String, Object>> records = new ArrayList<>();
        try (MappingIterator<Map<String, String>> rows = csvMapper.readerForMapOf(String.class)
                .with(schema)
                .readValues(csv)) {
            while (rows.hasNext()) {
                Map<String, String> row = rows.next();
                Map<String, Object> record = new LinkedHashMap<>();
                row.forEach((key, value) -> record.put(key, castCsvCell(value)));
                records.add(record);
            }
        } catch (IOException | RuntimeException e) {
            throw ReportValidationException.malformedInput("csv", e);
        }
        return records;
    }

    List<Map<String, Object>> parseXlsx(String base64, String sheetName) {
        byte[] bytes;
        try {
            bytes = Base64.getMimeDecoder().decode(base64);
        } catch (IllegalArgumentException e) {
            throw ReportValidationException.malformedInput("xlsx", e);
        }

        try (Workbook workbook = new XSSFWorkbook(new ByteArrayInputStream(bytes))) {
            Sheet sheet = sheetName != null ? workbook.getSheet(sheetName) : workbook.getSheetAt(0);
            if (sheet == null) {
                throw new ReportValidationException("Sheet not found: " + sheetName);
            }
            return readSheet(sheet);
        } catch (ReportValidationException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw ReportValidationException.malformedInput("xlsx", e);
        }
    }

    private List<Map<String, Object>> readSheet(Sheet sheet) {
        DataFormatter formatter = new DataFormatter();
        List<Map<String, Object>> records = new ArrayList<>();
        Row header = sheet.getRow(sheet.getFirstRowNum());
        if (header == null) {
            return records;
        }

        List<String> columns = new ArrayList<>();
        for (int c = 0; c < header.getLastCellNum(); c++) {
            Cell cell = header.getCell(c);
            String name = cell != null ? formatter.formatCellValue(cell).trim() : "";
            columns.add(name.isEmpty() ? "column_" + (c + 1) : name);
        }

        for (int r = sheet.getFirstRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
            Row row = sheet.getRow(r);
            if (row == null) {
                continue;
            }
            Map<String, Object> record = new LinkedHashMap<>();
            boolean hasValue = false;
            for (int c = 0; c < columns.size(); c++) {
                Object value = cellValue(row.getCell(c));
                hasValue |= value != null;
                record.put(columns.get(c), value);
            }
            if (hasValue) {
                records.add(record);
            }
        }
        return records;
    }

    private Object cellValue(Cell cell) {
        if (cell == null) {
            return null;
        }
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        return switch (type) {
            case NUMERIC -> {
                if (DateUtil.isCellDateFormatted(cell)) {
                    yield cell.getLocalDateTimeCellValue();
                }
                double d = cell.getNumericCellValue();
                yield d == Math.rint(d) && Math.abs(d) < 1e15 ? (Object) (long) d : (Object) d;
            }
            case STRING -> {
                String s = cell.getStringCellValue();
                yield s.isEmpty() ? null : s;
            }
            case BOOLEAN -> cell.getBooleanCellValue();
            default -> null;
        };
    }

    private Object castCsvCell(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        if ("true".equalsIgnoreCase(value) || "false".equalsIgnoreCase(value)) {
            return Boolean.parseBoolean(value);
        }
        if (INTEGER.matcher(value).matches()) {
            return Long.parseLong(value);
        }
        if (DECIMAL.matcher(value).matches()) {
            return Double.parseDouble(value);
        }
        return value;
    }

    private Object jsonValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return node.longValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        // nested structures stay as their JSON text
        return node.toString();
    }

    private String textOf(JsonNode data, String format) {
        if (!data.isTextual()) {
            throw new ReportValidationException(format + " input must be given as text");
        }
        return data.asText();
    }
}
