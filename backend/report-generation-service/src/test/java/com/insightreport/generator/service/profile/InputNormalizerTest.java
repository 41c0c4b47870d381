package com.insightreport.generator.service.profile;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.insightreport.generator.dto.report.StructuredInput;
import com.insightreport.generator.exception.ReportValidationException;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.LocalDateTime;
import java.util.Base64;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InputNormalizer 단위 테스트
 */
class InputNormalizerTest {

    private ObjectMapper objectMapper;
    private InputNormalizer inputNormalizer;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        inputNormalizer = new InputNormalizer(objectMapper);
    }

    private static StructuredInput input(StructuredInput.Format format, String data) {
        return StructuredInput.builder().format(format).data(TextNode.valueOf(data)).build();
    }

    @Nested
    @DisplayName("JSON")
    class Json {

        @Test
        @DisplayName("이미 파싱된 배열도 받는다")
        void acceptsParsedArray() throws IOException {
            StructuredInput structured = StructuredInput.builder()
                    .format(StructuredInput.Format.JSON)
                    .data(objectMapper.readTree("[{\"name\":\"a\",\"count\":3,\"ratio\":0.5,\"ok\":true}]"))
                    .build();

            List<Map<String, Object>> records = inputNormalizer.parse(structured);

            assertThat(records).hasSize(1);
            assertThat(records.get(0))
                    .containsEntry("name", "a")
                    .containsEntry("count", 3L)
                    .containsEntry("ratio", 0.5)
                    .containsEntry("ok", true);
        }

        @Test
        @DisplayName("중첩 객체는 JSON 텍스트로 남는다")
        void nestedValuesStayAsJsonText() {
            List<Map<String, Object>> records = inputNormalizer.parse(
                    input(StructuredInput.Format.JSON, "[{\"meta\":{\"k\":1}}]"));

            assertThat(records.get(0).get("meta")).isEqualTo("{\"k\":1}");
        }

        @Test
        @DisplayName("객체 배열이 아니면 검증 오류")
        void rejectsNonArray() {
            assertThatThrownBy(() -> inputNormalizer.parse(input(StructuredInput.Format.JSON, "{\"a\":1}")))
                    .isInstanceOf(ReportValidationException.class)
                    .hasMessageContaining("array of objects");

            assertThatThrownBy(() -> inputNormalizer.parse(input(StructuredInput.Format.JSON, "[1,2]")))
                    .isInstanceOf(ReportValidationException.class);
        }
    }

    @Nested
    @DisplayName("CSV")
    class Csv {

        @Test
        @DisplayName("정수, 실수, 불리언은 변환되고 나머지는 문자열")
        void castsCells() {
            String csv = "region,units,price,active\nnorth,10,2.5,true\n\nsouth,7,3,FALSE\n";

            List<Map<String, Object>> records = inputNormalizer.parse(input(StructuredInput.Format.CSV, csv));

            assertThat(records).hasSize(2);
            assertThat(records.get(0))
                    .containsEntry("region", "north")
                    .containsEntry("units", 10L)
                    .containsEntry("price", 2.5)
                    .containsEntry("active", true);
            assertThat(records.get(1)).containsEntry("active", false).containsEntry("price", 3L);
        }

        @Test
        @DisplayName("CSV 는 텍스트로 전달되어야 한다")
        void requiresText() throws IOException {
            StructuredInput structured = StructuredInput.builder()
                    .format(StructuredInput.Format.CSV)
                    .data(objectMapper.readTree("[{\"a\":1}]"))
                    .build();

            assertThatThrownBy(() -> inputNormalizer.parse(structured))
                    .isInstanceOf(ReportValidationException.class);
        }
    }

    @Nested
    @DisplayName("XLSX")
    class Xlsx {

        @Test
        @DisplayName("숫자, 날짜, 불리언 셀을 변환하고 빈 행은 건너뛴다")
        void readsFirstSheet() throws IOException {
            String base64 = workbook("Sales");

            List<Map<String, Object>> records = inputNormalizer.parse(input(StructuredInput.Format.XLSX, base64));

            assertThat(records).hasSize(1);
            assertThat(records.get(0))
                    .containsEntry("product", "widget")
                    .containsEntry("units", 12L)
                    .containsEntry("price", 9.5)
                    .containsEntry("shipped", true)
                    .containsEntry("date", LocalDateTime.of(2024, 1, 15, 0, 0));
        }

        @Test
        @DisplayName("없는 시트 이름은 검증 오류")
        void unknownSheet() throws IOException {
            StructuredInput structured = input(StructuredInput.Format.XLSX, workbook("Sales"));
            structured.setSheetName("Missing");

            assertThatThrownBy(() -> inputNormalizer.parse(structured))
                    .isInstanceOf(ReportValidationException.class)
                    .hasMessageContaining("Missing");
        }

        @Test
        @DisplayName("base64 가 아니거나 통합문서가 아니면 검증 오류")
        void malformedPayload() {
            assertThatThrownBy(() -> inputNormalizer.parse(input(StructuredInput.Format.XLSX, "%%%")))
                    .isInstanceOf(ReportValidationException.class);
            assertThatThrownBy(() -> inputNormalizer.parse(input(StructuredInput.Format.XLSX,
                    Base64.getEncoder().encodeToString("plain text".getBytes()))))
                    .isInstanceOf(ReportValidationException.class);
        }

        private String workbook(String sheetName) throws IOException {
            try (XSSFWorkbook workbook = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
                Sheet sheet = workbook.createSheet(sheetName);
                Row header = sheet.createRow(0);
                String[] columns = {"product", "units", "price", "shipped", "date"};
                for (int i = 0; i < columns.length; i++) {
                    header.createCell(i).setCellValue(columns[i]);
                }

                CellStyle dateStyle = workbook.createCellStyle();
                dateStyle.setDataFormat(workbook.getCreationHelper().createDataFormat().getFormat("yyyy-mm-dd"));

                Row row = sheet.createRow(1);
                row.createCell(0).setCellValue("widget");
                row.createCell(1).setCellValue(12);
                row.createCell(2).setCellValue(9.5);
                row.createCell(3).setCellValue(true);
                row.createCell(4).setCellValue(LocalDateTime.of(2024, 1, 15, 0, 0));
                row.getCell(4).setCellStyle(dateStyle);

                sheet.createRow(2);

                workbook.write(out);
                return Base64.getEncoder().encodeToString(out.toByteArray());
            }
        }
    }
}
