package com.insightreport.generator.service.profile;

import com.insightreport.generator.dto.report.InputData;
import com.insightreport.generator.dto.report.ProfileResult;
import com.insightreport.generator.dto.report.StructuredInput;
import com.insightreport.generator.dto.report.UnstructuredInput;
import com.insightreport.generator.entity.profile.ColumnProfile;
import com.insightreport.generator.entity.profile.ColumnType;
import com.insightreport.generator.entity.profile.DataProfile;
import com.insightreport.generator.entity.profile.TopValue;
import com.insightreport.generator.exception.ReportValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * 입력 데이터 프로파일러
 *
 * 정형 블록을 하나의 레코드 집합으로 합치고(스키마 합집합, 없는 키는 null),
 * 컬럼 타입 추론, 통계, 데이터 품질 점수, 차트 제안을 계산한다.
 * 비정형 블록은 원문 그대로 텍스트 목록으로 전달된다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DataProfiler {

    static final double TYPE_RATIO_THRESHOLD = 0.8;
    static final double CATEGORICAL_UNIQUE_RATIO = 0.5;
    static final int CATEGORICAL_MIN_VALUES = 10;
    static final int TOP_VALUES = 5;

    private final InputNormalizer inputNormalizer;
    private final ChartSuggestionEngine chartSuggestionEngine;

    /**
     * 입력 블록 목록을 프로파일링한다
     */
    public ProfileResult profile(List<InputData> inputData) {
        List<Map<String, Object>> records = new ArrayList<>();
        List<String> textBlocks = new ArrayList<>();
        Map<String, ColumnType> schemaHints = new HashMap<>();

        for (InputData input : inputData) {
            if (input instanceof StructuredInput structured) {
                records.addAll(inputNormalizer.parse(structured));
                if (structured.getSchemaHints() != null) {
                    schemaHints.putAll(structured.getSchemaHints());
                }
            } else if (input instanceof UnstructuredInput unstructured) {
                textBlocks.add(unstructured.getContent());
            } else {
                throw new ReportValidationException("Unsupported input block: " + input);
            }
        }

        List<String> columnNames = unionColumns(records);
        List<Map<String, Object>> normalized = alignRecords(records, columnNames);
        DataProfile profile = generateProfile(normalized, columnNames, schemaHints);

        log.info("Data profiled: rows={}, columns={}, textBlocks={}, qualityScore={}",
                profile.getRowCount(), profile.getColumnCount(), textBlocks.size(), profile.getDataQualityScore());

        return ProfileResult.builder()
                .profile(profile)
                .records(normalized)
                .textBlocks(textBlocks)
                .build();
    }

    DataProfile generateProfile(List<Map<String, Object>> records, List<String> columnNames,
                                Map<String, ColumnType> schemaHints) {
        if (records.isEmpty()) {
            return DataProfile.empty();
        }

        List<ColumnProfile> columns = new ArrayList<>(columnNames.size());
        for (String name : columnNames) {
            List<Object> values = records.stream().map(r -> r.get(name)).toList();
            columns.add(profileColumn(name, values, schemaHints.get(name)));
        }

        return DataProfile.builder()
                .rowCount(records.size())
                .columnCount(columns.size())
                .columns(columns)
                .dataQualityScore(calculateDataQualityScore(columns, records.size()))
                .suggestedCharts(chartSuggestionEngine.suggest(columns, records.size()))
                .build();
    }

    ColumnProfile profileColumn(String name, List<Object> values, ColumnType hint) {
        List<Object> present = values.stream().filter(v -> !ValueTypes.isMissing(v)).toList();
        ColumnType type = hint != null ? hint : inferColumnType(present);

        ColumnProfile.ColumnProfileBuilder builder = ColumnProfile.builder()
                .name(name)
                .type(type)
                .nullCount(values.size() - present.size())
                .uniqueCount(present.stream().map(String::valueOf).distinct().count());

        switch (type) {
            case NUMERIC -> applyNumericStats(builder, present);
            case CATEGORICAL, TEXT -> builder.topValues(topValues(present, TOP_VALUES));
            case DATETIME -> applyDateRange(builder, present);
            default -> {
                // boolean and unknown columns carry counts only
            }
        }
        return builder.build();
    }

    /**
     * 타입 추론. 날짜와 불리언 검사가 숫자 검사보다 먼저 실행된다.
     */
    ColumnType inferColumnType(List<Object> present) {
        if (present.isEmpty()) {
            return ColumnType.UNKNOWN;
        }
        if (ratio(present, ValueTypes::isDate) >= TYPE_RATIO_THRESHOLD) {
            return ColumnType.DATETIME;
        }
        if (ratio(present, ValueTypes::isBoolean) >= TYPE_RATIO_THRESHOLD) {
            return ColumnType.BOOLEAN;
        }
        if (ratio(present, ValueTypes::isNumeric) >= TYPE_RATIO_THRESHOLD) {
            return ColumnType.NUMERIC;
        }
        long distinct = present.stream().map(String::valueOf).distinct().count();
        if ((double) distinct / present.size() < CATEGORICAL_UNIQUE_RATIO && present.size() > CATEGORICAL_MIN_VALUES) {
            return ColumnType.CATEGORICAL;
        }
        return ColumnType.TEXT;
    }

    /**
     * 데이터 품질 점수 (0-100)
     */
    int calculateDataQualityScore(List<ColumnProfile> columns, int rowCount) {
        if (columns.isEmpty() || rowCount == 0) {
            return 0;
        }

        double score = 100;

        // null 비율
        double totalCells = (double) columns.size() * rowCount;
        long totalNulls = columns.stream().mapToLong(ColumnProfile::getNullCount).sum();
        score -= (totalNulls / totalCells) * 30;

        // 비범주형 컬럼의 낮은 고유성
        List<ColumnProfile> nonCategorical = columns.stream()
                .filter(c -> c.getType() != ColumnType.CATEGORICAL)
                .toList();
        if (!nonCategorical.isEmpty()) {
            double avgUniqueness = nonCategorical.stream()
                    .mapToDouble(c -> (double) c.getUniqueCount() / rowCount)
                    .average()
                    .orElse(0);
            if (avgUniqueness < 0.1) {
                score -= 20;
            }
        }

        // 타입 추론 실패 컬럼
        long unknown = columns.stream().filter(c -> c.getType() == ColumnType.UNKNOWN).count();
        score -= ((double) unknown / columns.size()) * 20;

        return (int) Math.max(0, Math.min(100, Math.round(score)));
    }

    static double median(List<Double> numbers) {
        List<Double> sorted = numbers.stream().sorted().toList();
        int mid = sorted.size() / 2;
        return sorted.size() % 2 == 0
                ? (sorted.get(mid - 1) + sorted.get(mid)) / 2
                : sorted.get(mid);
    }

    /**
     * 모표준편차 (n 으로 나눔)
     */
    static double populationStdDev(List<Double> numbers, double mean) {
        double variance = numbers.stream()
                .mapToDouble(v -> (v - mean) * (v - mean))
                .sum() / numbers.size();
        return Math.sqrt(variance);
    }

    static List<TopValue> topValues(List<Object> values, int n) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (Object value : values) {
            counts.merge(String.valueOf(value), 1L, Long::sum);
        }
        // stable sort keeps first-seen order among equal counts
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed())
                .limit(n)
                .map(e -> new TopValue(e.getKey(), e.getValue()))
                .toList();
    }

    private void applyNumericStats(ColumnProfile.ColumnProfileBuilder builder, List<Object> present) {
        List<Double> numbers = present.stream()
                .map(ValueTypes::toDouble)
                .flatMap(Optional::stream)
                .toList();
        if (numbers.isEmpty()) {
            return;
        }
        double mean = numbers.stream().mapToDouble(Double::doubleValue).average().orElse(0);
        builder.min(numbers.stream().mapToDouble(Double::doubleValue).min().orElse(0))
                .max(numbers.stream().mapToDouble(Double::doubleValue).max().orElse(0))
                .mean(mean)
                .median(median(numbers))
                .stdDev(populationStdDev(numbers, mean));
    }

    private void applyDateRange(ColumnProfile.ColumnProfileBuilder builder, List<Object> present) {
        List<LocalDateTime> dates = present.stream()
                .map(ValueTypes::toDateTime)
                .flatMap(Optional::stream)
                .toList();
        if (dates.isEmpty()) {
            return;
        }
        builder.minDate(ValueTypes.toIsoString(dates.stream().min(Comparator.naturalOrder()).orElseThrow()))
                .maxDate(ValueTypes.toIsoString(dates.stream().max(Comparator.naturalOrder()).orElseThrow()));
    }

    private static double ratio(List<Object> values, Predicate<Object> predicate) {
        return (double) values.stream().filter(predicate).count() / values.size();
    }

    private static List<String> unionColumns(List<Map<String, Object>> records) {
        Set<String> names = new LinkedHashSet<>();
        for (Map<String, Object> record : records) {
            names.addAll(record.keySet());
        }
        return new ArrayList<>(names);
    }

    private static List<Map<String, Object>> alignRecords(List<Map<String, Object>> records, List<String> columnNames) {
        Set<String> all = new HashSet<>(columnNames);
        List<Map<String, Object>> aligned = new ArrayList<>(records.size());
        for (Map<String, Object> record : records) {
            if (record.keySet().equals(all)) {
                aligned.add(record);
                continue;
            }
            Map<String, Object> row = new LinkedHashMap<>();
            for (String name : columnNames) {
                row.put(name, record.get(name));
            }
            aligned.add(row);
        }
        return aligned;
    }
}
