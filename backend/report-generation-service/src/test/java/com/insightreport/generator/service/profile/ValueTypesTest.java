package com.insightreport.generator.service.profile;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ValueTypes 단위 테스트
 */
class ValueTypesTest {

    @ParameterizedTest
    @ValueSource(strings = {"2024-01-15", "2024/1/5", "2024-01-15T10:30:00", "2024-01-15 10:30", "2024-01-15T10:30:00Z"})
    @DisplayName("YYYY-M-D 형태의 문자열은 날짜로 인식한다")
    void recognizesDates(String value) {
        assertThat(ValueTypes.isDate(value)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"2024-13-01", "2024-02-30", "15/01/2024", "20240115", "yesterday"})
    @DisplayName("형태가 다르거나 존재하지 않는 날짜는 거부한다")
    void rejectsNonDates(String value) {
        assertThat(ValueTypes.isDate(value)).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {"0", "-12", "3.14", "1e3", " 42 "})
    @DisplayName("유한한 숫자 문자열은 numeric")
    void recognizesNumbers(String value) {
        assertThat(ValueTypes.isNumeric(value)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "  ", "abc", "NaN", "1,000"})
    @DisplayName("빈 문자열, NaN, 구분자가 있는 숫자는 numeric 이 아니다")
    void rejectsNonNumbers(String value) {
        assertThat(ValueTypes.isNumeric(value)).isFalse();
    }

    @Test
    @DisplayName("오프셋이 있는 시각은 UTC 로 정규화된다")
    void normalizesOffsetToUtc() {
        assertThat(ValueTypes.toDateTime("2024-01-15T09:00:00+09:00"))
                .contains(LocalDateTime.of(2024, 1, 15, 0, 0));
    }

    @Test
    @DisplayName("null 과 빈 문자열만 누락 값이다")
    void missingValues() {
        assertThat(ValueTypes.isMissing(null)).isTrue();
        assertThat(ValueTypes.isMissing("")).isTrue();
        assertThat(ValueTypes.isMissing(" ")).isFalse();
        assertThat(ValueTypes.isMissing(0)).isFalse();
    }
}
