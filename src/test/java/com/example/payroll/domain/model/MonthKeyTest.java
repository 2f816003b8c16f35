package com.example.payroll.domain.model;

import static org.assertj.core.api.Assertions.*;

import java.time.YearMonth;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.example.payroll.exception.MalformedInputException;

class MonthKeyTest {

	@Test
	void parses_and_formats_year_month() {
		assertThat(MonthKey.parse("2024-05")).isEqualTo(YearMonth.of(2024, 5));
		assertThat(MonthKey.parse(" 2024-12 ")).isEqualTo(YearMonth.of(2024, 12));
		assertThat(MonthKey.format(YearMonth.of(2024, 5))).isEqualTo("2024-05");
	}

	@ParameterizedTest
	@ValueSource(strings = { "", " ", "2024-13", "2024-5", "May 2024", "2024/05", "24-05" })
	void rejects_malformed_keys(String raw) {
		assertThatThrownBy(() -> MonthKey.parse(raw))
				.isInstanceOf(MalformedInputException.class);
	}

	@Test
	void rejects_null() {
		assertThatThrownBy(() -> MonthKey.parse(null))
				.isInstanceOf(MalformedInputException.class)
				.hasMessageContaining("month must not be blank");
	}
}
