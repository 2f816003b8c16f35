package com.example.payroll.domain.model;

import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;

import com.example.payroll.exception.MalformedInputException;

/**
 * "YYYY-MM" 形式の月キー。
 */
public final class MonthKey {
	private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("uuuu-MM")
			.withResolverStyle(ResolverStyle.STRICT);

	private MonthKey() {
	}

	public static YearMonth parse(String raw) {
		if (raw == null || raw.isBlank())
			throw new MalformedInputException("month must not be blank");
		try {
			return YearMonth.parse(raw.trim(), FORMAT);
		} catch (DateTimeParseException e) {
			throw new MalformedInputException("month must be YYYY-MM: " + raw, e);
		}
	}

	public static String format(YearMonth month) {
		return FORMAT.format(month);
	}
}
