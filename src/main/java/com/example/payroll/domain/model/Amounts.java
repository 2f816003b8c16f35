package com.example.payroll.domain.model;

import java.math.BigDecimal;

import com.example.payroll.exception.MalformedInputException;

public final class Amounts {
	private Amounts() {
	}

	// CSV/コンソールからの文字列数値を解釈する
	public static BigDecimal parse(String field, String raw) {
		if (raw == null || raw.isBlank())
			throw new MalformedInputException(field + " must not be blank");
		try {
			return new BigDecimal(raw.trim());
		} catch (NumberFormatException e) {
			throw new MalformedInputException(field + " must be a number: " + raw, e);
		}
	}

	public static BigDecimal parseNonNegative(String field, String raw) {
		return requireNonNegative(field, parse(field, raw));
	}

	public static BigDecimal requireNonNegative(String field, BigDecimal value) {
		if (value == null)
			throw new MalformedInputException(field + " must not be null");
		if (value.signum() < 0)
			throw new MalformedInputException(field + " must be >= 0");
		return value;
	}
}
