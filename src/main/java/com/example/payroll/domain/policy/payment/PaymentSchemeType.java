package com.example.payroll.domain.policy.payment;

import java.util.Arrays;
import java.util.Optional;

public enum PaymentSchemeType {
	FIXED_SALARY("1"),
	PERCENT_PRODUCTION("2"),
	PERCENT_PLAN("3");

	private final String code;

	PaymentSchemeType(String code) {
		this.code = code;
	}

	public String code() {
		return code;
	}

	public static Optional<PaymentSchemeType> fromCode(String code) {
		return Arrays.stream(values()).filter(t -> t.code.equals(code)).findFirst();
	}
}
