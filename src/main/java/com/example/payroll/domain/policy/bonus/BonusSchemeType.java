package com.example.payroll.domain.policy.bonus;

import java.util.Arrays;
import java.util.Optional;

public enum BonusSchemeType {
	FIXED("1"),
	PERCENT_OF_BASE("2"),
	PLAN_PERFORMANCE("3");

	private final String code;

	BonusSchemeType(String code) {
		this.code = code;
	}

	// メニュー番号
	public String code() {
		return code;
	}

	public static Optional<BonusSchemeType> fromCode(String code) {
		return Arrays.stream(values()).filter(t -> t.code.equals(code)).findFirst();
	}
}
