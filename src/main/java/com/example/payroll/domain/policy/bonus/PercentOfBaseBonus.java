package com.example.payroll.domain.policy.bonus;

import java.math.BigDecimal;

public final class PercentOfBaseBonus implements BonusScheme {
	private static final BigDecimal RATE = new BigDecimal("0.10");

	@Override
	public BigDecimal calculateBonus(BigDecimal base, BigDecimal plan, BigDecimal actual) {
		return base.multiply(RATE);
	}

	@Override
	public BonusSchemeType type() {
		return BonusSchemeType.PERCENT_OF_BASE;
	}
}
