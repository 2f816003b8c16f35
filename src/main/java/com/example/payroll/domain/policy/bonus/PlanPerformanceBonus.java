package com.example.payroll.domain.policy.bonus;

import java.math.BigDecimal;
import java.math.MathContext;

public final class PlanPerformanceBonus implements BonusScheme {
	private static final BigDecimal RATE = new BigDecimal("0.20");

	@Override
	public BigDecimal calculateBonus(BigDecimal base, BigDecimal plan, BigDecimal actual) {
		// 計画なしの月は賞与なし
		if (plan.signum() == 0) {
			return BigDecimal.ZERO;
		}
		return base.multiply(RATE).multiply(actual).divide(plan, MathContext.DECIMAL64);
	}

	@Override
	public BonusSchemeType type() {
		return BonusSchemeType.PLAN_PERFORMANCE;
	}
}
