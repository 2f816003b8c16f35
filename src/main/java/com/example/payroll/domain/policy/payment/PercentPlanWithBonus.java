package com.example.payroll.domain.policy.payment;

import java.math.BigDecimal;
import java.math.MathContext;

// 計画達成率払い: base × (actual / plan)
public final class PercentPlanWithBonus implements PaymentScheme {

	@Override
	public BigDecimal calculate(BigDecimal base, BigDecimal bonus, BigDecimal plan, BigDecimal actual) {
		if (plan.signum() == 0) {
			return bonus;
		}
		return actual.multiply(base).divide(plan, MathContext.DECIMAL64).add(bonus);
	}

	@Override
	public PaymentSchemeType type() {
		return PaymentSchemeType.PERCENT_PLAN;
	}
}
