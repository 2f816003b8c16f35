package com.example.payroll.domain.policy.payment;

import java.math.BigDecimal;

// 出来高払い: 実績 1 単位ごとに base を支給
public final class PercentProductionWithBonus implements PaymentScheme {

	@Override
	public BigDecimal calculate(BigDecimal base, BigDecimal bonus, BigDecimal plan, BigDecimal actual) {
		return actual.multiply(base).add(bonus);
	}

	@Override
	public PaymentSchemeType type() {
		return PaymentSchemeType.PERCENT_PRODUCTION;
	}
}
