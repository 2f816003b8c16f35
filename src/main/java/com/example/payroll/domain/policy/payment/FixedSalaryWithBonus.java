package com.example.payroll.domain.policy.payment;

import java.math.BigDecimal;

public final class FixedSalaryWithBonus implements PaymentScheme {

	@Override
	public BigDecimal calculate(BigDecimal base, BigDecimal bonus, BigDecimal plan, BigDecimal actual) {
		return base.add(bonus);
	}

	@Override
	public PaymentSchemeType type() {
		return PaymentSchemeType.FIXED_SALARY;
	}
}
