package com.example.payroll.domain.policy.payment;

import java.math.BigDecimal;

import com.example.payroll.domain.policy.bonus.BonusScheme;

public sealed interface PaymentScheme
		permits FixedSalaryWithBonus, PercentProductionWithBonus, PercentPlanWithBonus {
	/**
	 * bonus: 賞与ルールで算出済みの賞与額（または呼び出し側が決めた固定額）
	 * 返り値: 当月の支給総額
	 */
	BigDecimal calculate(BigDecimal base, BigDecimal bonus, BigDecimal plan, BigDecimal actual);

	/**
	 * 賞与ルールを同じ base/plan/actual で評価してから計算する。
	 */
	default BigDecimal calculate(BigDecimal base, BonusScheme bonusScheme, BigDecimal plan, BigDecimal actual) {
		return calculate(base, bonusScheme.calculateBonus(base, plan, actual), plan, actual);
	}

	PaymentSchemeType type();
}
