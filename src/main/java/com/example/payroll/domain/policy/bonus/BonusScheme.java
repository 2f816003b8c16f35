package com.example.payroll.domain.policy.bonus;

import java.math.BigDecimal;

/**
 * 賞与ルール。base/plan/actual から賞与「額」を返す純粋関数。
 * plan == 0 でも例外は投げない。
 */
public sealed interface BonusScheme permits FixedBonus, PercentOfBaseBonus, PlanPerformanceBonus {

	BigDecimal calculateBonus(BigDecimal base, BigDecimal plan, BigDecimal actual);

	BonusSchemeType type();
}
