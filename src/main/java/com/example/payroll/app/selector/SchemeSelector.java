package com.example.payroll.app.selector;

import java.math.BigDecimal;

import com.example.payroll.domain.model.Amounts;
import com.example.payroll.domain.policy.bonus.BonusScheme;
import com.example.payroll.domain.policy.bonus.BonusSchemeType;
import com.example.payroll.domain.policy.bonus.FixedBonus;
import com.example.payroll.domain.policy.bonus.PercentOfBaseBonus;
import com.example.payroll.domain.policy.bonus.PlanPerformanceBonus;
import com.example.payroll.domain.policy.payment.FixedSalaryWithBonus;
import com.example.payroll.domain.policy.payment.PaymentScheme;
import com.example.payroll.domain.policy.payment.PaymentSchemeType;
import com.example.payroll.domain.policy.payment.PercentPlanWithBonus;
import com.example.payroll.domain.policy.payment.PercentProductionWithBonus;
import com.example.payroll.exception.InvalidSelectionException;

public class SchemeSelector {
	private SchemeSelector() {
	}

	// メニュー番号 → 種別
	public static BonusSchemeType bonusType(String code) {
		return BonusSchemeType.fromCode(code == null ? null : code.trim())
				.orElseThrow(() -> new InvalidSelectionException("bonus scheme", code));
	}

	public static PaymentSchemeType paymentType(String code) {
		return PaymentSchemeType.fromCode(code == null ? null : code.trim())
				.orElseThrow(() -> new InvalidSelectionException("payment scheme", code));
	}

	// 保存タグ（enum名） → 種別
	public static BonusSchemeType bonusTypeForTag(String tag) {
		if (tag != null) {
			for (var t : BonusSchemeType.values()) {
				if (t.name().equalsIgnoreCase(tag.trim()))
					return t;
			}
		}
		throw new InvalidSelectionException("bonus scheme", tag);
	}

	public static PaymentSchemeType paymentTypeForTag(String tag) {
		if (tag != null) {
			for (var t : PaymentSchemeType.values()) {
				if (t.name().equalsIgnoreCase(tag.trim()))
					return t;
			}
		}
		throw new InvalidSelectionException("payment scheme", tag);
	}

	public static BonusScheme bonusScheme(BonusSchemeType type, BigDecimal fixedAmount) {
		return switch (type) {
			case FIXED -> new FixedBonus(Amounts.requireNonNegative("fixed bonus", fixedAmount));
			case PERCENT_OF_BASE -> new PercentOfBaseBonus();
			case PLAN_PERFORMANCE -> new PlanPerformanceBonus();
		};
	}

	public static PaymentScheme paymentScheme(PaymentSchemeType type) {
		return switch (type) {
			case FIXED_SALARY -> new FixedSalaryWithBonus();
			case PERCENT_PRODUCTION -> new PercentProductionWithBonus();
			case PERCENT_PLAN -> new PercentPlanWithBonus();
		};
	}
}
