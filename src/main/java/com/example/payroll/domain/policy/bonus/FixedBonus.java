package com.example.payroll.domain.policy.bonus;

import java.math.BigDecimal;
import java.util.Objects;

public record FixedBonus(BigDecimal amount) implements BonusScheme {

	public FixedBonus {
		Objects.requireNonNull(amount, "amount must not be null");
		if (amount.signum() < 0)
			throw new IllegalArgumentException("fixed bonus must be >= 0");
	}

	@Override
	public BigDecimal calculateBonus(BigDecimal base, BigDecimal plan, BigDecimal actual) {
		return amount;
	}

	@Override
	public BonusSchemeType type() {
		return BonusSchemeType.FIXED;
	}
}
