package com.example.payroll.domain.model;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import com.example.payroll.domain.policy.bonus.BonusScheme;
import com.example.payroll.domain.policy.payment.PaymentScheme;

/**
 * 従業員。所属部署は名前でのみ参照する（部署を所有しない）。
 * 生成後に変わるのは月別実績 {@link #production()} だけ。
 */
public class Employee {
	private final String name;
	private final String position;
	private final String departmentName;
	private final PaymentScheme paymentScheme;
	private final BonusScheme bonusScheme;
	private final BigDecimal baseSalary;
	private final Map<YearMonth, BigDecimal> production = new TreeMap<>();

	public Employee(String name, String position, String departmentName,
			PaymentScheme paymentScheme, BonusScheme bonusScheme, BigDecimal baseSalary) {
		if (name == null || name.isBlank())
			throw new IllegalArgumentException("name must not be blank");
		if (departmentName == null || departmentName.isBlank())
			throw new IllegalArgumentException("department must not be blank");
		Objects.requireNonNull(baseSalary, "baseSalary must not be null");
		if (baseSalary.signum() < 0)
			throw new IllegalArgumentException("baseSalary must be >= 0");
		this.name = name;
		this.position = position == null ? "" : position;
		this.departmentName = departmentName;
		this.paymentScheme = Objects.requireNonNull(paymentScheme, "paymentScheme must not be null");
		this.bonusScheme = Objects.requireNonNull(bonusScheme, "bonusScheme must not be null");
		this.baseSalary = baseSalary;
	}

	public String name() {
		return name;
	}

	public String position() {
		return position;
	}

	public String departmentName() {
		return departmentName;
	}

	public PaymentScheme paymentScheme() {
		return paymentScheme;
	}

	public BonusScheme bonusScheme() {
		return bonusScheme;
	}

	public BigDecimal baseSalary() {
		return baseSalary;
	}

	public Map<YearMonth, BigDecimal> production() {
		return Collections.unmodifiableMap(production);
	}

	// 未登録の月は実績0
	public BigDecimal productionFor(YearMonth month) {
		return production.getOrDefault(month, BigDecimal.ZERO);
	}

	public void recordProduction(YearMonth month, BigDecimal value) {
		Objects.requireNonNull(month, "month must not be null");
		Objects.requireNonNull(value, "production must not be null");
		if (value.signum() < 0)
			throw new IllegalArgumentException("production must be >= 0");
		production.put(month, value);
	}

	public BigDecimal calculateSalary(YearMonth month, Department department) {
		if (!department.name().equals(departmentName))
			throw new IllegalArgumentException(
					"employee " + name + " does not belong to department " + department.name());
		BigDecimal actual = productionFor(month);
		BigDecimal plan = department.planFor(month);
		return paymentScheme.calculate(baseSalary, bonusScheme, plan, actual);
	}

	@Override
	public String toString() {
		return name + " - " + position + " (" + departmentName + ")";
	}
}
