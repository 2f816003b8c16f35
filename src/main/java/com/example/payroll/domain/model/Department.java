package com.example.payroll.domain.model;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

public class Department {
	private final String name;
	private Employee manager;
	private final List<Employee> employees = new ArrayList<>();
	private final Map<YearMonth, BigDecimal> plan = new TreeMap<>();

	public Department(String name) {
		if (name == null || name.isBlank())
			throw new IllegalArgumentException("department name must not be blank");
		this.name = name;
	}

	public String name() {
		return name;
	}

	public Optional<Employee> manager() {
		return Optional.ofNullable(manager);
	}

	public void assignManager(Employee manager) {
		this.manager = Objects.requireNonNull(manager, "manager must not be null");
	}

	public List<Employee> employees() {
		return Collections.unmodifiableList(employees);
	}

	// 重複チェックはしない（呼び出し側の責務）
	public void addEmployee(Employee employee) {
		employees.add(Objects.requireNonNull(employee, "employee must not be null"));
	}

	public Map<YearMonth, BigDecimal> plan() {
		return Collections.unmodifiableMap(plan);
	}

	public BigDecimal planFor(YearMonth month) {
		return plan.getOrDefault(month, BigDecimal.ZERO);
	}

	public void setPlan(YearMonth month, BigDecimal value) {
		Objects.requireNonNull(month, "month must not be null");
		Objects.requireNonNull(value, "plan must not be null");
		if (value.signum() < 0)
			throw new IllegalArgumentException("plan must be >= 0");
		plan.put(month, value);
	}

	/*
	 * 当月計画を在籍者で均等割りし、各自の実績として上書きする
	 * 在籍者0人なら何もしない
	 */
	public void distributePlan(YearMonth month) {
		if (employees.isEmpty()) {
			return;
		}
		BigDecimal perEmployee = planFor(month)
				.divide(BigDecimal.valueOf(employees.size()), MathContext.DECIMAL64);
		for (var e : employees) {
			e.recordProduction(month, perEmployee);
		}
	}
}
