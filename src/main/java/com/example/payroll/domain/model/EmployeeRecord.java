package com.example.payroll.domain.model;

import java.math.BigDecimal;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * 保存/読込用のフラットな従業員レコード。
 * bonus, payment_scheme, bonus_scheme は任意。production は JSON のみ（"YYYY-MM" → 実績）。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({ "name", "position", "department", "base_salary", "bonus", "payment_scheme", "bonus_scheme",
		"production" })
public record EmployeeRecord(
		@JsonProperty("name") String name,
		@JsonProperty("position") String position,
		@JsonProperty("department") String department,
		@JsonProperty("base_salary") BigDecimal baseSalary,
		@JsonProperty("bonus") BigDecimal bonus,
		@JsonProperty("payment_scheme") String paymentScheme,
		@JsonProperty("bonus_scheme") String bonusScheme,
		@JsonProperty("production") Map<String, BigDecimal> production) {

	// 旧形式（スキーム情報なし）
	public static EmployeeRecord simple(String name, String position, String department, BigDecimal baseSalary) {
		return new EmployeeRecord(name, position, department, baseSalary, null, null, null, null);
	}
}
