package com.example.payroll.app.dto;

import java.math.BigDecimal;

/**
 * bonusCode / paymentCode はメニュー番号（"1".."3"）。
 * bonusAmount は固定賞与（bonusCode = "1"）のときだけ使う。
 */
public record EmployeeRequest(
		String name,
		String position,
		String department,
		BigDecimal baseSalary,
		String bonusCode,
		BigDecimal bonusAmount,
		String paymentCode,
		boolean manager) {
}
