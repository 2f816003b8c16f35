package com.example.payroll.domain.model;

import java.math.BigDecimal;

import com.example.payroll.domain.policy.bonus.BonusScheme;
import com.example.payroll.domain.policy.payment.PaymentScheme;

// 役職タグのみ。振る舞いは Employee と同じ
public class Manager extends Employee {

	public Manager(String name, String position, String departmentName,
			PaymentScheme paymentScheme, BonusScheme bonusScheme, BigDecimal baseSalary) {
		super(name, position, departmentName, paymentScheme, bonusScheme, baseSalary);
	}
}
