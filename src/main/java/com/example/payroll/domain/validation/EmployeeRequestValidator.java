package com.example.payroll.domain.validation;

import com.example.payroll.app.dto.EmployeeRequest;
import com.example.payroll.exception.MalformedInputException;

public class EmployeeRequestValidator {
	private EmployeeRequestValidator() {
	}

	public static void validate(EmployeeRequest req) {
		if (req == null)
			throw new MalformedInputException("request must not be null");
		if (req.name() == null || req.name().isBlank())
			throw new MalformedInputException("employee name must not be blank");
		if (req.department() == null || req.department().isBlank())
			throw new MalformedInputException("department must not be blank");
		if (req.baseSalary() == null)
			throw new MalformedInputException("base salary must not be null");
		if (req.baseSalary().signum() < 0)
			throw new MalformedInputException("base salary must be >= 0");
	}
}
