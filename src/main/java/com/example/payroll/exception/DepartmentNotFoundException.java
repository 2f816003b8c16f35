package com.example.payroll.exception;

public class DepartmentNotFoundException extends RuntimeException {
	private final String departmentName;

	public DepartmentNotFoundException(String departmentName) {
		super("department not found: " + departmentName);
		this.departmentName = departmentName;
	}

	public String departmentName() {
		return departmentName;
	}
}
