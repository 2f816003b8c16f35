package com.example.payroll.app.dto;

import java.util.Optional;

public record DepartmentSummary(String name, int employeeCount, Optional<String> managerName) {}
