package com.example.payroll.app.dto;

import java.math.BigDecimal;
import java.time.YearMonth;

public record SalaryLine(String employeeName, String position, YearMonth month, BigDecimal salary) {}
