package com.example.payroll.port.outbound;

public enum RecordFormat {
	JSON,
	CSV
}
