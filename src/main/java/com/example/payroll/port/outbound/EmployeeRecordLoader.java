package com.example.payroll.port.outbound;

import java.nio.file.Path;
import java.util.List;

import com.example.payroll.domain.model.EmployeeRecord;

public interface EmployeeRecordLoader {
	List<EmployeeRecord> load(Path path);
}
