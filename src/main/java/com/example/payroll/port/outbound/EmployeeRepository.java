package com.example.payroll.port.outbound;

import java.util.List;

import com.example.payroll.domain.model.Employee;

public interface EmployeeRepository {
	void add(Employee employee);

	List<Employee> findAll(); // 登録順
}
