package com.example.payroll.infrastructure.persistence;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.example.payroll.domain.model.Employee;
import com.example.payroll.port.outbound.EmployeeRepository;

public class EmployeeRepositoryInMemory implements EmployeeRepository {
	private final List<Employee> store = new ArrayList<>();

	@Override
	public void add(Employee employee) {
		store.add(Objects.requireNonNull(employee, "employee must not be null"));
	}

	@Override
	public List<Employee> findAll() {
		return List.copyOf(store);
	}
}
