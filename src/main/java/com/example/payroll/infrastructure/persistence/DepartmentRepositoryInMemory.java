package com.example.payroll.infrastructure.persistence;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.example.payroll.domain.model.Department;
import com.example.payroll.port.outbound.DepartmentRepository;

public class DepartmentRepositoryInMemory implements DepartmentRepository {
	private final Map<String, Department> store = new LinkedHashMap<>();

	@Override
	public Optional<Department> findByName(String name) {
		return Optional.ofNullable(store.get(name));
	}

	@Override
	public void save(Department department) {
		store.put(department.name(), department);
	}

	@Override
	public List<Department> findAll() {
		return List.copyOf(store.values());
	}
}
