package com.example.payroll.port.outbound;

import java.util.List;
import java.util.Optional;

import com.example.payroll.domain.model.Department;

public interface DepartmentRepository {
	Optional<Department> findByName(String name);

	void save(Department department);

	List<Department> findAll(); // 登録順
}
