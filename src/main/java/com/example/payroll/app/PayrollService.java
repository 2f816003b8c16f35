package com.example.payroll.app;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.payroll.app.dto.DepartmentSummary;
import com.example.payroll.app.dto.EmployeeRequest;
import com.example.payroll.app.dto.SalaryLine;
import com.example.payroll.app.selector.SchemeSelector;
import com.example.payroll.domain.model.Amounts;
import com.example.payroll.domain.model.Department;
import com.example.payroll.domain.model.Employee;
import com.example.payroll.domain.model.Manager;
import com.example.payroll.domain.policy.bonus.BonusScheme;
import com.example.payroll.domain.policy.payment.PaymentScheme;
import com.example.payroll.domain.validation.EmployeeRequestValidator;
import com.example.payroll.exception.DepartmentNotFoundException;
import com.example.payroll.exception.MalformedInputException;
import com.example.payroll.port.outbound.DepartmentRepository;
import com.example.payroll.port.outbound.EmployeeRepository;

public class PayrollService {
	private static final Logger log = LoggerFactory.getLogger(PayrollService.class);

	private final DepartmentRepository departments;
	private final EmployeeRepository employees;

	public PayrollService(DepartmentRepository departments, EmployeeRepository employees) {
		this.departments = departments;
		this.employees = employees;
	}

	public Optional<Department> findDepartment(String name) {
		return departments.findByName(name);
	}

	// 既存名なら既存部署（在籍者・計画ごと）をそのまま返す
	public Department createDepartment(String name) {
		if (name == null || name.isBlank())
			throw new MalformedInputException("department name must not be blank");
		var existing = departments.findByName(name);
		if (existing.isPresent()) {
			log.info("department {} already exists, keeping it", name);
			return existing.get();
		}
		Department department = new Department(name);
		departments.save(department);
		log.info("department {} created", name);
		return department;
	}

	public Employee addEmployee(String departmentName, Employee employee) {
		Department department = requireDepartment(departmentName);
		if (!employee.departmentName().equals(departmentName))
			throw new IllegalArgumentException(
					"employee " + employee.name() + " refers to department " + employee.departmentName());
		department.addEmployee(employee);
		employees.add(employee);
		log.debug("employee {} added to {}", employee.name(), departmentName);
		return employee;
	}

	/*
	 * 検証 → 部署確認 → スキーム選択 → 登録 の順
	 * どこで失敗しても状態は変えない
	 */
	public Employee hire(EmployeeRequest req) {
		EmployeeRequestValidator.validate(req);
		Department department = requireDepartment(req.department());

		BonusScheme bonus = SchemeSelector.bonusScheme(SchemeSelector.bonusType(req.bonusCode()), req.bonusAmount());
		PaymentScheme payment = SchemeSelector.paymentScheme(SchemeSelector.paymentType(req.paymentCode()));

		Employee employee = req.manager()
				? new Manager(req.name(), req.position(), req.department(), payment, bonus, req.baseSalary())
				: new Employee(req.name(), req.position(), req.department(), payment, bonus, req.baseSalary());
		addEmployee(req.department(), employee);
		if (employee instanceof Manager) {
			department.assignManager(employee);
		}
		log.info("hired {} into {} ({} / {})", employee.name(), department.name(), payment.type(), bonus.type());
		return employee;
	}

	public void assignManager(String departmentName, String employeeName) {
		Department department = requireDepartment(departmentName);
		Employee manager = department.employees().stream()
				.filter(e -> e.name().equals(employeeName))
				.findFirst()
				.orElseThrow(() -> new IllegalArgumentException(
						"employee " + employeeName + " is not in department " + departmentName));
		department.assignManager(manager);
		log.info("{} is now manager of {}", employeeName, departmentName);
	}

	public void setPlan(String departmentName, YearMonth month, BigDecimal value) {
		Amounts.requireNonNegative("plan", value);
		requireDepartment(departmentName).setPlan(month, value);
		log.info("plan for {} in {} set to {}", departmentName, month, value);
	}

	public void distributePlan(String departmentName, YearMonth month) {
		Department department = requireDepartment(departmentName);
		if (department.employees().isEmpty()) {
			log.info("department {} has no employees, nothing to distribute for {}", departmentName, month);
			return;
		}
		department.distributePlan(month);
		log.info("plan {} for {} distributed over {} employees", department.planFor(month), month,
				department.employees().size());
	}

	public List<SalaryLine> calculateSalaries(YearMonth month) {
		return employees.findAll().stream()
				.map(e -> new SalaryLine(e.name(), e.position(), month,
						e.calculateSalary(month, requireDepartment(e.departmentName()))))
				.toList();
	}

	public List<Employee> listEmployees() {
		return employees.findAll();
	}

	public List<DepartmentSummary> listDepartments() {
		return departments.findAll().stream()
				.map(d -> new DepartmentSummary(d.name(), d.employees().size(), d.manager().map(Employee::name)))
				.toList();
	}

	private Department requireDepartment(String name) {
		return departments.findByName(name)
				.orElseThrow(() -> new DepartmentNotFoundException(name));
	}
}
