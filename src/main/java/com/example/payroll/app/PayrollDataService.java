package com.example.payroll.app;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.payroll.app.selector.SchemeSelector;
import com.example.payroll.domain.model.Employee;
import com.example.payroll.domain.model.EmployeeRecord;
import com.example.payroll.domain.model.MonthKey;
import com.example.payroll.domain.policy.bonus.BonusScheme;
import com.example.payroll.domain.policy.bonus.BonusSchemeType;
import com.example.payroll.domain.policy.bonus.FixedBonus;
import com.example.payroll.domain.policy.payment.PaymentScheme;
import com.example.payroll.domain.policy.payment.PaymentSchemeType;
import com.example.payroll.exception.MalformedInputException;
import com.example.payroll.port.outbound.EmployeeRecordLoader;
import com.example.payroll.port.outbound.EmployeeRecordSaver;
import com.example.payroll.port.outbound.RecordFormat;

/**
 * 従業員の保存と読込。読込は全レコードを検証してから登録する（部分登録しない）。
 */
public class PayrollDataService {
	private static final Logger log = LoggerFactory.getLogger(PayrollDataService.class);

	private final PayrollService payroll;
	private final Map<RecordFormat, EmployeeRecordLoader> loaders;
	private final Map<RecordFormat, EmployeeRecordSaver> savers;

	public PayrollDataService(PayrollService payroll,
			Map<RecordFormat, EmployeeRecordLoader> loaders,
			Map<RecordFormat, EmployeeRecordSaver> savers) {
		this.payroll = payroll;
		this.loaders = Map.copyOf(loaders);
		this.savers = Map.copyOf(savers);
	}

	public int exportJson(Path path) {
		return export(RecordFormat.JSON, path);
	}

	public int exportCsv(Path path) {
		return export(RecordFormat.CSV, path);
	}

	public int importJson(Path path) {
		return importFrom(RecordFormat.JSON, path);
	}

	public int importCsv(Path path) {
		return importFrom(RecordFormat.CSV, path);
	}

	private int export(RecordFormat format, Path path) {
		List<EmployeeRecord> records = payroll.listEmployees().stream()
				.map(e -> toRecord(e, format))
				.toList();
		saverFor(format).save(path, records);
		log.info("saved {} employee records to {} ({})", records.size(), path, format);
		return records.size();
	}

	private int importFrom(RecordFormat format, Path path) {
		List<EmployeeRecord> records = loaderFor(format).load(path);

		List<Employee> prepared = new ArrayList<>();
		for (int i = 0; i < records.size(); i++) {
			prepared.add(toEmployee(records.get(i), i + 1));
		}

		for (Employee e : prepared) {
			if (payroll.findDepartment(e.departmentName()).isEmpty()) {
				payroll.createDepartment(e.departmentName());
			}
			payroll.addEmployee(e.departmentName(), e);
		}
		log.info("loaded {} employee records from {} ({})", prepared.size(), path, format);
		return prepared.size();
	}

	static EmployeeRecord toRecord(Employee e, RecordFormat format) {
		BigDecimal bonus = e.bonusScheme() instanceof FixedBonus fixed ? fixed.amount() : null;
		Map<String, BigDecimal> production = null;
		// CSV には実績を載せない
		if (format == RecordFormat.JSON) {
			production = new LinkedHashMap<>();
			for (var entry : e.production().entrySet()) {
				production.put(MonthKey.format(entry.getKey()), entry.getValue());
			}
		}
		return new EmployeeRecord(e.name(), e.position(), e.departmentName(), e.baseSalary(), bonus,
				e.paymentScheme().type().name(), e.bonusScheme().type().name(), production);
	}

	/*
	 * スキームタグがなければ旧形式: 固定給 + 固定賞与(bonus、なければ0)
	 */
	static Employee toEmployee(EmployeeRecord r, int index) {
		if (r == null)
			throw new MalformedInputException("record " + index + ": empty record");
		if (r.name() == null || r.name().isBlank())
			throw new MalformedInputException("record " + index + ": name is required");
		if (r.department() == null || r.department().isBlank())
			throw new MalformedInputException("record " + index + ": department is required");
		if (r.baseSalary() == null)
			throw new MalformedInputException("record " + index + ": base_salary is required");
		if (r.baseSalary().signum() < 0)
			throw new MalformedInputException("record " + index + ": base_salary must be >= 0");

		BigDecimal bonusAmount = r.bonus() == null ? BigDecimal.ZERO : r.bonus();
		if (bonusAmount.signum() < 0)
			throw new MalformedInputException("record " + index + ": bonus must be >= 0");
		BonusSchemeType bonusType = r.bonusScheme() == null
				? BonusSchemeType.FIXED
				: SchemeSelector.bonusTypeForTag(r.bonusScheme());
		PaymentSchemeType paymentType = r.paymentScheme() == null
				? PaymentSchemeType.FIXED_SALARY
				: SchemeSelector.paymentTypeForTag(r.paymentScheme());
		BonusScheme bonus = SchemeSelector.bonusScheme(bonusType, bonusAmount);
		PaymentScheme payment = SchemeSelector.paymentScheme(paymentType);

		Employee employee = new Employee(r.name(), r.position(), r.department(), payment, bonus, r.baseSalary());
		if (r.production() != null) {
			for (var entry : r.production().entrySet()) {
				BigDecimal value = entry.getValue();
				if (value == null || value.signum() < 0)
					throw new MalformedInputException(
							"record " + index + ": production for " + entry.getKey() + " must be >= 0");
				employee.recordProduction(MonthKey.parse(entry.getKey()), value);
			}
		}
		return employee;
	}

	private EmployeeRecordLoader loaderFor(RecordFormat format) {
		var loader = loaders.get(format);
		if (loader == null)
			throw new IllegalStateException("no loader configured for " + format);
		return loader;
	}

	private EmployeeRecordSaver saverFor(RecordFormat format) {
		var saver = savers.get(format);
		if (saver == null)
			throw new IllegalStateException("no saver configured for " + format);
		return saver;
	}
}
