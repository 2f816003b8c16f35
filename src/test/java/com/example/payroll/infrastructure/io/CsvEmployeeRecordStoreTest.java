package com.example.payroll.infrastructure.io;

import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.example.payroll.app.PayrollDataService;
import com.example.payroll.app.PayrollService;
import com.example.payroll.app.dto.EmployeeRequest;
import com.example.payroll.app.dto.SalaryLine;
import com.example.payroll.domain.model.EmployeeRecord;
import com.example.payroll.exception.MalformedInputException;
import com.example.payroll.exception.RecordStoreException;
import com.example.payroll.infrastructure.persistence.DepartmentRepositoryInMemory;
import com.example.payroll.infrastructure.persistence.EmployeeRepositoryInMemory;
import com.example.payroll.port.outbound.RecordFormat;

class CsvEmployeeRecordStoreTest {

	@TempDir
	Path dir;

	CsvEmployeeRecordStore sut = new CsvEmployeeRecordStore();

	@Test
	@Tag("anchor")
	@DisplayName("ヘッダーは先頭レコードに関係なく全項目")
	void header_always_lists_every_column() throws IOException {
		Path file = dir.resolve("employees.csv");

		sut.save(file, List.of(
				EmployeeRecord.simple("Ann", "Clerk", "Sales", new BigDecimal("2000")),
				new EmployeeRecord("Bob", "Rep", "HR", new BigDecimal("1800"), new BigDecimal("50"),
						"FIXED_SALARY", "FIXED", null)));

		List<String> lines = Files.readAllLines(file);
		assertThat(lines.get(0)).isEqualTo("name,position,department,base_salary,bonus,payment_scheme,bonus_scheme");
		assertThat(lines).hasSize(3);
		assertThat(lines.get(1)).isEqualTo("Ann,Clerk,Sales,2000,,,");
	}

	@Test
	@Tag("regression")
	void fixed_bonus_after_non_fixed_first_record_is_kept() {
		Path file = dir.resolve("mixed.csv");

		sut.save(file, List.of(
				new EmployeeRecord("Bob", "Rep", "Sales", new BigDecimal("1500"), null,
						"PERCENT_PLAN", "PLAN_PERFORMANCE", null),
				new EmployeeRecord("Ann", "Clerk", "Sales", new BigDecimal("2000"), new BigDecimal("300"),
						"FIXED_SALARY", "FIXED", null)));

		List<EmployeeRecord> loaded = sut.load(file);
		assertThat(loaded.get(0).bonus()).isNull();
		assertThat(loaded.get(1).bonus()).isEqualByComparingTo("300");
		assertThat(loaded.get(1).bonusScheme()).isEqualTo("FIXED");
	}

	@Test
	void later_records_leave_missing_cells_empty() throws IOException {
		Path file = dir.resolve("employees.csv");

		sut.save(file, List.of(
				new EmployeeRecord("Ann", "Clerk", "Sales", new BigDecimal("2000"), new BigDecimal("300"),
						"FIXED_SALARY", "FIXED", null),
				new EmployeeRecord("Bob", "Rep", "Sales", new BigDecimal("1500"), null,
						"PERCENT_PLAN", "PLAN_PERFORMANCE", null)));

		List<EmployeeRecord> loaded = sut.load(file);
		assertThat(loaded).hasSize(2);
		assertThat(loaded.get(0).bonus()).isEqualByComparingTo("300");
		assertThat(loaded.get(1).bonus()).isNull();
		assertThat(loaded.get(1).paymentScheme()).isEqualTo("PERCENT_PLAN");
		assertThat(loaded.get(1).bonusScheme()).isEqualTo("PLAN_PERFORMANCE");
	}

	@Test
	@DisplayName("レコード0件なら何も書かない")
	void empty_records_write_nothing() {
		Path file = dir.resolve("empty.csv");

		sut.save(file, List.of());

		assertThat(file).doesNotExist();
	}

	@Test
	@DisplayName("数値は文字列として読み、実績は持たない")
	void parses_numbers_from_text() throws IOException {
		Path file = dir.resolve("plain.csv");
		Files.writeString(file, "name,position,department,base_salary\nAnn,Clerk,Sales,2000.0\nBob,Rep,HR, 1800 \n");

		List<EmployeeRecord> records = sut.load(file);

		assertThat(records).extracting(EmployeeRecord::name).containsExactly("Ann", "Bob");
		assertThat(records.get(0).baseSalary()).isEqualByComparingTo("2000");
		assertThat(records.get(1).baseSalary()).isEqualByComparingTo("1800");
		assertThat(records).allSatisfy(r -> {
			assertThat(r.production()).isNull();
			assertThat(r.bonus()).isNull();
		});
	}

	@Test
	@Tag("regression")
	void missing_required_cell_reports_line() throws IOException {
		Path file = dir.resolve("missing.csv");
		Files.writeString(file, "name,position,department,base_salary\nAnn,Clerk,Sales,2000\nBob,Rep,HR,\n");

		assertThatThrownBy(() -> sut.load(file))
				.isInstanceOf(MalformedInputException.class)
				.hasMessageContaining("line 3")
				.hasMessageContaining("base_salary is required");
	}

	@Test
	void non_numeric_salary_is_malformed() throws IOException {
		Path file = dir.resolve("nan.csv");
		Files.writeString(file, "name,position,department,base_salary\nAnn,Clerk,Sales,plenty\n");

		assertThatThrownBy(() -> sut.load(file))
				.isInstanceOf(MalformedInputException.class)
				.hasMessageContaining("base_salary must be a number");
	}

	@Test
	void missing_department_column_is_malformed() throws IOException {
		Path file = dir.resolve("nodept.csv");
		Files.writeString(file, "name,position,base_salary\nAnn,Clerk,2000\n");

		assertThatThrownBy(() -> sut.load(file))
				.isInstanceOf(MalformedInputException.class)
				.hasMessageContaining("department is required");
	}

	@Test
	void missing_file_is_a_store_failure() {
		assertThatThrownBy(() -> sut.load(dir.resolve("nope.csv")))
				.isInstanceOf(RecordStoreException.class);
	}

	@Test
	@Tag("regression")
	@DisplayName("CSV 保存→読込で固定賞与の給与が変わらない")
	void csv_round_trip_keeps_salaries() {
		YearMonth may = YearMonth.of(2024, 5);
		Path file = dir.resolve("payroll.csv");
		var source = new PayrollService(new DepartmentRepositoryInMemory(), new EmployeeRepositoryInMemory());
		var sourceData = new PayrollDataService(source, Map.of(RecordFormat.CSV, sut), Map.of(RecordFormat.CSV, sut));
		source.createDepartment("Sales");
		source.hire(new EmployeeRequest("Bob", "Rep", "Sales", new BigDecimal("1500"), "3", null, "3", false));
		source.hire(new EmployeeRequest("Ann", "Clerk", "Sales", new BigDecimal("2000"), "1",
				new BigDecimal("300"), "1", false));

		sourceData.exportCsv(file);

		var target = new PayrollService(new DepartmentRepositoryInMemory(), new EmployeeRepositoryInMemory());
		var targetData = new PayrollDataService(target, Map.of(RecordFormat.CSV, sut), Map.of(RecordFormat.CSV, sut));
		assertThat(targetData.importCsv(file)).isEqualTo(2);

		List<SalaryLine> before = source.calculateSalaries(may);
		List<SalaryLine> after = target.calculateSalaries(may);
		assertThat(after).extracting(SalaryLine::employeeName).containsExactly("Bob", "Ann");
		assertThat(after.get(1).salary()).isEqualByComparingTo("2300");
		for (int i = 0; i < before.size(); i++) {
			assertThat(after.get(i).salary()).isEqualByComparingTo(before.get(i).salary());
		}
	}
}
