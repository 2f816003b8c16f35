package com.example.payroll.adapter.console;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.YearMonth;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.payroll.app.PayrollDataService;
import com.example.payroll.app.PayrollService;
import com.example.payroll.app.dto.EmployeeRequest;
import com.example.payroll.app.selector.SchemeSelector;
import com.example.payroll.config.PayrollSettings;
import com.example.payroll.domain.model.Amounts;
import com.example.payroll.domain.model.MonthKey;
import com.example.payroll.domain.policy.bonus.BonusSchemeType;
import com.example.payroll.exception.DepartmentNotFoundException;
import com.example.payroll.exception.RecordStoreException;

/**
 * 対話メニュー（1〜12）。エラーは表示してループを続ける。
 */
public class PayrollConsole {
	private static final Logger log = LoggerFactory.getLogger(PayrollConsole.class);

	private final BufferedReader in;
	private final PrintStream out;
	private final PayrollService payroll;
	private final PayrollDataService data;
	private final PayrollSettings settings;

	public PayrollConsole(BufferedReader in, PrintStream out, PayrollService payroll, PayrollDataService data,
			PayrollSettings settings) {
		this.in = in;
		this.out = out;
		this.payroll = payroll;
		this.data = data;
		this.settings = settings;
	}

	public void run() {
		try {
			while (true) {
				printMenu();
				String choice = ask("Your choice: ");
				if (choice.equals("12")) {
					out.println("Bye.");
					return;
				}
				try {
					dispatch(choice);
				} catch (DepartmentNotFoundException | IllegalArgumentException e) {
					out.println("Error: " + e.getMessage());
					log.debug("action {} rejected: {}", choice, e.getMessage());
				} catch (RecordStoreException e) {
					out.println("Error: " + e.getMessage());
					log.warn("file action {} failed", choice, e);
				}
			}
		} catch (InputClosedException e) {
			// 入力終了 = 終了
			log.debug("input closed, leaving menu");
		}
	}

	private void printMenu() {
		out.println();
		out.println("===== Menu =====");
		out.println("1. Create department");
		out.println("2. Add employee");
		out.println("3. Set department plan");
		out.println("4. Distribute plan");
		out.println("5. Calculate salaries");
		out.println("6. Save to JSON");
		out.println("7. Save to CSV");
		out.println("8. List employees");
		out.println("9. List departments");
		out.println("10. Load from JSON");
		out.println("11. Load from CSV");
		out.println("12. Exit");
	}

	private void dispatch(String choice) {
		switch (choice) {
			case "1" -> createDepartment();
			case "2" -> addEmployee();
			case "3" -> setPlan();
			case "4" -> distributePlan();
			case "5" -> calculateSalaries();
			case "6" -> out.println("Saved " + data.exportJson(askPath("JSON file path", settings.jsonPath()))
					+ " employees.");
			case "7" -> out.println("Saved " + data.exportCsv(askPath("CSV file path", settings.csvPath()))
					+ " employees.");
			case "8" -> listEmployees();
			case "9" -> listDepartments();
			case "10" -> out.println("Loaded " + data.importJson(askPath("JSON file path", settings.jsonPath()))
					+ " employees.");
			case "11" -> out.println("Loaded " + data.importCsv(askPath("CSV file path", settings.csvPath()))
					+ " employees.");
			default -> out.println("Invalid choice!");
		}
	}

	private void createDepartment() {
		String name = ask("Department name: ");
		boolean existed = payroll.findDepartment(name).isPresent();
		payroll.createDepartment(name);
		out.println(existed ? "Department " + name + " already exists." : "Department " + name + " created.");
	}

	private void addEmployee() {
		String name = ask("Employee name: ");
		String position = ask("Position: ");
		String department = ask("Department: ");
		BigDecimal baseSalary = Amounts.parseNonNegative("base salary", ask("Base rate: "));

		out.println("Bonus scheme:");
		out.println("1. Fixed amount");
		out.println("2. 10% of base rate");
		out.println("3. Plan performance (20% of base rate)");
		String bonusCode = ask("Your choice: ");
		BigDecimal bonusAmount = null;
		if (SchemeSelector.bonusType(bonusCode) == BonusSchemeType.FIXED) {
			bonusAmount = Amounts.parseNonNegative("fixed bonus", ask("Fixed bonus amount: "));
		}

		out.println("Payment scheme:");
		out.println("1. Base rate + bonus");
		out.println("2. Per unit of production + bonus");
		out.println("3. Plan completion + bonus");
		String paymentCode = ask("Your choice: ");
		SchemeSelector.paymentType(paymentCode);

		boolean manager = ask("Manager? (y/N): ").equalsIgnoreCase("y");

		payroll.hire(new EmployeeRequest(name, position, department, baseSalary, bonusCode, bonusAmount,
				paymentCode, manager));
		out.println("Employee " + name + " added.");
	}

	private void setPlan() {
		String department = ask("Department name: ");
		YearMonth month = MonthKey.parse(ask("Month (YYYY-MM): "));
		BigDecimal plan = Amounts.parseNonNegative("plan", ask("Plan: "));
		payroll.setPlan(department, month, plan);
		out.println("Plan saved.");
	}

	private void distributePlan() {
		String department = ask("Department name: ");
		YearMonth month = MonthKey.parse(ask("Month (YYYY-MM): "));
		payroll.distributePlan(department, month);
		out.println("Plan distributed.");
	}

	private void calculateSalaries() {
		YearMonth month = MonthKey.parse(ask("Month (YYYY-MM): "));
		for (var line : payroll.calculateSalaries(month)) {
			out.println(String.format(Locale.ROOT, "%s (%s) - salary for %s: %.2f",
					line.employeeName(), line.position(), MonthKey.format(month), line.salary()));
		}
	}

	private void listEmployees() {
		payroll.listEmployees().forEach(out::println);
	}

	private void listDepartments() {
		for (var d : payroll.listDepartments()) {
			out.println(d.name() + " - employees: " + d.employeeCount()
					+ d.managerName().map(m -> ", manager: " + m).orElse(""));
		}
	}

	private Path askPath(String label, Path fallback) {
		String raw = ask(label + " [" + fallback + "]: ");
		return raw.isEmpty() ? fallback : Path.of(raw);
	}

	private String ask(String prompt) {
		out.print(prompt);
		out.flush();
		try {
			String line = in.readLine();
			if (line == null)
				throw new InputClosedException();
			return line.trim();
		} catch (IOException e) {
			throw new UncheckedIOException("failed to read console input", e);
		}
	}

	private static class InputClosedException extends RuntimeException {
		InputClosedException() {
			super("input closed");
		}
	}
}
