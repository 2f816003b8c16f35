package com.example.payroll;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.payroll.adapter.console.PayrollConsole;
import com.example.payroll.app.PayrollDataService;
import com.example.payroll.app.PayrollService;
import com.example.payroll.config.PayrollSettings;
import com.example.payroll.infrastructure.io.CsvEmployeeRecordStore;
import com.example.payroll.infrastructure.io.JsonEmployeeRecordStore;
import com.example.payroll.infrastructure.persistence.DepartmentRepositoryInMemory;
import com.example.payroll.infrastructure.persistence.EmployeeRepositoryInMemory;
import com.example.payroll.port.outbound.RecordFormat;

public class PayrollApplication {
	private static final Logger log = LoggerFactory.getLogger(PayrollApplication.class);

	public static void main(String[] args) {
		PayrollSettings settings = PayrollSettings.load();

		// セッション状態はここで作ってここで捨てる
		var payroll = new PayrollService(new DepartmentRepositoryInMemory(), new EmployeeRepositoryInMemory());
		var json = new JsonEmployeeRecordStore();
		var csv = new CsvEmployeeRecordStore();
		var data = new PayrollDataService(payroll,
				Map.of(RecordFormat.JSON, json, RecordFormat.CSV, csv),
				Map.of(RecordFormat.JSON, json, RecordFormat.CSV, csv));

		var console = new PayrollConsole(
				new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
				System.out, payroll, data, settings);

		log.info("payroll session started (json={}, csv={})", settings.jsonPath(), settings.csvPath());
		console.run();
		log.info("payroll session finished");
	}
}
