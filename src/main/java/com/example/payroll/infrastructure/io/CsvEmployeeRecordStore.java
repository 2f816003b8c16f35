package com.example.payroll.infrastructure.io;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.payroll.domain.model.Amounts;
import com.example.payroll.domain.model.EmployeeRecord;
import com.example.payroll.exception.MalformedInputException;
import com.example.payroll.exception.RecordStoreException;
import com.example.payroll.port.outbound.EmployeeRecordLoader;
import com.example.payroll.port.outbound.EmployeeRecordSaver;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

/**
 * ヘッダー付き CSV。実績(production)は扱わない。
 * 書き出し時の列は常に {@link #COLUMNS} で、値が無い項目は空欄。
 */
public class CsvEmployeeRecordStore implements EmployeeRecordLoader, EmployeeRecordSaver {
	private static final Logger log = LoggerFactory.getLogger(CsvEmployeeRecordStore.class);

	static final String NAME = "name";
	static final String POSITION = "position";
	static final String DEPARTMENT = "department";
	static final String BASE_SALARY = "base_salary";
	static final String BONUS = "bonus";
	static final String PAYMENT_SCHEME = "payment_scheme";
	static final String BONUS_SCHEME = "bonus_scheme";

	static final List<String> COLUMNS = List.of(
			NAME, POSITION, DEPARTMENT, BASE_SALARY, BONUS, PAYMENT_SCHEME, BONUS_SCHEME);

	private final CsvMapper mapper = new CsvMapper();

	@Override
	public List<EmployeeRecord> load(Path path) {
		CsvSchema schema = CsvSchema.emptySchema().withHeader();
		try (MappingIterator<Map<String, String>> rows = mapper.readerForMapOf(String.class)
				.with(schema)
				.readValues(path.toFile())) {
			List<EmployeeRecord> records = new ArrayList<>();
			int line = 1; // ヘッダー行
			while (rows.hasNextValue()) {
				line++;
				records.add(toRecord(rows.nextValue(), line));
			}
			log.debug("read {} records from {}", records.size(), path);
			return records;
		} catch (JsonProcessingException e) {
			throw new MalformedInputException("invalid employee CSV in " + path + ": " + e.getOriginalMessage(), e);
		} catch (IOException e) {
			throw new RecordStoreException("load", path, e);
		}
	}

	@Override
	public void save(Path path, List<EmployeeRecord> records) {
		if (records.isEmpty()) {
			log.warn("no employee records to write, {} left untouched", path);
			return;
		}
		CsvSchema.Builder builder = CsvSchema.builder().setUseHeader(true);
		COLUMNS.forEach(builder::addColumn);

		try (SequenceWriter out = mapper.writer(builder.build()).writeValues(path.toFile())) {
			for (EmployeeRecord record : records) {
				out.write(toRow(record));
			}
			log.debug("wrote {} records to {}", records.size(), path);
		} catch (IOException e) {
			throw new RecordStoreException("save", path, e);
		}
	}

	// 値が無い項目も空欄で出す
	private static Map<String, Object> toRow(EmployeeRecord r) {
		Map<String, Object> row = new LinkedHashMap<>();
		row.put(NAME, r.name());
		row.put(POSITION, r.position());
		row.put(DEPARTMENT, r.department());
		row.put(BASE_SALARY, r.baseSalary());
		row.put(BONUS, r.bonus());
		row.put(PAYMENT_SCHEME, r.paymentScheme());
		row.put(BONUS_SCHEME, r.bonusScheme());
		return row;
	}

	private static EmployeeRecord toRecord(Map<String, String> row, int line) {
		try {
			String name = required(row, NAME);
			String department = required(row, DEPARTMENT);
			BigDecimal baseSalary = Amounts.parse(BASE_SALARY, required(row, BASE_SALARY));
			String bonusRaw = optional(row, BONUS);
			BigDecimal bonus = bonusRaw == null ? null : Amounts.parse(BONUS, bonusRaw);
			return new EmployeeRecord(name, optional(row, POSITION), department, baseSalary, bonus,
					optional(row, PAYMENT_SCHEME), optional(row, BONUS_SCHEME), null);
		} catch (MalformedInputException e) {
			throw new MalformedInputException("line " + line + ": " + e.getMessage(), e);
		}
	}

	private static String required(Map<String, String> row, String column) {
		String value = optional(row, column);
		if (value == null)
			throw new MalformedInputException(column + " is required");
		return value;
	}

	private static String optional(Map<String, String> row, String column) {
		String value = row.get(column);
		return value == null || value.isBlank() ? null : value.trim();
	}
}
