package com.example.payroll.infrastructure.io;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.payroll.domain.model.EmployeeRecord;
import com.example.payroll.exception.MalformedInputException;
import com.example.payroll.exception.RecordStoreException;
import com.example.payroll.port.outbound.EmployeeRecordLoader;
import com.example.payroll.port.outbound.EmployeeRecordSaver;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

/**
 * 従業員レコードの JSON 配列ファイル。出力はインデント4スペース。
 */
public class JsonEmployeeRecordStore implements EmployeeRecordLoader, EmployeeRecordSaver {
	private static final Logger log = LoggerFactory.getLogger(JsonEmployeeRecordStore.class);
	private static final TypeReference<List<EmployeeRecord>> RECORDS = new TypeReference<>() {
	};

	private final ObjectMapper mapper;
	private final ObjectWriter writer;

	public JsonEmployeeRecordStore() {
		this(new ObjectMapper());
	}

	public JsonEmployeeRecordStore(ObjectMapper mapper) {
		this.mapper = mapper;
		DefaultIndenter indenter = new DefaultIndenter("    ", "\n");
		DefaultPrettyPrinter printer = new DefaultPrettyPrinter();
		printer.indentObjectsWith(indenter);
		printer.indentArraysWith(indenter);
		this.writer = mapper.writer(printer);
	}

	@Override
	public List<EmployeeRecord> load(Path path) {
		try {
			List<EmployeeRecord> records = mapper.readValue(path.toFile(), RECORDS);
			log.debug("read {} records from {}", records == null ? 0 : records.size(), path);
			return records == null ? List.of() : records;
		} catch (JsonProcessingException e) {
			throw new MalformedInputException("invalid employee JSON in " + path + ": " + e.getOriginalMessage(), e);
		} catch (IOException e) {
			throw new RecordStoreException("load", path, e);
		}
	}

	@Override
	public void save(Path path, List<EmployeeRecord> records) {
		try {
			writer.writeValue(path.toFile(), records);
			log.debug("wrote {} records to {}", records.size(), path);
		} catch (IOException e) {
			throw new RecordStoreException("save", path, e);
		}
	}
}
