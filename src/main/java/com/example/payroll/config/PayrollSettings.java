package com.example.payroll.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * クラスパスの payroll.properties。同名のシステムプロパティがあればそちらを優先。
 */
public record PayrollSettings(Path jsonPath, Path csvPath) {
	private static final Logger log = LoggerFactory.getLogger(PayrollSettings.class);

	public static final String RESOURCE = "payroll.properties";
	public static final String JSON_PATH = "payroll.json.path";
	public static final String CSV_PATH = "payroll.csv.path";

	public static PayrollSettings load() {
		return load(RESOURCE, System.getProperties());
	}

	public static PayrollSettings load(String resource, Properties overrides) {
		Properties props = new Properties();
		try (InputStream in = PayrollSettings.class.getClassLoader().getResourceAsStream(resource)) {
			if (in != null) {
				props.load(in);
			} else {
				log.debug("{} not found on classpath, using defaults", resource);
			}
		} catch (IOException e) {
			throw new UncheckedIOException("failed to read " + resource, e);
		}
		for (String key : new String[] { JSON_PATH, CSV_PATH }) {
			String value = overrides.getProperty(key);
			if (value != null && !value.isBlank()) {
				props.setProperty(key, value);
			}
		}
		return new PayrollSettings(
				Path.of(props.getProperty(JSON_PATH, "payroll.json")),
				Path.of(props.getProperty(CSV_PATH, "payroll.csv")));
	}
}
