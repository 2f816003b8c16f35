package com.example.payroll.exception;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

public class RecordStoreException extends UncheckedIOException {

	public RecordStoreException(String action, Path path, IOException cause) {
		super(action + " failed: " + path, cause);
	}
}
