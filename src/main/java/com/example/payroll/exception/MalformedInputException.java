package com.example.payroll.exception;

public class MalformedInputException extends IllegalArgumentException {

	public MalformedInputException(String message) {
		super(message);
	}

	public MalformedInputException(String message, Throwable cause) {
		super(message, cause);
	}
}
