package com.example.payroll.exception;

// 未定義のスキーム番号/タグが選ばれたとき
public class InvalidSelectionException extends IllegalArgumentException {

	public InvalidSelectionException(String what, String selection) {
		super("invalid " + what + " selection: " + selection);
	}
}
