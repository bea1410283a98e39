package com.nyota.common.exceptions.application;


import com.nyota.common.exceptions.CustomException;
import com.nyota.common.exceptions.ErrorCode;

/**
 * 요청 데이터가 유효하지 않을 때 발생하는 예외
 * HTTP 400 Bad Request
 */
public class InvalidRequestException extends CustomException {
	
	public InvalidRequestException(ErrorCode errorCode, String message) {
		super(errorCode, message);
	}
	
	public InvalidRequestException(ErrorCode errorCode, String message, Throwable cause) {
		super(errorCode, message, cause);
	}
	
	public static InvalidRequestException invalidFormat(String fieldName) {
		return new InvalidRequestException(
				ErrorCode.INVALID_FORMAT,
				"Invalid format: " + fieldName
		);
	}
	
	public static InvalidRequestException malformedPayload(Throwable cause) {
		return new InvalidRequestException(
				ErrorCode.INVALID_FORMAT,
				"Malformed request payload",
				cause
		);
	}
	
	public static InvalidRequestException requiredFieldMissing(String fieldName) {
		return new InvalidRequestException(
				ErrorCode.REQUIRED_FIELD_MISSING,
				"Required field is missing: " + fieldName
		);
	}
	
	@Override
	public String getExceptionType() {
		return "APPLICATION";
	}
}
