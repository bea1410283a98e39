package com.nyota.common.exceptions;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public enum ErrorCode {
	// 구매 관련 에러 (PURCHASE_0XX)
	PURCHASE_NOT_FOUND("PURCHASE_001", "Purchase not found", HttpStatus.NOT_FOUND),
	INVALID_PURCHASE_STATE("PURCHASE_002", "Operation is not allowed in the current purchase state", HttpStatus.CONFLICT),
	GATEWAY_REFERENCE_NOT_FOUND("PURCHASE_003", "Unknown gateway reference", HttpStatus.NOT_FOUND),
	PURCHASE_OWNERSHIP_MISMATCH("PURCHASE_004", "Purchase details do not match", HttpStatus.BAD_REQUEST),
	CHANNEL_ALREADY_IN_USE("PURCHASE_005", "Channel is already bound to a different checkout", HttpStatus.CONFLICT),
	
	// 결제 게이트웨이 관련 에러 (GATEWAY_0XX)
	WEBHOOK_AUTHENTICATION_FAILED("GATEWAY_001", "Webhook authentication failed", HttpStatus.UNAUTHORIZED),
	GATEWAY_PUSH_FAILED("GATEWAY_002", "Payment gateway push failed", HttpStatus.BAD_GATEWAY),
	
	// 라이브러리 접근 관련 에러 (ACCESS_0XX)
	ACCESS_RATE_LIMITED("ACCESS_001", "Too many attempts, try again later", HttpStatus.TOO_MANY_REQUESTS),
	NO_MATCHING_PURCHASE("ACCESS_002", "No purchase matches the given details", HttpStatus.NOT_FOUND),
	NO_LIBRARY_SESSION("ACCESS_003", "No library access in this session", HttpStatus.UNAUTHORIZED),
	
	// 검증 관련 에러 (VALIDATION_0XX)
	INVALID_INPUT("VALIDATION_001", "Invalid input", HttpStatus.BAD_REQUEST),
	REQUIRED_FIELD_MISSING("VALIDATION_002", "Required field is missing", HttpStatus.BAD_REQUEST),
	INVALID_FORMAT("VALIDATION_003", "Invalid format", HttpStatus.BAD_REQUEST),
	
	// 시스템 에러 (SYSTEM_0XX)
	INTERNAL_SERVER_ERROR("SYSTEM_001", "Internal server error", HttpStatus.INTERNAL_SERVER_ERROR),
	;
	private final String errCode;
	private final String message;
	private final HttpStatus status;
	
	ErrorCode(String errCode, String message, HttpStatus status) {
		
		this.status = status;
		this.errCode = errCode;
		this.message = message;
	}
	
	@Override
	public String toString() {
		return "ErrorCode{"
				+ " status='"
				+ status
				+ '\''
				+ "errCode='"
				+ errCode
				+ '\''
				+ ", message='"
				+ message
				+ '\''
				+ '}';
	}
}
