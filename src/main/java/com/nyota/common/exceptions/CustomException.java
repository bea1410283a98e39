package com.nyota.common.exceptions;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 구매/접근 복구 예외의 공통 부모. HTTP 상태는 ErrorCode 가 결정한다.
 */
@Getter
public abstract class CustomException extends RuntimeException {

	private final ErrorCode errorCode;

	protected CustomException(ErrorCode errorCode) {
		this(errorCode, errorCode.getMessage(), null);
	}

	protected CustomException(ErrorCode errorCode, String message) {
		this(errorCode, message, null);
	}

	protected CustomException(ErrorCode errorCode, String message, Throwable cause) {
		super(message, cause);
		this.errorCode = errorCode;
	}

	public HttpStatus getHttpStatus() {
		return errorCode.getStatus();
	}

	/**
	 * 클라이언트가 다시 시도해도 되는 시점까지 남은 초, 해당 없으면 null
	 */
	public Long getRetryAfterSeconds() {
		return null;
	}

	// DOMAIN | APPLICATION
	public abstract String getExceptionType();
}
