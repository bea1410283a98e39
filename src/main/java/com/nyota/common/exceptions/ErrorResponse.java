package com.nyota.common.exceptions;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.validation.FieldError;

import java.time.LocalDateTime;
import java.util.List;

/**
 * API 에러 응답 본문
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
		@JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss")
		LocalDateTime timestamp,
		int status,
		String code,
		String message,
		String path,
		// DOMAIN | APPLICATION
		String exceptionType,
		// 잠금 응답에서만 채워짐 (Retry-After 헤더와 같은 값)
		Long retryAfterSeconds,
		List<FieldErrorDetail> fieldErrors
) {

	public static ErrorResponse of(CustomException ex, String path) {
		return new ErrorResponse(
				LocalDateTime.now(),
				ex.getHttpStatus().value(),
				ex.getErrorCode().getErrCode(),
				ex.getMessage(),
				path,
				ex.getExceptionType(),
				ex.getRetryAfterSeconds(),
				null
		);
	}

	public static ErrorResponse of(ErrorCode errorCode, String message, String path) {
		return new ErrorResponse(
				LocalDateTime.now(),
				errorCode.getStatus().value(),
				errorCode.getErrCode(),
				message,
				path,
				null,
				null,
				null
		);
	}

	public static ErrorResponse ofValidation(String path, List<FieldError> errors) {
		List<FieldErrorDetail> fieldErrors = errors.stream()
				.map(FieldErrorDetail::from)
				.toList();

		return new ErrorResponse(
				LocalDateTime.now(),
				400,
				"VALIDATION_ERROR",
				"Request validation failed.",
				path,
				null,
				null,
				fieldErrors
		);
	}

	public record FieldErrorDetail(String field, String rejectedValue, String message) {

		static FieldErrorDetail from(FieldError error) {
			Object rejected = error.getRejectedValue();
			return new FieldErrorDetail(
					error.getField(),
					rejected != null ? rejected.toString() : null,
					error.getDefaultMessage()
			);
		}
	}
}
