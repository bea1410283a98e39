package com.nyota.common.exceptions;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

	@ExceptionHandler(CustomException.class)
	public ResponseEntity<ErrorResponse> handleCustomException(
			CustomException ex, HttpServletRequest request) {
		log.warn("CustomException [{}] {}: {}", ex.getExceptionType(), ex.getErrorCode().getErrCode(), ex.getMessage());

		ResponseEntity.BodyBuilder response = ResponseEntity.status(ex.getHttpStatus());
		// 잠금 응답은 Retry-After 헤더 포함
		if (ex.getRetryAfterSeconds() != null) {
			response.header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()));
		}
		return response.body(ErrorResponse.of(ex, request.getRequestURI()));
	}

	@Override
	protected ResponseEntity<Object> handleMethodArgumentNotValid(
			MethodArgumentNotValidException ex,
			HttpHeaders headers,
			HttpStatusCode status,
			WebRequest request) {
		log.warn("Validation failed: {} field errors", ex.getBindingResult().getFieldErrorCount());

		String path = request.getDescription(false).replace("uri=", "");
		return ResponseEntity.badRequest()
				.body(ErrorResponse.ofValidation(path, ex.getBindingResult().getFieldErrors()));
	}

	/**
	 * 도메인 값 검증 실패 (금액, 필수 값 등)
	 */
	@ExceptionHandler(IllegalArgumentException.class)
	public ResponseEntity<ErrorResponse> handleIllegalArgument(
			IllegalArgumentException ex, HttpServletRequest request) {
		log.warn("Invalid argument: {}", ex.getMessage());

		return ResponseEntity.badRequest()
				.body(ErrorResponse.of(ErrorCode.INVALID_INPUT, ex.getMessage(), request.getRequestURI()));
	}

	@ExceptionHandler(Exception.class)
	public ResponseEntity<ErrorResponse> handleGeneralException(
			Exception ex, HttpServletRequest request) {
		log.error("Unexpected exception occurred", ex);

		return ResponseEntity.internalServerError()
				.body(ErrorResponse.of(ErrorCode.INTERNAL_SERVER_ERROR,
						"Something went wrong. Please try again.", request.getRequestURI()));
	}
}
