package com.nyota.common.exceptions.application;


import com.nyota.common.exceptions.CustomException;
import com.nyota.common.exceptions.ErrorCode;

/**
 * 인증되지 않은 요청일 때 발생하는 예외
 * HTTP 401 Unauthorized
 */
public class UnauthorizedException extends CustomException {

	public UnauthorizedException(ErrorCode errorCode, String message) {
		super(errorCode, message);
	}

	@Override
	public String getExceptionType() {
		return "APPLICATION";
	}

	public static UnauthorizedException webhookSignatureInvalid() {
		return new UnauthorizedException(ErrorCode.WEBHOOK_AUTHENTICATION_FAILED, "Webhook signature is invalid.");
	}

	public static UnauthorizedException webhookCredentialMissing() {
		return new UnauthorizedException(ErrorCode.WEBHOOK_AUTHENTICATION_FAILED, "Webhook signature or secret is required.");
	}

	public static UnauthorizedException noLibrarySession() {
		return new UnauthorizedException(ErrorCode.NO_LIBRARY_SESSION, "Please recover your library access first.");
	}
}
