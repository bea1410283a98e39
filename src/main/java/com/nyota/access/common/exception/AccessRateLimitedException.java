package com.nyota.access.common.exception;

import com.nyota.common.exceptions.CustomException;
import com.nyota.common.exceptions.ErrorCode;

import java.time.Duration;

public class AccessRateLimitedException extends CustomException {

    private final long retryAfterSeconds;

    public AccessRateLimitedException(String message, long retryAfterSeconds) {
        super(ErrorCode.ACCESS_RATE_LIMITED, message);
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public static AccessRateLimitedException lockedOut(Duration retryAfter) {
        // 초 단위 올림, 최소 1초
        long seconds = Math.max(1, (retryAfter.toMillis() + 999) / 1000);
        return new AccessRateLimitedException(
                "Too many attempts. Try again in " + seconds + " seconds.",
                seconds
        );
    }

    @Override
    public Long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }

    @Override
    public String getExceptionType() {
        return "DOMAIN";
    }
}
