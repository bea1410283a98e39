package com.nyota.access.common.exception;

import com.nyota.common.exceptions.CustomException;
import com.nyota.common.exceptions.ErrorCode;

public class AccessRecoveryException extends CustomException {

    public AccessRecoveryException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public static AccessRecoveryException noMatchingPurchase() {
        return new AccessRecoveryException(
                ErrorCode.NO_MATCHING_PURCHASE,
                "We could not find a purchase for that phone number and date."
        );
    }

    @Override
    public String getExceptionType() {
        return "DOMAIN";
    }
}
