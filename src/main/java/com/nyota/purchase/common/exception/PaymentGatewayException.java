package com.nyota.purchase.common.exception;

import com.nyota.common.exceptions.CustomException;
import com.nyota.common.exceptions.ErrorCode;

/**
 * 결제 게이트웨이 호출(푸시 결제 요청) 실패
 */
public class PaymentGatewayException extends CustomException {

    public PaymentGatewayException(String message, Throwable cause) {
        super(ErrorCode.GATEWAY_PUSH_FAILED, message, cause);
    }

    @Override
    public String getExceptionType() {
        return "APPLICATION";
    }
}
