package com.nyota.purchase.common.exception;

import com.nyota.common.exceptions.CustomException;
import com.nyota.common.exceptions.ErrorCode;
import com.nyota.purchase.domain.PurchaseStatus;

public class PurchaseException extends CustomException {

    public PurchaseException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public static PurchaseException notFound(String purchaseId) {
        return new PurchaseException(ErrorCode.PURCHASE_NOT_FOUND, "Purchase not found: " + purchaseId);
    }

    public static PurchaseException gatewayReferenceNotFound(String gatewayReference) {
        return new PurchaseException(
                ErrorCode.GATEWAY_REFERENCE_NOT_FOUND,
                "No purchase for gateway reference: " + gatewayReference
        );
    }

    public static PurchaseException invalidState(String purchaseId, PurchaseStatus current, String action) {
        return new PurchaseException(
                ErrorCode.INVALID_PURCHASE_STATE,
                String.format("Cannot %s purchase %s in state %s", action, purchaseId, current)
        );
    }

    public static PurchaseException ownershipMismatch(String purchaseId) {
        return new PurchaseException(
                ErrorCode.PURCHASE_OWNERSHIP_MISMATCH,
                "Purchase details do not match: " + purchaseId
        );
    }

    public static PurchaseException channelConflict(String channelId) {
        return new PurchaseException(
                ErrorCode.CHANNEL_ALREADY_IN_USE,
                "Channel is already used by another checkout: " + channelId
        );
    }

    @Override
    public String getExceptionType() {
        return "DOMAIN";
    }
}
