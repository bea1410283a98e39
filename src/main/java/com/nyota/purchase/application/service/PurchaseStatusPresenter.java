package com.nyota.purchase.application.service;

import com.nyota.purchase.application.dto.PurchaseStatusEvent;
import com.nyota.purchase.domain.Purchase;
import com.nyota.purchase.domain.PurchaseStatus;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class PurchaseStatusPresenter {

    private final String libraryUrl;

    public PurchaseStatusPresenter(@Value("${nyota.checkout.library-url:/library}") String libraryUrl) {
        this.libraryUrl = libraryUrl;
    }

    public PurchaseStatusEvent present(Purchase purchase) {
        return present(purchase.getPurchaseId(), purchase.getChannelId(), purchase.getStatus());
    }

    public PurchaseStatusEvent present(String purchaseId, String channelId, PurchaseStatus status) {
        return new PurchaseStatusEvent(
                purchaseId,
                channelId,
                status,
                messageFor(status),
                status == PurchaseStatus.COMPLETED ? libraryUrl : null
        );
    }

    private String messageFor(PurchaseStatus status) {
        return switch (status) {
            case PENDING -> "Please check your phone to authorize the payment.";
            case COMPLETED -> "Payment confirmed!";
            case FAILED -> "Payment failed. Please check your phone and try again.";
            case TIMED_OUT -> "We have not received a confirmation yet. Check again or retry the payment.";
            case CANCELLED -> "Payment cancelled.";
        };
    }
}
