package com.nyota.purchase.adapter.in.web;

import com.nyota.purchase.adapter.in.web.dto.*;
import com.nyota.purchase.application.service.*;
import com.nyota.purchase.domain.Purchase;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/purchases")
@RequiredArgsConstructor
@Slf4j
public class PurchaseController {

    private final PurchaseCheckoutService purchaseCheckoutService;
    private final PurchaseQueryService purchaseQueryService;
    private final PurchaseRetryService purchaseRetryService;
    private final PurchaseCancelService purchaseCancelService;
    private final PendingPurchaseExpiryService pendingPurchaseExpiryService;
    private final PurchaseStatusPresenter presenter;

    @PostMapping
    public ResponseEntity<CheckoutResponse> checkout(
            @Valid @RequestBody CheckoutRequest request
    ) {
        log.info("체크아웃 요청 수신 - asset: {}, amount: {}, channelId: {}",
                request.assetReference(), request.amount(), request.channelId());

        Purchase purchase = purchaseCheckoutService.checkout(
                request.phoneNumber(),
                request.assetReference(),
                request.amount(),
                request.channelId()
        );

        CheckoutResponse response = CheckoutResponse.from(purchase, presenter.present(purchase));
        log.info("체크아웃 응답 반환 - purchaseId: {}, status: {}", response.purchaseId(), response.status());

        return ResponseEntity
                .status(HttpStatus.CREATED)
                .body(response);
    }

    @GetMapping("/{purchaseId}")
    public ResponseEntity<PurchaseStatusResponse> getPurchase(
            @PathVariable String purchaseId
    ) {
        Purchase purchase = purchaseQueryService.getPurchase(purchaseId);
        return ResponseEntity.ok(PurchaseStatusResponse.from(purchase, presenter.present(purchase)));
    }

    @PostMapping("/{purchaseId}/retry")
    public ResponseEntity<RetryResponse> retry(
            @PathVariable String purchaseId,
            @Valid @RequestBody RetryRequest request
    ) {
        log.info("재시도 요청 수신 - purchaseId: {}", purchaseId);

        Purchase purchase = purchaseRetryService.retry(
                purchaseId,
                request.gatewayReference(),
                request.phoneNumber()
        );

        RetryResponse response = RetryResponse.from(purchase, presenter.present(purchase));
        log.info("재시도 응답 반환 - purchaseId: {}, attempt: {}, status: {}",
                response.purchaseId(), response.attemptCount(), response.status());

        return ResponseEntity.ok(response);
    }

    @PostMapping("/{purchaseId}/cancel")
    public ResponseEntity<PurchaseStatusResponse> cancel(
            @PathVariable String purchaseId
    ) {
        log.info("취소 요청 수신 - purchaseId: {}", purchaseId);

        Purchase purchase = purchaseCancelService.cancel(purchaseId);
        return ResponseEntity.ok(PurchaseStatusResponse.from(purchase, presenter.present(purchase)));
    }

    // 클라이언트 측 대기 시간 초과 보고
    @PostMapping("/{purchaseId}/timeout")
    public ResponseEntity<PurchaseStatusResponse> reportTimeout(
            @PathVariable String purchaseId
    ) {
        log.info("대기 초과 보고 수신 - purchaseId: {}", purchaseId);

        Purchase purchase = pendingPurchaseExpiryService.reportClientTimeout(purchaseId);
        return ResponseEntity.ok(PurchaseStatusResponse.from(purchase, presenter.present(purchase)));
    }
}
