package com.nyota.purchase.application.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nyota.common.exceptions.application.InvalidRequestException;
import com.nyota.purchase.adapter.in.web.dto.GatewayWebhookPayload;
import com.nyota.purchase.application.dto.PurchaseResolvedEvent;
import com.nyota.purchase.application.port.out.PurchaseRepository;
import com.nyota.purchase.common.exception.PurchaseException;
import com.nyota.purchase.domain.CallbackResolution;
import com.nyota.purchase.domain.GatewayOutcome;
import com.nyota.purchase.domain.Money;
import com.nyota.purchase.domain.Purchase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Locale;

/**
 * 게이트웨이 콜백 수신. 같은 콜백이 몇 번 도착하든 원장에는 한 번만 반영된다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookIngestService {

    private final PurchaseRepository purchaseRepository;
    private final WebhookSignatureVerifier signatureVerifier;
    private final TransactionTemplate transactionTemplate;
    private final ApplicationEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public CallbackResolution ingest(String rawPayload, String signature) {
        GatewayWebhookPayload payload = parse(rawPayload);
        signatureVerifier.verify(rawPayload, signature, payload.secret());

        GatewayOutcome outcome = parseOutcome(payload);
        log.info("게이트웨이 콜백 수신 - gatewayReference: {}, outcome: {}, amount: {}",
                payload.gatewayReference(), outcome, payload.amount());

        return transactionTemplate.execute(status -> apply(payload, outcome));
    }

    private CallbackResolution apply(GatewayWebhookPayload payload, GatewayOutcome outcome) {
        Purchase purchase = purchaseRepository.findByGatewayReferenceForUpdate(payload.gatewayReference())
                .orElseThrow(() -> {
                    log.warn("알 수 없는 게이트웨이 참조 - gatewayReference: {}", payload.gatewayReference());
                    return PurchaseException.gatewayReferenceNotFound(payload.gatewayReference());
                });

        Money reportedAmount = payload.amount() == null
                ? null
                : Money.of(payload.amount(), purchase.getAmount().getCurrency());

        CallbackResolution resolution = purchase.applyGatewayOutcome(
                outcome, reportedAmount, payload.transactionId(), LocalDateTime.now(clock));

        switch (resolution) {
            case APPLIED -> {
                Purchase saved = purchaseRepository.save(purchase);
                eventPublisher.publishEvent(PurchaseResolvedEvent.from(saved));
                log.info("콜백 반영 완료 - purchaseId: {}, status: {}, reason: {}",
                        saved.getPurchaseId(), saved.getStatus(), saved.getFailureReason());
            }
            case RECORDED_AFTER_CANCEL -> {
                purchaseRepository.save(purchase);
                log.warn("취소된 구매에 콜백 도착 - 결과만 기록 - purchaseId: {}, outcome: {}",
                        purchase.getPurchaseId(), outcome);
            }
            case DUPLICATE -> log.info("중복 콜백 무시 - purchaseId: {}, status: {}",
                    purchase.getPurchaseId(), purchase.getStatus());
        }
        return resolution;
    }

    private GatewayWebhookPayload parse(String rawPayload) {
        if (rawPayload == null || rawPayload.isBlank()) {
            throw InvalidRequestException.malformedPayload(null);
        }
        try {
            GatewayWebhookPayload payload = objectMapper.readValue(rawPayload, GatewayWebhookPayload.class);
            if (payload == null) {
                throw InvalidRequestException.malformedPayload(null);
            }
            return payload;
        } catch (JsonProcessingException e) {
            log.warn("웹훅 본문 파싱 실패 - error: {}", e.getOriginalMessage());
            throw InvalidRequestException.malformedPayload(e);
        }
    }

    private GatewayOutcome parseOutcome(GatewayWebhookPayload payload) {
        if (payload.gatewayReference() == null || payload.gatewayReference().isBlank()) {
            throw InvalidRequestException.requiredFieldMissing("gatewayReference");
        }
        if (payload.outcome() == null || payload.outcome().isBlank()) {
            throw InvalidRequestException.requiredFieldMissing("outcome");
        }
        try {
            return GatewayOutcome.valueOf(payload.outcome().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw InvalidRequestException.invalidFormat("outcome");
        }
    }
}
