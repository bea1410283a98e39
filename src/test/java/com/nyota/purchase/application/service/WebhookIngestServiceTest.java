package com.nyota.purchase.application.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nyota.common.exceptions.application.InvalidRequestException;
import com.nyota.common.exceptions.application.UnauthorizedException;
import com.nyota.purchase.application.dto.PurchaseResolvedEvent;
import com.nyota.purchase.application.port.out.PurchaseRepository;
import com.nyota.purchase.common.exception.PurchaseException;
import com.nyota.purchase.domain.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("WebhookIngestService 테스트")
class WebhookIngestServiceTest {

    private static final String SECRET = "webhook-secret";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-10T10:00:30Z"), ZoneOffset.UTC);

    @Mock
    private PurchaseRepository purchaseRepository;

    @Mock
    private TransactionTemplate transactionTemplate;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private WebhookSignatureVerifier signatureVerifier;
    private WebhookIngestService webhookIngestService;
    private Purchase purchase;

    @BeforeEach
    void setUp() {
        signatureVerifier = new WebhookSignatureVerifier(SECRET);
        webhookIngestService = new WebhookIngestService(
                purchaseRepository, signatureVerifier, transactionTemplate, eventPublisher, new ObjectMapper(), CLOCK);

        lenient().when(transactionTemplate.execute(any()))
                .thenAnswer(invocation -> invocation.<TransactionCallback<?>>getArgument(0).doInTransaction(null));
        lenient().when(purchaseRepository.save(any(Purchase.class))).thenAnswer(invocation -> invocation.getArgument(0));

        purchase = Purchase.initiate(PhoneNumber.of("0711000000"), "album-sunrise", Money.of(500),
                "channel-1", LocalDateTime.of(2026, 3, 10, 10, 0));
    }

    private String payload(String outcome, long amount) {
        return String.format("""
                {"gatewayReference":"%s","outcome":"%s","amount":%d,"transactionId":"TXN-1"}
                """, purchase.getGatewayReference(), outcome, amount);
    }

    @Test
    @DisplayName("성공 콜백 - COMPLETED 반영 및 이벤트 발행")
    void ingest_Success_AppliesAndPublishes() {
        // Given
        String body = payload("SUCCESS", 500);
        given(purchaseRepository.findByGatewayReferenceForUpdate(purchase.getGatewayReference()))
                .willReturn(Optional.of(purchase));

        // When
        CallbackResolution resolution = webhookIngestService.ingest(body, signatureVerifier.sign(body));

        // Then
        assertThat(resolution).isEqualTo(CallbackResolution.APPLIED);
        assertThat(purchase.getStatus()).isEqualTo(PurchaseStatus.COMPLETED);

        ArgumentCaptor<PurchaseResolvedEvent> captor = ArgumentCaptor.forClass(PurchaseResolvedEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        assertThat(captor.getValue().channelId()).isEqualTo("channel-1");
        assertThat(captor.getValue().status()).isEqualTo(PurchaseStatus.COMPLETED);
    }

    @Test
    @DisplayName("같은 콜백 여러 번 수신 - 한 번만 반영, 이벤트 한 번만 발행")
    void ingest_RepeatedDelivery_AppliedOnce() {
        String body = payload("SUCCESS", 500);
        String signature = signatureVerifier.sign(body);
        given(purchaseRepository.findByGatewayReferenceForUpdate(purchase.getGatewayReference()))
                .willReturn(Optional.of(purchase));

        CallbackResolution first = webhookIngestService.ingest(body, signature);
        CallbackResolution second = webhookIngestService.ingest(body, signature);
        CallbackResolution third = webhookIngestService.ingest(body, signature);

        assertThat(first).isEqualTo(CallbackResolution.APPLIED);
        assertThat(second).isEqualTo(CallbackResolution.DUPLICATE);
        assertThat(third).isEqualTo(CallbackResolution.DUPLICATE);
        verify(eventPublisher, times(1)).publishEvent(any(PurchaseResolvedEvent.class));
        verify(purchaseRepository, times(1)).save(purchase);
    }

    @Test
    @DisplayName("취소된 구매 - 결과만 기록, 이벤트 미발행")
    void ingest_CancelledPurchase_RecordsOnly() {
        purchase.cancel(LocalDateTime.of(2026, 3, 10, 10, 0, 10));
        String body = payload("SUCCESS", 500);
        given(purchaseRepository.findByGatewayReferenceForUpdate(purchase.getGatewayReference()))
                .willReturn(Optional.of(purchase));

        CallbackResolution resolution = webhookIngestService.ingest(body, signatureVerifier.sign(body));

        assertThat(resolution).isEqualTo(CallbackResolution.RECORDED_AFTER_CANCEL);
        assertThat(purchase.getStatus()).isEqualTo(PurchaseStatus.CANCELLED);
        assertThat(purchase.getLateOutcome()).isEqualTo(GatewayOutcome.SUCCESS);
        verify(purchaseRepository).save(purchase);
        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("본문 secret 으로 인증")
    void ingest_PayloadSecret_Accepted() {
        String body = String.format("""
                {"gatewayReference":"%s","outcome":"failed","secret":"%s"}
                """, purchase.getGatewayReference(), SECRET);
        given(purchaseRepository.findByGatewayReferenceForUpdate(purchase.getGatewayReference()))
                .willReturn(Optional.of(purchase));

        CallbackResolution resolution = webhookIngestService.ingest(body, null);

        assertThat(resolution).isEqualTo(CallbackResolution.APPLIED);
        assertThat(purchase.getStatus()).isEqualTo(PurchaseStatus.FAILED);
    }

    @Test
    @DisplayName("서명 불일치 - 인증 예외, 원장 미조회")
    void ingest_BadSignature_Rejected() {
        String body = payload("SUCCESS", 500);

        assertThatThrownBy(() -> webhookIngestService.ingest(body, "deadbeef"))
                .isInstanceOf(UnauthorizedException.class);
        verifyNoInteractions(purchaseRepository, eventPublisher);
    }

    @Test
    @DisplayName("인증 정보 없음 - 인증 예외")
    void ingest_NoCredential_Rejected() {
        assertThatThrownBy(() -> webhookIngestService.ingest(payload("SUCCESS", 500), null))
                .isInstanceOf(UnauthorizedException.class);
    }

    @Test
    @DisplayName("알 수 없는 참조 - NotFound 예외")
    void ingest_UnknownReference_NotFound() {
        String body = payload("SUCCESS", 500);
        given(purchaseRepository.findByGatewayReferenceForUpdate(purchase.getGatewayReference()))
                .willReturn(Optional.empty());

        assertThatThrownBy(() -> webhookIngestService.ingest(body, signatureVerifier.sign(body)))
                .isInstanceOf(PurchaseException.class)
                .hasMessageContaining(purchase.getGatewayReference());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("잘못된 본문 - 요청 예외")
    void ingest_MalformedBody_InvalidRequest() {
        assertThatThrownBy(() -> webhookIngestService.ingest("{not json", "x"))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    @DisplayName("알 수 없는 outcome - 요청 예외")
    void ingest_UnknownOutcome_InvalidRequest() {
        String body = payload("MAYBE", 500);

        assertThatThrownBy(() -> webhookIngestService.ingest(body, signatureVerifier.sign(body)))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("outcome");
    }
}
