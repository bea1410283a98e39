package com.nyota.purchase.application.service;

import com.nyota.common.exceptions.application.UnauthorizedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;

/**
 * 게이트웨이 웹훅 인증.
 * 서명 헤더(원문 본문의 HMAC-SHA256 hex)가 있으면 서명으로, 없으면 본문의 secret 필드로 검증한다.
 */
@Component
@Slf4j
public class WebhookSignatureVerifier {

    private static final String ALGORITHM = "HmacSHA256";

    private final byte[] webhookSecret;

    public WebhookSignatureVerifier(@Value("${nyota.gateway.webhook-secret}") String webhookSecret) {
        if (webhookSecret == null || webhookSecret.isBlank()) {
            throw new IllegalStateException("nyota.gateway.webhook-secret 설정이 필요합니다");
        }
        this.webhookSecret = webhookSecret.getBytes(StandardCharsets.UTF_8);
    }

    public void verify(String rawPayload, String signature, String payloadSecret) {
        if (signature != null && !signature.isBlank()) {
            byte[] expected = sign(rawPayload).getBytes(StandardCharsets.US_ASCII);
            byte[] provided = signature.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII);
            if (!MessageDigest.isEqual(expected, provided)) {
                log.warn("웹훅 서명 불일치");
                throw UnauthorizedException.webhookSignatureInvalid();
            }
            return;
        }

        if (payloadSecret != null) {
            if (!MessageDigest.isEqual(webhookSecret, payloadSecret.getBytes(StandardCharsets.UTF_8))) {
                log.warn("웹훅 secret 불일치");
                throw UnauthorizedException.webhookSignatureInvalid();
            }
            return;
        }

        log.warn("웹훅 인증 정보 없음");
        throw UnauthorizedException.webhookCredentialMissing();
    }

    public String sign(String rawPayload) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(webhookSecret, ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(rawPayload.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC 계산 실패", e);
        }
    }
}
