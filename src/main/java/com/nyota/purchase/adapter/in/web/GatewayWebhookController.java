package com.nyota.purchase.adapter.in.web;

import com.nyota.purchase.adapter.in.web.dto.WebhookAckResponse;
import com.nyota.purchase.application.service.WebhookIngestService;
import com.nyota.purchase.domain.CallbackResolution;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/webhooks")
@RequiredArgsConstructor
@Slf4j
public class GatewayWebhookController {

    public static final String SIGNATURE_HEADER = "X-Gateway-Signature";

    private final WebhookIngestService webhookIngestService;

    // 서명 검증을 위해 본문을 원문 그대로 받는다
    @PostMapping(value = "/gateway", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<WebhookAckResponse> receive(
            @RequestBody String rawPayload,
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature
    ) {
        CallbackResolution resolution = webhookIngestService.ingest(rawPayload, signature);
        log.info("웹훅 응답 반환 - result: {}", resolution);

        return ResponseEntity.ok(WebhookAckResponse.from(resolution));
    }
}
