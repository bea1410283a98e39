package com.nyota.purchase.adapter.in.web;

import com.nyota.purchase.application.service.PurchaseStreamService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping("/api/v1/purchases/stream")
@RequiredArgsConstructor
@Slf4j
public class PurchaseStreamController {

    private final PurchaseStreamService purchaseStreamService;

    @GetMapping(value = "/{channelId}", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@PathVariable String channelId) {
        log.info("스트림 연결 요청 - channelId: {}", channelId);
        return purchaseStreamService.open(channelId);
    }
}
