package com.nyota.access.adapter.in.web;

import com.nyota.access.adapter.in.web.dto.AccessGrantResponse;
import com.nyota.access.adapter.in.web.dto.AccessRecoveryRequest;
import com.nyota.access.adapter.in.web.dto.PurchaseSessionRequest;
import com.nyota.access.application.service.AccessRecoveryService;
import com.nyota.access.domain.AccessGrant;
import com.nyota.common.exceptions.application.UnauthorizedException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
public class AccessRecoveryController {

    private final AccessRecoveryService accessRecoveryService;
    private final LibrarySession librarySession;

    @PostMapping("/library/recover")
    public ResponseEntity<AccessGrantResponse> recover(
            @Valid @RequestBody AccessRecoveryRequest request,
            HttpServletRequest httpRequest
    ) {
        log.info("접근 복구 요청 수신 - purchaseDate: {}", request.purchaseDate());

        AccessGrant grant = accessRecoveryService.recover(
                request.phoneNumber(),
                request.purchaseDate(),
                httpRequest.getRemoteAddr()
        );
        librarySession.bind(httpRequest.getSession(true), grant);

        return ResponseEntity.ok(AccessGrantResponse.from(grant));
    }

    @GetMapping("/library/session")
    public ResponseEntity<AccessGrantResponse> currentSession(HttpServletRequest httpRequest) {
        String phone = librarySession.currentPhone(httpRequest.getSession(false))
                .orElseThrow(UnauthorizedException::noLibrarySession);

        return ResponseEntity.ok(AccessGrantResponse.from(accessRecoveryService.currentAccess(phone)));
    }

    // 결제 완료 직후 라이브러리 세션 발급
    @PostMapping("/purchases/{purchaseId}/session")
    public ResponseEntity<AccessGrantResponse> bindPurchaseSession(
            @PathVariable String purchaseId,
            @Valid @RequestBody PurchaseSessionRequest request,
            HttpServletRequest httpRequest
    ) {
        log.info("결제 완료 세션 요청 수신 - purchaseId: {}", purchaseId);

        AccessGrant grant = accessRecoveryService.grantForCompletedPurchase(
                purchaseId,
                request.gatewayReference(),
                request.phoneNumber()
        );
        librarySession.bind(httpRequest.getSession(true), grant);

        return ResponseEntity.ok(AccessGrantResponse.from(grant));
    }
}
