package com.nyota.access.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.nyota.access.domain.AccessGrant;

import java.time.LocalDateTime;
import java.util.List;

public record AccessGrantResponse(
        // 마스킹된 번호
        String phoneNumber,

        List<String> purchaseIds,

        @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
        LocalDateTime expiresAt
) {
    public static AccessGrantResponse from(AccessGrant grant) {
        String phone = grant.phoneNumber();
        return new AccessGrantResponse(
                "*".repeat(phone.length() - 3) + phone.substring(phone.length() - 3),
                grant.purchaseIds(),
                grant.expiresAt()
        );
    }
}
