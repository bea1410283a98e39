package com.nyota.access.adapter.in.web;

import com.nyota.access.domain.AccessGrant;
import jakarta.servlet.http.HttpSession;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * HTTP 세션에 구매자 번호를 묶는다. 새 권한이 발급되면 기존 번호를 대체한다 (계정 전환).
 */
@Component
public class LibrarySession {

    static final String CUSTOMER_PHONE_ATTRIBUTE = "nyota.library.customerPhone";

    private final Duration sessionLifetime;

    public LibrarySession(@Value("${nyota.access.session-lifetime:365d}") Duration sessionLifetime) {
        this.sessionLifetime = sessionLifetime;
    }

    public void bind(HttpSession session, AccessGrant grant) {
        session.setAttribute(CUSTOMER_PHONE_ATTRIBUTE, grant.phoneNumber());
        session.setMaxInactiveInterval((int) Math.min(Integer.MAX_VALUE, sessionLifetime.toSeconds()));
    }

    public Optional<String> currentPhone(HttpSession session) {
        if (session == null) {
            return Optional.empty();
        }
        return Optional.ofNullable((String) session.getAttribute(CUSTOMER_PHONE_ATTRIBUTE));
    }
}
