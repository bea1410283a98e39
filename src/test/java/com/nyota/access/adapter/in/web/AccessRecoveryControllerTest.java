package com.nyota.access.adapter.in.web;

import com.nyota.access.application.service.AccessRecoveryService;
import com.nyota.access.common.exception.AccessRateLimitedException;
import com.nyota.access.common.exception.AccessRecoveryException;
import com.nyota.access.domain.AccessGrant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockHttpSession;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.BDDMockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AccessRecoveryController.class)
@Import(LibrarySession.class)
class AccessRecoveryControllerTest {

    private static final String RECOVER_BODY = "{\"phoneNumber\":\"0711000000\",\"purchaseDate\":\"2025-03-10\"}";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AccessRecoveryService accessRecoveryService;

    private static AccessGrant grant(String phone, String... purchaseIds) {
        return new AccessGrant(phone, List.of(purchaseIds), LocalDateTime.of(2027, 3, 20, 12, 0));
    }

    @Test
    @DisplayName("복구 API 성공 - 세션에 구매자 번호 바인딩")
    void recover_success() throws Exception {
        // given
        given(accessRecoveryService.recover(eq("0711000000"), eq(LocalDate.of(2025, 3, 10)), anyString()))
                .willReturn(grant("254711000000", "PUR-1"));

        // when
        MvcResult result = mockMvc.perform(post("/api/v1/library/recover")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(RECOVER_BODY)
                        .with(request -> {
                            request.setRemoteAddr("203.0.113.7");
                            return request;
                        }))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.phoneNumber").value("*********000"))
                .andExpect(jsonPath("$.purchaseIds[0]").value("PUR-1"))
                .andExpect(jsonPath("$.expiresAt").value("2027-03-20T12:00:00"))
                .andReturn();

        // then
        verify(accessRecoveryService).recover("0711000000", LocalDate.of(2025, 3, 10), "203.0.113.7");
        MockHttpSession session = (MockHttpSession) result.getRequest().getSession(false);
        assertThat(session).isNotNull();
        assertThat(session.getAttribute(LibrarySession.CUSTOMER_PHONE_ATTRIBUTE)).isEqualTo("254711000000");
        assertThat(session.getMaxInactiveInterval()).isEqualTo((int) Duration.ofDays(365).toSeconds());
    }

    @Test
    @DisplayName("복구 API - 잠금 시 429, Retry-After 헤더")
    void recover_rateLimited() throws Exception {
        given(accessRecoveryService.recover(anyString(), any(), anyString()))
                .willThrow(AccessRateLimitedException.lockedOut(Duration.ofMinutes(12)));

        mockMvc.perform(post("/api/v1/library/recover")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(RECOVER_BODY))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string(HttpHeaders.RETRY_AFTER, "720"))
                .andExpect(jsonPath("$.code").value("ACCESS_001"))
                .andExpect(jsonPath("$.retryAfterSeconds").value(720));
    }

    @Test
    @DisplayName("복구 API - 일치하는 구매 없음 404, 세션 미생성")
    void recover_notFound() throws Exception {
        given(accessRecoveryService.recover(anyString(), any(), anyString()))
                .willThrow(AccessRecoveryException.noMatchingPurchase());

        MvcResult result = mockMvc.perform(post("/api/v1/library/recover")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(RECOVER_BODY))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("ACCESS_002"))
                .andReturn();

        assertThat(result.getRequest().getSession(false)).isNull();
    }

    @Test
    @DisplayName("복구 API - 날짜 형식 오류 400")
    void recover_badDate() throws Exception {
        mockMvc.perform(post("/api/v1/library/recover")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"phoneNumber\":\"0711000000\",\"purchaseDate\":\"10/03/2026\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(accessRecoveryService);
    }

    @Test
    @DisplayName("새 권한 발급 시 세션의 번호 교체 (계정 전환)")
    void recover_switchAccount_replacesIdentity() throws Exception {
        MockHttpSession session = new MockHttpSession();
        session.setAttribute(LibrarySession.CUSTOMER_PHONE_ATTRIBUTE, "254722000000");
        given(accessRecoveryService.recover(anyString(), any(), anyString()))
                .willReturn(grant("254711000000", "PUR-1"));

        mockMvc.perform(post("/api/v1/library/recover")
                        .session(session)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(RECOVER_BODY))
                .andExpect(status().isOk());

        assertThat(session.getAttribute(LibrarySession.CUSTOMER_PHONE_ATTRIBUTE)).isEqualTo("254711000000");
    }

    @Test
    @DisplayName("세션 조회 - 세션 없으면 401")
    void currentSession_none() throws Exception {
        mockMvc.perform(get("/api/v1/library/session"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("ACCESS_003"));
    }

    @Test
    @DisplayName("세션 조회 - 바인딩된 번호의 권한 반환")
    void currentSession_bound() throws Exception {
        MockHttpSession session = new MockHttpSession();
        session.setAttribute(LibrarySession.CUSTOMER_PHONE_ATTRIBUTE, "254711000000");
        given(accessRecoveryService.currentAccess("254711000000")).willReturn(grant("254711000000", "PUR-1", "PUR-2"));

        mockMvc.perform(get("/api/v1/library/session").session(session))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.purchaseIds.length()").value(2));
    }

    @Test
    @DisplayName("결제 완료 세션 발급 - 번호와 게이트웨이 참조 전달")
    void bindPurchaseSession_success() throws Exception {
        given(accessRecoveryService.grantForCompletedPurchase("PUR-1", "GW-1", "0711000000"))
                .willReturn(grant("254711000000", "PUR-1"));

        MvcResult result = mockMvc.perform(post("/api/v1/purchases/{purchaseId}/session", "PUR-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"gatewayReference\":\"GW-1\",\"phoneNumber\":\"0711000000\"}"))
                .andExpect(status().isOk())
                .andReturn();

        assertThat(result.getRequest().getSession(false).getAttribute(LibrarySession.CUSTOMER_PHONE_ATTRIBUTE))
                .isEqualTo("254711000000");
    }

    @Test
    @DisplayName("결제 완료 세션 발급 - 본문 없는 요청은 400, 서비스 미호출")
    void bindPurchaseSession_BareId_BadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/purchases/{purchaseId}/session", "PUR-1"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/v1/purchases/{purchaseId}/session", "PUR-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"phoneNumber\":\"0711000000\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors[0].field").value("gatewayReference"));

        then(accessRecoveryService).shouldHaveNoInteractions();
    }
}
