package com.nyota.purchase.application.service;

import com.nyota.common.exceptions.application.UnauthorizedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("WebhookSignatureVerifier 테스트")
class WebhookSignatureVerifierTest {

    private final WebhookSignatureVerifier verifier = new WebhookSignatureVerifier("key");

    @Test
    @DisplayName("서명 - 알려진 HMAC-SHA256 hex 값")
    void sign_KnownVector() {
        // HMAC_SHA256("key", "The quick brown fox jumps over the lazy dog")
        assertThat(verifier.sign("The quick brown fox jumps over the lazy dog"))
                .isEqualTo("f7bc83f430538424b13298e6aa6fb143ef4d59a14946175997479dbc2d1a3cd8");
    }

    @Test
    @DisplayName("서명 검증 - 대문자 hex 도 허용")
    void verify_UppercaseSignature_Accepted() {
        String body = "{\"a\":1}";
        String signature = verifier.sign(body).toUpperCase(Locale.ROOT);

        assertThatCode(() -> verifier.verify(body, signature, null)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("서명 검증 - 기본 로케일이 터키어여도 대문자 hex 허용")
    void verify_UppercaseSignature_TurkishDefaultLocale() {
        Locale original = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            String body = "{\"a\":1}";
            String signature = verifier.sign(body).toUpperCase(Locale.ROOT);

            assertThatCode(() -> verifier.verify(body, signature, null)).doesNotThrowAnyException();
        } finally {
            Locale.setDefault(original);
        }
    }

    @Test
    @DisplayName("서명 검증 - 본문이 바뀌면 거부")
    void verify_TamperedBody_Rejected() {
        String signature = verifier.sign("{\"amount\":500}");

        assertThatThrownBy(() -> verifier.verify("{\"amount\":5}", signature, null))
                .isInstanceOf(UnauthorizedException.class);
    }

    @Test
    @DisplayName("서명 헤더가 있으면 본문 secret 은 무시")
    void verify_SignatureTakesPrecedence() {
        assertThatThrownBy(() -> verifier.verify("{}", "00", "key"))
                .isInstanceOf(UnauthorizedException.class);
    }

    @Test
    @DisplayName("본문 secret 불일치 - 거부")
    void verify_WrongSecret_Rejected() {
        assertThatThrownBy(() -> verifier.verify("{}", null, "wrong"))
                .isInstanceOf(UnauthorizedException.class);
    }

    @Test
    @DisplayName("secret 미설정 - 생성 시 실패")
    void constructor_BlankSecret_Rejected() {
        assertThatThrownBy(() -> new WebhookSignatureVerifier(" "))
                .isInstanceOf(IllegalStateException.class);
    }
}
