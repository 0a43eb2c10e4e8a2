package com.vinow.marketplace.unit.application.verification;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vinow.marketplace.application.verification.QrPayload;
import com.vinow.marketplace.application.verification.QrPayloadDecoder;
import com.vinow.marketplace.common.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("QrPayloadDecoder 테스트")
class QrPayloadDecoderTest {

    private final QrPayloadDecoder decoder = new QrPayloadDecoder(new ObjectMapper());

    @Test
    @DisplayName("order_<id> - 주문 ID")
    void testDecode_OrderIdPrefix() {
        QrPayload payload = decoder.decode("order_5001");

        assertFalse(payload.hasCode());
        assertEquals(5001L, payload.getOrderId());
    }

    @Test
    @DisplayName("JSON order_id - 숫자/문자열 모두 허용")
    void testDecode_JsonOrderId() {
        assertEquals(42L, decoder.decode("{\"order_id\": 42}").getOrderId());
        assertEquals(43L, decoder.decode("{\"order_id\": \"43\"}").getOrderId());
    }

    @Test
    @DisplayName("JSON code - 대문자로 정규화, code가 order_id보다 우선")
    void testDecode_JsonCode() {
        QrPayload payload = decoder.decode("{\"code\": \"abc123\", \"order_id\": 7}");

        assertTrue(payload.hasCode());
        assertEquals("ABC123", payload.getVerificationCode());
    }

    @Test
    @DisplayName("URL code 파라미터")
    void testDecode_UriCode() {
        QrPayload payload = decoder.decode("https://vinow.vn/redeem?code=xyz789&src=pos");

        assertEquals("XYZ789", payload.getVerificationCode());
    }

    @Test
    @DisplayName("코드 단독")
    void testDecode_BareCode() {
        assertEquals("K7M2PQ9R", decoder.decode(" k7m2pq9r ").getVerificationCode());
    }

    @ParameterizedTest
    @ValueSource(strings = {"order_abc", "order_-1", "{\"foo\": 1}", "{not json", "https://vinow.vn/redeem", "ab", "코드"})
    @DisplayName("해석할 수 없는 페이로드 - ValidationException")
    void testDecode_Invalid(String raw) {
        assertThrows(ValidationException.class, () -> decoder.decode(raw));
    }
}
