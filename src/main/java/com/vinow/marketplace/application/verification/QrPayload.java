package com.vinow.marketplace.application.verification;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 해석된 QR 페이로드: 검증 코드 또는 주문 ID 중 하나
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class QrPayload {

    private final String verificationCode;
    private final Long orderId;

    public static QrPayload ofCode(String verificationCode) {
        return new QrPayload(verificationCode, null);
    }

    public static QrPayload ofOrderId(Long orderId) {
        return new QrPayload(null, orderId);
    }

    public boolean hasCode() {
        return verificationCode != null;
    }
}
