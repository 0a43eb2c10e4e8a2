package com.vinow.marketplace.infrastructure.lock;

/**
 * 락 키 생성 유틸리티
 */
public class LockKeyGenerator {

    private static final String ORDER_KEY_PREFIX = "marketplace:order:";

    public static String order(Long orderId) {
        return ORDER_KEY_PREFIX + orderId;
    }

    private LockKeyGenerator() {
        throw new AssertionError("이 클래스는 인스턴스화될 수 없습니다");
    }
}
