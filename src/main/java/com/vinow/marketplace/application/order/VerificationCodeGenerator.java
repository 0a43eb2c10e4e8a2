package com.vinow.marketplace.application.order;

import com.vinow.marketplace.common.exception.ApplicationException;
import com.vinow.marketplace.common.exception.ErrorCode;
import com.vinow.marketplace.domain.order.OrderRepository;
import com.vinow.marketplace.infrastructure.config.MarketplaceProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;

/**
 * 주문 검증 코드 생성기
 *
 * 형식: [A-Z0-9]{length} (혼동되는 0/O, 1/I 제외)
 * 저장소에 이미 있는 코드면 다시 뽑는다. 최종 유일성은 unique 제약이 보장한다.
 */
@Slf4j
@Component
public class VerificationCodeGenerator {

    private static final char[] ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789".toCharArray();
    private static final int MAX_ATTEMPTS = 10;

    private final OrderRepository orderRepository;
    private final int length;
    private final SecureRandom random = new SecureRandom();

    public VerificationCodeGenerator(OrderRepository orderRepository, MarketplaceProperties properties) {
        int configured = properties.getOrder().getVerificationCodeLength();
        if (configured < 4 || configured > 32) {
            throw new IllegalArgumentException("검증 코드 길이는 4~32 사이여야 합니다: " + configured);
        }
        this.orderRepository = orderRepository;
        this.length = configured;
    }

    public String generate() {
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            String candidate = randomCode();
            if (!orderRepository.existsByVerificationCode(candidate)) {
                return candidate;
            }
            log.debug("[VerificationCodeGenerator] 코드 충돌, 재생성 - attempt={}", attempt);
        }
        throw new ApplicationException(ErrorCode.ID_GENERATION_FAILED,
                "검증 코드 생성 실패 - attempts=" + MAX_ATTEMPTS);
    }

    private String randomCode() {
        StringBuilder code = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            code.append(ALPHABET[random.nextInt(ALPHABET.length)]);
        }
        return code.toString();
    }
}
