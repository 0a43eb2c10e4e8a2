package com.vinow.marketplace.common.id;

import com.vinow.marketplace.common.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.function.LongSupplier;

/**
 * BusinessIdGenerator - 주문/결제/환불/정산 번호 생성기
 *
 * 형식: {PREFIX}{yyyyMMddHHmmssSSS}{6자리 suffix}
 * 예: ORD20250115103000123000001
 *
 * 알고리즘:
 * 1. 모니터(synchronized)로 lastTimestamp, sequence 보호
 * 2. 새 밀리초의 첫 번호 → 난수 시작값 [0, 500000)을 sequence로 사용
 * 3. 같은 밀리초 재호출 → sequence 증가
 * 4. sequence가 10^6에 도달하면 다음 밀리초까지 spin-wait 후 난수 시작값으로 재설정
 * 5. suffix는 항상 0으로 채운 6자리 sequence
 *
 * 보장 범위:
 * - 같은 프로세스 내에서는 중복 없음
 * - 여러 인스턴스 간 유일성은 난수 suffix에 의존 (확률적)
 *   → 전역 유일성이 필요하면 인스턴스별 범위 할당 또는 DB 시퀀스를 사용해야 한다
 */
@Slf4j
@Component
public class BusinessIdGenerator {

    private static final int SEQUENCE_DIGITS = 6;
    private static final int SEQUENCE_LIMIT = 1_000_000;
    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMddHHmmssSSS").withZone(ZoneId.of("Asia/Ho_Chi_Minh"));

    private final LongSupplier clock;
    private final SecureRandom random = new SecureRandom();

    private long lastTimestamp = -1L;
    private int sequence = 0;

    @Autowired
    public BusinessIdGenerator() {
        this(System::currentTimeMillis);
    }

    BusinessIdGenerator(LongSupplier clock) {
        this.clock = clock;
    }

    public String next(IdPrefix prefix) {
        return next(prefix.getValue());
    }

    public String next(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new ValidationException("식별자 접두어는 비어 있을 수 없습니다");
        }

        long timestamp;
        int currentSequence;
        synchronized (this) {
            timestamp = clock.getAsLong();
            if (timestamp < lastTimestamp) {
                // 시계가 뒤로 간 경우 마지막 값을 유지해 단조 증가를 지킨다
                log.warn("[BusinessIdGenerator] 시계 역행 감지 - last={}, now={}", lastTimestamp, timestamp);
                timestamp = lastTimestamp;
            }

            if (timestamp == lastTimestamp) {
                sequence++;
                if (sequence >= SEQUENCE_LIMIT) {
                    timestamp = waitNextMillis(lastTimestamp);
                    sequence = randomStart();
                }
            } else {
                sequence = randomStart();
            }
            lastTimestamp = timestamp;
            currentSequence = sequence;
        }

        return prefix
                + TIMESTAMP_FORMAT.format(Instant.ofEpochMilli(timestamp))
                + String.format("%0" + SEQUENCE_DIGITS + "d", currentSequence);
    }

    /**
     * sequence 공간 소진 시 다음 밀리초까지 대기
     */
    private long waitNextMillis(long last) {
        long timestamp = clock.getAsLong();
        while (timestamp <= last) {
            Thread.onSpinWait();
            timestamp = clock.getAsLong();
        }
        return timestamp;
    }

    private int randomStart() {
        return random.nextInt(SEQUENCE_LIMIT / 2);
    }
}
