package com.vinow.marketplace.infrastructure.persistence.verification;

import com.vinow.marketplace.domain.verification.VerificationRecord;
import com.vinow.marketplace.domain.verification.VerificationRecordRepository;
import com.vinow.marketplace.infrastructure.persistence.InMemoryDatastore;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * InMemoryVerificationRecordRepository - 추가 전용 목록
 */
@Repository
@InMemoryDatastore
public class InMemoryVerificationRecordRepository implements VerificationRecordRepository {

    private final CopyOnWriteArrayList<VerificationRecord> records = new CopyOnWriteArrayList<>();
    private final AtomicLong idSequence = new AtomicLong();

    @Override
    public VerificationRecord save(VerificationRecord record) {
        if (record.getVerificationRecordId() != null) {
            throw new IllegalStateException("검증 기록은 수정할 수 없습니다 - id=" + record.getVerificationRecordId());
        }
        record.assignId(idSequence.incrementAndGet());
        records.add(record);
        return record;
    }

    @Override
    public List<VerificationRecord> findByOrderId(Long orderId) {
        return records.stream()
                .filter(record -> record.getOrderId().equals(orderId))
                .collect(Collectors.toList());
    }

    @Override
    public long countByOrderId(Long orderId) {
        return records.stream()
                .filter(record -> record.getOrderId().equals(orderId))
                .count();
    }

    @Override
    public List<VerificationRecord> findByMerchant(Long merchantId, String staffId, LocalDateTime from,
                                                   LocalDateTime to, int page, int size) {
        return records.stream()
                .filter(matches(merchantId, staffId, from, to))
                .sorted(Comparator.comparing(VerificationRecord::getCreatedAt)
                        .thenComparing(VerificationRecord::getVerificationRecordId)
                        .reversed())
                .skip((long) page * size)
                .limit(size)
                .collect(Collectors.toList());
    }

    @Override
    public long countByMerchant(Long merchantId, String staffId, LocalDateTime from, LocalDateTime to) {
        return records.stream().filter(matches(merchantId, staffId, from, to)).count();
    }

    @Override
    public List<VerificationRecord> findByMerchantIdAndCreatedAtBetween(Long merchantId, LocalDateTime from,
                                                                        LocalDateTime to) {
        return records.stream()
                .filter(matches(merchantId, null, from, to))
                .sorted(Comparator.comparing(VerificationRecord::getVerificationRecordId))
                .collect(Collectors.toList());
    }

    private Predicate<VerificationRecord> matches(Long merchantId, String staffId,
                                                  LocalDateTime from, LocalDateTime to) {
        return record -> record.getMerchantId().equals(merchantId)
                && (staffId == null || staffId.equals(record.getStaffId()))
                && (from == null || !record.getCreatedAt().isBefore(from))
                && (to == null || record.getCreatedAt().isBefore(to));
    }

    /**
     * 테스트용: 모든 기록 삭제
     */
    public void clear() {
        records.clear();
    }
}
