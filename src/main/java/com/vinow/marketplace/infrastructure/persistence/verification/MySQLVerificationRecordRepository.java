package com.vinow.marketplace.infrastructure.persistence.verification;

import com.vinow.marketplace.domain.verification.VerificationRecord;
import com.vinow.marketplace.domain.verification.VerificationRecordRepository;
import com.vinow.marketplace.infrastructure.persistence.JpaDatastore;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * MySQL 기반 VerificationRecord Repository 구현
 *
 * 기간 조건이 없으면 넓은 경계값으로 대체해 JPQL 하나로 처리한다.
 */
@Repository
@JpaDatastore
public class MySQLVerificationRecordRepository implements VerificationRecordRepository {

    private static final LocalDateTime MIN_TIME = LocalDateTime.of(2000, 1, 1, 0, 0);
    private static final LocalDateTime MAX_TIME = LocalDateTime.of(9999, 12, 31, 0, 0);

    private final VerificationRecordJpaRepository verificationRecordJpaRepository;

    public MySQLVerificationRecordRepository(VerificationRecordJpaRepository verificationRecordJpaRepository) {
        this.verificationRecordJpaRepository = verificationRecordJpaRepository;
    }

    @Override
    public VerificationRecord save(VerificationRecord record) {
        return verificationRecordJpaRepository.save(record);
    }

    @Override
    public List<VerificationRecord> findByOrderId(Long orderId) {
        return verificationRecordJpaRepository.findByOrderId(orderId);
    }

    @Override
    public long countByOrderId(Long orderId) {
        return verificationRecordJpaRepository.countByOrderId(orderId);
    }

    @Override
    public List<VerificationRecord> findByMerchant(Long merchantId, String staffId, LocalDateTime from,
                                                   LocalDateTime to, int page, int size) {
        return verificationRecordJpaRepository.search(merchantId, staffId,
                from == null ? MIN_TIME : from,
                to == null ? MAX_TIME : to,
                PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "createdAt", "verificationRecordId")));
    }

    @Override
    public long countByMerchant(Long merchantId, String staffId, LocalDateTime from, LocalDateTime to) {
        return verificationRecordJpaRepository.countSearch(merchantId, staffId,
                from == null ? MIN_TIME : from,
                to == null ? MAX_TIME : to);
    }

    @Override
    public List<VerificationRecord> findByMerchantIdAndCreatedAtBetween(Long merchantId, LocalDateTime from,
                                                                        LocalDateTime to) {
        return verificationRecordJpaRepository.findCreatedBetween(merchantId, from, to);
    }
}
