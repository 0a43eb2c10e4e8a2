package com.vinow.marketplace.infrastructure.persistence.refund;

import com.vinow.marketplace.domain.refund.RefundRecord;
import com.vinow.marketplace.domain.refund.RefundRecordRepository;
import com.vinow.marketplace.domain.refund.RefundStatus;
import com.vinow.marketplace.infrastructure.persistence.JpaDatastore;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
@JpaDatastore
public class MySQLRefundRecordRepository implements RefundRecordRepository {

    private final RefundRecordJpaRepository refundRecordJpaRepository;

    public MySQLRefundRecordRepository(RefundRecordJpaRepository refundRecordJpaRepository) {
        this.refundRecordJpaRepository = refundRecordJpaRepository;
    }

    @Override
    public RefundRecord save(RefundRecord record) {
        return refundRecordJpaRepository.save(record);
    }

    @Override
    public Optional<RefundRecord> findOpenByOrderId(Long orderId) {
        return refundRecordJpaRepository.findFirstByOrderIdAndStatusOrderByRefundRecordIdDesc(orderId,
                RefundStatus.REQUESTED);
    }

    @Override
    public List<RefundRecord> findByOrderId(Long orderId) {
        return refundRecordJpaRepository.findByOrderIdOrderByRefundRecordIdAsc(orderId);
    }
}
