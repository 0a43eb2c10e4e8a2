package com.vinow.marketplace.infrastructure.persistence.refund;

import com.vinow.marketplace.domain.refund.RefundRecord;
import com.vinow.marketplace.domain.refund.RefundStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface RefundRecordJpaRepository extends JpaRepository<RefundRecord, Long> {

    Optional<RefundRecord> findFirstByOrderIdAndStatusOrderByRefundRecordIdDesc(Long orderId, RefundStatus status);

    List<RefundRecord> findByOrderIdOrderByRefundRecordIdAsc(Long orderId);
}
