package com.vinow.marketplace.domain.refund;

import java.util.List;
import java.util.Optional;

public interface RefundRecordRepository {

    RefundRecord save(RefundRecord record);

    /**
     * 주문의 처리 대기(REQUESTED) 환불 기록
     */
    Optional<RefundRecord> findOpenByOrderId(Long orderId);

    List<RefundRecord> findByOrderId(Long orderId);
}
