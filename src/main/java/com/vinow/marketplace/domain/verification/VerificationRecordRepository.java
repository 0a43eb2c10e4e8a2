package com.vinow.marketplace.domain.verification;

import java.time.LocalDateTime;
import java.util.List;

/**
 * VerificationRecord Repository Interface (Port)
 *
 * 추가 전용: 갱신/삭제 메서드 없음
 */
public interface VerificationRecordRepository {

    VerificationRecord save(VerificationRecord record);

    List<VerificationRecord> findByOrderId(Long orderId);

    long countByOrderId(Long orderId);

    /**
     * 가맹점 기록 조회, 최신순
     *
     * @param staffId null이면 전체 직원
     * @param from    null이면 하한 없음 (포함)
     * @param to      null이면 상한 없음 (미포함)
     */
    List<VerificationRecord> findByMerchant(Long merchantId, String staffId,
                                            LocalDateTime from, LocalDateTime to, int page, int size);

    long countByMerchant(Long merchantId, String staffId, LocalDateTime from, LocalDateTime to);

    /**
     * 가맹점의 기간 내 기록 [from, to)
     */
    List<VerificationRecord> findByMerchantIdAndCreatedAtBetween(Long merchantId, LocalDateTime from, LocalDateTime to);
}
