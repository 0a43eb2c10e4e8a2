package com.vinow.marketplace.infrastructure.persistence.verification;

import com.vinow.marketplace.domain.verification.VerificationRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;

public interface VerificationRecordJpaRepository extends JpaRepository<VerificationRecord, Long> {

    List<VerificationRecord> findByOrderId(Long orderId);

    long countByOrderId(Long orderId);

    @Query("SELECT r FROM VerificationRecord r " +
           "WHERE r.merchantId = :merchantId " +
           "AND (:staffId IS NULL OR r.staffId = :staffId) " +
           "AND r.createdAt >= :from AND r.createdAt < :to")
    List<VerificationRecord> search(@Param("merchantId") Long merchantId,
                                    @Param("staffId") String staffId,
                                    @Param("from") LocalDateTime from,
                                    @Param("to") LocalDateTime to,
                                    Pageable pageable);

    @Query("SELECT COUNT(r) FROM VerificationRecord r " +
           "WHERE r.merchantId = :merchantId " +
           "AND (:staffId IS NULL OR r.staffId = :staffId) " +
           "AND r.createdAt >= :from AND r.createdAt < :to")
    long countSearch(@Param("merchantId") Long merchantId,
                     @Param("staffId") String staffId,
                     @Param("from") LocalDateTime from,
                     @Param("to") LocalDateTime to);

    @Query("SELECT r FROM VerificationRecord r " +
           "WHERE r.merchantId = :merchantId " +
           "AND r.createdAt >= :from AND r.createdAt < :to " +
           "ORDER BY r.verificationRecordId")
    List<VerificationRecord> findCreatedBetween(@Param("merchantId") Long merchantId,
                                                @Param("from") LocalDateTime from,
                                                @Param("to") LocalDateTime to);
}
