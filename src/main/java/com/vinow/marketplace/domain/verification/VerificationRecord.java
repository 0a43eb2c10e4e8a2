package com.vinow.marketplace.domain.verification;

import com.vinow.marketplace.domain.order.Order;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * VerificationRecord - 사용(검증) 감사 기록
 *
 * 비즈니스 규칙:
 * - 성공한 사용 1건당 정확히 1건 생성
 * - 생성 후 수정/삭제 없음 (모든 컬럼 updatable = false)
 * - order_id 유니크 제약으로 DB 레벨에서도 중복 사용 기록 차단
 */
@Entity
@Table(name = "verification_records",
        uniqueConstraints = @UniqueConstraint(name = "uk_verification_records_order", columnNames = "order_id"),
        indexes = {
                @Index(name = "idx_verification_records_merchant_created", columnList = "merchant_id, created_at"),
                @Index(name = "idx_verification_records_staff", columnList = "merchant_id, staff_id")
        })
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class VerificationRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "verification_record_id")
    private Long verificationRecordId;

    @Column(name = "order_id", nullable = false, updatable = false)
    private Long orderId;

    @Column(name = "merchant_id", nullable = false, updatable = false)
    private Long merchantId;

    @Column(name = "store_id", updatable = false)
    private Long storeId;

    @Column(name = "staff_id", nullable = false, updatable = false, length = 100)
    private String staffId;

    @Column(name = "staff_name", updatable = false, length = 100)
    private String staffName;

    @Column(name = "verification_method", nullable = false, updatable = false, length = 10)
    @Enumerated(EnumType.STRING)
    private VerificationMethod verificationMethod;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static VerificationRecord of(Order order, String staffId, String staffName,
                                        VerificationMethod method, LocalDateTime now) {
        return VerificationRecord.builder()
                .orderId(order.getOrderId())
                .merchantId(order.getMerchantId())
                .storeId(order.getStoreId())
                .staffId(staffId)
                .staffName(staffName)
                .verificationMethod(method)
                .createdAt(now)
                .build();
    }

    public void assignId(Long verificationRecordId) {
        this.verificationRecordId = verificationRecordId;
    }
}
