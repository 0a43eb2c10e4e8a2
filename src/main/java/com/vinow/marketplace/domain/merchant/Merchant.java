package com.vinow.marketplace.domain.merchant;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Merchant - 가맹점 (배치 대상 열거용 최소 모델)
 *
 * 가맹점 등록/심사는 별도 서비스 소관이며, 여기서는 상태만 읽는다.
 */
@Entity
@Table(name = "merchants")
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Merchant {

    @Id
    @Column(name = "merchant_id")
    private Long merchantId;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "status", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private MerchantStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public boolean isActive() {
        return status == MerchantStatus.ACTIVE;
    }
}
