package com.vinow.marketplace.infrastructure.persistence.merchant;

import com.vinow.marketplace.domain.merchant.Merchant;
import com.vinow.marketplace.domain.merchant.MerchantStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface MerchantJpaRepository extends JpaRepository<Merchant, Long> {

    @Query("SELECT m.merchantId FROM Merchant m WHERE m.status = :status ORDER BY m.merchantId")
    List<Long> findIdsByStatus(@Param("status") MerchantStatus status);
}
