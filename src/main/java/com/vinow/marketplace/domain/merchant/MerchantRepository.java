package com.vinow.marketplace.domain.merchant;

import java.util.List;
import java.util.Optional;

public interface MerchantRepository {

    Merchant save(Merchant merchant);

    Optional<Merchant> findById(Long merchantId);

    /**
     * 배치 대상 가맹점 ID (ACTIVE), 오름차순
     */
    List<Long> findActiveMerchantIds();
}
