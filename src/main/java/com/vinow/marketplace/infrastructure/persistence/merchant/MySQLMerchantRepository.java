package com.vinow.marketplace.infrastructure.persistence.merchant;

import com.vinow.marketplace.common.exception.ExternalIOException;
import com.vinow.marketplace.domain.merchant.Merchant;
import com.vinow.marketplace.domain.merchant.MerchantRepository;
import com.vinow.marketplace.domain.merchant.MerchantStatus;
import com.vinow.marketplace.infrastructure.persistence.JpaDatastore;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
@JpaDatastore
public class MySQLMerchantRepository implements MerchantRepository {

    private final MerchantJpaRepository merchantJpaRepository;

    public MySQLMerchantRepository(MerchantJpaRepository merchantJpaRepository) {
        this.merchantJpaRepository = merchantJpaRepository;
    }

    @Override
    public Merchant save(Merchant merchant) {
        return merchantJpaRepository.save(merchant);
    }

    @Override
    public Optional<Merchant> findById(Long merchantId) {
        return merchantJpaRepository.findById(merchantId);
    }

    @Override
    public List<Long> findActiveMerchantIds() {
        try {
            return merchantJpaRepository.findIdsByStatus(MerchantStatus.ACTIVE);
        } catch (DataAccessException e) {
            throw ExternalIOException.datastore("활성 가맹점 조회 실패", e);
        }
    }
}
