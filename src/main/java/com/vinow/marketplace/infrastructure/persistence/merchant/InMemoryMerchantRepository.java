package com.vinow.marketplace.infrastructure.persistence.merchant;

import com.vinow.marketplace.domain.merchant.Merchant;
import com.vinow.marketplace.domain.merchant.MerchantRepository;
import com.vinow.marketplace.infrastructure.persistence.InMemoryDatastore;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Repository
@InMemoryDatastore
public class InMemoryMerchantRepository implements MerchantRepository {

    private final ConcurrentHashMap<Long, Merchant> merchants = new ConcurrentHashMap<>();

    @Override
    public Merchant save(Merchant merchant) {
        merchants.put(merchant.getMerchantId(), merchant);
        return merchant;
    }

    @Override
    public Optional<Merchant> findById(Long merchantId) {
        return Optional.ofNullable(merchants.get(merchantId));
    }

    @Override
    public List<Long> findActiveMerchantIds() {
        return merchants.values().stream()
                .filter(Merchant::isActive)
                .map(Merchant::getMerchantId)
                .sorted()
                .collect(Collectors.toList());
    }
}
