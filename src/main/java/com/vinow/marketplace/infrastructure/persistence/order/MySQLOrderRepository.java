package com.vinow.marketplace.infrastructure.persistence.order;

import com.vinow.marketplace.common.exception.ConcurrencyConflictException;
import com.vinow.marketplace.common.exception.ExternalIOException;
import com.vinow.marketplace.domain.order.Order;
import com.vinow.marketplace.domain.order.OrderRepository;
import com.vinow.marketplace.domain.order.OrderStatus;
import com.vinow.marketplace.infrastructure.persistence.JpaDatastore;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 Order Repository 구현
 *
 * 저장 시 예외 변환:
 * - 버전 충돌 (@Version) → ConcurrencyConflictException
 * - 그 외 접근 오류 → ExternalIOException
 * - 유니크 제약 위반은 그대로 전파 (호출자가 판단)
 */
@Repository
@JpaDatastore
public class MySQLOrderRepository implements OrderRepository {

    private final OrderJpaRepository orderJpaRepository;

    public MySQLOrderRepository(OrderJpaRepository orderJpaRepository) {
        this.orderJpaRepository = orderJpaRepository;
    }

    @Override
    public Order save(Order order) {
        try {
            return orderJpaRepository.saveAndFlush(order);
        } catch (OptimisticLockingFailureException e) {
            throw new ConcurrencyConflictException("orderId=" + order.getOrderId(), e);
        } catch (DataIntegrityViolationException e) {
            throw e;
        } catch (DataAccessException e) {
            throw ExternalIOException.datastore("주문 저장 실패 - orderId=" + order.getOrderId(), e);
        }
    }

    @Override
    public Optional<Order> findById(Long orderId) {
        return orderJpaRepository.findByIdWithItems(orderId);
    }

    @Override
    public Optional<Order> findByIdForUpdate(Long orderId) {
        return orderJpaRepository.findByIdForUpdate(orderId);
    }

    @Override
    public Optional<Order> findByOrderNumber(String orderNumber) {
        return orderJpaRepository.findByOrderNumber(orderNumber);
    }

    @Override
    public Optional<Order> findByVerificationCode(String verificationCode) {
        return orderJpaRepository.findByVerificationCode(verificationCode);
    }

    @Override
    public boolean existsByVerificationCode(String verificationCode) {
        return orderJpaRepository.existsByVerificationCode(verificationCode);
    }

    @Override
    public List<Order> findByMerchantId(Long merchantId, OrderStatus status, int page, int size) {
        return orderJpaRepository.findByMerchantIdAndOptionalStatus(merchantId, status,
                PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "createdAt")));
    }

    @Override
    public long countByMerchantId(Long merchantId, OrderStatus status) {
        return orderJpaRepository.countByMerchantIdAndOptionalStatus(merchantId, status);
    }

    @Override
    public List<Order> findByMerchantIdAndCreatedAtBetween(Long merchantId, LocalDateTime from, LocalDateTime to) {
        return orderJpaRepository.findCreatedBetween(merchantId, from, to);
    }

    @Override
    public List<Order> findByMerchantIdAndVerifiedAtBetween(Long merchantId, LocalDateTime from, LocalDateTime to) {
        return orderJpaRepository.findVerifiedBetween(merchantId, from, to);
    }

    @Override
    public List<Order> findByMerchantIdAndStatusOrderByUpdatedAtDesc(Long merchantId, OrderStatus status,
                                                                     int page, int size) {
        return orderJpaRepository.findByMerchantIdAndOrderStatusOrderByUpdatedAtDesc(merchantId, status,
                PageRequest.of(page, size));
    }

    @Override
    public List<Order> findByMerchantIdAndUpdatedAtAfter(Long merchantId, LocalDateTime since) {
        return orderJpaRepository.findByMerchantIdAndUpdatedAtGreaterThanEqual(merchantId, since);
    }

    @Override
    public List<Order> findAllByIds(List<Long> orderIds) {
        if (orderIds.isEmpty()) {
            return List.of();
        }
        return orderJpaRepository.findByOrderIdIn(orderIds);
    }
}
