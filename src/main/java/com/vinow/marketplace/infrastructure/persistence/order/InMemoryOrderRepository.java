package com.vinow.marketplace.infrastructure.persistence.order;

import com.vinow.marketplace.domain.order.Order;
import com.vinow.marketplace.domain.order.OrderRepository;
import com.vinow.marketplace.domain.order.OrderStatus;
import com.vinow.marketplace.infrastructure.persistence.InMemoryDatastore;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * InMemoryOrderRepository - Order 저장소 구현체 (인메모리)
 *
 * ConcurrentHashMap + 검증 코드 보조 인덱스.
 * 주문 단위 직렬화는 OrderLockManager가 담당하므로 findByIdForUpdate는 findById와 같다.
 */
@Repository
@InMemoryDatastore
public class InMemoryOrderRepository implements OrderRepository {

    private final ConcurrentHashMap<Long, Order> orders = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Long> orderIdsByCode = new ConcurrentHashMap<>();
    private final AtomicLong orderIdSequence = new AtomicLong(5000L);
    private final AtomicLong orderItemIdSequence = new AtomicLong(5000L);

    @Override
    public Order save(Order order) {
        if (order.getOrderId() == null) {
            order.assignId(orderIdSequence.incrementAndGet());
        }
        order.assignItemIds(orderItemIdSequence::incrementAndGet);

        Long owner = orderIdsByCode.putIfAbsent(order.getVerificationCode(), order.getOrderId());
        if (owner != null && !owner.equals(order.getOrderId())) {
            throw new IllegalStateException("검증 코드 중복 - code=" + order.getVerificationCode());
        }
        orders.put(order.getOrderId(), order);
        return order;
    }

    @Override
    public Optional<Order> findById(Long orderId) {
        return Optional.ofNullable(orders.get(orderId));
    }

    @Override
    public Optional<Order> findByIdForUpdate(Long orderId) {
        return findById(orderId);
    }

    @Override
    public Optional<Order> findByOrderNumber(String orderNumber) {
        return orders.values().stream()
                .filter(order -> order.getOrderNumber().equals(orderNumber))
                .findFirst();
    }

    @Override
    public Optional<Order> findByVerificationCode(String verificationCode) {
        Long orderId = orderIdsByCode.get(verificationCode);
        return orderId == null ? Optional.empty() : findById(orderId);
    }

    @Override
    public boolean existsByVerificationCode(String verificationCode) {
        return orderIdsByCode.containsKey(verificationCode);
    }

    @Override
    public List<Order> findByMerchantId(Long merchantId, OrderStatus status, int page, int size) {
        return orders.values().stream()
                .filter(order -> order.belongsTo(merchantId))
                .filter(order -> status == null || order.getOrderStatus() == status)
                .sorted(Comparator.comparing(Order::getCreatedAt).reversed())
                .skip((long) page * size)
                .limit(size)
                .collect(Collectors.toList());
    }

    @Override
    public long countByMerchantId(Long merchantId, OrderStatus status) {
        return orders.values().stream()
                .filter(order -> order.belongsTo(merchantId))
                .filter(order -> status == null || order.getOrderStatus() == status)
                .count();
    }

    @Override
    public List<Order> findByMerchantIdAndCreatedAtBetween(Long merchantId, LocalDateTime from, LocalDateTime to) {
        return orders.values().stream()
                .filter(order -> order.belongsTo(merchantId))
                .filter(order -> inRange(order.getCreatedAt(), from, to))
                .sorted(Comparator.comparing(Order::getOrderId))
                .collect(Collectors.toList());
    }

    @Override
    public List<Order> findByMerchantIdAndVerifiedAtBetween(Long merchantId, LocalDateTime from, LocalDateTime to) {
        return orders.values().stream()
                .filter(order -> order.belongsTo(merchantId))
                .filter(order -> inRange(order.getVerifiedAt(), from, to))
                .sorted(Comparator.comparing(Order::getOrderId))
                .collect(Collectors.toList());
    }

    @Override
    public List<Order> findByMerchantIdAndStatusOrderByUpdatedAtDesc(Long merchantId, OrderStatus status,
                                                                     int page, int size) {
        return orders.values().stream()
                .filter(order -> order.belongsTo(merchantId))
                .filter(order -> order.getOrderStatus() == status)
                .sorted(Comparator.comparing(Order::getUpdatedAt).reversed())
                .skip((long) page * size)
                .limit(size)
                .collect(Collectors.toList());
    }

    @Override
    public List<Order> findByMerchantIdAndUpdatedAtAfter(Long merchantId, LocalDateTime since) {
        return orders.values().stream()
                .filter(order -> order.belongsTo(merchantId))
                .filter(order -> !order.getUpdatedAt().isBefore(since))
                .collect(Collectors.toList());
    }

    @Override
    public List<Order> findAllByIds(List<Long> orderIds) {
        return orderIds.stream()
                .distinct()
                .map(orders::get)
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(ArrayList::new));
    }

    private static boolean inRange(LocalDateTime value, LocalDateTime from, LocalDateTime to) {
        return value != null && !value.isBefore(from) && value.isBefore(to);
    }

    /**
     * 테스트용: 모든 주문 삭제
     */
    public void clear() {
        orders.clear();
        orderIdsByCode.clear();
    }
}
