package com.vinow.marketplace.domain.order;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Order Repository Interface (Port)
 *
 * 구현체:
 * - InMemoryOrderRepository: 로컬/테스트 (marketplace.datastore.type=memory)
 * - MySQLOrderRepository: JPA + MySQL (marketplace.datastore.type=jpa, 기본값)
 */
public interface OrderRepository {

    Order save(Order order);

    Optional<Order> findById(Long orderId);

    /**
     * 상태 전환용 조회 (JPA 구현은 SELECT ... FOR UPDATE)
     */
    Optional<Order> findByIdForUpdate(Long orderId);

    Optional<Order> findByOrderNumber(String orderNumber);

    Optional<Order> findByVerificationCode(String verificationCode);

    boolean existsByVerificationCode(String verificationCode);

    List<Order> findByMerchantId(Long merchantId, OrderStatus status, int page, int size);

    long countByMerchantId(Long merchantId, OrderStatus status);

    /**
     * 가맹점의 기간 내 생성 주문 [from, to)
     */
    List<Order> findByMerchantIdAndCreatedAtBetween(Long merchantId, LocalDateTime from, LocalDateTime to);

    /**
     * 가맹점의 기간 내 사용(검증) 주문 [from, to)
     */
    List<Order> findByMerchantIdAndVerifiedAtBetween(Long merchantId, LocalDateTime from, LocalDateTime to);

    /**
     * 가맹점의 특정 상태 주문, 최근 수정 순
     */
    List<Order> findByMerchantIdAndStatusOrderByUpdatedAtDesc(Long merchantId, OrderStatus status, int page, int size);

    List<Order> findByMerchantIdAndUpdatedAtAfter(Long merchantId, LocalDateTime since);

    List<Order> findAllByIds(List<Long> orderIds);
}
