package com.vinow.marketplace.infrastructure.persistence.order;

import com.vinow.marketplace.domain.order.Order;
import com.vinow.marketplace.domain.order.OrderStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Order JPA Repository
 *
 * orderItems는 LAZY이므로 단건 조회는 fetch join으로 함께 로드한다.
 */
public interface OrderJpaRepository extends JpaRepository<Order, Long> {

    @Query("SELECT o FROM Order o " +
           "LEFT JOIN FETCH o.orderItems " +
           "WHERE o.orderId = :orderId")
    Optional<Order> findByIdWithItems(@Param("orderId") Long orderId);

    /**
     * 주문 ID로 조회 (비관적 락 - SELECT ... FOR UPDATE)
     *
     * 상태 전환(검증, 환불, 취소 등) 직전에 사용한다.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM Order o WHERE o.orderId = :orderId")
    Optional<Order> findByIdForUpdate(@Param("orderId") Long orderId);

    Optional<Order> findByOrderNumber(String orderNumber);

    Optional<Order> findByVerificationCode(String verificationCode);

    boolean existsByVerificationCode(String verificationCode);

    @Query("SELECT o FROM Order o " +
           "WHERE o.merchantId = :merchantId " +
           "AND (:status IS NULL OR o.orderStatus = :status)")
    List<Order> findByMerchantIdAndOptionalStatus(@Param("merchantId") Long merchantId,
                                                  @Param("status") OrderStatus status,
                                                  Pageable pageable);

    @Query("SELECT COUNT(o) FROM Order o " +
           "WHERE o.merchantId = :merchantId " +
           "AND (:status IS NULL OR o.orderStatus = :status)")
    long countByMerchantIdAndOptionalStatus(@Param("merchantId") Long merchantId,
                                            @Param("status") OrderStatus status);

    @Query("SELECT o FROM Order o " +
           "WHERE o.merchantId = :merchantId " +
           "AND o.createdAt >= :from AND o.createdAt < :to " +
           "ORDER BY o.orderId")
    List<Order> findCreatedBetween(@Param("merchantId") Long merchantId,
                                   @Param("from") LocalDateTime from,
                                   @Param("to") LocalDateTime to);

    @Query("SELECT o FROM Order o " +
           "WHERE o.merchantId = :merchantId " +
           "AND o.verifiedAt >= :from AND o.verifiedAt < :to " +
           "ORDER BY o.orderId")
    List<Order> findVerifiedBetween(@Param("merchantId") Long merchantId,
                                    @Param("from") LocalDateTime from,
                                    @Param("to") LocalDateTime to);

    List<Order> findByMerchantIdAndOrderStatusOrderByUpdatedAtDesc(Long merchantId, OrderStatus orderStatus,
                                                                   Pageable pageable);

    List<Order> findByMerchantIdAndUpdatedAtGreaterThanEqual(Long merchantId, LocalDateTime since);

    List<Order> findByOrderIdIn(List<Long> orderIds);
}
