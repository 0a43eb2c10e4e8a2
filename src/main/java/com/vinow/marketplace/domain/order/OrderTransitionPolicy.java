package com.vinow.marketplace.domain.order;

import com.vinow.marketplace.common.exception.ValidationException;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * OrderTransitionPolicy - 주문 상태 전환표 (Domain Service)
 *
 * 역할:
 * - 현재 상태에서 허용되는 목표 상태 계산
 * - "사용 가능(redeemable)" 상태 정책 관리
 * - 사유가 필요한 전환 검증
 *
 * 기본 전환표:
 * PENDING    → CONFIRMED, CANCELLED, REFUNDING
 * CONFIRMED  → PREPARING, CANCELLED
 * PREPARING  → READY, CANCELLED
 * READY      → VERIFIED, CANCELLED
 * VERIFIED   → COMPLETED, REFUNDING
 * REFUNDING  → REFUNDED, (환불 직전 상태로 복원)
 *
 * 사용 가능 상태 정책:
 * - READY는 항상 사용 가능
 * - 정책에 포함된 PENDING/CONFIRMED/PREPARING에는 VERIFIED로 가는 간선이 추가된다
 *
 * 순수 도메인 로직만 포함하며 DomainServiceConfig에서 Bean으로 등록된다.
 */
public class OrderTransitionPolicy {

    private static final Set<OrderStatus> REDEEMABLE_CANDIDATES =
            EnumSet.of(OrderStatus.PENDING, OrderStatus.CONFIRMED, OrderStatus.PREPARING, OrderStatus.READY);

    private static final Set<OrderStatus> RESTORABLE_STATUSES =
            EnumSet.of(OrderStatus.PENDING, OrderStatus.VERIFIED);

    private final Map<OrderStatus, Set<OrderStatus>> transitions;
    private final Set<OrderStatus> redeemableStatuses;

    public OrderTransitionPolicy(Collection<OrderStatus> redeemableStatuses) {
        EnumSet<OrderStatus> redeemable = EnumSet.of(OrderStatus.READY);
        if (redeemableStatuses != null) {
            for (OrderStatus status : redeemableStatuses) {
                if (!REDEEMABLE_CANDIDATES.contains(status)) {
                    throw new IllegalArgumentException("사용 가능 상태로 지정할 수 없습니다: " + status);
                }
                redeemable.add(status);
            }
        }
        this.redeemableStatuses = Collections.unmodifiableSet(redeemable);
        this.transitions = buildTransitions(redeemable);
    }

    /**
     * 기본 정책: PENDING, CONFIRMED, PREPARING, READY 모두 사용 가능
     */
    public static OrderTransitionPolicy defaultPolicy() {
        return new OrderTransitionPolicy(REDEEMABLE_CANDIDATES);
    }

    private static Map<OrderStatus, Set<OrderStatus>> buildTransitions(Set<OrderStatus> redeemable) {
        Map<OrderStatus, Set<OrderStatus>> table = new EnumMap<>(OrderStatus.class);
        for (OrderStatus status : OrderStatus.values()) {
            table.put(status, EnumSet.noneOf(OrderStatus.class));
        }
        table.get(OrderStatus.PENDING).addAll(EnumSet.of(OrderStatus.CONFIRMED, OrderStatus.CANCELLED, OrderStatus.REFUNDING));
        table.get(OrderStatus.CONFIRMED).addAll(EnumSet.of(OrderStatus.PREPARING, OrderStatus.CANCELLED));
        table.get(OrderStatus.PREPARING).addAll(EnumSet.of(OrderStatus.READY, OrderStatus.CANCELLED));
        table.get(OrderStatus.READY).addAll(EnumSet.of(OrderStatus.VERIFIED, OrderStatus.CANCELLED));
        table.get(OrderStatus.VERIFIED).addAll(EnumSet.of(OrderStatus.COMPLETED, OrderStatus.REFUNDING));
        table.get(OrderStatus.REFUNDING).add(OrderStatus.REFUNDED);

        for (OrderStatus status : redeemable) {
            table.get(status).add(OrderStatus.VERIFIED);
        }
        table.replaceAll((status, targets) -> Collections.unmodifiableSet(targets));
        return Collections.unmodifiableMap(table);
    }

    /**
     * 주문의 현재 상태에서 허용되는 목표 상태
     *
     * REFUNDING은 저장된 환불 직전 상태로의 복원 간선을 추가로 가진다.
     */
    public Set<OrderStatus> allowedTargets(Order order) {
        if (order.getOrderStatus().isTerminal()) {
            return Collections.emptySet();
        }
        Set<OrderStatus> targets = transitions.get(order.getOrderStatus());
        if (order.getOrderStatus() != OrderStatus.REFUNDING) {
            return targets;
        }
        EnumSet<OrderStatus> withRestore = EnumSet.copyOf(targets);
        withRestore.add(restoreTargetOf(order));
        return withRestore;
    }

    public boolean canTransition(Order order, OrderStatus target) {
        return allowedTargets(order).contains(target);
    }

    public boolean isRedeemable(OrderStatus status) {
        return redeemableStatuses.contains(status);
    }

    public Set<OrderStatus> getRedeemableStatuses() {
        return redeemableStatuses;
    }

    /**
     * 환불 거절 시 복원할 상태
     *
     * 환불 요청 시점에 저장된 값을 사용한다. 값이 없는 과거 데이터는 verifiedAt으로 판단한다.
     */
    public OrderStatus restoreTargetOf(Order order) {
        OrderStatus stored = order.getPreRefundStatus();
        if (stored != null && RESTORABLE_STATUSES.contains(stored)) {
            return stored;
        }
        return order.getVerifiedAt() != null ? OrderStatus.VERIFIED : OrderStatus.PENDING;
    }

    /**
     * 전환 검증
     *
     * @throws InvalidOrderTransitionException 전환표에 간선이 없을 때
     * @throws ValidationException             취소/환불 요청/환불 거절에 사유가 없을 때
     */
    public void validate(Order order, OrderStatus target, String reason) {
        if (target == null) {
            throw new ValidationException("목표 상태는 필수입니다");
        }
        if (!canTransition(order, target)) {
            throw new InvalidOrderTransitionException(order.getOrderId(), order.getOrderStatus(), target);
        }
        if (requiresReason(order.getOrderStatus(), target) && (reason == null || reason.isBlank())) {
            throw new ValidationException(String.format("%s 전환에는 사유가 필요합니다 - orderId=%d",
                    target, order.getOrderId()));
        }
    }

    private boolean requiresReason(OrderStatus current, OrderStatus target) {
        if (target == OrderStatus.CANCELLED || target == OrderStatus.REFUNDING) {
            return true;
        }
        // REFUNDING → 복원은 환불 거절이므로 거절 사유 필요
        return current == OrderStatus.REFUNDING && target != OrderStatus.REFUNDED;
    }
}
