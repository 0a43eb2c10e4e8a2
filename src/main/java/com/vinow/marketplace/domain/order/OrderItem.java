package com.vinow.marketplace.domain.order;

import com.vinow.marketplace.common.exception.ValidationException;
import jakarta.persistence.*;
import lombok.*;

/**
 * OrderItem - 주문 항목 (주문 시점의 상품 스냅샷)
 *
 * 비즈니스 규칙:
 * - 수량은 1 이상, 단가는 0 이상
 * - subtotal = unitPrice × quantity
 */
@Entity
@Table(name = "order_items")
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OrderItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "order_item_id")
    private Long orderItemId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "order_id", nullable = false)
    private Order order;

    @Column(name = "product_id", nullable = false)
    private Long productId;

    @Column(name = "product_name", nullable = false)
    private String productName;

    @Column(name = "unit_price", nullable = false)
    private Long unitPrice;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Column(name = "subtotal", nullable = false)
    private Long subtotal;

    public static OrderItem createOrderItem(Long productId, String productName, Long unitPrice, Integer quantity) {
        if (productId == null || productName == null || productName.isBlank()) {
            throw new ValidationException("상품 ID와 상품명은 필수입니다");
        }
        if (quantity == null || quantity <= 0) {
            throw new ValidationException("수량은 1 이상이어야 합니다 - productId=" + productId);
        }
        if (unitPrice == null || unitPrice < 0) {
            throw new ValidationException("단가는 0 이상이어야 합니다 - productId=" + productId);
        }
        long subtotal;
        try {
            subtotal = Math.multiplyExact(unitPrice, quantity.longValue());
        } catch (ArithmeticException e) {
            throw new ValidationException(String.format("항목 금액이 허용 범위를 넘었습니다 - productId=%d, unitPrice=%d, quantity=%d",
                    productId, unitPrice, quantity), e);
        }

        return OrderItem.builder()
                .productId(productId)
                .productName(productName)
                .unitPrice(unitPrice)
                .quantity(quantity)
                .subtotal(subtotal)
                .build();
    }

    void assignOrder(Order order) {
        this.order = order;
    }

    void assignId(Long orderItemId) {
        this.orderItemId = orderItemId;
    }
}
