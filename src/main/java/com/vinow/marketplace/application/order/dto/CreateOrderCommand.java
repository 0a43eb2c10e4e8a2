package com.vinow.marketplace.application.order.dto;

import com.vinow.marketplace.domain.order.PaymentMethod;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 주문 생성 커맨드 (주문 생성 협력 시스템이 전달)
 *
 * 가격 계산, 장바구니, 결제 승인은 호출 측 책임이다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateOrderCommand {
    private Long merchantId;
    private Long storeId;
    private Long userId;
    private List<OrderItemCommand> items;
    private Long discountAmount;
    private PaymentMethod paymentMethod;
    private String currency;
}
