package com.vinow.marketplace.application.order.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderItemCommand {
    private Long productId;
    private String productName;
    private Long unitPrice;
    private Integer quantity;
}
