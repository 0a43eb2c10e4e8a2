package com.vinow.marketplace.application.order.dto;

import com.vinow.marketplace.domain.order.Order;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
@AllArgsConstructor
public class OrderPageResult {
    private List<Order> orders;
    private int page;
    private int size;
    private long totalCount;

    public boolean hasNext() {
        return (long) (page + 1) * size < totalCount;
    }
}
