package com.vinow.marketplace.common.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

/**
 * 주문 ID 목록 (대사 불일치/해결 주문, 이의 제기 대상)
 */
@Converter
public class LongListJsonConverter extends JsonAttributeConverter<List<Long>> {

    public LongListJsonConverter() {
        super(new TypeReference<List<Long>>() {});
    }

    @Override
    protected List<Long> emptyValue() {
        return new ArrayList<>();
    }
}
