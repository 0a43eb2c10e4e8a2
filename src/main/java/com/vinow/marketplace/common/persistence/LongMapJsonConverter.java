package com.vinow.marketplace.common.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.Map;
import java.util.TreeMap;

/**
 * 결제수단별 매출 (결제수단 → 금액)
 */
@Converter
public class LongMapJsonConverter extends JsonAttributeConverter<Map<String, Long>> {

    public LongMapJsonConverter() {
        super(new TypeReference<Map<String, Long>>() {});
    }

    @Override
    protected Map<String, Long> emptyValue() {
        return new TreeMap<>();
    }
}
