package com.vinow.marketplace.common.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

/**
 * 환불 증빙 이미지 참조 목록
 */
@Converter
public class StringListJsonConverter extends JsonAttributeConverter<List<String>> {

    public StringListJsonConverter() {
        super(new TypeReference<List<String>>() {});
    }

    @Override
    protected List<String> emptyValue() {
        return new ArrayList<>();
    }
}
