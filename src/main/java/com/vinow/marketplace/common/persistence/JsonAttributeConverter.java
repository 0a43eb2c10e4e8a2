package com.vinow.marketplace.common.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;

/**
 * JSON 문자열 컬럼 ↔ 자바 컬렉션 변환 공통 구현
 *
 * 변환 실패는 잘못된 데이터이므로 IllegalStateException으로 전파한다.
 */
public abstract class JsonAttributeConverter<T> implements AttributeConverter<T, String> {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final TypeReference<T> typeReference;

    protected JsonAttributeConverter(TypeReference<T> typeReference) {
        this.typeReference = typeReference;
    }

    protected abstract T emptyValue();

    @Override
    public String convertToDatabaseColumn(T attribute) {
        try {
            return OBJECT_MAPPER.writeValueAsString(attribute == null ? emptyValue() : attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON 컬럼 직렬화 실패", e);
        }
    }

    @Override
    public T convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return emptyValue();
        }
        try {
            return OBJECT_MAPPER.readValue(dbData, typeReference);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON 컬럼 역직렬화 실패: " + dbData, e);
        }
    }
}
