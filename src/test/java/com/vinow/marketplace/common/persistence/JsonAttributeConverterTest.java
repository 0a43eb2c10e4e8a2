package com.vinow.marketplace.common.persistence;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JSON 컬럼 변환기 테스트")
class JsonAttributeConverterTest {

    @Test
    @DisplayName("null 속성 - 빈 컬렉션 JSON으로 저장")
    void testConvertToDatabaseColumn_Null() {
        assertEquals("[]", new StringListJsonConverter().convertToDatabaseColumn(null));
        assertEquals("{}", new LongMapJsonConverter().convertToDatabaseColumn(null));
    }

    @Test
    @DisplayName("빈 컬럼 - 빈 컬렉션으로 복원")
    void testConvertToEntityAttribute_Blank() {
        assertTrue(new LongListJsonConverter().convertToEntityAttribute(null).isEmpty());
        assertTrue(new LongMapJsonConverter().convertToEntityAttribute(" ").isEmpty());
    }

    @Test
    @DisplayName("주문 ID 목록 - 작은 값도 Long으로 복원")
    void testLongList_ElementType() {
        List<Long> orderIds = new LongListJsonConverter().convertToEntityAttribute("[3,1000000000000]");

        assertEquals(List.of(3L, 1000000000000L), orderIds);
    }

    @Test
    @DisplayName("결제수단별 매출 - 키 순서대로 저장")
    void testLongMap_Column() {
        Map<String, Long> breakdown = new TreeMap<>(Map.of("MOMO", 30000L, "CASH", 50000L));

        String column = new LongMapJsonConverter().convertToDatabaseColumn(breakdown);

        assertEquals("{\"CASH\":50000,\"MOMO\":30000}", column);
        assertEquals(breakdown, new LongMapJsonConverter().convertToEntityAttribute(column));
    }

    @Test
    @DisplayName("손상된 JSON - IllegalStateException")
    void testConvertToEntityAttribute_Malformed() {
        assertThrows(IllegalStateException.class,
                () -> new StringListJsonConverter().convertToEntityAttribute("[\"a\""));
    }
}
