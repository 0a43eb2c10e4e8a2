package com.vinow.marketplace.application.verification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vinow.marketplace.common.exception.ValidationException;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * QR 페이로드 해석기
 *
 * 지원 형식:
 * - order_{orderId}
 * - JSON: {"code":"ABC123"} 또는 {"order_id":123}
 * - URI: https://.../verify?code=ABC123
 * - 코드 단독: [A-Z0-9]{4,32}
 *
 * 그 외 형식은 ValidationException
 */
@Component
public class QrPayloadDecoder {

    private static final String ORDER_PREFIX = "order_";
    private static final Pattern BARE_CODE = Pattern.compile("[A-Z0-9]{4,32}");

    private final ObjectMapper objectMapper;

    public QrPayloadDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public QrPayload decode(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new ValidationException("QR 페이로드가 비어 있습니다");
        }
        String trimmed = payload.trim();

        if (trimmed.startsWith(ORDER_PREFIX)) {
            return QrPayload.ofOrderId(parseOrderId(trimmed.substring(ORDER_PREFIX.length())));
        }
        if (trimmed.startsWith("{")) {
            return decodeJson(trimmed);
        }
        if (trimmed.contains("://")) {
            return decodeUri(trimmed);
        }

        String code = trimmed.toUpperCase(Locale.ROOT);
        if (BARE_CODE.matcher(code).matches()) {
            return QrPayload.ofCode(code);
        }
        throw new ValidationException("해석할 수 없는 QR 페이로드입니다");
    }

    private QrPayload decodeJson(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ValidationException("QR 페이로드 JSON 형식 오류", e);
        }

        JsonNode code = root.get("code");
        if (code != null && code.isTextual() && !code.asText().isBlank()) {
            return QrPayload.ofCode(code.asText().trim().toUpperCase(Locale.ROOT));
        }
        JsonNode orderId = root.get("order_id");
        if (orderId != null && orderId.canConvertToLong()) {
            return QrPayload.ofOrderId(orderId.asLong());
        }
        if (orderId != null && orderId.isTextual()) {
            return QrPayload.ofOrderId(parseOrderId(orderId.asText()));
        }
        throw new ValidationException("QR 페이로드에 code 또는 order_id가 없습니다");
    }

    private QrPayload decodeUri(String uri) {
        String code;
        try {
            code = UriComponentsBuilder.fromUriString(uri).build().getQueryParams().getFirst("code");
        } catch (IllegalArgumentException e) {
            throw new ValidationException("QR 페이로드 URI 형식 오류", e);
        }
        if (code == null || code.isBlank()) {
            throw new ValidationException("QR 페이로드 URI에 code 파라미터가 없습니다");
        }
        return QrPayload.ofCode(code.trim().toUpperCase(Locale.ROOT));
    }

    private Long parseOrderId(String raw) {
        try {
            long orderId = Long.parseLong(raw.trim());
            if (orderId <= 0) {
                throw new ValidationException("QR 페이로드의 주문 ID가 유효하지 않습니다: " + raw);
            }
            return orderId;
        } catch (NumberFormatException e) {
            throw new ValidationException("QR 페이로드의 주문 ID가 숫자가 아닙니다: " + raw, e);
        }
    }
}
