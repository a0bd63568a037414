package personal.hitch.coordination.realtime.domain.model;

import personal.hitch.common.exception.BusinessException;
import personal.hitch.common.exception.ErrorCode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Inbound Message
 * 클라이언트가 보낸 이벤트 {type, payload}
 * 필드 형식이 맞지 않으면 INVALID_INPUT으로 거부한다.
 */
public record InboundMessage(String type, Map<String, Object> payload) {

    public InboundMessage {
        if (type == null || type.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Event type is required");
        }
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public Long requireLong(String field) {
        return optionalLong(field)
                .orElseThrow(() -> new BusinessException(ErrorCode.INVALID_INPUT, "Field is required: " + field));
    }

    public Optional<Long> optionalLong(String field) {
        Object value = payload.get(field);
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Number) {
            return Optional.of(((Number) value).longValue());
        }
        try {
            return Optional.of(Long.parseLong(value.toString()));
        } catch (NumberFormatException e) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Field must be an integer: " + field, e);
        }
    }

    public double requireDouble(String field) {
        return optionalDouble(field)
                .orElseThrow(() -> new BusinessException(ErrorCode.INVALID_INPUT, "Field is required: " + field));
    }

    /**
     * 유한한 실수만 허용 (NaN, Infinity 거부)
     */
    public Optional<Double> optionalDouble(String field) {
        Object value = payload.get(field);
        if (value == null) {
            return Optional.empty();
        }
        double number;
        if (value instanceof Number) {
            number = ((Number) value).doubleValue();
        } else {
            try {
                number = Double.parseDouble(value.toString());
            } catch (NumberFormatException e) {
                throw new BusinessException(ErrorCode.INVALID_INPUT, "Field must be a number: " + field, e);
            }
        }
        if (!Double.isFinite(number)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Field must be a finite number: " + field);
        }
        return Optional.of(number);
    }

    public String requireText(String field) {
        return optionalText(field)
                .filter(text -> !text.isBlank())
                .orElseThrow(() -> new BusinessException(ErrorCode.INVALID_INPUT, "Field is required: " + field));
    }

    public Optional<String> optionalText(String field) {
        Object value = payload.get(field);
        return value == null ? Optional.empty() : Optional.of(value.toString());
    }
}
