package com.printshop_voice_backend.services.tools;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;

/**
 * Lenient readers for model-supplied params: numbers may arrive as JSON numbers or strings.
 */
final class ToolParams {

    private ToolParams() {
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    static Integer integer(JsonNode node, String field) {
        BigDecimal value = decimal(node, field);
        if (value == null) {
            return null;
        }
        try {
            return value.intValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("'" + field + "' must be a whole number");
        }
    }

    static BigDecimal decimal(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.decimalValue();
        }
        if (value.isTextual()) {
            String text = value.asText().replace("$", "").replace(",", "").trim();
            try {
                return text.isEmpty() ? null : new BigDecimal(text);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("'" + field + "' must be a number, got '" + value.asText() + "'");
            }
        }
        throw new IllegalArgumentException("'" + field + "' must be a number");
    }
}
