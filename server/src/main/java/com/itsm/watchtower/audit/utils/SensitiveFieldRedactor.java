package com.itsm.watchtower.audit.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.experimental.UtilityClass;

import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Masks the values of sensitive keys in arbitrary JSON values before they are written to the audit trail.
 * <p>
 * A key is sensitive when its lowercase form contains one of {@link #SENSITIVE_KEY_FRAGMENTS}. Objects and arrays
 * are copied recursively, so the value handed in is never modified. Scalars, {@code null} and missing nodes are
 * returned as they are.
 */
@UtilityClass
public class SensitiveFieldRedactor {

    public static final String REDACTION_MARKER = "[REDACTED]";

    private static final List<String> SENSITIVE_KEY_FRAGMENTS = List.of(
            "password", "passwd", "secret", "token",
            "api_key", "apikey", "api-key",
            "authorization", "cookie", "private_key", "credential", "session",
            "ssn", "credit_card", "card_number", "cvv"
    );

    public static JsonNode redact(JsonNode value) {
        if (value == null) {
            return null;
        }
        if (value.isObject()) {
            ObjectNode copy = JsonNodeFactory.instance.objectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                copy.set(field.getKey(), isSensitiveKey(field.getKey()) ? TextNode.valueOf(REDACTION_MARKER) : redact(field.getValue()));
            }
            return copy;
        }
        if (value.isArray()) {
            ArrayNode copy = JsonNodeFactory.instance.arrayNode(value.size());
            for (JsonNode element : value) {
                copy.add(redact(element));
            }
            return copy;
        }
        return value;
    }

    public static boolean isSensitiveKey(String key) {
        String lowerKey = key.toLowerCase(Locale.ROOT);
        for (String fragment : SENSITIVE_KEY_FRAGMENTS) {
            if (lowerKey.contains(fragment)) {
                return true;
            }
        }
        return false;
    }
}
