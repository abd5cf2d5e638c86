package com.itsm.watchtower.audit.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.itsm.watchtower.models.audit.AuditDiff;
import lombok.experimental.UtilityClass;

import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Computes the key level difference between the stored state of a resource and the state sent by the client.
 */
@UtilityClass
public class StateDiffer {

    /**
     * Structural equality where numbers compare by value, so {@code 1} and {@code 1.0} are the same.
     */
    private static final Comparator<JsonNode> VALUE_COMPARATOR = (left, right) -> {
        if (left.equals(right)) {
            return 0;
        }
        if (left.isNumber() && right.isNumber() && isFinite(left) && isFinite(right)) {
            return left.decimalValue().compareTo(right.decimalValue());
        }
        return 1;
    };

    // NaN and infinite doubles have no decimal value
    private static boolean isFinite(JsonNode number) {
        return !(number.isDouble() || number.isFloat()) || Double.isFinite(number.doubleValue());
    }

    /**
     * @return the difference, or {@code null} when either side is not a JSON object or nothing differs
     */
    public static AuditDiff diff(JsonNode prior, JsonNode next) {
        if (prior == null || next == null || !prior.isObject() || !next.isObject()) {
            return null;
        }
        Map<String, JsonNode> added = new LinkedHashMap<>();
        Map<String, JsonNode> removed = new LinkedHashMap<>();
        Map<String, AuditDiff.ValueChange> changed = new LinkedHashMap<>();

        Iterator<Map.Entry<String, JsonNode>> nextFields = next.fields();
        while (nextFields.hasNext()) {
            Map.Entry<String, JsonNode> field = nextFields.next();
            JsonNode before = prior.get(field.getKey());
            if (before == null) {
                added.put(field.getKey(), field.getValue());
            } else if (!before.equals(VALUE_COMPARATOR, field.getValue())) {
                changed.put(field.getKey(), new AuditDiff.ValueChange(before, field.getValue()));
            }
        }
        Iterator<Map.Entry<String, JsonNode>> priorFields = prior.fields();
        while (priorFields.hasNext()) {
            Map.Entry<String, JsonNode> field = priorFields.next();
            if (!next.has(field.getKey())) {
                removed.put(field.getKey(), field.getValue());
            }
        }

        AuditDiff diff = new AuditDiff(added, removed, changed);
        return diff.isEmpty() ? null : diff;
    }
}
