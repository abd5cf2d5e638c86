package com.itsm.watchtower.models.audit;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Key level comparison between the stored state of a resource and the state sent by the client.
 *
 * @param added   keys only present in the new state, with their new value
 * @param removed keys only present in the stored state, with their old value
 * @param changed keys present in both states whose values differ
 */
public record AuditDiff(Map<String, JsonNode> added,
                        Map<String, JsonNode> removed,
                        Map<String, ValueChange> changed) {

    public AuditDiff {
        added = Collections.unmodifiableMap(new LinkedHashMap<>(added));
        removed = Collections.unmodifiableMap(new LinkedHashMap<>(removed));
        changed = Collections.unmodifiableMap(new LinkedHashMap<>(changed));
    }

    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty() && changed.isEmpty();
    }

    public record ValueChange(JsonNode from, JsonNode to) {
    }
}
