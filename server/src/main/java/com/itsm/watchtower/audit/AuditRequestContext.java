package com.itsm.watchtower.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.itsm.watchtower.models.audit.ResourceInfo;

/**
 * Everything about a mutating request that has to be captured on the request thread.
 *
 * @param action         create, update, delete or the lowercase method
 * @param body           parsed request body, {@code null} when there was none
 * @param actorId        id of the authenticated user, {@code null} for anonymous requests
 */
public record AuditRequestContext(String action, ResourceInfo resourceInfo, JsonNode body, Long actorId,
                                  String ipAddress, String userAgent, boolean securityAction) {
}
