package com.itsm.watchtower.audit.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.itsm.watchtower.models.audit.AuditActions;
import lombok.experimental.UtilityClass;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Derives the recorded action from the HTTP method and flags requests that touch security relevant data.
 */
@UtilityClass
public class AuditActionClassifier {

    private static final Set<String> WRITE_METHODS = Set.of("POST", "PUT", "PATCH", "DELETE");
    private static final String API_PREFIX = "^/api/(?:v\\d+/)?";

    /**
     * Evaluated as a disjunction, so the order of the rules does not matter.
     */
    private static final List<SecurityRule> SECURITY_RULES = List.of(
            new SecurityRule(WRITE_METHODS, Pattern.compile(API_PREFIX + "vulnerabilities(?:/.*)?$"), null, "vulnerability write"),
            new SecurityRule(Set.of("POST"), Pattern.compile(API_PREFIX + "incidents(?:/.*)?$"), null, "incident creation"),
            new SecurityRule(WRITE_METHODS, Pattern.compile(API_PREFIX + "users(?:/.*)?$"), null, "user change"),
            new SecurityRule(Set.of("POST"), Pattern.compile(API_PREFIX + "changes(?:/.*)?$"), AuditActionClassifier::isSecurityChange, "security change request"),
            new SecurityRule(Set.of("POST"), Pattern.compile(API_PREFIX + "auth/(?:login|register)/?$"), null, "authentication attempt")
    );

    public static String methodToAction(String method) {
        return switch (method.toUpperCase(Locale.ROOT)) {
            case "POST" -> AuditActions.CREATE;
            case "PUT", "PATCH" -> AuditActions.UPDATE;
            case "DELETE" -> AuditActions.DELETE;
            default -> method.toLowerCase(Locale.ROOT);
        };
    }

    public static boolean isSecurityAction(String method, String path, JsonNode body) {
        if (method == null || path == null) {
            return false;
        }
        String upperMethod = method.toUpperCase(Locale.ROOT);
        for (SecurityRule rule : SECURITY_RULES) {
            if (rule.matches(upperMethod, path, body)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isSecurityChange(JsonNode body) {
        if (body == null) {
            return false;
        }
        JsonNode flag = body.path("is_security_change");
        return (flag.isIntegralNumber() && flag.asLong() == 1) || (flag.isBoolean() && flag.booleanValue());
    }

    private record SecurityRule(Set<String> methods, Pattern path, Predicate<JsonNode> bodyPredicate, String description) {

        boolean matches(String method, String requestPath, JsonNode body) {
            if (!methods.contains(method) || !path.matcher(requestPath).matches()) {
                return false;
            }
            return bodyPredicate == null || bodyPredicate.test(body);
        }
    }
}
