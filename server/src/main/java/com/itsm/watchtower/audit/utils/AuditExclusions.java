package com.itsm.watchtower.audit.utils;

import lombok.experimental.UtilityClass;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Decides which requests never enter the audit trail: reads, probes, documentation and the audit log API itself.
 */
@UtilityClass
public class AuditExclusions {

    private static final List<Pattern> EXCLUDED_PATHS = List.of(
            Pattern.compile("^/health(?:/.*)?$"),
            Pattern.compile("^/api/(?:v\\d+/)?health(?:/.*)?$"),
            Pattern.compile("^/metrics$"),
            Pattern.compile("^/actuator(?:/.*)?$"),
            Pattern.compile("^/api-docs(?:/.*)?$"),
            Pattern.compile("^/v3/api-docs(?:/.*)?$"),
            Pattern.compile("^/swagger-ui(?:\\.html|/.*)?$"),
            // reading the audit log must not produce audit records of its own
            Pattern.compile("^/api/(?:v\\d+/)?audit-logs(?:/.*)?$")
    );

    public static boolean isExcludedPath(String path, String method) {
        if (method != null) {
            String upperMethod = method.toUpperCase(Locale.ROOT);
            if ("GET".equals(upperMethod) || "HEAD".equals(upperMethod)) {
                return true;
            }
        }
        if (path == null) {
            return false;
        }
        for (Pattern pattern : EXCLUDED_PATHS) {
            if (pattern.matcher(path).matches()) {
                return true;
            }
        }
        return false;
    }
}
