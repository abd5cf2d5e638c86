package com.itsm.watchtower.audit.utils;

import com.itsm.watchtower.models.audit.ResourceInfo;
import lombok.experimental.UtilityClass;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps request paths such as {@code /api/v1/incidents/INC-1} to the addressed resource.
 */
@UtilityClass
public class ResourcePathResolver {

    private static final Pattern API_PATH = Pattern.compile("^/api/(?:v\\d+/)?([^/]+)(?:/([^/]+))?");

    public static ResourceInfo extractResourceInfo(String path) {
        if (path == null) {
            return ResourceInfo.unknown();
        }
        Matcher matcher = API_PATH.matcher(path);
        if (!matcher.find()) {
            return ResourceInfo.unknown();
        }
        return new ResourceInfo(matcher.group(1), matcher.group(2));
    }
}
