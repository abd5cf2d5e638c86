package com.itsm.watchtower.audit.utils;

import com.itsm.watchtower.models.audit.ResourceInfo;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ResourcePathResolverTest {

    @ParameterizedTest
    @CsvSource(nullValues = "null", value = {
            "/api/v1/incidents/INC-42, incidents, INC-42",
            "/api/v1/incidents, incidents, null",
            "/api/incidents/INC-42, incidents, INC-42",
            "/api/v2/service-requests/SR-1/comments, service-requests, SR-1",
            "/api/v1/users/7/, users, 7",
            "/api/auth/login, auth, login",
            "/health, unknown, null",
            "/apiv1/incidents, unknown, null",
            "'', unknown, null"
    })
    void extractsTypeAndId(String path, String expectedType, String expectedId) {
        assertEquals(new ResourceInfo(expectedType, expectedId), ResourcePathResolver.extractResourceInfo(path));
    }

    @Test
    void treatsMissingPathAsUnknown() {
        assertEquals(ResourceInfo.unknown(), ResourcePathResolver.extractResourceInfo(null));
    }
}
