package com.itsm.watchtower.audit.utils;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class AuditActionClassifierTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @ParameterizedTest
    @CsvSource({"POST, create", "PUT, update", "PATCH, update", "DELETE, delete", "OPTIONS, options", "post, create"})
    void mapsMethodToAction(String method, String action) {
        assertEquals(action, AuditActionClassifier.methodToAction(method));
    }

    @ParameterizedTest
    @CsvSource({
            "POST, /api/v1/vulnerabilities",
            "PUT, /api/v1/vulnerabilities/CVE-1",
            "PATCH, /api/vulnerabilities/CVE-1",
            "DELETE, /api/v1/vulnerabilities/CVE-1",
            "POST, /api/v1/incidents",
            "POST, /api/incidents",
            "POST, /api/v1/users",
            "DELETE, /api/v1/users/7",
            "POST, /api/v1/auth/login",
            "POST, /api/auth/register"
    })
    void flagsSecurityRelevantRequests(String method, String path) {
        assertTrue(AuditActionClassifier.isSecurityAction(method, path, null));
    }

    @ParameterizedTest
    @CsvSource({
            "PUT, /api/v1/incidents/INC-1",
            "DELETE, /api/v1/incidents/INC-1",
            "POST, /api/v1/problems",
            "POST, /api/v1/auth/logout",
            "POST, /api/v1/changes",
            "POST, /api/v1/vulnerabilities-report"
    })
    void leavesOrdinaryRequestsUnflagged(String method, String path) {
        assertFalse(AuditActionClassifier.isSecurityAction(method, path, null));
    }

    @Test
    void flagsChangeRequestsMarkedAsSecurityChanges() throws Exception {
        assertTrue(AuditActionClassifier.isSecurityAction("POST", "/api/v1/changes", objectMapper.readTree("{\"is_security_change\": 1}")));
        assertTrue(AuditActionClassifier.isSecurityAction("POST", "/api/v1/changes", objectMapper.readTree("{\"is_security_change\": true}")));
        assertFalse(AuditActionClassifier.isSecurityAction("POST", "/api/v1/changes", objectMapper.readTree("{\"is_security_change\": 0}")));
        assertFalse(AuditActionClassifier.isSecurityAction("POST", "/api/v1/changes", objectMapper.readTree("{\"is_security_change\": \"1\"}")));
        assertFalse(AuditActionClassifier.isSecurityAction("PUT", "/api/v1/changes/5", objectMapper.readTree("{\"is_security_change\": 1}")));
    }

    @Test
    void toleratesNonObjectBodies() throws Exception {
        assertFalse(AuditActionClassifier.isSecurityAction("POST", "/api/v1/changes", objectMapper.readTree("[1, 2]")));
        assertFalse(AuditActionClassifier.isSecurityAction("POST", "/api/v1/changes", objectMapper.readTree("\"text\"")));
    }
}
