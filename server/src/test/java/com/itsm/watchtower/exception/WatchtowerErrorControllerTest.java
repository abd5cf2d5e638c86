package com.itsm.watchtower.exception;

import com.itsm.watchtower.models.dto.response.ResponseTemplate;
import jakarta.servlet.RequestDispatcher;
import jakarta.servlet.http.HttpServletRequest;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.servlet.error.DefaultErrorAttributes;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.junit.jupiter.api.Assertions.*;

class WatchtowerErrorControllerTest {

    private final WatchtowerErrorController errorController = new WatchtowerErrorController(new DefaultErrorAttributes());

    @Test
    void handleErrorWithoutException() {
        HttpServletRequest request = new MockHttpServletRequest();
        request.setAttribute(RequestDispatcher.ERROR_STATUS_CODE, 404);
        request.setAttribute(RequestDispatcher.ERROR_MESSAGE, "Audit log not found: 9");

        ResponseEntity<ResponseTemplate<Void>> response = errorController.handleError(request);

        assertEquals(404, response.getStatusCode().value());
        assertNotNull(response.getBody());
        assertEquals("Audit log not found: 9", response.getBody().message());
        assertEquals("Not Found", response.getBody().code());
        assertNull(response.getBody().data());
    }

    @Test
    void handleErrorWithException() {
        HttpServletRequest request = new MockHttpServletRequest();
        request.setAttribute(RequestDispatcher.ERROR_STATUS_CODE, 500);
        request.setAttribute(RequestDispatcher.ERROR_EXCEPTION, new IllegalStateException("storage unavailable"));

        ResponseEntity<ResponseTemplate<Void>> response = errorController.handleError(request);

        assertEquals(500, response.getStatusCode().value());
        assertNotNull(response.getBody());
        assertEquals("storage unavailable", response.getBody().message());
        assertEquals("Internal Server Error", response.getBody().code());
    }
}
