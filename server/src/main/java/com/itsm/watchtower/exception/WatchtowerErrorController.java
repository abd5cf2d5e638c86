package com.itsm.watchtower.exception;

import com.itsm.watchtower.models.dto.response.ResponseTemplate;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.web.servlet.error.AbstractErrorController;
import org.springframework.boot.web.error.ErrorAttributeOptions;
import org.springframework.boot.web.servlet.error.ErrorAttributes;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@Slf4j
public class WatchtowerErrorController extends AbstractErrorController {
    public WatchtowerErrorController(ErrorAttributes errorAttributes) {
        super(errorAttributes);
    }

    @RequestMapping("/error")
    public ResponseEntity<ResponseTemplate<Void>> handleError(HttpServletRequest request) {
        HttpStatus status = this.getStatus(request);
        Map<String, Object> errorAttributes = this.getErrorAttributes(request, ErrorAttributeOptions.defaults().including(ErrorAttributeOptions.Include.MESSAGE));
        if (status.is5xxServerError()) {
            Object exception = request.getAttribute("jakarta.servlet.error.exception");
            if (exception instanceof Throwable throwable) {
                log.error("Request to {} failed", errorAttributes.get("path"), throwable);
            } else {
                log.error("Request to {} failed: {}", errorAttributes.get("path"), errorAttributes.get("message"));
            }
        }
        Object message = errorAttributes.getOrDefault("message", status.getReasonPhrase());
        Object error = errorAttributes.getOrDefault("error", status.getReasonPhrase());
        return new ResponseEntity<>(ResponseTemplate.error(String.valueOf(message), String.valueOf(error)), status);
    }
}
