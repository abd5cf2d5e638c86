package com.itsm.watchtower.models.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Envelope of every JSON response returned by the API.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResponseTemplate<T>(T data, String message, String code) {

    public static <T> ResponseTemplate<T> success(T data, String message) {
        return new ResponseTemplate<>(data, message, "OK");
    }

    public static <T> ResponseTemplate<T> error(String message, String code) {
        return new ResponseTemplate<>(null, message, code);
    }
}
