package com.itsm.watchtower.spi;

/**
 * Raised by storage implementations when the underlying store cannot be read or written.
 */
public class AuditStorageException extends RuntimeException {

    public AuditStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
