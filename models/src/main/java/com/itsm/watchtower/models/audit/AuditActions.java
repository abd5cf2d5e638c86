package com.itsm.watchtower.models.audit;

/**
 * Action names recorded in the audit trail. Methods without a mapping are recorded as their lowercased name.
 */
public final class AuditActions {

    public static final String CREATE = "create";
    public static final String UPDATE = "update";
    public static final String DELETE = "delete";

    private AuditActions() {
    }
}
