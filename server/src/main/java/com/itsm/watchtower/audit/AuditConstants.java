package com.itsm.watchtower.audit;

import lombok.experimental.UtilityClass;

@UtilityClass
public class AuditConstants {
    public static final String AUDIT_ERROR_METRIC = "audit-log-error";
    public static final String AUDIT_DROPPED_METRIC = "audit-log-dropped";
    public static final String PRIOR_STATE_ERROR_METRIC = "audit-prior-state-error";
    public static final String ACTION_TAG = "action";
    public static final String EXCEPTION_TAG = "exception";
}
