package com.itsm.watchtower.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.itsm.watchtower.audit.utils.SensitiveFieldRedactor;
import com.itsm.watchtower.audit.utils.StateDiffer;
import com.itsm.watchtower.models.audit.AuditActions;
import com.itsm.watchtower.models.audit.AuditDiff;
import com.itsm.watchtower.models.db.AuditRecord;
import com.itsm.watchtower.spi.AuditSink;

import java.util.concurrent.atomic.AtomicReference;

/**
 * The audit of one request, waiting for its response to be sent.
 * <p>
 * {@link #responseSent()} hands the record to the writers exactly once, no matter how often or from which thread the
 * completion of the response is reported.
 */
public class PendingAudit {

    public enum State {
        PENDING, SENT
    }

    private final AuditRequestContext context;
    private final JsonNode priorState;
    private final AuditTaskExecutor auditTaskExecutor;
    private final AuditSink auditSink;
    private final AtomicReference<State> state = new AtomicReference<>(State.PENDING);

    public PendingAudit(AuditRequestContext context, JsonNode priorState, AuditTaskExecutor auditTaskExecutor, AuditSink auditSink) {
        this.context = context;
        this.priorState = priorState;
        this.auditTaskExecutor = auditTaskExecutor;
        this.auditSink = auditSink;
    }

    /**
     * @return {@code true} only for the call that actually scheduled the record
     */
    public boolean responseSent() {
        if (!state.compareAndSet(State.PENDING, State.SENT)) {
            return false;
        }
        return auditTaskExecutor.submit(() -> auditSink.write(buildRecord()));
    }

    public State getState() {
        return state.get();
    }

    AuditRecord buildRecord() {
        JsonNode redactedPrior = SensitiveFieldRedactor.redact(priorState);
        JsonNode redactedNew = SensitiveFieldRedactor.redact(context.body());
        AuditDiff diff = null;
        if (AuditActions.UPDATE.equals(context.action()) && redactedPrior != null) {
            diff = StateDiffer.diff(redactedPrior, redactedNew);
        }
        return AuditRecord.builder()
                .actorId(context.actorId())
                .action(context.action())
                .resourceType(context.resourceInfo().resourceType())
                .resourceId(context.resourceInfo().resourceId())
                // the diff already carries the old values of everything that changed
                .priorState(diff == null ? redactedPrior : null)
                .diff(diff)
                .newState(redactedNew)
                .ipAddress(context.ipAddress())
                .userAgent(context.userAgent())
                .securityAction(context.securityAction())
                .build();
    }
}
