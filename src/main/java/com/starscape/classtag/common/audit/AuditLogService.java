package com.starscape.classtag.common.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.classtag.common.security.UserPrincipal;
import com.starscape.classtag.common.web.CorrelationIdFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Writes audit entries in their own transaction.
 *
 * Audit is best effort: a failure to serialise or persist is logged at WARN and
 * never propagates to the operation being audited, and a rollback of the caller's
 * transaction does not remove entries already written. Callers must pass only
 * non-secret references; token material is masked before it gets here.
 */
@Service
public class AuditLogService {

    private static final Logger log = LoggerFactory.getLogger(AuditLogService.class);

    static final String ANONYMOUS = "anonymous";

    private final AuditEntryRepository auditRepository;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate requiresNew;
    private final Clock clock;

    public AuditLogService(
            AuditEntryRepository auditRepository,
            ObjectMapper objectMapper,
            PlatformTransactionManager transactionManager,
            Clock clock) {
        this.auditRepository = auditRepository;
        this.objectMapper = objectMapper;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    public void record(AuditAction action, AuditOutcome outcome, String subjectRef, Map<String, ?> details) {
        try {
            String auditId = "aud_" + UUID.randomUUID().toString().replace("-", "");
            String payload = details == null || details.isEmpty() ? null : objectMapper.writeValueAsString(details);

            AuditEntry entry = new AuditEntry(
                auditId,
                CorrelationIdFilter.currentRequestId(),
                action,
                outcome,
                currentActor(),
                currentClientIp(),
                subjectRef,
                payload,
                Instant.now(clock)
            );

            requiresNew.executeWithoutResult(status -> auditRepository.save(entry));
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize audit details for action {}", action, e);
        } catch (RuntimeException e) {
            log.warn("Failed to write audit entry for action {} ({})", action, outcome, e);
        }
    }

    public void success(AuditAction action, String subjectRef, Map<String, ?> details) {
        record(action, AuditOutcome.SUCCESS, subjectRef, details);
    }

    public void failure(AuditAction action, String subjectRef, Map<String, ?> details) {
        record(action, AuditOutcome.FAILURE, subjectRef, details);
    }

    private String currentActor() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getPrincipal() instanceof UserPrincipal) {
            return ((UserPrincipal) authentication.getPrincipal()).getUserId();
        }
        return ANONYMOUS;
    }

    private String currentClientIp() {
        RequestAttributes attributes = RequestContextHolder.getRequestAttributes();
        if (attributes == null) {
            return null;
        }
        Object ip = attributes.getAttribute(CorrelationIdFilter.CLIENT_IP_ATTRIBUTE, RequestAttributes.SCOPE_REQUEST);
        return ip != null ? ip.toString() : null;
    }
}
