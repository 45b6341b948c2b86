package com.starscape.classtag.features.qrdecode.app;

import com.starscape.classtag.common.audit.AuditAction;
import com.starscape.classtag.common.audit.AuditLogService;
import com.starscape.classtag.common.exception.DomainValidationException;
import com.starscape.classtag.common.exception.EventInactiveException;
import com.starscape.classtag.common.exception.NameMismatchException;
import com.starscape.classtag.common.exception.NotFoundException;
import com.starscape.classtag.common.exception.TokenExpiredException;
import com.starscape.classtag.features.accesstoken.app.TokenCrypto;
import com.starscape.classtag.features.accesstoken.domain.AccessToken;
import com.starscape.classtag.features.accesstoken.domain.AccessTokenRepository;
import com.starscape.classtag.features.accesstoken.domain.TokenScope;
import com.starscape.classtag.features.qrdecode.domain.QrPayload;
import com.starscape.classtag.features.subjects.domain.SchoolEvent;
import com.starscape.classtag.features.subjects.domain.SchoolEventRepository;
import com.starscape.classtag.features.subjects.domain.Subject;
import com.starscape.classtag.features.subjects.domain.SubjectRepository;
import com.starscape.classtag.features.tagging.domain.PhotoSubjectAssignmentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * Handler for decoding a scanned student QR code into a verified subject.
 *
 * Checks run in order: payload syntax, subject exists in the named event,
 * event active, subject token not expired, scanned name reconciles with the
 * stored one. A subject that exists in another event is reported exactly like
 * a missing one.
 */
@Service
public class DecodeQrHandler {

    private static final Logger log = LoggerFactory.getLogger(DecodeQrHandler.class);

    static final String STUDENT_NOT_FOUND = "Student not found";

    private final QrCodec qrCodec;
    private final NameReconciler nameReconciler;
    private final SubjectRepository subjectRepository;
    private final SchoolEventRepository eventRepository;
    private final PhotoSubjectAssignmentRepository assignmentRepository;
    private final AccessTokenRepository tokenRepository;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public DecodeQrHandler(
            QrCodec qrCodec,
            NameReconciler nameReconciler,
            SubjectRepository subjectRepository,
            SchoolEventRepository eventRepository,
            PhotoSubjectAssignmentRepository assignmentRepository,
            AccessTokenRepository tokenRepository,
            AuditLogService auditLogService,
            Clock clock) {
        this.qrCodec = qrCodec;
        this.nameReconciler = nameReconciler;
        this.subjectRepository = subjectRepository;
        this.eventRepository = eventRepository;
        this.assignmentRepository = assignmentRepository;
        this.tokenRepository = tokenRepository;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public DecodedStudent handle(String qrCode) {
        try {
            DecodedStudent decoded = decode(qrCode);
            auditLogService.success(AuditAction.QR_DECODED, decoded.id().toString(),
                    Map.of("eventId", decoded.eventId().toString()));
            return decoded;
        } catch (DomainValidationException | NotFoundException e) {
            log.info("QR decode rejected: {}", e.getMessage());
            auditLogService.failure(AuditAction.QR_DECODED, null, Map.of("error", e.getMessage()));
            throw e;
        }
    }

    private DecodedStudent decode(String qrCode) {
        QrPayload payload = qrCodec.decode(qrCode);
        Instant now = Instant.now(clock);

        Subject subject = subjectRepository.findById(payload.subjectId())
                .filter(found -> found.belongsTo(payload.eventId()))
                .orElseThrow(() -> new NotFoundException(STUDENT_NOT_FOUND));

        SchoolEvent event = eventRepository.findById(payload.eventId())
                .orElseThrow(() -> new NotFoundException(STUDENT_NOT_FOUND));
        if (!event.isActive()) {
            throw new EventInactiveException();
        }

        if (subject.isTokenExpiredAt(now)) {
            throw new TokenExpiredException(subject.getTokenExpiresAt());
        }

        NameReconciler.Reconciliation reconciliation = nameReconciler.reconcile(payload.subjectName(), subject.getName());
        if (!reconciliation.matches()) {
            throw new NameMismatchException(subject.getName(), payload.subjectName());
        }

        long photoCount = assignmentRepository.countBySubjectId(subject.getSubjectId());
        String maskedToken = tokenRepository
                .findByScopeAndResourceIdOrderByCreatedAtDesc(TokenScope.FAMILY, subject.getSubjectId())
                .stream()
                .filter(token -> token.isValidAt(now))
                .findFirst()
                .map(AccessToken::getTokenPrefix)
                .map(TokenCrypto::mask)
                .orElse(null);
        String tokenStatus = subject.getTokenExpiresAt() != null ? "active" : "no_expiry";

        log.debug("Decoded QR for subject {} in event {}", subject.getSubjectId(), event.getEventId());

        return new DecodedStudent(
            subject.getSubjectId(),
            reconciliation.canonicalName(),
            subject.getGrade(),
            subject.getEventId(),
            photoCount,
            maskedToken,
            tokenStatus,
            now
        );
    }
}
