package com.starscape.classtag.features.tagging.app;

import com.starscape.classtag.common.audit.AuditAction;
import com.starscape.classtag.common.audit.AuditLogService;
import com.starscape.classtag.common.config.TaggingProperties;
import com.starscape.classtag.common.exception.BatchValidationException;
import com.starscape.classtag.common.exception.DomainValidationException;
import com.starscape.classtag.common.exception.ScopeMismatchException;
import com.starscape.classtag.features.photos.domain.Photo;
import com.starscape.classtag.features.photos.domain.PhotoRepository;
import com.starscape.classtag.features.subjects.domain.Subject;
import com.starscape.classtag.features.subjects.domain.SubjectRepository;
import com.starscape.classtag.features.tagging.domain.PhotoSubjectAssignmentRepository;
import com.starscape.classtag.features.tagging.domain.TaggingWorkflow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Handler for assigning a batch of photos to one subject.
 *
 * All preconditions are checked before the first insert, so a rejected batch
 * changes nothing. Each pair is inserted with ON CONFLICT DO NOTHING; the
 * affected row count tells an assignment from a duplicate, which makes the
 * operation idempotent under concurrent identical requests. Pairs are inserted
 * in photo id order whatever order the request lists them in.
 */
@Service
public class BatchTagHandler {

    private static final Logger log = LoggerFactory.getLogger(BatchTagHandler.class);

    static final String SUBJECT_SCOPE_MESSAGE = "Subject not found or does not belong to this event";
    static final String FOREIGN_PHOTOS_MESSAGE = "Some photos do not belong to this event";
    static final String UNAPPROVED_MESSAGE = "Cannot tag unapproved photos";

    private final SubjectRepository subjectRepository;
    private final PhotoRepository photoRepository;
    private final PhotoSubjectAssignmentRepository assignmentRepository;
    private final AuditLogService auditLogService;
    private final TaggingProperties taggingProperties;
    private final Clock clock;

    public BatchTagHandler(
            SubjectRepository subjectRepository,
            PhotoRepository photoRepository,
            PhotoSubjectAssignmentRepository assignmentRepository,
            AuditLogService auditLogService,
            TaggingProperties taggingProperties,
            Clock clock) {
        this.subjectRepository = subjectRepository;
        this.photoRepository = photoRepository;
        this.assignmentRepository = assignmentRepository;
        this.auditLogService = auditLogService;
        this.taggingProperties = taggingProperties;
        this.clock = clock;
    }

    @Transactional(timeoutString = "${app.tagging.transaction-timeout-seconds:5}")
    public BatchTagResult handle(UUID eventId, UUID subjectId, List<UUID> photoIds,
                                 TaggingWorkflow workflow, String taggedBy) {
        TaggingWorkflow effectiveWorkflow = workflow != null ? workflow : TaggingWorkflow.QR_TAGGING;
        try {
            BatchTagResult result = assign(eventId, subjectId, photoIds, effectiveWorkflow, taggedBy);

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("eventId", eventId.toString());
            details.put("workflow", effectiveWorkflow.getWireName());
            details.put("assignedCount", result.assignedCount());
            details.put("duplicateCount", result.duplicateCount());
            auditLogService.success(AuditAction.BATCH_TAGGED, subjectId.toString(), details);
            return result;
        } catch (DomainValidationException e) {
            log.info("Batch tagging rejected for subject {}: {}", subjectId, e.getMessage());
            auditLogService.failure(AuditAction.BATCH_TAGGED, subjectId != null ? subjectId.toString() : null,
                    Map.of("error", e.getMessage(), "workflow", effectiveWorkflow.getWireName()));
            throw e;
        }
    }

    private BatchTagResult assign(UUID eventId, UUID subjectId, List<UUID> photoIds,
                                  TaggingWorkflow workflow, String taggedBy) {
        if (photoIds == null || photoIds.isEmpty()) {
            throw new BatchValidationException("At least one photo ID is required");
        }
        if (photoIds.stream().anyMatch(Objects::isNull)) {
            throw new BatchValidationException("Photo IDs cannot be null");
        }

        Set<UUID> distinctIds = new LinkedHashSet<>(photoIds);
        int limit = limitFor(workflow);
        if (distinctIds.size() > limit) {
            throw new BatchValidationException(
                "Too many photos in one batch",
                Map.of("limit", String.valueOf(limit), "requested", String.valueOf(distinctIds.size()))
            );
        }

        Subject subject = subjectRepository.findById(subjectId)
                .filter(found -> found.belongsTo(eventId))
                .orElseThrow(() -> new ScopeMismatchException(SUBJECT_SCOPE_MESSAGE));

        List<Photo> photos = photoRepository.findByEventIdAndPhotoIdIn(eventId, distinctIds);
        if (photos.size() != distinctIds.size()) {
            throw new BatchValidationException(
                FOREIGN_PHOTOS_MESSAGE,
                Map.of("expected", String.valueOf(distinctIds.size()), "found", String.valueOf(photos.size()))
            );
        }

        long unapproved = photos.stream().filter(photo -> !photo.isApproved()).count();
        if (unapproved > 0) {
            throw new BatchValidationException(
                UNAPPROVED_MESSAGE,
                Map.of("unapprovedCount", String.valueOf(unapproved))
            );
        }

        Instant now = Instant.now(clock);
        int assigned = 0;
        int duplicates = 0;
        // Fixed insert order so overlapping concurrent batches lock pairs in the same sequence
        for (UUID photoId : new TreeSet<>(distinctIds)) {
            int inserted = assignmentRepository.insertIfAbsent(photoId, subject.getSubjectId(), now, taggedBy);
            if (inserted == 1) {
                assigned++;
            } else {
                duplicates++;
            }
        }

        log.info("Tagged {} photos to subject {} via {} ({} duplicates)",
                assigned, subject.getSubjectId(), workflow.getWireName(), duplicates);

        return new BatchTagResult(assigned, duplicates, workflow, subject.getName());
    }

    private int limitFor(TaggingWorkflow workflow) {
        switch (workflow) {
            case QR_TAGGING:
                return taggingProperties.getQrBatchLimit();
            case MANUAL_TAGGING:
                return taggingProperties.getManualBatchLimit();
            default:
                throw new IllegalArgumentException("Unhandled workflow: " + workflow);
        }
    }
}
