package com.starscape.classtag.features.tagging.app;

import com.starscape.classtag.common.audit.AuditAction;
import com.starscape.classtag.common.audit.AuditLogService;
import com.starscape.classtag.common.exception.NotFoundException;
import com.starscape.classtag.features.tagging.domain.PhotoSubjectAssignmentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;
import java.util.UUID;

/**
 * Handler for declassifying a photo, i.e. removing one photo/subject edge.
 */
@Service
public class RemoveAssignmentHandler {

    private static final Logger log = LoggerFactory.getLogger(RemoveAssignmentHandler.class);

    private final PhotoSubjectAssignmentRepository assignmentRepository;
    private final AuditLogService auditLogService;

    public RemoveAssignmentHandler(
            PhotoSubjectAssignmentRepository assignmentRepository,
            AuditLogService auditLogService) {
        this.assignmentRepository = assignmentRepository;
        this.auditLogService = auditLogService;
    }

    @Transactional
    public void handle(UUID subjectId, UUID photoId) {
        int deleted = assignmentRepository.deleteByPhotoIdAndSubjectId(photoId, subjectId);
        if (deleted == 0) {
            throw new NotFoundException("Photo is not assigned to this subject");
        }

        log.info("Removed photo {} from subject {}", photoId, subjectId);
        auditLogService.success(AuditAction.ASSIGNMENT_REMOVED, subjectId.toString(),
                Map.of("photoId", photoId.toString()));
    }
}
