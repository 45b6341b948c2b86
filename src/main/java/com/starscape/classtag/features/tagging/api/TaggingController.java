package com.starscape.classtag.features.tagging.api;

import com.starscape.classtag.common.security.UserPrincipal;
import com.starscape.classtag.features.tagging.api.dto.BatchTagRequest;
import com.starscape.classtag.features.tagging.api.dto.BatchTagResponse;
import com.starscape.classtag.features.tagging.app.BatchTagHandler;
import com.starscape.classtag.features.tagging.app.BatchTagResult;
import com.starscape.classtag.features.tagging.app.RemoveAssignmentHandler;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Controller for photo/subject tagging.
 * Handles batch assignment and removal of a single assignment.
 */
@RestController
@RequestMapping("/commands/tagging")
public class TaggingController {

    private final BatchTagHandler batchTagHandler;
    private final RemoveAssignmentHandler removeAssignmentHandler;

    public TaggingController(
            BatchTagHandler batchTagHandler,
            RemoveAssignmentHandler removeAssignmentHandler) {
        this.batchTagHandler = batchTagHandler;
        this.removeAssignmentHandler = removeAssignmentHandler;
    }

    /**
     * Assign a batch of photos to one subject.
     * POST /commands/tagging/batch
     */
    @PostMapping("/batch")
    public ResponseEntity<BatchTagResponse> batchTag(
            @Valid @RequestBody BatchTagRequest request,
            @AuthenticationPrincipal UserPrincipal principal) {

        BatchTagResult result = batchTagHandler.handle(
            request.eventId(),
            request.subjectId(),
            request.photoIds(),
            request.workflow(),
            principal.getUserId()
        );
        return ResponseEntity.ok(BatchTagResponse.from(result));
    }

    /**
     * Remove a photo from a subject.
     * DELETE /commands/tagging/subjects/{subjectId}/photos/{photoId}
     */
    @DeleteMapping("/subjects/{subjectId}/photos/{photoId}")
    public ResponseEntity<Void> removeAssignment(
            @PathVariable UUID subjectId,
            @PathVariable UUID photoId) {

        removeAssignmentHandler.handle(subjectId, photoId);
        return ResponseEntity.status(HttpStatus.NO_CONTENT).build();
    }
}
