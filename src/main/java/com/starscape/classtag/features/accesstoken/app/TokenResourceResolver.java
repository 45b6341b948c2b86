package com.starscape.classtag.features.accesstoken.app;

import com.starscape.classtag.features.accesstoken.domain.TokenScope;
import com.starscape.classtag.features.photos.domain.Photo;
import com.starscape.classtag.features.subjects.domain.SchoolEventRepository;
import com.starscape.classtag.features.subjects.domain.SubjectRepository;
import com.starscape.classtag.features.tagging.domain.PhotoSubjectAssignmentRepository;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Interprets a token's {@code resourceId} according to its scope.
 */
@Component
public class TokenResourceResolver {

    private final SchoolEventRepository eventRepository;
    private final SubjectRepository subjectRepository;
    private final PhotoSubjectAssignmentRepository assignmentRepository;

    public TokenResourceResolver(
            SchoolEventRepository eventRepository,
            SubjectRepository subjectRepository,
            PhotoSubjectAssignmentRepository assignmentRepository) {
        this.eventRepository = eventRepository;
        this.subjectRepository = subjectRepository;
        this.assignmentRepository = assignmentRepository;
    }

    public boolean exists(TokenScope scope, UUID resourceId) {
        switch (scope) {
            case EVENT:
                return eventRepository.existsById(resourceId);
            case COURSE:
                return subjectRepository.existsByCourseId(resourceId);
            case FAMILY:
                return subjectRepository.existsById(resourceId);
            default:
                throw new IllegalArgumentException("Unhandled token scope: " + scope);
        }
    }

    /**
     * Whether the photo lies inside the resource the token grants access to.
     * EVENT: same event. COURSE: tagged to a subject of the course. FAMILY: tagged to the subject.
     */
    public boolean covers(TokenScope scope, UUID resourceId, Photo photo) {
        switch (scope) {
            case EVENT:
                return photo.getEventId().equals(resourceId);
            case COURSE:
                return assignmentRepository.isPhotoTaggedToCourse(photo.getPhotoId(), resourceId);
            case FAMILY:
                return assignmentRepository.existsByPhotoIdAndSubjectId(photo.getPhotoId(), resourceId);
            default:
                throw new IllegalArgumentException("Unhandled token scope: " + scope);
        }
    }
}
