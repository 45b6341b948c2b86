package com.starscape.classtag.features.tagging.app;

import com.starscape.classtag.common.audit.AuditAction;
import com.starscape.classtag.common.audit.AuditLogService;
import com.starscape.classtag.common.config.TaggingProperties;
import com.starscape.classtag.common.exception.BatchValidationException;
import com.starscape.classtag.common.exception.ScopeMismatchException;
import com.starscape.classtag.features.photos.domain.Photo;
import com.starscape.classtag.features.photos.domain.PhotoRepository;
import com.starscape.classtag.features.subjects.domain.Subject;
import com.starscape.classtag.features.subjects.domain.SubjectRepository;
import com.starscape.classtag.features.tagging.domain.PhotoSubjectAssignmentRepository;
import com.starscape.classtag.features.tagging.domain.TaggingWorkflow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BatchTagHandlerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private SubjectRepository subjectRepository;

    @Mock
    private PhotoRepository photoRepository;

    @Mock
    private PhotoSubjectAssignmentRepository assignmentRepository;

    @Mock
    private AuditLogService auditLogService;

    private BatchTagHandler handler;

    private UUID eventId;
    private Subject subject;

    @BeforeEach
    void setUp() {
        TaggingProperties properties = new TaggingProperties();
        properties.setQrBatchLimit(50);
        properties.setManualBatchLimit(100);
        handler = new BatchTagHandler(subjectRepository, photoRepository, assignmentRepository,
                auditLogService, properties, Clock.fixed(NOW, ZoneOffset.UTC));
        eventId = UUID.randomUUID();
        subject = new Subject(UUID.randomUUID(), eventId, "Juan Pérez", "5A", null, null);
    }

    @Test
    @DisplayName("handle - New photos: Should assign all of them")
    void handle_AssignsAll() {
        // Arrange
        List<Photo> photos = photos(5, true);
        List<UUID> ids = ids(photos);
        when(subjectRepository.findById(subject.getSubjectId())).thenReturn(Optional.of(subject));
        when(photoRepository.findByEventIdAndPhotoIdIn(eq(eventId), anyCollection())).thenReturn(photos);
        when(assignmentRepository.insertIfAbsent(any(UUID.class), eq(subject.getSubjectId()), eq(NOW), eq("staff-1")))
                .thenReturn(1);

        // Act
        BatchTagResult result = handler.handle(eventId, subject.getSubjectId(), ids, null, "staff-1");

        // Assert
        assertEquals(5, result.assignedCount());
        assertEquals(0, result.duplicateCount());
        assertEquals(TaggingWorkflow.QR_TAGGING, result.workflow());
        assertEquals("5 photos assigned to Juan Pérez", result.message());
        verify(auditLogService).success(eq(AuditAction.BATCH_TAGGED), eq(subject.getSubjectId().toString()), anyMap());
    }

    @Test
    @DisplayName("handle - Repeated batch: Should report every photo as duplicate")
    void handle_AllDuplicates() {
        List<Photo> photos = photos(5, true);
        when(subjectRepository.findById(subject.getSubjectId())).thenReturn(Optional.of(subject));
        when(photoRepository.findByEventIdAndPhotoIdIn(eq(eventId), anyCollection())).thenReturn(photos);
        when(assignmentRepository.insertIfAbsent(any(UUID.class), any(UUID.class), any(Instant.class), anyString()))
                .thenReturn(0);

        BatchTagResult result = handler.handle(eventId, subject.getSubjectId(), ids(photos),
                TaggingWorkflow.MANUAL_TAGGING, "staff-1");

        assertEquals(0, result.assignedCount());
        assertEquals(5, result.duplicateCount());
        assertEquals("All 5 photos were already assigned to Juan Pérez", result.message());
    }

    @Test
    @DisplayName("handle - Repeated ids in one request: Should be counted once")
    void handle_DeduplicatesRequest() {
        List<Photo> photos = photos(2, true);
        List<UUID> ids = new ArrayList<>(ids(photos));
        ids.add(photos.get(0).getPhotoId());
        when(subjectRepository.findById(subject.getSubjectId())).thenReturn(Optional.of(subject));
        when(photoRepository.findByEventIdAndPhotoIdIn(eq(eventId), anyCollection())).thenReturn(photos);
        when(assignmentRepository.insertIfAbsent(any(UUID.class), any(UUID.class), any(Instant.class), anyString()))
                .thenReturn(1);

        BatchTagResult result = handler.handle(eventId, subject.getSubjectId(), ids, null, "staff-1");

        assertEquals(2, result.assignedCount());
        assertEquals(0, result.duplicateCount());
    }

    @Test
    @DisplayName("handle - Unapproved photo: Should reject the whole batch")
    void handle_Unapproved() {
        List<Photo> photos = new ArrayList<>(photos(2, true));
        photos.addAll(photos(1, false));
        when(subjectRepository.findById(subject.getSubjectId())).thenReturn(Optional.of(subject));
        when(photoRepository.findByEventIdAndPhotoIdIn(eq(eventId), anyCollection())).thenReturn(photos);

        BatchValidationException ex = assertThrows(BatchValidationException.class,
                () -> handler.handle(eventId, subject.getSubjectId(), ids(photos), null, "staff-1"));

        assertEquals(BatchTagHandler.UNAPPROVED_MESSAGE, ex.getMessage());
        assertEquals("1", ex.getDetails().get("unapprovedCount"));
        verify(assignmentRepository, never()).insertIfAbsent(any(), any(), any(), any());
        verify(auditLogService).failure(eq(AuditAction.BATCH_TAGGED), eq(subject.getSubjectId().toString()), anyMap());
    }

    @Test
    @DisplayName("handle - Photo from another event: Should reject the whole batch")
    void handle_ForeignPhoto() {
        List<Photo> photos = photos(3, true);
        List<UUID> ids = new ArrayList<>(ids(photos));
        ids.add(UUID.randomUUID());
        when(subjectRepository.findById(subject.getSubjectId())).thenReturn(Optional.of(subject));
        when(photoRepository.findByEventIdAndPhotoIdIn(eq(eventId), anyCollection())).thenReturn(photos);

        BatchValidationException ex = assertThrows(BatchValidationException.class,
                () -> handler.handle(eventId, subject.getSubjectId(), ids, null, "staff-1"));

        assertEquals(BatchTagHandler.FOREIGN_PHOTOS_MESSAGE, ex.getMessage());
        assertEquals("4", ex.getDetails().get("expected"));
        assertEquals("3", ex.getDetails().get("found"));
        verify(assignmentRepository, never()).insertIfAbsent(any(), any(), any(), any());
    }

    @Test
    @DisplayName("handle - Subject of another event: Should reject as scope mismatch")
    void handle_SubjectOutOfScope() {
        Subject elsewhere = new Subject(subject.getSubjectId(), UUID.randomUUID(), "Juan Pérez", "5A", null, null);
        when(subjectRepository.findById(subject.getSubjectId())).thenReturn(Optional.of(elsewhere));

        assertThrows(ScopeMismatchException.class,
                () -> handler.handle(eventId, subject.getSubjectId(), List.of(UUID.randomUUID()), null, "staff-1"));
        verifyNoInteractions(photoRepository);
    }

    @Test
    @DisplayName("handle - Empty batch: Should reject before any lookup")
    void handle_Empty() {
        BatchValidationException ex = assertThrows(BatchValidationException.class,
                () -> handler.handle(eventId, subject.getSubjectId(), List.of(), null, "staff-1"));

        assertEquals("At least one photo ID is required", ex.getMessage());
        verifyNoInteractions(subjectRepository, photoRepository);
    }

    @Test
    @DisplayName("handle - Over the QR ceiling: Should reject, manual ceiling is higher")
    void handle_Ceiling() {
        List<UUID> ids = IntStream.range(0, 51).mapToObj(i -> UUID.randomUUID()).collect(Collectors.toList());

        BatchValidationException ex = assertThrows(BatchValidationException.class,
                () -> handler.handle(eventId, subject.getSubjectId(), ids, TaggingWorkflow.QR_TAGGING, "staff-1"));

        assertEquals("50", ex.getDetails().get("limit"));
        assertEquals("51", ex.getDetails().get("requested"));
        verifyNoInteractions(subjectRepository);
    }

    @Test
    @DisplayName("handle - Photos listed in any order: Should insert pairs in photo id order")
    void handle_DeterministicInsertOrder() {
        // Arrange
        List<Photo> photos = photos(4, true);
        List<UUID> sorted = new ArrayList<>(ids(photos));
        Collections.sort(sorted);
        List<UUID> reversed = new ArrayList<>(sorted);
        Collections.reverse(reversed);
        when(subjectRepository.findById(subject.getSubjectId())).thenReturn(Optional.of(subject));
        when(photoRepository.findByEventIdAndPhotoIdIn(eq(eventId), anyCollection())).thenReturn(photos);
        when(assignmentRepository.insertIfAbsent(any(UUID.class), any(UUID.class), any(Instant.class), anyString()))
                .thenReturn(1);

        // Act
        handler.handle(eventId, subject.getSubjectId(), reversed, null, "staff-1");

        // Assert
        InOrder inOrder = inOrder(assignmentRepository);
        for (UUID photoId : sorted) {
            inOrder.verify(assignmentRepository).insertIfAbsent(eq(photoId), eq(subject.getSubjectId()), eq(NOW), eq("staff-1"));
        }
    }

    @Test
    @DisplayName("handle - Null photo id: Should reject as a validation error")
    void handle_NullPhotoId() {
        List<UUID> ids = Arrays.asList(UUID.randomUUID(), null);

        BatchValidationException ex = assertThrows(BatchValidationException.class,
                () -> handler.handle(eventId, subject.getSubjectId(), ids, null, "staff-1"));

        assertEquals("Photo IDs cannot be null", ex.getMessage());
        verifyNoInteractions(subjectRepository, photoRepository);
    }

    private List<Photo> photos(int count, boolean approved) {
        List<Photo> photos = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            UUID photoId = UUID.randomUUID();
            photos.add(new Photo(photoId, eventId, approved, photoId + ".jpg", "events/" + photoId + ".jpg"));
        }
        return photos;
    }

    private static List<UUID> ids(List<Photo> photos) {
        return photos.stream().map(Photo::getPhotoId).collect(Collectors.toList());
    }
}
