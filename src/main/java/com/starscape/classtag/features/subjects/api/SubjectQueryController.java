package com.starscape.classtag.features.subjects.api;

import com.starscape.classtag.common.exception.NotFoundException;
import com.starscape.classtag.features.qrdecode.app.QrCodec;
import com.starscape.classtag.features.subjects.api.dto.QrPayloadResponse;
import com.starscape.classtag.features.subjects.domain.Subject;
import com.starscape.classtag.features.subjects.domain.SubjectRepository;
import org.springframework.http.ResponseEntity;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Query endpoints for subjects. Currently serves the QR payload printed on student cards.
 */
@RestController
@RequestMapping("/queries/subjects")
public class SubjectQueryController {

    private final SubjectRepository subjectRepository;
    private final QrCodec qrCodec;

    public SubjectQueryController(SubjectRepository subjectRepository, QrCodec qrCodec) {
        this.subjectRepository = subjectRepository;
        this.qrCodec = qrCodec;
    }

    /**
     * GET /queries/subjects/{subjectId}/qr-payload
     */
    @GetMapping("/{subjectId}/qr-payload")
    @Transactional(readOnly = true)
    public ResponseEntity<QrPayloadResponse> getQrPayload(@PathVariable UUID subjectId) {
        Subject subject = subjectRepository.findById(subjectId)
                .orElseThrow(() -> new NotFoundException("Subject not found: " + subjectId));

        return ResponseEntity.ok(new QrPayloadResponse(
            subject.getSubjectId(),
            subject.getEventId(),
            qrCodec.encode(subject)
        ));
    }
}
