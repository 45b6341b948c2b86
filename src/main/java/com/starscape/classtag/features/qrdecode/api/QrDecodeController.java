package com.starscape.classtag.features.qrdecode.api;

import com.starscape.classtag.features.qrdecode.api.dto.DecodeQrRequest;
import com.starscape.classtag.features.qrdecode.api.dto.DecodeQrResponse;
import com.starscape.classtag.features.qrdecode.app.DecodeQrHandler;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/commands/qr")
public class QrDecodeController {

    private final DecodeQrHandler decodeHandler;

    public QrDecodeController(DecodeQrHandler decodeHandler) {
        this.decodeHandler = decodeHandler;
    }

    /**
     * Decode a scanned student QR code.
     * POST /commands/qr/decode
     */
    @PostMapping("/decode")
    public ResponseEntity<DecodeQrResponse> decode(@Valid @RequestBody DecodeQrRequest request) {
        return ResponseEntity.ok(DecodeQrResponse.from(decodeHandler.handle(request.qrCode())));
    }
}
