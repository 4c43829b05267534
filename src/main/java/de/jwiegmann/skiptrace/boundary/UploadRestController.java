package de.jwiegmann.skiptrace.boundary;

import de.jwiegmann.skiptrace.boundary.dto.init.UploadInitRequest;
import de.jwiegmann.skiptrace.boundary.dto.init.UploadInitResponse;
import de.jwiegmann.skiptrace.boundary.dto.mapping.MappingConfirmRequest;
import de.jwiegmann.skiptrace.boundary.dto.record.RecordListResponse;
import de.jwiegmann.skiptrace.boundary.dto.status.UploadStatusListResponse;
import de.jwiegmann.skiptrace.boundary.dto.status.UploadStatusResponse;
import de.jwiegmann.skiptrace.control.UploadService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;

@RestController
@RequestMapping("/skiptrace-api/v1")
public class UploadRestController {

    private final UploadService service;

    public UploadRestController(UploadService service) {
        this.service = service;
    }

    /**
     * POST /skiptrace-api/v1/upload: Tabelle hochladen, liefert den Mapping-Vorschlag
     */
    @PostMapping("/upload")
    public ResponseEntity<UploadInitResponse> upload(@RequestBody UploadInitRequest req) {

        UploadInitResponse resp = service.createBatch(req);

        return ResponseEntity
                .created(URI.create("/skiptrace-api/v1/upload/" + resp.getBatchId()))
                .body(resp);
    }

    /**
     * PUT /skiptrace-api/v1/upload/{batchId}/mapping: Mapping, Policy und Tags bestätigen
     */
    @PutMapping("/upload/{batchId}/mapping")
    public ResponseEntity<UploadStatusResponse> confirmMapping(
            @PathVariable String batchId,
            @RequestBody MappingConfirmRequest req
    ) {
        return ResponseEntity.accepted().body(service.confirmMapping(batchId, req));
    }

    /**
     * POST /skiptrace-api/v1/upload/{batchId}/process: Verarbeitung starten bzw. fortsetzen
     */
    @PostMapping("/upload/{batchId}/process")
    public ResponseEntity<UploadStatusResponse> process(@PathVariable String batchId) {
        return ResponseEntity.ok(service.process(batchId));
    }

    /**
     * POST /skiptrace-api/v1/upload/{batchId}/cancel
     */
    @PostMapping("/upload/{batchId}/cancel")
    public ResponseEntity<UploadStatusResponse> cancel(@PathVariable String batchId) {
        return ResponseEntity.accepted().body(service.cancel(batchId));
    }

    /**
     * GET /skiptrace-api/v1/upload/{batchId}: Status eines Uploads
     */
    @GetMapping("/upload/{batchId}")
    public ResponseEntity<UploadStatusResponse> getStatus(@PathVariable String batchId) {
        return ResponseEntity.ok(service.getStatus(batchId));
    }

    /**
     * GET /skiptrace-api/v1/upload/{batchId}/records: Ergebnis pro Datensatz
     */
    @GetMapping("/upload/{batchId}/records")
    public ResponseEntity<RecordListResponse> getRecords(@PathVariable String batchId) {
        return ResponseEntity.ok(service.getRecords(batchId));
    }

    /**
     * GET /skiptrace-api/v1/upload: Status aller Uploads
     */
    @GetMapping("/upload")
    public ResponseEntity<UploadStatusListResponse> getAllStatus() {
        return ResponseEntity.ok(service.getAllStatus());
    }

    @DeleteMapping("/upload/{batchId}")
    public ResponseEntity<Void> purge(@PathVariable String batchId) {
        service.purge(batchId);
        return ResponseEntity.noContent().build();
    }
}
