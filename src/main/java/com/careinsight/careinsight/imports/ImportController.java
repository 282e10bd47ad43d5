package com.careinsight.careinsight.imports;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Exposes the preview and commit steps of the patient CSV import.
 */
@RestController
@RequestMapping("/api/import")
public class ImportController {

    private final ImportService importService;

    public ImportController(ImportService importService) {
        this.importService = importService;
    }

    /**
     * Stages an uploaded file and returns its token, schema verdict and first rows.
     */
    @PostMapping(value = "/preview", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ImportModels.PreviewResponse> preview(@RequestParam("file") MultipartFile file) {
        try (InputStream content = file.getInputStream()) {
            return ResponseEntity.ok(importService.preview(file.getOriginalFilename(), content));
        } catch (IOException ex) {
            throw new UncheckedIOException(ImportConstants.MSG_SAVE_FAILED, ex);
        }
    }

    /**
     * Commits a previewed file in {@code overwrite} or {@code append} mode.
     */
    @PostMapping("/commit")
    public ResponseEntity<ImportModels.CommitResponse> commit(@RequestBody(required = false) ImportModels.CommitRequest request) {
        ImportModels.CommitRequest body = request == null ? new ImportModels.CommitRequest(null, null) : request;
        ImportMode mode = ImportMode.fromValue(body.mode());
        return ResponseEntity.ok(importService.commit(body.token(), mode));
    }
}
