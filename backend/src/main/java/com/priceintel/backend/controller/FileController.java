package com.priceintel.backend.controller;

import com.priceintel.backend.service.ArtifactStorageService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.core.io.InputStreamResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;

/**
 * Serves stored product images; the inference service downloads them from here.
 */
@RestController
@RequestMapping("/api/files")
@Tag(name = "Files", description = "Product Image Download")
public class FileController {

    private final ArtifactStorageService storageService;

    public FileController(ArtifactStorageService storageService) {
        this.storageService = storageService;
    }

    @GetMapping("/{fileId}")
    @Operation(summary = "Download image", description = "Download a stored product image by ID")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Image returned"),
            @ApiResponse(responseCode = "404", description = "Image not found")
    })
    public ResponseEntity<InputStreamResource> downloadFile(
            @Parameter(description = "File ID") @PathVariable String fileId) throws IOException {

        var found = storageService.find(fileId);
        if (found.isEmpty()) {
            return ResponseEntity.notFound().build();
        }

        var resource = found.get();
        MediaType contentType;
        try {
            contentType = MediaType.parseMediaType(resource.getContentType());
        } catch (InvalidMediaTypeException e) {
            contentType = MediaType.APPLICATION_OCTET_STREAM;
        }

        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "inline; filename=\"" + resource.getFilename() + "\"")
                .contentType(contentType)
                .body(new InputStreamResource(resource.getInputStream()));
    }
}
