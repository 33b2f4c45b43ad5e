package com.shlawgathon.faceguard.backend.controller;

import com.shlawgathon.faceguard.backend.dto.AddEmbeddingRequest;
import com.shlawgathon.faceguard.backend.dto.AddEmbeddingResponse;
import com.shlawgathon.faceguard.backend.dto.BatchAddEmbeddingsRequest;
import com.shlawgathon.faceguard.backend.dto.BatchAddEmbeddingsResponse;
import com.shlawgathon.faceguard.backend.dto.IndexStatusResponse;
import com.shlawgathon.faceguard.backend.service.EmbeddingIndexService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Enrollment into the embedding index. The write side lives under /internal
 * and is called by the record store when persons and embeddings change.
 */
@RestController
@Tag(name = "Index", description = "Face embedding index management")
public class IndexController {

    private final EmbeddingIndexService indexService;

    public IndexController(EmbeddingIndexService indexService) {
        this.indexService = indexService;
    }

    @PostMapping("/internal/index/embeddings")
    @Operation(summary = "Add embedding", description = "Add one face embedding to the index")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Embedding added"),
            @ApiResponse(responseCode = "400", description = "Invalid request or wrong vector dimension"),
            @ApiResponse(responseCode = "401", description = "Missing or invalid API key")
    })
    public ResponseEntity<AddEmbeddingResponse> addEmbedding(@Valid @RequestBody AddEmbeddingRequest request) {
        int position = indexService.addEmbedding(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(AddEmbeddingResponse.builder()
                .personId(request.getPersonId())
                .embeddingId(request.getEmbeddingId())
                .position(position)
                .build());
    }

    @PostMapping("/internal/index/embeddings/batch")
    @Operation(summary = "Batch add embeddings",
            description = "Add many embeddings, skipping invalid ones, then persist a snapshot")
    public ResponseEntity<BatchAddEmbeddingsResponse> addEmbeddings(
            @Valid @RequestBody BatchAddEmbeddingsRequest request) {
        return ResponseEntity.ok(indexService.addEmbeddings(request.getEmbeddings()));
    }

    @DeleteMapping("/internal/index/persons/{personId}")
    @Operation(summary = "Deactivate person", description = "Exclude all of a person's embeddings from search")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Person deactivated"),
            @ApiResponse(responseCode = "404", description = "Person has no active embeddings")
    })
    public ResponseEntity<Map<String, Object>> deactivatePerson(
            @Parameter(description = "Person ID") @PathVariable String personId) {
        if (!indexService.deactivatePerson(personId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("personId", personId, "deactivated", true));
    }

    @PostMapping("/internal/index/snapshot")
    @Operation(summary = "Save snapshot", description = "Persist the index to the snapshot directory now")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Snapshot written"),
            @ApiResponse(responseCode = "503", description = "Snapshot could not be written")
    })
    public ResponseEntity<IndexStatusResponse> saveSnapshot() {
        boolean saved = indexService.saveSnapshot();
        return ResponseEntity.status(saved ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                .body(indexService.status());
    }

    @GetMapping("/api/index/stats")
    @Operation(summary = "Index statistics", description = "Dimension, sizes and snapshot state")
    public ResponseEntity<IndexStatusResponse> stats() {
        return ResponseEntity.ok(indexService.status());
    }
}
