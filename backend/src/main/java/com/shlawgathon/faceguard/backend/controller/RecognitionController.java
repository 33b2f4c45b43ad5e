package com.shlawgathon.faceguard.backend.controller;

import com.shlawgathon.faceguard.backend.dto.RecognitionEventRequest;
import com.shlawgathon.faceguard.backend.dto.RecognitionEventResponse;
import com.shlawgathon.faceguard.backend.dto.RecognizeRequest;
import com.shlawgathon.faceguard.backend.dto.RecognizeResponse;
import com.shlawgathon.faceguard.backend.dto.SearchRequest;
import com.shlawgathon.faceguard.backend.dto.SearchResponse;
import com.shlawgathon.faceguard.backend.service.RecognitionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Recognition", description = "Face search, identity resolution and sighting ingestion")
public class RecognitionController {

    private final RecognitionService recognitionService;

    public RecognitionController(RecognitionService recognitionService) {
        this.recognitionService = recognitionService;
    }

    @PostMapping("/api/recognition/search")
    @Operation(summary = "Search embeddings", description = "Top-k embedding candidates above a similarity threshold")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Candidates, best first"),
            @ApiResponse(responseCode = "400", description = "Invalid request or wrong vector dimension")
    })
    public ResponseEntity<SearchResponse> search(@Valid @RequestBody SearchRequest request) {
        return ResponseEntity.ok(recognitionService.search(request));
    }

    @PostMapping("/api/recognition/recognize")
    @Operation(summary = "Recognize face", description = "Resolve an embedding to the best matching person")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Resolution result, matched or not"),
            @ApiResponse(responseCode = "400", description = "Invalid request or wrong vector dimension")
    })
    public ResponseEntity<RecognizeResponse> recognize(@Valid @RequestBody RecognizeRequest request) {
        return ResponseEntity.ok(recognitionService.recognize(request));
    }

    @PostMapping("/internal/recognition/events")
    @Operation(summary = "Ingest sighting",
            description = "Resolve identity, announce the sighting and evaluate alert rules")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Sighting processed"),
            @ApiResponse(responseCode = "400", description = "Invalid request or wrong vector dimension"),
            @ApiResponse(responseCode = "401", description = "Missing or invalid API key")
    })
    public ResponseEntity<RecognitionEventResponse> ingest(@Valid @RequestBody RecognitionEventRequest request) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(recognitionService.processEvent(request));
    }
}
