package com.shlawgathon.faceguard.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to enroll one face embedding into the index.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Face embedding to add to the similarity index")
public class AddEmbeddingRequest {

    @NotBlank
    @Schema(description = "Owning person ID", example = "3f0c6a9e-2d4b-4c1a-9a57-0e7d6f1b2c3d")
    private String personId;

    @NotBlank
    @Schema(description = "Embedding ID assigned by the record store")
    private String embeddingId;

    @NotNull
    @Schema(description = "Raw embedding vector, normalized on insert")
    private float[] vector;

    @Schema(description = "Face quality score in [0, 1]", example = "0.92")
    private Double qualityScore;

    @Schema(description = "Whether this is the person's primary embedding")
    private boolean primary;
}
