package com.shlawgathon.faceguard.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Identity resolution for one face embedding")
public class RecognizeRequest {

    @NotNull
    @Schema(description = "Query embedding")
    private float[] embedding;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    @Schema(description = "Match threshold; defaults to the configured recognition threshold", example = "0.6")
    private Double threshold;
}
