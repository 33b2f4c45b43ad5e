package com.shlawgathon.faceguard.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Raw nearest-neighbour search over the embedding index")
public class SearchRequest {

    @NotNull
    @Schema(description = "Query embedding")
    private float[] embedding;

    @Min(1)
    @Max(1000)
    @Builder.Default
    @Schema(description = "Maximum candidates to return", example = "10")
    private int k = 10;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    @Schema(description = "Minimum similarity; defaults to the configured recognition threshold", example = "0.6")
    private Double threshold;
}
