package com.shlawgathon.faceguard.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * One detected face from a camera, posted by the detection pipeline.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Face sighting to run through recognition and alerting")
public class RecognitionEventRequest {

    @Schema(description = "Sighting ID; generated when absent")
    private String sightingId;

    @NotBlank
    @Schema(description = "Camera that produced the frame", example = "cam-lobby-01")
    private String cameraId;

    @Schema(description = "Location of the camera", example = "hq-lobby")
    private String locationId;

    @Schema(description = "Capture time; defaults to receipt time")
    private Instant observedAt;

    @NotNull
    @Schema(description = "Face embedding produced by the model")
    private float[] embedding;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    @Schema(description = "Detector confidence for the face", example = "0.97")
    private Double detectionConfidence;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    @Schema(description = "Match threshold override")
    private Double threshold;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();
}
