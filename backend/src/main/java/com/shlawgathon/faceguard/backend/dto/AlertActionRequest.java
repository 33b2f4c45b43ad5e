package com.shlawgathon.faceguard.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Who is acknowledging or resolving an alert")
public class AlertActionRequest {

    @Size(max = 200)
    @Schema(description = "Operator name or ID", example = "operator-7")
    private String by;
}
