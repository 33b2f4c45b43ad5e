package com.shlawgathon.faceguard.backend.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchAddEmbeddingsRequest {

    @NotEmpty
    private List<AddEmbeddingRequest> embeddings;
}
