package com.shlawgathon.faceguard.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddEmbeddingResponse {

    private String personId;
    private String embeddingId;
    private int position;
}
