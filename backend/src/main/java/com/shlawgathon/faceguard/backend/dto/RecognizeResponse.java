package com.shlawgathon.faceguard.backend.dto;

import com.shlawgathon.faceguard.backend.model.PersonMatch;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecognizeResponse {

    private boolean matched;
    private double threshold;
    // null when nobody matched
    private PersonMatch match;
}
