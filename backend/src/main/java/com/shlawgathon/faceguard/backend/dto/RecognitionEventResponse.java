package com.shlawgathon.faceguard.backend.dto;

import com.shlawgathon.faceguard.backend.model.PersonMatch;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecognitionEventResponse {

    private String sightingId;
    private boolean matched;
    private PersonMatch match;
    private List<String> alertIds;
}
