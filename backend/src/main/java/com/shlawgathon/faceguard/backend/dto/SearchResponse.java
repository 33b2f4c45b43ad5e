package com.shlawgathon.faceguard.backend.dto;

import com.shlawgathon.faceguard.backend.index.MatchCandidate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResponse {

    private double threshold;
    private List<MatchCandidate> candidates;
}
