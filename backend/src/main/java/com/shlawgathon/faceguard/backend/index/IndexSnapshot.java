package com.shlawgathon.faceguard.backend.index;

import java.util.List;
import java.util.Map;

/**
 * Point-in-time copy of the index state, detached from the live index.
 *
 * @param dimension         vector dimension
 * @param vectors           dense row-major store, {@code entries.size() * dimension} floats
 * @param entries           entries ordered by position
 * @param personPositions   person id to every position ever assigned to that person
 * @param inactivePositions positions removed from search
 * @param zeroPositions     positions whose vector had zero magnitude
 */
public record IndexSnapshot(
        int dimension,
        float[] vectors,
        List<IndexEntry> entries,
        Map<String, List<Integer>> personPositions,
        List<Integer> inactivePositions,
        List<Integer> zeroPositions) {
}
