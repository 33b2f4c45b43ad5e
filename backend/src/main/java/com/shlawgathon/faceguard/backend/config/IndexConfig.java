package com.shlawgathon.faceguard.backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlawgathon.faceguard.backend.index.SnapshotStore;
import com.shlawgathon.faceguard.backend.index.VectorIndex;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

@Configuration
public class IndexConfig {

    @Value("${faceguard.index.dimension:512}")
    private int dimension;

    @Value("${faceguard.index.snapshot-dir:data/index}")
    private String snapshotDir;

    @Bean
    public VectorIndex vectorIndex() {
        return new VectorIndex(dimension);
    }

    @Bean
    public SnapshotStore snapshotStore(ObjectMapper objectMapper) {
        return new SnapshotStore(Path.of(snapshotDir), objectMapper);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
