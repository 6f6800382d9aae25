package com.hometown.happiness.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

@Configuration
public class ScoringConfig {
    private static final Logger log = LoggerFactory.getLogger(ScoringConfig.class);

    @Bean
    public ScoringWeights scoringWeights(HappinessProperties properties) {
        return load(Path.of(properties.getScoring().getPath()), new ObjectMapper());
    }

    /**
     * Reads {@code scoring.json}. A missing file means the defaults (+1/-1 regular, +3/-3 playoff);
     * a file that exists but cannot be parsed stops startup.
     */
    public static ScoringWeights load(Path path, ObjectMapper mapper) {
        if (path == null || !Files.exists(path)) {
            ScoringWeights defaults = ScoringWeights.defaults();
            log.info("[SCORING] No scoring config at {}; using defaults {}", path, defaults);
            return defaults;
        }
        try {
            Map<String, Integer> raw = mapper.readValue(path.toFile(), new TypeReference<Map<String, Integer>>() {});
            ScoringWeights weights = ScoringWeights.fromMap(raw == null ? Map.of() : raw);
            log.info("[SCORING] Loaded {} from {}", weights, path);
            return weights;
        } catch (IOException ex) {
            throw new IllegalStateException("Invalid scoring config " + path + ": " + ex.getMessage(), ex);
        }
    }
}
