package com.tripAgent.TripOptimizer.service;

import com.tripAgent.TripOptimizer.config.LoyaltyProperties;
import com.tripAgent.TripOptimizer.model.LoyaltyProgram;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Read-only table of loyalty programs, built once from {@code loyalty.programs}.
 * Codes are matched case-insensitively.
 */
@Slf4j
@Component
public class LoyaltyProgramRegistry {

    private final Map<String, LoyaltyProgram> programs;

    public LoyaltyProgramRegistry(LoyaltyProperties properties) {
        Map<String, LoyaltyProgram> table = new TreeMap<>();
        properties.getPrograms().forEach((code, settings) -> {
            if (settings.getPointValue() <= 0 || settings.getConversionRate() <= 0) {
                throw new IllegalStateException("Loyalty program " + code
                        + " needs a positive point-value and conversion-rate");
            }
            String normalized = normalize(code);
            table.put(normalized, new LoyaltyProgram(normalized, settings.getPointValue(), settings.getConversionRate()));
        });
        this.programs = Collections.unmodifiableMap(table);
        log.info("Loaded {} loyalty programs: {}", programs.size(), programs.keySet());
    }

    public Optional<LoyaltyProgram> find(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(programs.get(normalize(code)));
    }

    /** Programs sorted by code. */
    public List<LoyaltyProgram> listPrograms() {
        return List.copyOf(programs.values());
    }

    private static String normalize(String code) {
        return code.trim().toUpperCase(Locale.ROOT);
    }
}
