package com.tripAgent.TripOptimizer.service;

import com.tripAgent.TripOptimizer.config.OptimizerProperties;
import com.tripAgent.TripOptimizer.model.TripPackage;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

@Component
@RequiredArgsConstructor
public class PackageRanker {

    static final Comparator<TripPackage> RANKING = Comparator
            .comparingDouble(TripPackage::getTotalScore).reversed()
            .thenComparingDouble(TripPackage::getTotalCost)
            .thenComparing(p -> p.getWindow().getStartDate());

    private final OptimizerProperties properties;

    /**
     * Top {@code optimizer.top-k} packages by score. The input list is left untouched.
     */
    public List<TripPackage> rank(List<TripPackage> packages) {
        return rank(packages, properties.getTopK());
    }

    public List<TripPackage> rank(List<TripPackage> packages, int topK) {
        return packages.stream()
                .sorted(RANKING)
                .limit(Math.max(0, topK))
                .toList();
    }
}
