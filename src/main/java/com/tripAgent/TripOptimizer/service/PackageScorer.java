package com.tripAgent.TripOptimizer.service;

import com.tripAgent.TripOptimizer.config.OptimizerProperties;
import com.tripAgent.TripOptimizer.model.PreferencePriority;
import com.tripAgent.TripOptimizer.model.ScoringWeights;
import com.tripAgent.TripOptimizer.model.TravelPreferences;
import com.tripAgent.TripOptimizer.model.TripPackage;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Weighted multi-criteria score. Each sub-score is on a 0-100 scale before weighting,
 * except the hotel score which can reach 120 with the family bonus.
 */
@Component
@RequiredArgsConstructor
public class PackageScorer {

    static final double FAMILY_FRIENDLY_BONUS = 20;

    private final OptimizerProperties properties;

    public double score(TripPackage tripPackage, TravelPreferences preferences) {
        return score(tripPackage, preferences, PreferencePriority.resolve(preferences));
    }

    /**
     * Variant for callers that resolved the priority once for a whole batch.
     */
    public double score(TripPackage tripPackage, TravelPreferences preferences, PreferencePriority priority) {
        ScoringWeights weights = priority.weights();
        double total = costScore(tripPackage.getTotalCost()) * weights.getCost()
                + flightTimeScore(tripPackage.getFlight().getDepartureHour(), preferences.isPreferEveningFlights()) * weights.getFlight()
                + hotelScore(tripPackage.getHotel().getDistanceFromPoiKm(),
                        preferences.isFamilyFriendlyHotel() && tripPackage.getHotel().isFamilyFriendly()) * weights.getHotel()
                + durationScore(tripPackage.getDuration()) * weights.getDuration();
        return BigDecimal.valueOf(total).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }

    double costScore(double totalCost) {
        return Math.max(0, 100 - (totalCost / properties.getMaxExpectedCost()) * 100);
    }

    /**
     * Evening mode splits the rest of the day into morning (50) and everything else (30);
     * day mode scores every non-day hour 50.
     */
    static double flightTimeScore(int departureHour, boolean preferEvening) {
        if (preferEvening) {
            if (departureHour >= 18 && departureHour <= 22) {
                return 100;
            }
            if (departureHour >= 6 && departureHour <= 12) {
                return 50;
            }
            return 30;
        }
        return departureHour >= 8 && departureHour <= 16 ? 100 : 50;
    }

    static double hotelScore(double distanceKm, boolean familyBonus) {
        double score;
        if (distanceKm <= 1.0) {
            score = 100;
        } else if (distanceKm <= 2.0) {
            score = 80;
        } else if (distanceKm <= 3.0) {
            score = 60;
        } else {
            score = 40;
        }
        return familyBonus ? score + FAMILY_FRIENDLY_BONUS : score;
    }

    static double durationScore(int days) {
        if (days >= 5) {
            return 100;
        }
        if (days >= 4) {
            return 80;
        }
        if (days >= 3) {
            return 60;
        }
        return 40;
    }
}
