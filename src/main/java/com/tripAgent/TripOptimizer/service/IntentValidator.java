package com.tripAgent.TripOptimizer.service;

import com.tripAgent.TripOptimizer.exception.InvalidIntentException;
import com.tripAgent.TripOptimizer.model.TravelPreferences;
import com.tripAgent.TripOptimizer.model.TripIntent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@Component
@RequiredArgsConstructor
public class IntentValidator {

    private final LoyaltyProgramRegistry programRegistry;

    public void validate(TripIntent intent) {
        if (intent == null) {
            throw new InvalidIntentException("Trip intent is required");
        }
        if (intent.getDestination() == null || intent.getDestination().isBlank()) {
            throw new InvalidIntentException("Destination is required");
        }
        if (intent.getStartDate() == null || intent.getEndDate() == null) {
            throw new InvalidIntentException("Both start and end dates are required");
        }
        if (intent.getStartDate().isAfter(intent.getEndDate())) {
            throw new InvalidIntentException(
                    "Start date " + intent.getStartDate() + " is after end date " + intent.getEndDate());
        }
        if (intent.getTravelers() <= 0) {
            throw new InvalidIntentException("Traveler count must be positive, got " + intent.getTravelers());
        }

        TravelPreferences preferences = intent.getPreferences();
        if (preferences == null) {
            throw new InvalidIntentException("Preferences are required");
        }
        if (preferences.getMinDuration() < 1) {
            throw new InvalidIntentException("Minimum duration must be at least 1 day");
        }
        if (preferences.getMinDuration() > preferences.getMaxDuration()) {
            throw new InvalidIntentException("Minimum duration " + preferences.getMinDuration()
                    + " exceeds maximum duration " + preferences.getMaxDuration());
        }

        Set<String> programCodes = new HashSet<>();
        for (Map.Entry<String, Long> balance : intent.getLoyaltyBalances().entrySet()) {
            if (balance.getKey() == null || balance.getKey().isBlank()) {
                throw new InvalidIntentException("Loyalty program code is required");
            }
            if (!programCodes.add(balance.getKey().trim().toUpperCase(Locale.ROOT))) {
                throw new InvalidIntentException("Duplicate loyalty program: " + balance.getKey());
            }
            if (balance.getValue() == null || balance.getValue() < 0) {
                throw new InvalidIntentException("Invalid points balance for " + balance.getKey());
            }
            if (programRegistry.find(balance.getKey()).isEmpty()) {
                throw new InvalidIntentException("Unknown loyalty program: " + balance.getKey());
            }
        }
    }
}
