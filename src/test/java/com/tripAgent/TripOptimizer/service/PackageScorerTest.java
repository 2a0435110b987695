package com.tripAgent.TripOptimizer.service;

import com.tripAgent.TripOptimizer.model.PreferencePriority;
import com.tripAgent.TripOptimizer.model.ScoringWeights;
import com.tripAgent.TripOptimizer.model.TravelPreferences;
import com.tripAgent.TripOptimizer.model.TripPackage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static com.tripAgent.TripOptimizer.testutil.TripFixtures.SEPT_1;
import static com.tripAgent.TripOptimizer.testutil.TripFixtures.flight;
import static com.tripAgent.TripOptimizer.testutil.TripFixtures.hotel;
import static com.tripAgent.TripOptimizer.testutil.TripFixtures.properties;
import static com.tripAgent.TripOptimizer.testutil.TripFixtures.tripPackage;
import static com.tripAgent.TripOptimizer.testutil.TripFixtures.window;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PackageScorerTest {

    private final PackageScorer scorer = new PackageScorer(properties());

    // (100 + 50 * 3) * 2 = 500, cost score 75
    private final TripPackage eveningFamilyPackage = tripPackage("p", window(SEPT_1, 3),
            flight("a", 100, 19), hotel("x", 50, 0.8, true), 2);

    @Test
    void shouldScoreBalancedPackage() {
        // 75 * .40 + 50 * .30 + 100 * .25 + 60 * .05
        assertThat(scorer.score(eveningFamilyPackage, TravelPreferences.defaults())).isEqualTo(73.0);
    }

    @Test
    void shouldRewardEveningDepartureWhenPreferred() {
        TravelPreferences preferences = TravelPreferences.builder().preferEveningFlights(true).build();

        assertThat(scorer.score(eveningFamilyPackage, preferences)).isEqualTo(88.0);
    }

    @Test
    void shouldAddFamilyBonusOnTopOfDistanceScore() {
        TravelPreferences preferences = TravelPreferences.builder()
                .preferEveningFlights(true)
                .familyFriendlyHotel(true)
                .build();

        // hotel sub-score reaches 120
        assertThat(scorer.score(eveningFamilyPackage, preferences)).isEqualTo(93.0);
    }

    @Test
    void shouldIgnoreFamilyPreferenceForHotelThatIsNotFamilyFriendly() {
        TripPackage plain = tripPackage("p", window(SEPT_1, 3), flight("a", 100, 19), hotel("x", 50, 0.8, false), 2);
        TravelPreferences preferences = TravelPreferences.builder().familyFriendlyHotel(true).build();

        assertThat(scorer.score(plain, preferences)).isEqualTo(73.0);
    }

    @Test
    void shouldApplyCostWeightsWhenCostIsPrioritized() {
        TripPackage cheapLateFlight = tripPackage("p", window(SEPT_1, 3),
                flight("a", 100, 23), hotel("x", 50, 4.0, false), 2);
        TravelPreferences preferences = TravelPreferences.builder().prioritizeCost(true).build();

        // 75 * .60 + 50 * .20 + 40 * .15 + 60 * .05
        assertThat(scorer.score(cheapLateFlight, preferences)).isEqualTo(64.0);
    }

    @Test
    void shouldHonorOnlyFirstPriorityFlag() {
        TravelPreferences preferences = TravelPreferences.builder()
                .prioritizeHotelQuality(true)
                .prioritizeFlightTime(true)
                .build();

        assertThat(PreferencePriority.resolve(preferences)).isEqualTo(PreferencePriority.FLIGHT_TIME);
        assertThat(PreferencePriority.resolve(TravelPreferences.defaults())).isEqualTo(PreferencePriority.BALANCED);
    }

    @Test
    void shouldUseWeightTablesThatSumToOne() {
        for (PreferencePriority priority : PreferencePriority.values()) {
            ScoringWeights weights = priority.weights();
            double sum = weights.getCost() + weights.getFlight() + weights.getHotel() + weights.getDuration();
            assertThat(sum).as(priority.name()).isCloseTo(1.0, within(1e-9));
        }
        assertThat(PreferencePriority.HOTEL_QUALITY.weights().getHotel()).isEqualTo(0.50);
        assertThat(PreferencePriority.FLIGHT_TIME.weights().getFlight()).isEqualTo(0.50);
    }

    @ParameterizedTest
    @CsvSource({
            "19, true, 100",
            "22, true, 100",
            "7, true, 50",
            "14, true, 30",
            "23, true, 30",
            "14, false, 100",
            "8, false, 100",
            "19, false, 50",
            "3, false, 50"
    })
    void shouldScoreDepartureHourDifferentlyInEveningAndDayMode(int hour, boolean preferEvening, double expected) {
        assertThat(PackageScorer.flightTimeScore(hour, preferEvening)).isEqualTo(expected);
    }

    @Test
    void shouldScoreMiddayLowerInEveningModeThanMorning() {
        assertThat(PackageScorer.flightTimeScore(14, true)).isLessThan(PackageScorer.flightTimeScore(9, true));
        assertThat(PackageScorer.flightTimeScore(14, false)).isGreaterThan(PackageScorer.flightTimeScore(19, false));
    }

    @ParameterizedTest
    @CsvSource({"0.5, 100", "1.0, 100", "1.5, 80", "2.0, 80", "2.9, 60", "3.1, 40", "12.0, 40"})
    void shouldBandHotelDistance(double distanceKm, double expected) {
        assertThat(PackageScorer.hotelScore(distanceKm, false)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({"1, 40", "2, 40", "3, 60", "4, 80", "5, 100", "9, 100"})
    void shouldBandDuration(int days, double expected) {
        assertThat(PackageScorer.durationScore(days)).isEqualTo(expected);
    }

    @Test
    void shouldSaturateCostScoreAtZero() {
        assertThat(scorer.costScore(0)).isEqualTo(100.0);
        assertThat(scorer.costScore(1_000)).isEqualTo(50.0);
        assertThat(scorer.costScore(2_000)).isZero();
        assertThat(scorer.costScore(9_000)).isZero();
    }

    @Test
    void shouldReturnSameScoreOnRepeatedCalls() {
        TravelPreferences preferences = TravelPreferences.builder().familyFriendlyHotel(true).build();

        double first = scorer.score(eveningFamilyPackage, preferences);
        double second = scorer.score(eveningFamilyPackage, preferences);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void shouldRoundToOneDecimal() {
        // (123 + 77 * 4) * 1 = 431, cost score 78.45
        TripPackage oddPackage = tripPackage("p", window(SEPT_1, 4), flight("a", 123, 9), hotel("x", 77, 1.7, false), 1);

        double score = scorer.score(oddPackage, TravelPreferences.defaults());

        // 78.45 * .40 + 100 * .30 + 80 * .25 + 80 * .05 = 85.38
        assertThat(score).isEqualTo(85.4);
    }
}
