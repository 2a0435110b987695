package com.tripAgent.TripOptimizer.service;

import com.tripAgent.TripOptimizer.adapter.FlightSource;
import com.tripAgent.TripOptimizer.adapter.HotelSource;
import com.tripAgent.TripOptimizer.config.LoyaltyProperties;
import com.tripAgent.TripOptimizer.config.OptimizerProperties;
import com.tripAgent.TripOptimizer.exception.InvalidIntentException;
import com.tripAgent.TripOptimizer.exception.NoCandidatesAvailableException;
import com.tripAgent.TripOptimizer.model.FlightCandidate;
import com.tripAgent.TripOptimizer.model.TravelPreferences;
import com.tripAgent.TripOptimizer.model.TripIntent;
import com.tripAgent.TripOptimizer.model.TripPackage;
import com.tripAgent.TripOptimizer.testutil.StubSources.StubFlightSource;
import com.tripAgent.TripOptimizer.testutil.StubSources.StubHotelSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.tripAgent.TripOptimizer.testutil.StubSources.failingFlights;
import static com.tripAgent.TripOptimizer.testutil.StubSources.flights;
import static com.tripAgent.TripOptimizer.testutil.StubSources.hotels;
import static com.tripAgent.TripOptimizer.testutil.StubSources.slowFlights;
import static com.tripAgent.TripOptimizer.testutil.TripFixtures.SEPT_1;
import static com.tripAgent.TripOptimizer.testutil.TripFixtures.SEPT_10;
import static com.tripAgent.TripOptimizer.testutil.TripFixtures.flight;
import static com.tripAgent.TripOptimizer.testutil.TripFixtures.hotel;
import static com.tripAgent.TripOptimizer.testutil.TripFixtures.intent;
import static com.tripAgent.TripOptimizer.testutil.TripFixtures.properties;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TripOptimizerServiceTest {

    private ExecutorService sourceExecutor;
    private ExecutorService windowExecutor;
    private OptimizerProperties properties;

    private StubFlightSource flightSource;
    private StubHotelSource hotelSource;

    @BeforeEach
    void setUp() {
        sourceExecutor = Executors.newCachedThreadPool();
        windowExecutor = Executors.newFixedThreadPool(2);
        properties = properties();
        flightSource = flights("skyscanner", flight("skyscanner", 150, 19), flight("skyscanner", 95, 7));
        hotelSource = hotels("booking", hotel("booking", 80, 0.7, true), hotel("booking", 55, 3.5, false));
    }

    @AfterEach
    void tearDown() {
        sourceExecutor.shutdownNow();
        windowExecutor.shutdownNow();
    }

    @Test
    void shouldReturnTopPackagesInsideTheRequestedRange() {
        // Given
        TripIntent intent = intent(TravelPreferences.builder().preferEveningFlights(true).build());

        // When
        List<TripPackage> result = optimizer(List.of(flightSource), List.of(hotelSource)).optimize(intent);

        // Then
        assertThat(result).hasSize(3);
        assertThat(result).isSortedAccordingTo(Comparator.comparingDouble(TripPackage::getTotalScore).reversed());
        assertThat(result).allSatisfy(p -> {
            assertThat(p.getWindow().getStartDate()).isAfterOrEqualTo(SEPT_1);
            assertThat(p.getWindow().getEndDate()).isBeforeOrEqualTo(SEPT_10);
            assertThat(p.getDuration()).isBetween(3, 5);
            assertThat(p.getTotalCost()).isEqualTo(
                    (p.getFlight().getCost() + p.getHotel().getCostPerNight() * p.getDuration()) * 2);
            assertThat(p.getTotalScore()).isBetween(0.0, 120.0);
            assertThat(p.getLoyaltyEvaluation()).isNull();
        });
        assertThat(result).extracting(TripPackage::getId).doesNotHaveDuplicates();
    }

    @Test
    void shouldAttachBestLoyaltyEvaluation() {
        TripIntent intent = intent().toBuilder().loyaltyBalance("virgin", 1_000_000L).build();

        List<TripPackage> result = optimizer(List.of(flightSource), List.of(hotelSource)).optimize(intent);

        assertThat(result).isNotEmpty().allSatisfy(p -> {
            assertThat(p.getLoyaltyEvaluation()).isNotNull();
            assertThat(p.getLoyaltyEvaluation().getProgramCode()).isEqualTo("VIRGIN");
            assertThat(p.getPointsPrice()).isEqualTo((long) Math.ceil(p.getTotalCost() * 85));
        });
    }

    @Test
    void shouldRejectInvalidIntentBeforeCallingAnySource() {
        TripIntent intent = intent().toBuilder().travelers(0).build();

        assertThatThrownBy(() -> optimizer(List.of(flightSource), List.of(hotelSource)).optimize(intent))
                .isInstanceOf(InvalidIntentException.class);
        assertThat(flightSource.calls()).isZero();
        assertThat(hotelSource.calls()).isZero();
    }

    @Test
    void shouldFailWhenNoWindowFitsTheRange() {
        TripIntent intent = intent().toBuilder().endDate(SEPT_1.plusDays(2)).build();

        assertThatThrownBy(() -> optimizer(List.of(flightSource), List.of(hotelSource)).optimize(intent))
                .isInstanceOf(NoCandidatesAvailableException.class);
        assertThat(flightSource.calls()).isZero();
    }

    @Test
    void shouldFailWhenEveryFlightSourceTimesOut() {
        // Given a single window and three flight sources that never answer in time
        properties.setSourceTimeout(Duration.ofMillis(100));
        TripIntent intent = intent(TravelPreferences.builder().minDuration(3).maxDuration(3).build())
                .toBuilder().endDate(SEPT_1.plusDays(3)).build();
        List<FlightSource> slow = List.of(
                slowFlights("skyscanner", Duration.ofSeconds(2), flight("skyscanner", 100, 9)),
                slowFlights("kayak", Duration.ofSeconds(2), flight("kayak", 100, 9)),
                slowFlights("expedia", Duration.ofSeconds(2), flight("expedia", 100, 9)));

        // When / Then
        assertThatThrownBy(() -> optimizer(slow, List.of(hotelSource)).optimize(intent))
                .isInstanceOf(NoCandidatesAvailableException.class);
    }

    @Test
    void shouldStillProducePackagesWhenOneSourceIsDown() {
        List<FlightSource> sources = List.of(failingFlights("kayak"), flightSource);

        List<TripPackage> result = optimizer(sources, List.of(hotelSource)).optimize(intent());

        assertThat(result).hasSize(3);
        assertThat(result).extracting(p -> p.getFlight().getSource()).containsOnly("skyscanner");
    }

    @Test
    void shouldSkipWindowThatExceedsWindowTimeout() {
        // Given two windows, the first of which stalls its flight source
        properties.setSourceTimeout(Duration.ofSeconds(5));
        properties.setWindowTimeout(Duration.ofMillis(200));
        FlightCandidate evening = flight("skyscanner", 150, 19);
        StubFlightSource stalling = new StubFlightSource("skyscanner", (window, ignored) -> {
            if (window.getStartDate().equals(SEPT_1)) {
                sleepQuietly(Duration.ofSeconds(2));
            }
            return List.of(evening);
        });
        TripIntent intent = intent(TravelPreferences.builder().minDuration(3).maxDuration(3).build())
                .toBuilder().endDate(SEPT_1.plusDays(4)).build();

        // When
        List<TripPackage> result = optimizer(List.of(stalling), List.of(hotelSource)).optimize(intent);

        // Then
        assertThat(result).isNotEmpty()
                .allSatisfy(p -> assertThat(p.getWindow().getStartDate()).isEqualTo(SEPT_1.plusDays(1)));
    }

    @Test
    void shouldNotCountPoolQueueingAgainstWindowTimeout() {
        // Given three windows on a single worker, each fan-out taking 250ms of a 400ms budget
        windowExecutor.shutdownNow();
        windowExecutor = Executors.newFixedThreadPool(1);
        properties.setSourceTimeout(Duration.ofSeconds(5));
        properties.setWindowTimeout(Duration.ofMillis(400));
        properties.setTopK(10);
        StubFlightSource steady = slowFlights("skyscanner", Duration.ofMillis(250), flight("skyscanner", 150, 19));
        TripIntent intent = intent(TravelPreferences.builder().minDuration(3).maxDuration(3).build())
                .toBuilder().endDate(SEPT_1.plusDays(5)).build();

        // When
        List<TripPackage> result = optimizer(List.of(steady), List.of(hotelSource)).optimize(intent);

        // Then every window contributes its two packages
        assertThat(result).hasSize(6);
        assertThat(result).extracting(p -> p.getWindow().getStartDate())
                .containsOnly(SEPT_1, SEPT_1.plusDays(1), SEPT_1.plusDays(2));
        assertThat(steady.calls()).isEqualTo(3);
    }

    private TripOptimizerService optimizer(List<FlightSource> flightSources, List<HotelSource> hotelSources) {
        LoyaltyProperties loyaltyProperties = new LoyaltyProperties();
        LoyaltyProperties.Program virgin = new LoyaltyProperties.Program();
        virgin.setPointValue(0.012);
        virgin.setConversionRate(85);
        loyaltyProperties.getPrograms().put("VIRGIN", virgin);
        LoyaltyProgramRegistry registry = new LoyaltyProgramRegistry(loyaltyProperties);

        return new TripOptimizerService(
                new IntentValidator(registry),
                new WindowEnumerator(properties),
                new CandidateAggregator(flightSources, hotelSources, sourceExecutor, properties),
                new PackageAssembler(),
                new LoyaltyService(registry, new LoyaltyEvaluator(properties)),
                new PackageScorer(properties),
                new PackageRanker(properties),
                windowExecutor,
                properties);
    }

    private static void sleepQuietly(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
