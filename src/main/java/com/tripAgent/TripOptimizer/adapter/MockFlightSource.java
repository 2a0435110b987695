package com.tripAgent.TripOptimizer.adapter;

import com.tripAgent.TripOptimizer.model.FlightCandidate;
import com.tripAgent.TripOptimizer.model.TravelWindow;
import com.tripAgent.TripOptimizer.model.TripIntent;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.Set;

/**
 * Generates plausible flights for a named travel site. The random generator is owned by the
 * instance, so two sources never share a sequence.
 */
@Slf4j
public class MockFlightSource implements FlightSource {

    static final List<Integer> EVENING_HOURS = List.of(18, 19, 20, 21);
    static final List<Integer> DAY_HOURS = List.of(8, 9, 10, 11, 14, 15, 16);
    static final Set<String> PREMIUM_DESTINATIONS = Set.of("london", "paris", "rome");

    private final String sourceName;
    private final List<String> airlines;
    private final Random random;
    private final int offersPerCall;

    public MockFlightSource(String sourceName, List<String> airlines, Random random, int offersPerCall) {
        if (airlines.isEmpty()) {
            throw new IllegalArgumentException("Mock flight source " + sourceName + " needs at least one airline");
        }
        this.sourceName = sourceName;
        this.airlines = List.copyOf(airlines);
        this.random = random;
        this.offersPerCall = offersPerCall;
    }

    @Override
    public String getSourceName() {
        return sourceName;
    }

    @Override
    public List<FlightCandidate> fetch(TravelWindow window, TripIntent intent) {
        boolean evening = intent.getPreferences().isPreferEveningFlights();
        List<FlightCandidate> flights = new ArrayList<>(offersPerCall);

        for (int i = 0; i < offersPerCall; i++) {
            List<Integer> hours = evening ? EVENING_HOURS : DAY_HOURS;
            LocalDateTime departure = window.getStartDate()
                    .atTime(LocalTime.of(pick(hours), random.nextInt(60)));
            LocalDateTime arrival = departure
                    .plusHours(1 + random.nextInt(3))
                    .withMinute(random.nextInt(60));

            int cost = 80 + random.nextInt(221);
            if (PREMIUM_DESTINATIONS.contains(intent.getDestination().toLowerCase(Locale.ROOT))) {
                cost += 50 + random.nextInt(51);
            }

            String airline = pick(airlines);
            flights.add(FlightCandidate.builder()
                    .airline(airline)
                    .flightNumber(airline.substring(0, 2).toUpperCase(Locale.ROOT) + (100 + random.nextInt(9900)))
                    .departureTime(departure)
                    .arrivalTime(arrival)
                    .cost(cost)
                    .source(sourceName)
                    .build());
        }

        log.debug("[{}] generated {} flights for {}", sourceName, flights.size(), window.getStartDate());
        return flights;
    }

    private <T> T pick(List<T> values) {
        return values.get(random.nextInt(values.size()));
    }
}
