package com.tripAgent.TripOptimizer.adapter;

import com.tripAgent.TripOptimizer.model.HotelCandidate;
import com.tripAgent.TripOptimizer.model.TravelWindow;
import com.tripAgent.TripOptimizer.model.TripIntent;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;

@Slf4j
public class MockHotelSource implements HotelSource {

    private final String sourceName;
    private final List<String> chains;
    private final Random random;
    private final int offersPerCall;

    public MockHotelSource(String sourceName, List<String> chains, Random random, int offersPerCall) {
        if (chains.isEmpty()) {
            throw new IllegalArgumentException("Mock hotel source " + sourceName + " needs at least one chain");
        }
        this.sourceName = sourceName;
        this.chains = List.copyOf(chains);
        this.random = random;
        this.offersPerCall = offersPerCall;
    }

    @Override
    public String getSourceName() {
        return sourceName;
    }

    @Override
    public List<HotelCandidate> fetch(TravelWindow window, TripIntent intent) {
        boolean familyFriendly = intent.getPreferences().isFamilyFriendlyHotel();
        boolean premium = MockFlightSource.PREMIUM_DESTINATIONS
                .contains(intent.getDestination().toLowerCase(Locale.ROOT));
        List<HotelCandidate> hotels = new ArrayList<>(offersPerCall);

        for (int i = 0; i < offersPerCall; i++) {
            int costPerNight = 60 + random.nextInt(91);
            if (familyFriendly) {
                costPerNight += 20 + random.nextInt(21);
            }
            if (premium) {
                costPerNight += 30 + random.nextInt(31);
            }
            // 0.5 to 5.0 km, one decimal
            double distance = Math.round((0.5 + random.nextDouble() * 4.5) * 10) / 10.0;

            hotels.add(HotelCandidate.builder()
                    .name(chains.get(random.nextInt(chains.size())) + " " + intent.getDestination())
                    .costPerNight(costPerNight)
                    .distanceFromPoiKm(distance)
                    .familyFriendly(familyFriendly)
                    .rating(Math.round((3.5 + random.nextDouble() * 1.5) * 10) / 10.0)
                    .source(sourceName)
                    .build());
        }

        log.debug("[{}] generated {} hotels for {} nights", sourceName, hotels.size(), window.getDuration());
        return hotels;
    }
}
