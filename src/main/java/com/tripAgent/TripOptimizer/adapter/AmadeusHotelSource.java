package com.tripAgent.TripOptimizer.adapter;

import com.tripAgent.TripOptimizer.exception.SourceUnavailableException;
import com.tripAgent.TripOptimizer.model.AmadeusHotelListResponse;
import com.tripAgent.TripOptimizer.model.AmadeusHotelOffersResponse;
import com.tripAgent.TripOptimizer.model.HotelCandidate;
import com.tripAgent.TripOptimizer.model.TravelWindow;
import com.tripAgent.TripOptimizer.model.TripIntent;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Two calls per window: hotels near the city center (for distance and amenities), then
 * priced offers for the nearest of them.
 */
@Slf4j
@Component
@Order(100)
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "provider.amadeus", name = "enabled", havingValue = "true")
public class AmadeusHotelSource implements HotelSource {

    static final int MAX_HOTELS = 10;
    static final Set<String> FAMILY_AMENITIES = Set.of("KIDS_WELCOME", "BABY-SITTING");

    private final AmadeusClient client;

    @Override
    public String getSourceName() {
        return "amadeus-hotels";
    }

    @Override
    @Retry(name = "amadeusSource", fallbackMethod = "fallbackFetch")
    public List<HotelCandidate> fetch(TravelWindow window, TripIntent intent) {
        String cityCode = AmadeusClient.locationCode(intent.getDestination());
        log.info("🔹 Searching hotels via Amadeus API in {} for {} nights", cityCode, window.getDuration());

        AmadeusHotelListResponse nearby = client.get(uri -> uri
                        .path("/v1/reference-data/locations/hotels/by-city")
                        .queryParam("cityCode", cityCode)
                        .queryParam("radius", client.hotelSearchRadiusKm())
                        .queryParam("radiusUnit", "KM")
                        .build(),
                AmadeusHotelListResponse.class);

        Map<String, AmadeusHotelListResponse.Hotel> hotels = nearestHotels(nearby);
        if (hotels.isEmpty()) {
            return List.of();
        }

        AmadeusHotelOffersResponse offers = client.get(uri -> uri
                        .path("/v3/shopping/hotel-offers")
                        .queryParam("hotelIds", String.join(",", hotels.keySet()))
                        .queryParam("adults", intent.getTravelers())
                        .queryParam("checkInDate", window.getStartDate())
                        .queryParam("checkOutDate", window.getEndDate())
                        .queryParam("currency", client.currency())
                        .build(),
                AmadeusHotelOffersResponse.class);

        return mapOffers(offers, hotels, window.getDuration(), getSourceName());
    }

    static Map<String, AmadeusHotelListResponse.Hotel> nearestHotels(AmadeusHotelListResponse response) {
        Map<String, AmadeusHotelListResponse.Hotel> byId = new LinkedHashMap<>();
        if (response == null || response.getData() == null) {
            return byId;
        }
        response.getData().stream()
                .filter(h -> h.getHotelId() != null)
                .sorted((a, b) -> Double.compare(distanceKm(a), distanceKm(b)))
                .limit(MAX_HOTELS)
                .forEach(h -> byId.put(h.getHotelId(), h));
        return byId;
    }

    static List<HotelCandidate> mapOffers(AmadeusHotelOffersResponse response,
                                          Map<String, AmadeusHotelListResponse.Hotel> hotels,
                                          int nights, String sourceName) {
        List<HotelCandidate> list = new ArrayList<>();
        if (response == null || response.getData() == null || nights <= 0) {
            return list;
        }

        for (var entry : response.getData()) {
            try {
                var offer = entry.getOffers().get(0);
                var reference = hotels.get(entry.getHotel().getHotelId());
                list.add(HotelCandidate.builder()
                        .name(entry.getHotel().getName())
                        .costPerNight(Double.parseDouble(offer.getPrice().getTotal()) / nights)
                        .distanceFromPoiKm(reference != null ? distanceKm(reference) : Double.MAX_VALUE)
                        .familyFriendly(reference != null && reference.getAmenities() != null
                                && reference.getAmenities().stream().anyMatch(FAMILY_AMENITIES::contains))
                        .rating(entry.getHotel().getRating() != null ? Double.valueOf(entry.getHotel().getRating()) : null)
                        .source(sourceName)
                        .bookingReference(offer.getId())
                        .build());
            } catch (RuntimeException e) {
                log.warn("⚠️ Skipping unparseable Amadeus hotel offer: {}", e.getMessage());
            }
        }

        log.info("✅ Parsed {} hotel offers from Amadeus", list.size());
        return list;
    }

    private static double distanceKm(AmadeusHotelListResponse.Hotel hotel) {
        if (hotel.getDistance() == null || hotel.getDistance().getValue() == null) {
            return Double.MAX_VALUE;
        }
        double value = hotel.getDistance().getValue();
        return "MI".equalsIgnoreCase(hotel.getDistance().getUnit()) ? value * 1.609344 : value;
    }

    private List<HotelCandidate> fallbackFetch(TravelWindow window, TripIntent intent, Exception ex) {
        log.error("⚠️ Amadeus hotel search exhausted retries: {}", ex.getMessage());
        throw new SourceUnavailableException(getSourceName(), "retries exhausted", ex);
    }
}
