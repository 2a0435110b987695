package com.tripAgent.TripOptimizer.adapter;

import com.tripAgent.TripOptimizer.exception.SourceUnavailableException;
import com.tripAgent.TripOptimizer.model.AmadeusFlightOffersResponse;
import com.tripAgent.TripOptimizer.model.FlightCandidate;
import com.tripAgent.TripOptimizer.model.TravelWindow;
import com.tripAgent.TripOptimizer.model.TripIntent;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Component
@Order(100)
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "provider.amadeus", name = "enabled", havingValue = "true")
public class AmadeusFlightSource implements FlightSource {

    static final int MAX_OFFERS = 10;

    private final AmadeusClient client;

    @Override
    public String getSourceName() {
        return "amadeus-flights";
    }

    @Override
    @Retry(name = "amadeusSource", fallbackMethod = "fallbackFetch")
    public List<FlightCandidate> fetch(TravelWindow window, TripIntent intent) {
        String origin = intent.getOrigin() != null ? intent.getOrigin() : client.defaultOrigin();
        String destination = AmadeusClient.locationCode(intent.getDestination());
        log.info("🔹 Searching flights via Amadeus API for {} → {} on {}", origin, destination, window.getStartDate());

        AmadeusFlightOffersResponse response = client.get(uri -> uri
                        .path("/v2/shopping/flight-offers")
                        .queryParam("originLocationCode", origin)
                        .queryParam("destinationLocationCode", destination)
                        .queryParam("departureDate", window.getStartDate())
                        .queryParam("returnDate", window.getEndDate())
                        .queryParam("adults", intent.getTravelers())
                        .queryParam("currencyCode", client.currency())
                        .queryParam("max", MAX_OFFERS)
                        .build(),
                AmadeusFlightOffersResponse.class);

        return mapOffers(response, intent.getTravelers(), getSourceName());
    }

    /**
     * Offer totals cover every traveler; candidates carry the per-traveler cost.
     */
    static List<FlightCandidate> mapOffers(AmadeusFlightOffersResponse response, int travelers, String sourceName) {
        List<FlightCandidate> list = new ArrayList<>();
        if (response == null || response.getData() == null) {
            return list;
        }

        for (var offer : response.getData()) {
            try {
                var segments = offer.getItineraries().get(0).getSegments();
                var first = segments.get(0);
                var last = segments.get(segments.size() - 1);

                list.add(FlightCandidate.builder()
                        .airline(first.getCarrierCode())
                        .flightNumber(first.getCarrierCode() + first.getNumber())
                        .departureTime(LocalDateTime.parse(first.getDeparture().getAt()))
                        .arrivalTime(LocalDateTime.parse(last.getArrival().getAt()))
                        .cost(Double.parseDouble(offer.getPrice().getTotal()) / travelers)
                        .source(sourceName)
                        .bookingReference(offer.getId())
                        .build());
            } catch (RuntimeException e) {
                log.warn("⚠️ Skipping unparseable Amadeus offer {}: {}", offer.getId(), e.getMessage());
            }
        }

        log.info("✅ Parsed {} flight offers from Amadeus", list.size());
        return list;
    }

    private List<FlightCandidate> fallbackFetch(TravelWindow window, TripIntent intent, Exception ex) {
        log.error("⚠️ Amadeus flight search exhausted retries: {}", ex.getMessage());
        throw new SourceUnavailableException(getSourceName(), "retries exhausted", ex);
    }
}
