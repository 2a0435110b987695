package com.tripAgent.TripOptimizer.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

/**
 * Subset of the Amadeus {@code /v2/shopping/flight-offers} payload.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AmadeusFlightOffersResponse {
    private List<Offer> data;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Offer {
        private String id;
        private Price price;
        private List<Itinerary> itineraries;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Price {
        private String currency;
        private String total;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Itinerary {
        private String duration;
        private List<Segment> segments;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Segment {
        private Location departure;
        private Location arrival;
        private String carrierCode;
        private String number;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Location {
        private String iataCode;
        private String at;
    }
}
