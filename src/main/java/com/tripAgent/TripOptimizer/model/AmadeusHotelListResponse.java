package com.tripAgent.TripOptimizer.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

/**
 * Subset of {@code /v1/reference-data/locations/hotels/by-city}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AmadeusHotelListResponse {
    private List<Hotel> data;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Hotel {
        private String hotelId;
        private String name;
        private Distance distance;
        private List<String> amenities;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Distance {
        private Double value;
        private String unit;
    }
}
