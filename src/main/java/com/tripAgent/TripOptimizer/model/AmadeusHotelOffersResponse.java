package com.tripAgent.TripOptimizer.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

/**
 * Subset of {@code /v3/shopping/hotel-offers}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AmadeusHotelOffersResponse {
    private List<HotelOffers> data;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class HotelOffers {
        private Hotel hotel;
        private boolean available;
        private List<Offer> offers;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Hotel {
        private String hotelId;
        private String name;
        private String rating;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Offer {
        private String id;
        private Price price;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Price {
        private String currency;
        private String total;
    }
}
