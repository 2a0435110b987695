package com.tripAgent.TripOptimizer.config;

import com.tripAgent.TripOptimizer.adapter.FlightSource;
import com.tripAgent.TripOptimizer.adapter.HotelSource;
import com.tripAgent.TripOptimizer.adapter.MockFlightSource;
import com.tripAgent.TripOptimizer.adapter.MockHotelSource;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;

import java.util.List;
import java.util.Random;

/**
 * Offline sources, one per travel site. Each gets its own seeded {@link Random}.
 * Bean order is the registration order the aggregator merges results in.
 */
@Configuration
@ConditionalOnProperty(prefix = "sources.mock", name = "enabled", havingValue = "true", matchIfMissing = true)
public class MockSourceConfig {

    private static final int OFFERS_PER_CALL = 3;

    private final MockSourceProperties properties;

    public MockSourceConfig(MockSourceProperties properties) {
        this.properties = properties;
    }

    @Bean
    @Order(10)
    public FlightSource skyscannerFlights() {
        return new MockFlightSource("skyscanner",
                List.of("British Airways", "Virgin Atlantic", "EasyJet"), random(1), OFFERS_PER_CALL);
    }

    @Bean
    @Order(20)
    public FlightSource kayakFlights() {
        return new MockFlightSource("kayak",
                List.of("Lufthansa", "Air France", "KLM"), random(2), OFFERS_PER_CALL);
    }

    @Bean
    @Order(30)
    public FlightSource expediaFlights() {
        return new MockFlightSource("expedia",
                List.of("Emirates", "Qatar Airways", "Turkish Airlines"), random(3), OFFERS_PER_CALL);
    }

    @Bean
    @Order(10)
    public HotelSource bookingHotels() {
        return new MockHotelSource("booking",
                List.of("Hilton", "Marriott", "IHG"), random(4), OFFERS_PER_CALL);
    }

    @Bean
    @Order(20)
    public HotelSource hotelsDotComHotels() {
        return new MockHotelSource("hotels",
                List.of("Hyatt", "Accor", "Wyndham"), random(5), OFFERS_PER_CALL);
    }

    @Bean
    @Order(30)
    public HotelSource airbnbHotels() {
        return new MockHotelSource("airbnb",
                List.of("Private Apartment", "Villa", "Loft"), random(6), OFFERS_PER_CALL);
    }

    private Random random(int stream) {
        return new Random(properties.getSeed() * 31 + stream);
    }
}
