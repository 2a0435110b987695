package com.tripAgent.TripOptimizer.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "provider.amadeus")
public class AmadeusConfig {
    private boolean enabled;
    private String baseUrl = "https://test.api.amadeus.com";
    private String tokenUrl = "https://test.api.amadeus.com/v1/security/oauth2/token";
    private String clientId;
    private String clientSecret;
    private String defaultOrigin = "LHR";
    private String currency = "GBP";
    private int hotelSearchRadiusKm = 5;

    @Bean
    public WebClient amadeusWebClient(WebClient.Builder builder) {
        return builder.baseUrl(baseUrl).build();
    }
}
