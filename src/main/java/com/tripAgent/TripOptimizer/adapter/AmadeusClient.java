package com.tripAgent.TripOptimizer.adapter;

import com.tripAgent.TripOptimizer.config.AmadeusConfig;
import com.tripAgent.TripOptimizer.exception.ExternalApiException;
import com.tripAgent.TripOptimizer.service.TokenCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Instant;
import java.util.Locale;
import java.util.function.Function;

/**
 * Authenticated GETs against the Amadeus self-service API, shared by the flight and hotel sources.
 * Calls block: they run on the aggregator's source tasks, which own the timeout.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "provider.amadeus", name = "enabled", havingValue = "true")
public class AmadeusClient {

    static final String PROVIDER = "amadeus";

    private final WebClient amadeusWebClient;
    private final AmadeusConfig config;
    private final TokenCache tokenCache;

    public <T> T get(Function<UriBuilder, URI> uri, Class<T> responseType) {
        try {
            String token = tokenCache.getOrRefresh(PROVIDER, this::requestToken);
            return amadeusWebClient.get()
                    .uri(uri)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, r -> {
                        log.error("❌ Amadeus API error: {}", r.statusCode());
                        if (r.statusCode().value() == 401) {
                            tokenCache.clear(PROVIDER);
                        }
                        return r.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .flatMap(body -> Mono.error(new ExternalApiException(
                                        "Amadeus error " + r.statusCode().value() + ": " + body)));
                    })
                    .bodyToMono(responseType)
                    .block();
        } catch (ExternalApiException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ExternalApiException("Amadeus request failed: " + e.getMessage(), e);
        }
    }

    public String defaultOrigin() {
        return config.getDefaultOrigin();
    }

    public String currency() {
        return config.getCurrency();
    }

    public int hotelSearchRadiusKm() {
        return config.getHotelSearchRadiusKm();
    }

    /**
     * IATA code for a destination: three-letter codes pass through, city names use their
     * first three letters.
     */
    public static String locationCode(String destination) {
        String trimmed = destination.trim();
        String letters = trimmed.length() > 3 ? trimmed.substring(0, 3) : trimmed;
        return letters.toUpperCase(Locale.ROOT);
    }

    private TokenCache.IssuedToken requestToken() {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "client_credentials");
        form.add("client_id", config.getClientId());
        form.add("client_secret", config.getClientSecret());

        TokenResponse tokenResponse = amadeusWebClient.post()
                .uri(config.getTokenUrl())
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_FORM_URLENCODED_VALUE)
                .body(BodyInserters.fromFormData(form))
                .retrieve()
                .bodyToMono(TokenResponse.class)
                .block();

        if (tokenResponse == null || tokenResponse.access_token() == null) {
            throw new ExternalApiException("Amadeus token endpoint returned no token");
        }
        return new TokenCache.IssuedToken(tokenResponse.access_token(),
                Instant.now().plusSeconds(tokenResponse.expires_in()));
    }

    // Internal DTO
    private record TokenResponse(String access_token, int expires_in) {}
}
