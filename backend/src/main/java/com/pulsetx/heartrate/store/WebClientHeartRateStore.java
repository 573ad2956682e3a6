package com.pulsetx.heartrate.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pulsetx.heartrate.HeartRateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Optional;

/**
 * Remote heart-rate aggregate service: GET {base}/average?start=..&end=.. answering {"average": n|null, "count": n}.
 */
@Slf4j
public class WebClientHeartRateStore implements HeartRateStore {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public WebClientHeartRateStore(WebClient.Builder builder, String baseUrl, String apiToken, ObjectMapper objectMapper) {
        WebClient.Builder b = builder.clone().baseUrl(baseUrl);
        if (apiToken != null && !apiToken.isBlank()) {
            b.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiToken);
        }
        this.webClient = b.build();
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Double> averageBetween(Instant start, Instant end) {
        return webClient.get()
                .uri(uri -> uri.path("/average")
                        .queryParam("start", start.toString())
                        .queryParam("end", end.toString())
                        .build())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(String.class)
                .flatMap(json -> Mono.justOrEmpty(parseAverage(json, objectMapper)));
    }

    static Optional<Double> parseAverage(String json, ObjectMapper mapper) {
        try {
            JsonNode root = mapper.readTree(json);
            JsonNode count = root.path("count");
            if (count.isNumber() && count.asLong() == 0) {
                return Optional.empty();
            }
            JsonNode average = root.path("average");
            if (!average.isNumber()) {
                return Optional.empty();
            }
            return Optional.of(average.asDouble());
        } catch (Exception e) {
            log.debug("Unreadable heart-rate average response: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
