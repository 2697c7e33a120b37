package com.neuroshield.risk.ml;

import com.fasterxml.jackson.databind.JsonNode;
import com.neuroshield.risk.fusion.MlLabel;
import io.github.resilience4j.ratelimiter.RateLimiter;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Classifier over HTTP: POST {acc_holder, to_address, features} and read {"prediction": "..."}.
 * Single attempt with a bounded timeout. A local rate limiter guards the classifier; a call it refuses
 * counts as unavailable rather than waiting for a permit.
 */
public class WebClientFraudClassifierClient implements FraudClassifierClient {

    private final WebClient webClient;
    private final String url;
    private final Duration timeout;
    private final RateLimiter rateLimiter;

    public WebClientFraudClassifierClient(WebClient.Builder builder, String url, Duration timeout, RateLimiter rateLimiter) {
        this.webClient = builder.build();
        this.url = url;
        this.timeout = timeout;
        this.rateLimiter = rateLimiter;
    }

    @Override
    public Mono<MlLabel> classify(String address, List<Object> features) {
        return Mono.defer(() -> {
            if (!rateLimiter.acquirePermission()) {
                return Mono.error(new MlUnavailableException("Local classifier limiter refused call for " + address));
            }
            return call(address, features);
        });
    }

    private Mono<MlLabel> call(String address, List<Object> features) {
        Map<String, Object> body = new HashMap<>();
        body.put("acc_holder", address);
        body.put("to_address", address);
        body.put("features", features != null ? features : List.of());
        return webClient.post()
                .uri(url)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(timeout)
                .switchIfEmpty(Mono.error(() -> new MlUnavailableException("Empty classifier response")))
                .map(WebClientFraudClassifierClient::toLabel)
                .onErrorMap(e -> !(e instanceof MlUnavailableException), WebClientFraudClassifierClient::unavailable);
    }

    static MlLabel toLabel(JsonNode response) {
        JsonNode prediction = response.get("prediction");
        if (prediction == null || !prediction.isTextual()) {
            throw new MlUnavailableException("Classifier response has no prediction: " + response);
        }
        return MlLabel.fromPrediction(prediction.asText());
    }

    private static MlUnavailableException unavailable(Throwable e) {
        if (e instanceof TimeoutException) {
            return new MlUnavailableException("Classifier timed out", e);
        }
        return new MlUnavailableException("Classifier call failed: " + e.getMessage(), e);
    }
}
