package com.neuroshield.risk.ml;

import com.neuroshield.risk.fusion.MlLabel;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * External fraud classifier. Untrusted and possibly unavailable.
 */
public interface FraudClassifierClient {

    /**
     * Classifies the address from its feature vector. Errors with {@link MlUnavailableException}
     * when no verdict could be obtained within the configured timeout.
     */
    Mono<MlLabel> classify(String address, List<Object> features);
}
