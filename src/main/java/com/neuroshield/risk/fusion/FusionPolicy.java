package com.neuroshield.risk.fusion;

import com.neuroshield.domain.TrustSnapshot;

/**
 * Combines the (possibly dampened) ML risk with community trust state. Implementations are stateless.
 */
public interface FusionPolicy {

    FusionOutcome fuse(double mlRisk, TrustSnapshot trust, boolean hasActiveProposal);
}
