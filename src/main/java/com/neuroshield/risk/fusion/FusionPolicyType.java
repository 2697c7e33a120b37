package com.neuroshield.risk.fusion;

/**
 * Selectable fusion policies (neuroshield.risk.fusion-policy).
 */
public enum FusionPolicyType {

    /** ML risk plus a DAO boost. */
    ADDITIVE,
    /** Ordered rule list; first matching rule sets the risk. */
    LAYERED_RULES;

    public FusionPolicy create() {
        return switch (this) {
            case ADDITIVE -> new AdditiveFusionPolicy();
            case LAYERED_RULES -> new LayeredRuleFusionPolicy();
        };
    }
}
