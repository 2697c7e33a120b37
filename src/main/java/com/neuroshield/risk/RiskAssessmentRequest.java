package com.neuroshield.risk;

import com.neuroshield.risk.fusion.AddressActivity;
import com.neuroshield.risk.fusion.MlLabel;

import java.util.List;

/**
 * @param mlLabel       verdict the caller already has; when null the classifier is asked
 * @param features      classifier feature vector, used only when mlLabel is null
 * @param activity      destination footprint for false-positive dampening; null when unknown
 * @param fallbackLabel label to use if the classifier is unavailable; null for the configured default
 */
public record RiskAssessmentRequest(
        String address,
        MlLabel mlLabel,
        List<Object> features,
        AddressActivity activity,
        boolean allowListed,
        MlLabel fallbackLabel
) {
}
