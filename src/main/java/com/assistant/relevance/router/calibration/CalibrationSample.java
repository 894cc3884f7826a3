package com.assistant.relevance.router.calibration;

import com.assistant.relevance.router.RouteName;

import java.util.Objects;

/**
 * One observed routing outcome used to fit confidence bins.
 *
 * @param predictedRoute route the semantic router picked
 * @param score          its semantic score
 * @param finalRoute     identifier of the handler that finally served the request
 */
public record CalibrationSample(RouteName predictedRoute, double score, String finalRoute) {

    public CalibrationSample {
        Objects.requireNonNull(predictedRoute, "predictedRoute is required");
    }

    public boolean isCorrect() {
        return predictedRoute.getId().equals(finalRoute);
    }
}
