package com.assistant.relevance.router.calibration;

import com.assistant.relevance.router.LabeledSample;
import com.assistant.relevance.router.RouteName;

import java.util.Optional;

/**
 * One logged routing interaction.
 *
 * @param text            the user utterance
 * @param finalHandler    identifier of the handler that finally served it
 * @param semanticHandler route the semantic router picked, or null when it abstained
 * @param semanticScore   score of the semantic pick, or null
 */
public record DatasetEntry(String text, String finalHandler, String semanticHandler, Double semanticScore) {

    public LabeledSample toLabeledSample() {
        return new LabeledSample(text, finalHandler);
    }

    /**
     * The semantic pick as a calibration sample, when the semantic router made one.
     */
    public Optional<CalibrationSample> toCalibrationSample() {
        if (semanticScore == null) {
            return Optional.empty();
        }
        return RouteName.fromId(semanticHandler)
                .map(route -> new CalibrationSample(route, semanticScore, finalHandler));
    }
}
