package com.assistant.relevance.router;

import java.util.Optional;

/**
 * A historical utterance with the route that finally handled it.
 *
 * @param text          the utterance
 * @param expectedRoute identifier of the expected route; may name a handler the router does not know
 */
public record LabeledSample(String text, String expectedRoute) {

    public static LabeledSample of(String text, RouteName expected) {
        return new LabeledSample(text, expected.getId());
    }

    public Optional<RouteName> expected() {
        return RouteName.fromId(expectedRoute);
    }

    public boolean isUsable() {
        return text != null && !text.isBlank() && expected().isPresent();
    }
}
