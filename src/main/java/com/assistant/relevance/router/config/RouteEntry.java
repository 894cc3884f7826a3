package com.assistant.relevance.router.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * One route as persisted in JSON.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RouteEntry(
        String name,
        Double threshold,
        List<String> utterances,
        List<String> negativeUtterances,
        Double alpha
) {}
