package com.assistant.relevance.router.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Root of the persisted router configuration file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RouterConfigDocument(
        Integer version,
        String updatedAt,
        Double hybridAlpha,
        Double minScoreGap,
        List<RouteEntry> routes
) {}
