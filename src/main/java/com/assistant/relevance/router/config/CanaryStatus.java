package com.assistant.relevance.router.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Canary rollout of a snapshot to a share of chats.
 *
 * @param enabled      whether the canary is active
 * @param splitPercent share of chats (0..100) served by the canary snapshot
 * @param versionId    canary snapshot id, or null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CanaryStatus(boolean enabled, int splitPercent, String versionId) {

    public CanaryStatus {
        splitPercent = Math.max(0, Math.min(100, splitPercent));
    }

    public static CanaryStatus disabled() {
        return new CanaryStatus(false, 0, null);
    }
}
