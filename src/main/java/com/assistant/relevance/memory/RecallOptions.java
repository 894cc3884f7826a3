package com.assistant.relevance.memory;

/**
 * Per-call options for a memory search.
 */
public class RecallOptions {

    public static final int MAX_LIMIT = 50;

    private final Integer limit;
    private final Long chatId;
    private final Integer maxInjectedChars;

    private RecallOptions(Builder builder) {
        this.limit = builder.limit;
        this.chatId = builder.chatId;
        this.maxInjectedChars = builder.maxInjectedChars;
    }

    /**
     * Requested hit count clamped to 1..50, or null for the engine default.
     */
    public Integer getLimit() {
        return limit;
    }

    /**
     * Chat scope, or null for global memory only.
     */
    public Long getChatId() {
        return chatId;
    }

    /**
     * Snippet character budget, or null for no budget.
     */
    public Integer getMaxInjectedChars() {
        return maxInjectedChars;
    }

    public static RecallOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Integer limit;
        private Long chatId;
        private Integer maxInjectedChars;

        public Builder limit(int limit) {
            this.limit = Math.max(1, Math.min(MAX_LIMIT, limit));
            return this;
        }

        /**
         * Scopes the search to a chat. Non-positive ids mean no chat scope.
         */
        public Builder chatId(Long chatId) {
            this.chatId = chatId != null && chatId > 0 ? chatId : null;
            return this;
        }

        public Builder maxInjectedChars(Integer maxInjectedChars) {
            this.maxInjectedChars = maxInjectedChars;
            return this;
        }

        public RecallOptions build() {
            return new RecallOptions(this);
        }
    }

    @Override
    public String toString() {
        return "RecallOptions{" +
                "limit=" + limit +
                ", chatId=" + chatId +
                ", maxInjectedChars=" + maxInjectedChars +
                '}';
    }
}
