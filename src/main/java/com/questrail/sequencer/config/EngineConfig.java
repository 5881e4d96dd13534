package com.questrail.sequencer.config;

import com.questrail.sequencer.cache.CacheLimits;
import com.questrail.sequencer.condition.NestedConditionPolicy;
import com.questrail.sequencer.exec.ExecutionTimingPolicy;
import com.questrail.sequencer.exec.FailurePolicy;
import com.questrail.sequencer.parse.LanguageLimits;
import com.questrail.sequencer.transport.ResponseKeywords;

import java.util.Objects;

/**
 * Aggregated configuration for a sequence engine.
 */
public record EngineConfig(
    LanguageLimits languageLimits,
    ExecutionTimingPolicy timingPolicy,
    CacheLimits cacheLimits,
    ResponseKeywords responseKeywords,
    FailurePolicy failurePolicy,
    NestedConditionPolicy nestedConditionPolicy
) {
    public EngineConfig {
        Objects.requireNonNull(languageLimits, "languageLimits");
        Objects.requireNonNull(timingPolicy, "timingPolicy");
        Objects.requireNonNull(cacheLimits, "cacheLimits");
        Objects.requireNonNull(responseKeywords, "responseKeywords");
        Objects.requireNonNull(failurePolicy, "failurePolicy");
        Objects.requireNonNull(nestedConditionPolicy, "nestedConditionPolicy");
    }

    public static EngineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private LanguageLimits languageLimits = LanguageLimits.defaults();
        private ExecutionTimingPolicy timingPolicy = ExecutionTimingPolicy.defaults();
        private CacheLimits cacheLimits = CacheLimits.defaults();
        private ResponseKeywords responseKeywords = ResponseKeywords.defaults();
        private FailurePolicy failurePolicy = FailurePolicy.FAIL_FAST;
        private NestedConditionPolicy nestedConditionPolicy = NestedConditionPolicy.SKIP;

        public Builder withLanguageLimits(LanguageLimits limits) {
            this.languageLimits = limits;
            return this;
        }

        public Builder withTimingPolicy(ExecutionTimingPolicy timingPolicy) {
            this.timingPolicy = timingPolicy;
            return this;
        }

        public Builder withCacheLimits(CacheLimits limits) {
            this.cacheLimits = limits;
            return this;
        }

        public Builder withResponseKeywords(ResponseKeywords keywords) {
            this.responseKeywords = keywords;
            return this;
        }

        public Builder withFailurePolicy(FailurePolicy policy) {
            this.failurePolicy = policy;
            return this;
        }

        public Builder withNestedConditionPolicy(NestedConditionPolicy policy) {
            this.nestedConditionPolicy = policy;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(languageLimits, timingPolicy, cacheLimits, responseKeywords,
                    failurePolicy, nestedConditionPolicy);
        }
    }
}
