package com.specforge.core.runstate;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Invocation options recorded in {@code run.json}.
 *
 * @param fromStep first step to execute, earlier steps are skipped
 * @param stopAfter step after which the run stops
 * @param dryRun whether steps were only planned
 * @param skip skip flags in effect
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record RunConfig(
    @JsonProperty("from_step") String fromStep,
    @JsonProperty("stop_after") String stopAfter,
    @JsonProperty("dry_run") boolean dryRun,
    @JsonProperty("skip") List<String> skip
) {
    /**
     * Compact constructor with validation.
     */
    public RunConfig {
        skip = skip == null ? List.of() : List.copyOf(skip);
    }

    public static RunConfig empty() {
        return new RunConfig(null, null, false, List.of());
    }
}
