package com.eyelevel.uploadqueue.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Descriptive sub-state of an upload while the ingestion service is working on it.
 */
@Getter
@AllArgsConstructor
public enum ProcessingStage {
    QUEUED("queued"),
    DOWNLOADING("downloading"),
    EXTRACTING("extracting"),
    ANALYZING("analyzing");

    private static final Map<String, ProcessingStage> VALUE_MAP = Stream.of(values()).collect(
            Collectors.toMap(ProcessingStage::getValue, Function.identity()));

    @JsonValue
    private final String value;

    /**
     * Resolves a stage reported by the ingestion service. Unknown or missing values resolve to empty
     * so the caller can fall back to its own mapping.
     */
    public static Optional<ProcessingStage> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(VALUE_MAP.get(value.trim().toLowerCase(Locale.ROOT)));
    }
}
