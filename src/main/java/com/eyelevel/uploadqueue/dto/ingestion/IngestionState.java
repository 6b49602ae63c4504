package com.eyelevel.uploadqueue.dto.ingestion;

import com.eyelevel.uploadqueue.model.ProcessingStage;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Ingestion states reported by the ingestion service, with a safe conversion from the raw string.
 */
@Getter
@AllArgsConstructor
public enum IngestionState {
    PENDING("pending", ProcessingStage.DOWNLOADING),
    PROCESSING("processing", ProcessingStage.EXTRACTING),
    COMPLETED("completed", null),
    FAILED("failed", null);

    private static final Map<String, IngestionState> VALUE_MAP = Stream.of(values()).collect(
            Collectors.toMap(IngestionState::getValue, Function.identity()));

    private final String value;
    private final ProcessingStage impliedStage;

    /**
     * Converts a raw status string. Anything unrecognized is treated as {@code PROCESSING} so the
     * upload keeps being tracked until the service reports a final state or the poll deadline passes.
     */
    public static IngestionState convertByValue(String value) {
        if (value == null) {
            return PROCESSING;
        }
        return VALUE_MAP.getOrDefault(value.trim().toLowerCase(Locale.ROOT), PROCESSING);
    }
}
