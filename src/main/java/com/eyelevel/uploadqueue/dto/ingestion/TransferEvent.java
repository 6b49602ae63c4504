package com.eyelevel.uploadqueue.dto.ingestion;

/**
 * Signal emitted while a submission is being transferred: a number of progress reports, followed by
 * exactly one acceptance carrying the id assigned by the ingestion service.
 *
 * @param progress   Transfer progress in percent, meaningful for progress events.
 * @param externalId Id assigned by the ingestion service, set only on the acceptance event.
 */
public record TransferEvent(int progress, String externalId) {

    public static TransferEvent progress(int percent) {
        return new TransferEvent(percent, null);
    }

    public static TransferEvent accepted(String externalId) {
        return new TransferEvent(100, externalId);
    }

    public boolean isAccepted() {
        return externalId != null;
    }
}
