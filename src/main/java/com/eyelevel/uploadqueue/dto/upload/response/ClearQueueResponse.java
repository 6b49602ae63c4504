package com.eyelevel.uploadqueue.dto.upload.response;

import java.util.List;

/**
 * @param removedCount Number of uploads removed.
 * @param removedIds   Ids of the removed uploads, in queue order.
 */
public record ClearQueueResponse(int removedCount, List<String> removedIds) {

    public static ClearQueueResponse of(final List<String> removedIds) {
        return new ClearQueueResponse(removedIds.size(), removedIds);
    }
}
