package com.eyelevel.uploadqueue.dto.upload.response;

import com.eyelevel.uploadqueue.model.UploadStatus;

import java.util.List;
import java.util.Map;

/**
 * @param items       Every upload in queue order.
 * @param activeCount Uploads currently holding a transfer slot.
 * @param counts      Number of uploads per status.
 */
public record UploadQueueSnapshot(List<UploadItemView> items, int activeCount, Map<UploadStatus, Long> counts) {
}
