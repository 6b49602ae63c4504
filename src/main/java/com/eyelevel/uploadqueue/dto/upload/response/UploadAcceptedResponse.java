package com.eyelevel.uploadqueue.dto.upload.response;

import java.util.List;

/**
 * @param uploadIds Ids of the queued uploads, in submission order.
 */
public record UploadAcceptedResponse(List<String> uploadIds) {
}
