package com.eyelevel.uploadqueue.controller;

import com.eyelevel.uploadqueue.dto.common.ApiResponse;
import com.eyelevel.uploadqueue.dto.upload.request.AddReferenceRequest;
import com.eyelevel.uploadqueue.dto.upload.response.ClearQueueResponse;
import com.eyelevel.uploadqueue.dto.upload.response.UploadAcceptedResponse;
import com.eyelevel.uploadqueue.dto.upload.response.UploadEventView;
import com.eyelevel.uploadqueue.dto.upload.response.UploadItemView;
import com.eyelevel.uploadqueue.dto.upload.response.UploadQueueSnapshot;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.multipart.MultipartFile;
import reactor.core.publisher.Flux;

import java.util.List;

@Tag(name = "Upload Queue", description = "Endpoints for queueing uploads to the ingestion service and following them until processing finishes.")
public interface UploadQueueApi {

    @Operation(summary = "Queue Files",
            description = "Queues one upload per file. Uploads start as soon as a transfer slot is free.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Files queued.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Accepted", value = """
                                    {
                                        "displayMessage": "2 file(s) queued for upload.",
                                        "response": {
                                            "uploadIds": ["upload-5f0c...", "upload-91ab..."]
                                        },
                                        "showMessage": true,
                                        "statusCode": 202
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - No file or an empty file was sent.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<UploadAcceptedResponse>> addFiles(
            @Parameter(description = "One or more files to upload.", required = true)
            @RequestPart("files") List<MultipartFile> files);

    @Operation(summary = "Queue Remote Resource",
            description = "Queues a resource the ingestion service downloads from the given URL.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Reference queued.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - Missing or non-http(s) URL.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<UploadAcceptedResponse>> addReference(@Valid @RequestBody AddReferenceRequest request);

    @Operation(summary = "Get Queue Snapshot",
            description = "Returns every upload in queue order with the number of active transfers and a count per status.")
    ResponseEntity<ApiResponse<UploadQueueSnapshot>> getSnapshot();

    @Operation(summary = "Get Upload")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Upload found.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "No upload with this id.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<UploadItemView>> getUpload(
            @Parameter(description = "Id returned when the upload was queued.", required = true, example = "upload-5f0c...")
            @PathVariable("uploadId") String uploadId);

    @Operation(summary = "Retry Failed Upload",
            description = "Resets a failed upload to pending so it is transferred again.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Upload queued again.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "No upload with this id.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "The upload has not failed.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<UploadItemView>> retryUpload(@PathVariable("uploadId") String uploadId);

    @Operation(summary = "Cancel Upload",
            description = "Aborts a pending, transferring or processing upload and removes it from the queue. No notification is sent.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Upload cancelled.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "No upload with this id.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "The upload already completed or failed.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<UploadItemView>> cancelUpload(@PathVariable("uploadId") String uploadId);

    @Operation(summary = "Clear Completed Uploads")
    ResponseEntity<ApiResponse<ClearQueueResponse>> clearCompleted();

    @Operation(summary = "Clear Queue",
            description = "Cancels every upload still in flight and removes all uploads, finished or not.")
    ResponseEntity<ApiResponse<ClearQueueResponse>> clearAll();

    @Operation(summary = "Stream Upload Events",
            description = "Server-Sent Events stream of uploads reaching a final state. Only events after subscription are sent.")
    Flux<ServerSentEvent<UploadEventView>> streamEvents();
}
