package com.eyelevel.uploadqueue.controller;

import com.eyelevel.uploadqueue.dto.common.ApiResponse;
import com.eyelevel.uploadqueue.dto.upload.request.AddReferenceRequest;
import com.eyelevel.uploadqueue.dto.upload.response.ClearQueueResponse;
import com.eyelevel.uploadqueue.dto.upload.response.UploadAcceptedResponse;
import com.eyelevel.uploadqueue.dto.upload.response.UploadEventView;
import com.eyelevel.uploadqueue.dto.upload.response.UploadItemView;
import com.eyelevel.uploadqueue.dto.upload.response.UploadQueueSnapshot;
import com.eyelevel.uploadqueue.model.UploadItem;
import com.eyelevel.uploadqueue.service.UploadQueueService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.util.CollectionUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import reactor.core.publisher.Flux;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * REST controller exposing the upload queue: queueing files and references, inspecting the queue,
 * retrying and cancelling uploads. All responses follow the standardized {@link ApiResponse} format.
 */
@Slf4j
@RestController
@RequestMapping("/uploads")
@RequiredArgsConstructor
@Validated
public class UploadQueueController implements UploadQueueApi {

    private final UploadQueueService uploadQueueService;

    @Override
    @PostMapping(value = "/v1/files", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<UploadAcceptedResponse>> addFiles(@RequestPart("files") final List<MultipartFile> files) {
        if (CollectionUtils.isEmpty(files)) {
            throw new IllegalArgumentException("At least one file must be provided.");
        }
        final List<Resource> contents = new ArrayList<>();
        for (final MultipartFile file : files) {
            contents.add(copyOf(file));
        }

        final List<String> uploadIds = new ArrayList<>();
        for (int i = 0; i < files.size(); i++) {
            uploadIds.add(uploadQueueService.addFile(files.get(i).getOriginalFilename(), contents.get(i)));
        }
        log.info("Queued {} file(s) for upload.", uploadIds.size());

        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ApiResponse.ok(
                uploadIds.size() + " file(s) queued for upload.",
                new UploadAcceptedResponse(uploadIds),
                HttpStatus.ACCEPTED.value()));
    }

    @Override
    @PostMapping("/v1/references")
    public ResponseEntity<ApiResponse<UploadAcceptedResponse>> addReference(@Valid @RequestBody final AddReferenceRequest request) {
        final String uploadId = uploadQueueService.addReference(request.url());

        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ApiResponse.ok(
                "Resource queued for upload.",
                new UploadAcceptedResponse(List.of(uploadId)),
                HttpStatus.ACCEPTED.value()));
    }

    @Override
    @GetMapping("/v1")
    public ResponseEntity<ApiResponse<UploadQueueSnapshot>> getSnapshot() {
        final UploadQueueSnapshot snapshot = new UploadQueueSnapshot(
                uploadQueueService.snapshot().stream().map(UploadItemView::from).toList(),
                uploadQueueService.getActiveCount(),
                uploadQueueService.countByStatus());

        return ResponseEntity.ok(ApiResponse.ok("Upload queue retrieved successfully.", snapshot, HttpStatus.OK.value()));
    }

    @Override
    @GetMapping("/v1/{uploadId}")
    public ResponseEntity<ApiResponse<UploadItemView>> getUpload(@PathVariable("uploadId") final String uploadId) {
        final UploadItemView view = UploadItemView.from(uploadQueueService.findById(uploadId));
        return ResponseEntity.ok(ApiResponse.ok("Upload retrieved successfully.", view, HttpStatus.OK.value()));
    }

    @Override
    @PostMapping("/v1/{uploadId}/retry")
    public ResponseEntity<ApiResponse<UploadItemView>> retryUpload(@PathVariable("uploadId") final String uploadId) {
        log.info("Retry requested for upload {}", uploadId);
        final UploadItemView view = UploadItemView.from(uploadQueueService.retry(uploadId));

        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ApiResponse.ok(
                "Upload queued for retry.", view, HttpStatus.ACCEPTED.value()));
    }

    @Override
    @DeleteMapping("/v1/{uploadId}")
    public ResponseEntity<ApiResponse<UploadItemView>> cancelUpload(@PathVariable("uploadId") final String uploadId) {
        log.info("Cancel requested for upload {}", uploadId);
        final UploadItemView view = UploadItemView.from(uploadQueueService.cancel(uploadId));
        return ResponseEntity.ok(ApiResponse.ok("Upload cancelled.", view, HttpStatus.OK.value()));
    }

    @Override
    @PostMapping("/v1/clear-completed")
    public ResponseEntity<ApiResponse<ClearQueueResponse>> clearCompleted() {
        final ClearQueueResponse cleared = ClearQueueResponse.of(ids(uploadQueueService.clearCompleted()));
        return ResponseEntity.ok(ApiResponse.ok(
                cleared.removedCount() + " completed upload(s) cleared.", cleared, HttpStatus.OK.value()));
    }

    @Override
    @PostMapping("/v1/clear-all")
    public ResponseEntity<ApiResponse<ClearQueueResponse>> clearAll() {
        final ClearQueueResponse cleared = ClearQueueResponse.of(ids(uploadQueueService.clearAll()));
        return ResponseEntity.ok(ApiResponse.ok(
                cleared.removedCount() + " upload(s) cleared.", cleared, HttpStatus.OK.value()));
    }

    @Override
    @GetMapping(value = "/v1/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<UploadEventView>> streamEvents() {
        return uploadQueueService.events()
                .map(event -> ServerSentEvent.builder(UploadEventView.from(event))
                        .id(event.item().getId())
                        .event(event.type().name().toLowerCase(Locale.ROOT))
                        .build());
    }

    /**
     * The servlet container deletes multipart temp files when the request ends, while the upload may be
     * transferred (or retried) much later. The content is therefore kept in memory.
     */
    private static Resource copyOf(final MultipartFile file) {
        if (file.isEmpty()) {
            throw new IllegalArgumentException("File '" + file.getOriginalFilename() + "' is empty.");
        }
        try {
            final String fileName = file.getOriginalFilename();
            return new ByteArrayResource(file.getBytes(), "Uploaded file " + fileName) {
                @Override
                public String getFilename() {
                    return fileName;
                }
            };
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read uploaded file " + file.getOriginalFilename(), e);
        }
    }

    private static List<String> ids(final List<UploadItem> items) {
        return items.stream().map(UploadItem::getId).toList();
    }
}
