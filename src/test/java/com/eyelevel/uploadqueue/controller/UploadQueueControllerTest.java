package com.eyelevel.uploadqueue.controller;

import com.eyelevel.uploadqueue.exception.InvalidUploadOperationException;
import com.eyelevel.uploadqueue.exception.UploadNotFoundException;
import com.eyelevel.uploadqueue.exception.handler.GlobalExceptionHandler;
import com.eyelevel.uploadqueue.model.UploadItem;
import com.eyelevel.uploadqueue.model.UploadPayload;
import com.eyelevel.uploadqueue.model.UploadStatus;
import com.eyelevel.uploadqueue.service.UploadQueueService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class UploadQueueControllerTest {

    @Mock
    private UploadQueueService uploadQueueService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new UploadQueueController(uploadQueueService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void queuesAReference() throws Exception {
        when(uploadQueueService.addReference("https://example.com/a.pdf")).thenReturn("upload-1");

        mockMvc.perform(post("/uploads/v1/references")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\":\"https://example.com/a.pdf\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.response.uploadIds[0]").value("upload-1"))
                .andExpect(jsonPath("$.statusCode").value(202));
    }

    @Test
    void blankReferenceFailsValidation() throws Exception {
        mockMvc.perform(post("/uploads/v1/references")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\":\"\"}"))
                .andExpect(status().isBadRequest());

        verify(uploadQueueService, never()).addReference(any());
    }

    @Test
    void unsupportedReferenceIsABadRequest() throws Exception {
        when(uploadQueueService.addReference("ftp://example.com/a.pdf"))
                .thenThrow(new IllegalArgumentException("Source URL must be an absolute http(s) URL"));

        mockMvc.perform(post("/uploads/v1/references")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\":\"ftp://example.com/a.pdf\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.displayMessage").value("Source URL must be an absolute http(s) URL"));
    }

    @Test
    void queuesEveryUploadedFile() throws Exception {
        when(uploadQueueService.addFile(eq("a.txt"), any())).thenReturn("upload-a");
        when(uploadQueueService.addFile(eq("b.txt"), any())).thenReturn("upload-b");

        mockMvc.perform(multipart("/uploads/v1/files")
                        .file(new MockMultipartFile("files", "a.txt", "text/plain", "alpha".getBytes()))
                        .file(new MockMultipartFile("files", "b.txt", "text/plain", "beta".getBytes())))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.response.uploadIds[0]").value("upload-a"))
                .andExpect(jsonPath("$.response.uploadIds[1]").value("upload-b"));
    }

    @Test
    void emptyFileIsABadRequest() throws Exception {
        mockMvc.perform(multipart("/uploads/v1/files")
                        .file(new MockMultipartFile("files", "empty.txt", "text/plain", new byte[0])))
                .andExpect(status().isBadRequest());

        verify(uploadQueueService, never()).addFile(any(), any());
    }

    @Test
    void snapshotListsItemsAndCounts() throws Exception {
        final UploadItem item = UploadItem.pending("upload-1", UploadPayload.ofReference("https://example.com/a.pdf"),
                Instant.EPOCH);
        final Map<UploadStatus, Long> counts = new EnumMap<>(UploadStatus.class);
        counts.put(UploadStatus.PENDING, 1L);
        when(uploadQueueService.snapshot()).thenReturn(List.of(item));
        when(uploadQueueService.getActiveCount()).thenReturn(0);
        when(uploadQueueService.countByStatus()).thenReturn(counts);

        mockMvc.perform(get("/uploads/v1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.response.items[0].id").value("upload-1"))
                .andExpect(jsonPath("$.response.items[0].kind").value("REFERENCE"))
                .andExpect(jsonPath("$.response.items[0].displayName").value("https://example.com/a.pdf"))
                .andExpect(jsonPath("$.response.activeCount").value(0))
                .andExpect(jsonPath("$.response.counts.PENDING").value(1));
    }

    @Test
    void retryOfAnUploadThatHasNotFailedIsAConflict() throws Exception {
        when(uploadQueueService.retry("upload-1"))
                .thenThrow(new InvalidUploadOperationException("retry", "upload-1", UploadStatus.ACTIVE));

        mockMvc.perform(post("/uploads/v1/upload-1/retry"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.response").value("ACTIVE"));
    }

    @Test
    void cancelOfAnUnknownUploadIsNotFound() throws Exception {
        when(uploadQueueService.cancel("upload-x")).thenThrow(new UploadNotFoundException("upload-x"));

        mockMvc.perform(delete("/uploads/v1/upload-x"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.statusCode").value(404));
    }

    @Test
    void clearCompletedReportsRemovedIds() throws Exception {
        final UploadItem done = UploadItem.pending("upload-1", UploadPayload.ofReference("https://example.com/a.pdf"),
                Instant.EPOCH).toActive().toProcessing("res-1", Instant.EPOCH).toCompleted();
        when(uploadQueueService.clearCompleted()).thenReturn(List.of(done));

        mockMvc.perform(post("/uploads/v1/clear-completed"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.response.removedCount").value(1))
                .andExpect(jsonPath("$.response.removedIds[0]").value("upload-1"));
    }
}
