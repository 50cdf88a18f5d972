package net.ogimage.controller;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Duration;
import java.util.UUID;
import net.ogimage.application.render.ImagePipelineService;
import net.ogimage.application.render.ImageRequest;
import net.ogimage.application.render.PipelineResult;
import net.ogimage.application.render.RenderCompletionWaiter;
import net.ogimage.application.render.TaskStatusView;
import net.ogimage.config.PipelineProperties;
import net.ogimage.exception.DedupFailedException;
import net.ogimage.exception.InvalidImageRequestException;
import net.ogimage.exception.StorageUnavailableException;
import net.ogimage.exception.TaskNotFoundException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class OgImageControllerTest {

    private static final UUID TASK_ID = UUID.fromString("6f1c2a7e-3b1d-4c55-9a0e-2f4b8d9c1e77");

    @Mock
    private ImagePipelineService pipelineService;

    private static final String IMAGE_URL = "https://cdn.example.com/og_images/abc.png";

    private MockMvc mockMvc;
    private ThreadPoolTaskScheduler taskScheduler;

    @BeforeEach
    void setUp() {
        taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.initialize();
        PipelineProperties properties = new PipelineProperties();
        properties.setRedirectWaitTimeout(Duration.ofMillis(300));
        properties.setRedirectPollInterval(Duration.ofMillis(10));
        RenderCompletionWaiter waiter = new RenderCompletionWaiter(pipelineService, taskScheduler, properties);
        mockMvc = MockMvcBuilders.standaloneSetup(new OgImageController(pipelineService, waiter))
            .setControllerAdvice(new ApiExceptionHandler())
            .build();
    }

    @AfterEach
    void tearDown() {
        taskScheduler.shutdown();
    }

    @Test
    @DisplayName("GET / redirects straight to a cached image")
    void root_cachedImage_redirectsImmediately() throws Exception {
        when(pipelineService.requestImage(any(ImageRequest.class))).thenReturn(PipelineResult.cached(IMAGE_URL));

        MvcResult pending = mockMvc.perform(get("/").param("url", "https://example.com"))
            .andExpect(request().asyncStarted())
            .andReturn();

        mockMvc.perform(asyncDispatch(pending))
            .andExpect(status().isTemporaryRedirect())
            .andExpect(header().string("Location", IMAGE_URL));
        verify(pipelineService, never()).getStatus(any(UUID.class));
    }

    @Test
    @DisplayName("GET / waits for the render and then redirects")
    void root_renderCompletesWhileWaiting_redirectsToImage() throws Exception {
        when(pipelineService.requestImage(any(ImageRequest.class))).thenReturn(PipelineResult.processing(TASK_ID));
        when(pipelineService.getStatus(TASK_ID)).thenReturn(
            new TaskStatusView(TASK_ID, "pending", null, null),
            new TaskStatusView(TASK_ID, "processing", null, null),
            new TaskStatusView(TASK_ID, "completed", IMAGE_URL, null));

        MvcResult pending = mockMvc.perform(get("/")
                .param("url", "https://example.com")
                .param("width", "800")
                .param("height", "418"))
            .andExpect(request().asyncStarted())
            .andReturn();

        mockMvc.perform(asyncDispatch(pending))
            .andExpect(status().isTemporaryRedirect())
            .andExpect(header().string("Location", IMAGE_URL));
        verify(pipelineService).requestImage(new ImageRequest("https://example.com", null, 800, 418, false));
    }

    @Test
    @DisplayName("GET / reports a failed render as an error")
    void root_renderFails_returnsServerErrorWithReason() throws Exception {
        when(pipelineService.requestImage(any(ImageRequest.class))).thenReturn(PipelineResult.processing(TASK_ID));
        when(pipelineService.getStatus(TASK_ID)).thenReturn(
            new TaskStatusView(TASK_ID, "processing", null, null),
            new TaskStatusView(TASK_ID, "failed", null, "render_error: net::ERR_NAME_NOT_RESOLVED"));

        MvcResult pending = mockMvc.perform(get("/").param("url", "https://example.com"))
            .andExpect(request().asyncStarted())
            .andReturn();

        mockMvc.perform(asyncDispatch(pending))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error").value("Image generation failed"))
            .andExpect(jsonPath("$.message").value("render_error: net::ERR_NAME_NOT_RESOLVED"));
    }

    @Test
    @DisplayName("GET / gives up with 504 when the render outlasts the wait")
    void root_renderStillRunningAfterWait_returnsGatewayTimeout() throws Exception {
        when(pipelineService.requestImage(any(ImageRequest.class))).thenReturn(PipelineResult.processing(TASK_ID));
        when(pipelineService.getStatus(TASK_ID)).thenReturn(new TaskStatusView(TASK_ID, "processing", null, null));

        MvcResult pending = mockMvc.perform(get("/").param("url", "https://example.com"))
            .andExpect(request().asyncStarted())
            .andReturn();

        mockMvc.perform(asyncDispatch(pending))
            .andExpect(status().isGatewayTimeout())
            .andExpect(jsonPath("$.error").value("Image generation timed out"))
            .andExpect(jsonPath("$.message").value(containsString("/status/" + TASK_ID)));
    }

    @Test
    void root_missingUrl_returnsBadRequest() throws Exception {
        mockMvc.perform(get("/"))
            .andExpect(status().isBadRequest());

        verifyNoInteractions(pipelineService);
    }

    @Test
    @DisplayName("GET /generate returns the cached image url")
    void generate_cachedImage_returnsImageUrl() throws Exception {
        when(pipelineService.requestImage(any(ImageRequest.class)))
            .thenReturn(PipelineResult.cached("https://cdn.example.com/og_images/abc.png"));

        mockMvc.perform(get("/generate").param("url", "https://example.com"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.status").value("cached"))
            .andExpect(jsonPath("$.image_url").value("https://cdn.example.com/og_images/abc.png"))
            .andExpect(jsonPath("$.task_id").doesNotExist());
    }

    @Test
    @DisplayName("GET /generate returns a pollable task for uncached pages")
    void generate_processing_returnsTaskAndStatusUrl() throws Exception {
        when(pipelineService.requestImage(any(ImageRequest.class))).thenReturn(PipelineResult.processing(TASK_ID));

        mockMvc.perform(get("/generate")
                .param("url", "https://example.com")
                .param("ttl", "48")
                .param("width", "800")
                .param("height", "418")
                .param("force_refresh", "true"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.status").value("processing"))
            .andExpect(jsonPath("$.task_id").value(TASK_ID.toString()))
            .andExpect(jsonPath("$.check_status_url").value("http://localhost/status/" + TASK_ID))
            .andExpect(jsonPath("$.image_url").doesNotExist());

        verify(pipelineService).requestImage(new ImageRequest("https://example.com", 48, 800, 418, true));
    }

    @Test
    void generate_missingUrl_returnsBadRequest() throws Exception {
        mockMvc.perform(get("/generate"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Invalid request"));

        verifyNoInteractions(pipelineService);
    }

    @Test
    void generate_disallowedDomain_returnsBadRequestWithMessage() throws Exception {
        when(pipelineService.requestImage(any(ImageRequest.class)))
            .thenThrow(new InvalidImageRequestException("Domain 'evil.test' is not allowed."));

        mockMvc.perform(get("/generate").param("url", "https://evil.test"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Domain 'evil.test' is not allowed."));
    }

    @Test
    void generate_dedupExhausted_returnsServiceUnavailableWithRetryAfter() throws Exception {
        when(pipelineService.requestImage(any(ImageRequest.class)))
            .thenThrow(new DedupFailedException("abc", 3));

        mockMvc.perform(get("/generate").param("url", "https://example.com"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(header().string("Retry-After", "1"))
            .andExpect(jsonPath("$.error").value("Render queue busy"));
    }

    @Test
    void generate_storageDown_returnsServiceUnavailable() throws Exception {
        when(pipelineService.requestImage(any(ImageRequest.class)))
            .thenThrow(new StorageUnavailableException("task-ledger", "connection refused"));

        mockMvc.perform(get("/generate").param("url", "https://example.com"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(header().string("Retry-After", "5"))
            .andExpect(jsonPath("$.message").value("task-ledger is not reachable"));
    }

    @Test
    void status_completedTask_returnsImageUrl() throws Exception {
        when(pipelineService.getStatus(TASK_ID))
            .thenReturn(new TaskStatusView(TASK_ID, "completed", "https://cdn.example.com/og_images/abc.png", null));

        mockMvc.perform(get("/status/{task_id}", TASK_ID))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("completed"))
            .andExpect(jsonPath("$.image_url").value("https://cdn.example.com/og_images/abc.png"));
    }

    @Test
    void status_failedTask_returnsErrorMessage() throws Exception {
        when(pipelineService.getStatus(TASK_ID))
            .thenReturn(new TaskStatusView(TASK_ID, "failed", null, "timeout"));

        mockMvc.perform(get("/status/{task_id}", TASK_ID))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("failed"))
            .andExpect(jsonPath("$.error_message").value("timeout"));
    }

    @Test
    void status_unknownTask_returnsNotFound() throws Exception {
        when(pipelineService.getStatus(TASK_ID)).thenThrow(new TaskNotFoundException(TASK_ID));

        mockMvc.perform(get("/status/{task_id}", TASK_ID))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("Task not found"));
    }

    @Test
    void status_malformedTaskId_returnsBadRequest() throws Exception {
        mockMvc.perform(get("/status/not-a-uuid"))
            .andExpect(status().isBadRequest());

        verifyNoInteractions(pipelineService);
    }

    @Test
    void image_completedTask_redirectsToImage() throws Exception {
        when(pipelineService.getStatus(TASK_ID))
            .thenReturn(new TaskStatusView(TASK_ID, "completed", "https://cdn.example.com/og_images/abc.png", null));

        mockMvc.perform(get("/image/{task_id}", TASK_ID))
            .andExpect(status().isTemporaryRedirect())
            .andExpect(header().string("Location", "https://cdn.example.com/og_images/abc.png"));
    }

    @Test
    void image_processingTask_returnsNotFound() throws Exception {
        when(pipelineService.getStatus(TASK_ID)).thenReturn(new TaskStatusView(TASK_ID, "processing", null, null));

        mockMvc.perform(get("/image/{task_id}", TASK_ID))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("Image not available"))
            .andExpect(jsonPath("$.message").value("Task " + TASK_ID + " is processing"));
    }
}
