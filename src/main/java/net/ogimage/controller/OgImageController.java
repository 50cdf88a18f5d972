package net.ogimage.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.net.URI;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;
import net.ogimage.application.render.ImagePipelineService;
import net.ogimage.application.render.ImageRequest;
import net.ogimage.application.render.PipelineResult;
import net.ogimage.application.render.RenderCompletionWaiter;
import net.ogimage.application.render.TaskStatusView;
import net.ogimage.controller.support.ErrorResponseUtils;
import net.ogimage.domain.render.RenderTaskState;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

/**
 * HTTP surface of the image pipeline.
 *
 * <p>{@code /generate} answers 202 for both cached and processing results; the {@code status}
 * field tells them apart. Clients poll {@code /status/{task_id}} and may follow
 * {@code /image/{task_id}} once the task completed.</p>
 *
 * <p>{@code GET /?url=...} is the form meant for {@code og:image} meta tags: it redirects
 * straight to the image, waiting for the render when there is no fresh artifact yet.</p>
 */
@RestController
@Slf4j
public class OgImageController {

    private final ImagePipelineService pipelineService;
    private final RenderCompletionWaiter completionWaiter;

    public OgImageController(ImagePipelineService pipelineService, RenderCompletionWaiter completionWaiter) {
        this.pipelineService = pipelineService;
        this.completionWaiter = completionWaiter;
    }

    @GetMapping("/")
    public CompletableFuture<ResponseEntity<?>> redirectToImage(@RequestParam String url,
                                                                @RequestParam(required = false) Integer ttl,
                                                                @RequestParam(required = false) Integer width,
                                                                @RequestParam(required = false) Integer height,
                                                                @RequestParam(name = "force_refresh", defaultValue = "false") boolean forceRefresh) {
        PipelineResult result = pipelineService.requestImage(new ImageRequest(url, ttl, width, height, forceRefresh));
        if (result.isCached()) {
            return CompletableFuture.completedFuture(redirect(result.imageUrl()));
        }
        log.info("Waiting for render task {} before redirecting {}", result.taskId(), url);
        return completionWaiter.awaitTerminal(result.taskId()).thenApply(OgImageController::redirectOrError);
    }

    @GetMapping("/generate")
    public ResponseEntity<GenerateResponse> generate(@RequestParam String url,
                                                     @RequestParam(required = false) Integer ttl,
                                                     @RequestParam(required = false) Integer width,
                                                     @RequestParam(required = false) Integer height,
                                                     @RequestParam(name = "force_refresh", defaultValue = "false") boolean forceRefresh) {
        PipelineResult result = pipelineService.requestImage(new ImageRequest(url, ttl, width, height, forceRefresh));
        GenerateResponse body = result.isCached()
            ? new GenerateResponse(result.status().label(), result.imageUrl(), null, null)
            : new GenerateResponse(result.status().label(), null, result.taskId(), statusUrl(result.taskId()));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
    }

    @GetMapping("/status/{task_id}")
    public ResponseEntity<StatusResponse> status(@PathVariable("task_id") UUID taskId) {
        TaskStatusView view = pipelineService.getStatus(taskId);
        return ResponseEntity.ok(new StatusResponse(view.status(), view.imageUrl(), view.errorMessage()));
    }

    @GetMapping("/image/{task_id}")
    public ResponseEntity<?> image(@PathVariable("task_id") UUID taskId) {
        TaskStatusView view = pipelineService.getStatus(taskId);
        if (!RenderTaskState.COMPLETED.statusLabel().equals(view.status()) || view.imageUrl() == null) {
            return ErrorResponseUtils.notFound("Image not available", "Task " + taskId + " is " + view.status());
        }
        return redirect(view.imageUrl());
    }

    private static ResponseEntity<?> redirectOrError(TaskStatusView view) {
        if (RenderTaskState.COMPLETED.statusLabel().equals(view.status()) && view.imageUrl() != null) {
            return redirect(view.imageUrl());
        }
        return ErrorResponseUtils.error(HttpStatus.INTERNAL_SERVER_ERROR, "Image generation failed",
            view.errorMessage() != null ? view.errorMessage() : "unknown error");
    }

    private static ResponseEntity<?> redirect(String imageUrl) {
        return ResponseEntity.status(HttpStatus.TEMPORARY_REDIRECT)
            .location(URI.create(imageUrl))
            .build();
    }

    private static String statusUrl(UUID taskId) {
        return ServletUriComponentsBuilder.fromCurrentContextPath()
            .path("/status/{taskId}")
            .buildAndExpand(taskId)
            .toUriString();
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record GenerateResponse(
        @JsonProperty("status") String status,
        @JsonProperty("image_url") String imageUrl,
        @JsonProperty("task_id") UUID taskId,
        @JsonProperty("check_status_url") String checkStatusUrl) {
    }

    public record StatusResponse(
        @JsonProperty("status") String status,
        @JsonProperty("image_url") String imageUrl,
        @JsonProperty("error_message") String errorMessage) {
    }
}
