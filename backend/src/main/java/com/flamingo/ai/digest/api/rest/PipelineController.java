package com.flamingo.ai.digest.api.rest;

import com.flamingo.ai.digest.api.dto.request.ChannelWeightRequest;
import com.flamingo.ai.digest.api.dto.request.WindowRequest;
import com.flamingo.ai.digest.api.dto.response.ClusteringResponse;
import com.flamingo.ai.digest.api.dto.response.CountResponse;
import com.flamingo.ai.digest.api.dto.response.DigestRunResponse;
import com.flamingo.ai.digest.api.dto.response.ItemErrorResponse;
import com.flamingo.ai.digest.api.dto.response.PipelineStatsResponse;
import com.flamingo.ai.digest.domain.model.TimeWindow;
import com.flamingo.ai.digest.exception.InvalidWindowException;
import com.flamingo.ai.digest.service.ops.PipelineOperationsService;
import jakarta.validation.Valid;
import java.time.Clock;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for operator actions on the pipeline. */
@RestController
@RequestMapping("/api/pipeline")
@RequiredArgsConstructor
@Slf4j
public class PipelineController {

  private final PipelineOperationsService operationsService;
  private final Clock clock;

  /**
   * Lists the most recently failed items.
   *
   * @param limit maximum number of items, capped at 200
   */
  @GetMapping("/errors")
  public ResponseEntity<List<ItemErrorResponse>> recentErrors(
      @RequestParam(defaultValue = "50") int limit) {
    List<ItemErrorResponse> response =
        operationsService.recentErrors(limit).stream().map(ItemErrorResponse::fromView).toList();
    return ResponseEntity.ok(response);
  }

  /** Requeues one failed item. */
  @PostMapping("/items/{itemId}/retry")
  public ResponseEntity<Void> retryItem(@PathVariable UUID itemId) {
    operationsService.retryItem(itemId);
    return ResponseEntity.accepted().build();
  }

  /** Requeues every failed item. */
  @PostMapping("/items/retry-failed")
  public ResponseEntity<CountResponse> retryFailedItems() {
    return ResponseEntity.ok(new CountResponse(operationsService.retryFailedItems()));
  }

  /** Deletes failed digest rows so their windows can be published again. */
  @DeleteMapping("/digests/errors")
  public ResponseEntity<CountResponse> clearDigestErrors() {
    return ResponseEntity.ok(new CountResponse(operationsService.clearDigestErrors()));
  }

  @GetMapping("/stats")
  public ResponseEntity<PipelineStatsResponse> stats() {
    return ResponseEntity.ok(
        PipelineStatsResponse.fromStats(operationsService.stats(), clock.instant()));
  }

  /** Sets the importance weight of a channel. */
  @PutMapping("/channels/{username}/importance-weight")
  public ResponseEntity<Void> updateChannelWeight(
      @PathVariable String username, @Valid @RequestBody ChannelWeightRequest request) {
    operationsService.updateChannelWeight(username, request.getWeight());
    return ResponseEntity.noContent().build();
  }

  /** Rebuilds the clusters of a window. */
  @PostMapping("/clusters")
  public ResponseEntity<ClusteringResponse> rebuildClusters(
      @Valid @RequestBody WindowRequest request) {
    TimeWindow window = toWindow(request);
    log.info("Cluster rebuild requested for window {}", window);
    return ResponseEntity.ok(
        ClusteringResponse.fromResult(operationsService.rebuildClusters(window)));
  }

  /** Publishes the digest of a window, clustering it first. */
  @PostMapping("/digests")
  public ResponseEntity<DigestRunResponse> publishDigest(
      @Valid @RequestBody WindowRequest request) {
    TimeWindow window = toWindow(request);
    log.info("Digest requested for window {} (chat {})", window, request.getChatId());
    return ResponseEntity.ok(
        DigestRunResponse.fromResult(operationsService.publishDigest(window, request.getChatId())));
  }

  private static TimeWindow toWindow(WindowRequest request) {
    try {
      return new TimeWindow(request.getStart(), request.getEnd());
    } catch (IllegalArgumentException | NullPointerException e) {
      throw new InvalidWindowException(request.getStart(), request.getEnd(), e);
    }
  }
}
