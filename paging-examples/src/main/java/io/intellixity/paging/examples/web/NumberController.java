package io.intellixity.paging.examples.web;

import io.intellixity.paging.examples.service.NumberService;
import io.intellixity.paging.examples.session.PagingMode;
import io.intellixity.paging.examples.session.PagingSession;
import io.intellixity.paging.examples.session.PagingSessions;
import io.intellixity.paging.source.LoadResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api/numbers")
public final class NumberController {
  private static final Logger log = LoggerFactory.getLogger(NumberController.class);

  private final PagingSessions sessions;
  private final NumberService numbers;

  public NumberController(PagingSessions sessions, NumberService numbers) {
    this.sessions = sessions;
    this.numbers = numbers;
  }

  public record InsertRequest(List<Long> values) {}
  public record InsertResponse(long inserted) {}
  public record ErrorResponse(String error, String message) {}

  @PostMapping("/sessions")
  public ResponseEntity<SessionResponse> createSession(@RequestParam(name = "mode", required = false) String mode,
                                                       @RequestParam(name = "pageSize", required = false) Integer pageSize) {
    PagingSession s = sessions.create(PagingMode.parse(mode), pageSize);
    return ResponseEntity.status(HttpStatus.CREATED).body(SessionResponse.of(s));
  }

  /** 404 for an unknown session, 410 once it has been invalidated (restart it), 503 for a failed load. */
  @GetMapping("/sessions/{id}/pages")
  public CompletableFuture<ResponseEntity<?>> page(@PathVariable("id") String id,
                                                   @RequestParam(name = "type", required = false) String type,
                                                   @RequestParam(name = "key", required = false) Long key) {
    CompletableFuture<LoadResult<Long, Long>> load = sessions.load(id, type, key);
    if (load == null) return CompletableFuture.completedFuture(notFound(id));
    return load.thenApply(r -> toResponse(id, r));
  }

  @PostMapping("/sessions/{id}/restart")
  public ResponseEntity<?> restart(@PathVariable("id") String id) {
    PagingSession s = sessions.restart(id);
    return (s == null) ? notFound(id) : ResponseEntity.status(HttpStatus.CREATED).body(SessionResponse.of(s));
  }

  @DeleteMapping("/sessions/{id}")
  public ResponseEntity<Void> close(@PathVariable("id") String id) {
    return sessions.close(id) ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
  }

  @PostMapping
  public InsertResponse insert(@RequestBody InsertRequest req) {
    if (req == null || req.values() == null || req.values().isEmpty()) {
      throw new IllegalArgumentException("values must not be empty");
    }
    if (req.values().stream().anyMatch(Objects::isNull)) throw new IllegalArgumentException("values must not contain null");
    return new InsertResponse(numbers.insertAll(req.values()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> badRequest(IllegalArgumentException e) {
    return ResponseEntity.badRequest().body(new ErrorResponse("bad_request", e.getMessage()));
  }

  static ResponseEntity<?> toResponse(String id, LoadResult<Long, Long> r) {
    if (r instanceof LoadResult.Page<Long, Long> page) return ResponseEntity.ok(PageResponse.of(id, page));
    if (r instanceof LoadResult.Error<Long, Long> err) {
      log.warn("paging.session_load_failed id={} cause={}", id, err.cause().toString());
      return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
          .body(new ErrorResponse("load_failed", String.valueOf(err.cause().getMessage())));
    }
    return ResponseEntity.status(HttpStatus.GONE)
        .body(new ErrorResponse("session_invalidated", "Data changed; restart session " + id));
  }

  private static ResponseEntity<?> notFound(String id) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ErrorResponse("unknown_session", id));
  }
}
