package com.phillippitts.voicedispatch.presentation.controller;

import com.phillippitts.voicedispatch.exception.UtteranceRejectedException;
import com.phillippitts.voicedispatch.service.dispatch.Dispatcher;
import com.phillippitts.voicedispatch.service.input.UtteranceQueue;
import com.phillippitts.voicedispatch.service.notifier.ComponentSnapshot;
import com.phillippitts.voicedispatch.service.notifier.TrackingStatusNotifier;
import com.phillippitts.voicedispatch.util.LogSanitizer;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * REST surface of the {@code http-text} input.
 *
 * <ul>
 *   <li>{@code POST /api/utterances} queues typed text for the dispatcher (202, or 503 when
 *       the queue is full)</li>
 *   <li>{@code GET /api/status} reports the loop state and the latest status of every
 *       component</li>
 * </ul>
 *
 * <p>Responses to queued utterances go to the configured outputs, not to the HTTP caller.
 */
@RestController
@RequestMapping("/api")
class UtteranceController {

    private static final Logger LOG = LogManager.getLogger(UtteranceController.class);

    static final int MAX_TEXT_LENGTH = 1000;

    private final UtteranceQueue queue;
    private final TrackingStatusNotifier statusNotifier;
    private final Dispatcher dispatcher;

    UtteranceController(UtteranceQueue queue, TrackingStatusNotifier statusNotifier, Dispatcher dispatcher) {
        this.queue = queue;
        this.statusNotifier = statusNotifier;
        this.dispatcher = dispatcher;
    }

    record UtteranceRequest(@NotBlank @Size(max = MAX_TEXT_LENGTH) String text) { }

    @PostMapping("/utterances")
    ResponseEntity<Map<String, Object>> submit(@Valid @RequestBody UtteranceRequest request) {
        if (!queue.offer(request.text())) {
            throw new UtteranceRejectedException(queue.capacity());
        }
        LOG.info("Queued utterance '{}'", LogSanitizer.truncate(request.text(), 80));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of(
                "status", "queued",
                "pending", queue.size()));
    }

    @GetMapping("/status")
    ResponseEntity<Map<String, Object>> status() {
        List<Map<String, Object>> components = statusNotifier.snapshot().stream()
                .sorted(Comparator.comparing(ComponentSnapshot::group).thenComparing(ComponentSnapshot::name))
                .map(s -> Map.<String, Object>of(
                        "name", s.name(),
                        "group", s.group().name(),
                        "status", s.status().name(),
                        "since", s.since().toString()))
                .toList();
        return ResponseEntity.ok(Map.of(
                "loop", dispatcher.isLooping() ? "running" : "stopped",
                "keyPhrases", dispatcher.getKeyPhrases().stream().map(k -> k.source()).toList(),
                "components", components));
    }
}
