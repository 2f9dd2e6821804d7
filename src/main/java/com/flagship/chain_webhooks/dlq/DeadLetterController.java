package com.flagship.chain_webhooks.dlq;

import com.flagship.chain_webhooks.dlq.dto.DeadLetterResponse;
import com.flagship.chain_webhooks.dlq.dto.ResolveDeadLetterRequest;
import com.flagship.chain_webhooks.event.Network;
import com.flagship.chain_webhooks.exception.UnsupportedNetworkException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Operator endpoints for the dead letter queue.
 */
@RestController
@RequestMapping("/api/admin/dlq")
@RequiredArgsConstructor
@Slf4j
public class DeadLetterController {

    private final DeadLetterQueue deadLetterQueue;

    @GetMapping
    public List<DeadLetterResponse> list(
            @RequestParam(value = "network", required = false) String network,
            @RequestParam(value = "limit", defaultValue = "" + DeadLetterQueue.DEFAULT_LIST_LIMIT) int limit) {
        Network filter = network == null || network.isBlank()
            ? null
            : Network.fromPath(network).orElseThrow(() -> new UnsupportedNetworkException(network));
        return deadLetterQueue.list(filter, limit).stream()
            .map(DeadLetterResponse::from)
            .toList();
    }

    @GetMapping("/{eventId}")
    public DeadLetterResponse get(@PathVariable("eventId") String eventId) {
        return DeadLetterResponse.from(deadLetterQueue.get(eventId));
    }

    @PostMapping("/{eventId}/replay")
    public ResponseEntity<DeadLetterResponse> replay(@PathVariable("eventId") String eventId) {
        log.info("Operator requested replay of dead letter {}", eventId);
        DeadLetterEvent superseded = deadLetterQueue.replay(eventId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(DeadLetterResponse.from(superseded));
    }

    @PostMapping("/{eventId}/resolve")
    public DeadLetterResponse resolve(@PathVariable("eventId") String eventId,
                                      @Valid @RequestBody ResolveDeadLetterRequest request) {
        return DeadLetterResponse.from(deadLetterQueue.resolve(eventId, request.getNotes()));
    }
}
