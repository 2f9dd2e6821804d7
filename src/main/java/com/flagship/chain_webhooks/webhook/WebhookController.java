package com.flagship.chain_webhooks.webhook;

import com.flagship.chain_webhooks.webhook.dto.WebhookResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Receives confirmation webhooks from the blockchain monitoring provider.
 *
 * The body is bound as raw bytes so the signature is checked against exactly
 * what was sent. Responds as soon as the event is queued:
 * - 200 accepted, or unattributed when no trade owns the addresses
 * - 401 bad or missing X-Signature
 * - 400 malformed payload
 * - 404 unsupported network
 * - 503 queue full (the provider redelivers)
 */
@RestController
@RequestMapping("/webhooks")
@RequiredArgsConstructor
@Slf4j
public class WebhookController {

    static final String SIGNATURE_HEADER = "X-Signature";

    private final WebhookIngestionService ingestionService;

    @PostMapping("/{network}")
    public ResponseEntity<WebhookResponse> receive(
            @PathVariable("network") String network,
            @RequestBody(required = false) byte[] body,
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature) {

        long startTime = System.currentTimeMillis();
        try {
            IngestionResult result = ingestionService.ingest(network, body, signature);
            return ResponseEntity.ok(WebhookResponse.from(result));
        } finally {
            log.debug("Webhook request on {} handled in {}ms", network, System.currentTimeMillis() - startTime);
        }
    }
}
