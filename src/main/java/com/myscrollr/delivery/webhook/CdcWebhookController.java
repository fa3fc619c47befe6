package com.myscrollr.delivery.webhook;

import com.myscrollr.delivery.config.RoutingProperties;
import com.myscrollr.delivery.model.dto.ChangeRecord;
import com.myscrollr.delivery.model.dto.RouteResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

@RestController
@RequiredArgsConstructor
public class CdcWebhookController {

    private static final String BEARER_PREFIX = "Bearer ";

    private final CdcEnvelopeParser envelopeParser;
    private final CdcDispatchService dispatchService;
    private final RoutingProperties routingProperties;

    @PostMapping(path = "/webhooks/cdc", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<RouteResponse> receive(
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody(required = false) String body) {
        authenticate(authorization);
        List<ChangeRecord> records = envelopeParser.parse(body);
        Set<String> users = dispatchService.dispatch(records);
        return ResponseEntity.ok(new RouteResponse(new ArrayList<>(users)));
    }

    private void authenticate(String authorization) {
        if (!routingProperties.webhookAuthEnabled()) {
            return;
        }
        if (authorization == null || !authorization.startsWith(BEARER_PREFIX)) {
            throw new WebhookAuthenticationException("Missing bearer token");
        }
        byte[] presented = authorization.substring(BEARER_PREFIX.length()).trim().getBytes(StandardCharsets.UTF_8);
        byte[] expected = routingProperties.webhookSecret().getBytes(StandardCharsets.UTF_8);
        if (!MessageDigest.isEqual(presented, expected)) {
            throw new WebhookAuthenticationException("Invalid bearer token");
        }
    }
}
