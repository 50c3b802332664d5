package com.stagecraft.engine.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.stagecraft.engine.provider.MalformedCallbackException;
import com.stagecraft.engine.provider.ProviderNotFoundException;
import com.stagecraft.engine.service.ProviderCallbackHandler;
import com.stagecraft.engine.service.TransitionResult;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

/**
 * Inbound provider notifications.
 *
 * POST /webhooks/{provider}
 *
 * HTTP 200: event received (including duplicates, which are no-ops)
 * HTTP 400: body is not a callback this provider sends
 * HTTP 404: unknown provider, or no job with this handle
 */
@RestController
@RequestMapping("/webhooks")
public class ProviderWebhookController {

    private final ProviderCallbackHandler callbackHandler;

    public ProviderWebhookController(ProviderCallbackHandler callbackHandler) {
        this.callbackHandler = callbackHandler;
    }

    @PostMapping("/{provider}")
    public Map<String, Object> receive(@PathVariable String provider, @RequestBody JsonNode body) {
        TransitionResult result;
        try {
            result = callbackHandler.handle(provider, body);
        } catch (ProviderNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage(), e);
        } catch (MalformedCallbackException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
        if (result == TransitionResult.UNKNOWN_HANDLE) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No job known for this callback");
        }
        return Map.of("received", true, "outcome", result.name());
    }
}
