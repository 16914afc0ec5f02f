package com.example.kiosksync.gateway;

import com.example.kiosksync.error.*;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.ClientResponse;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Shared plumbing of the HTTP gateways: blocking with a timeout and turning the backend's
 * error bodies back into the exceptions the embedded gateways throw.
 */
class RemoteCalls {

    private static final Logger logger = LoggerFactory.getLogger(RemoteCalls.class);

    private final String target;
    private final Duration timeout;

    RemoteCalls(String target, Duration timeout) {
        this.target = target;
        this.timeout = timeout;
    }

    <R> R call(String what, Mono<R> request) {
        try {
            return request.block(timeout);
        } catch (SyncException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.warn("Remote {} {} failed: {}", target, what, e.getMessage());
            throw new RemoteUnavailableException(target + " " + what + " failed: " + e.getMessage(), e);
        }
    }

    /** The body of a call that must answer with one; an empty 2xx counts as an outage. */
    <R> R require(String what, R body) {
        if (body == null) {
            logger.warn("Remote {} {} answered without a body", target, what);
            throw new RemoteUnavailableException(target + " " + what + " answered without a body");
        }
        return body;
    }

    /** The {@code version} field a write answered with. */
    long version(String what, JsonNode body) {
        JsonNode version = require(what, body).path("version");
        if (!version.isIntegralNumber()) {
            logger.warn("Remote {} {} answered without a version: {}", target, what, body);
            throw new RemoteUnavailableException(target + " " + what + " answered without a version");
        }
        return version.asLong();
    }

    Mono<? extends Throwable> toException(ClientResponse response) {
        int status = response.statusCode().value();
        return response.bodyToMono(JsonNode.class)
                .defaultIfEmpty(MissingNode.getInstance())
                .onErrorReturn(MissingNode.getInstance())
                .map(body -> translate(status, body));
    }

    Throwable translate(int status, JsonNode body) {
        String error = body.path("error").asText("");
        String message = body.path("message").asText("HTTP " + status);
        String id = body.path("id").asText("");
        switch (status) {
            case 404:
                return new NotFoundException(target, id);
            case 409:
                if (ApiErrors.VERSION_CONFLICT.equals(error)) {
                    return new VersionConflictException(id,
                            body.path("currentVersion").asLong(),
                            body.path("expectedVersion").asLong());
                }
                return new DuplicateEntityException(target, id);
            case 400:
                if (ApiErrors.RESERVED_ID.equals(error)) {
                    return new ReservedIdentifierException(body.path("name").asText(id), id);
                }
                return new InvalidRequestException(message);
            default:
                return new RemoteUnavailableException(target + " backend answered " + status + ": " + message);
        }
    }
}
