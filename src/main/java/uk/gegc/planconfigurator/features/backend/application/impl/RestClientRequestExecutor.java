package uk.gegc.planconfigurator.features.backend.application.impl;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import uk.gegc.planconfigurator.features.backend.application.BackendProperties;
import uk.gegc.planconfigurator.features.backend.application.BackendStructuredLogger;
import uk.gegc.planconfigurator.features.backend.application.RequestExecutor;
import uk.gegc.planconfigurator.features.backend.application.RequestLifecycleListener;
import uk.gegc.planconfigurator.features.backend.application.SlotSequencer;
import uk.gegc.planconfigurator.features.backend.application.error.ErrorNormalizer;
import uk.gegc.planconfigurator.features.backend.domain.exception.AuthenticationRequiredException;
import uk.gegc.planconfigurator.features.backend.domain.exception.BackendCallException;
import uk.gegc.planconfigurator.features.backend.domain.exception.NetworkException;
import uk.gegc.planconfigurator.features.backend.domain.exception.SupersededRequestException;
import uk.gegc.planconfigurator.features.backend.domain.model.BinaryPayload;
import uk.gegc.planconfigurator.features.backend.domain.model.ErrorEnvelope;
import uk.gegc.planconfigurator.features.backend.domain.model.ErrorKind;
import uk.gegc.planconfigurator.features.backend.domain.model.ExecutionOptions;
import uk.gegc.planconfigurator.features.backend.domain.model.RequestCompletedEvent;
import uk.gegc.planconfigurator.features.backend.domain.model.RequestDescriptor;
import uk.gegc.planconfigurator.features.backend.domain.model.RequestStartedEvent;
import uk.gegc.planconfigurator.features.backend.domain.model.ResponseEnvelope;
import uk.gegc.planconfigurator.features.backend.domain.model.SlotTicket;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadLocalRandom;

/**
 * {@link RequestExecutor} on Spring's {@link RestClient}.
 * <p>
 * Idempotent requests are retried on transport failures and timeouts with exponential
 * backoff; error responses are never retried. An idempotent call made with a slot scope takes
 * a ticket for its slot, and a call whose ticket was overtaken by a newer call from the same
 * scope settles with {@link SupersededRequestException} instead of its own result. Calls without
 * a scope, and non-idempotent calls, always deliver their own result.
 */
@Slf4j
@Service
public class RestClientRequestExecutor implements RequestExecutor {

    private final RestClient restClient;
    private final BackendProperties properties;
    private final ErrorNormalizer errorNormalizer;
    private final SlotSequencer slotSequencer;
    private final List<RequestLifecycleListener> listeners;
    private final Executor taskExecutor;
    private final ObjectMapper objectMapper;

    public RestClientRequestExecutor(@Qualifier("backendRestClient") RestClient restClient,
                                     BackendProperties properties,
                                     ErrorNormalizer errorNormalizer,
                                     SlotSequencer slotSequencer,
                                     List<RequestLifecycleListener> listeners,
                                     @Qualifier("backendTaskExecutor") Executor taskExecutor,
                                     ObjectMapper objectMapper) {
        this.restClient = restClient;
        this.properties = properties;
        this.errorNormalizer = errorNormalizer;
        this.slotSequencer = slotSequencer;
        this.listeners = List.copyOf(listeners);
        this.taskExecutor = taskExecutor;
        this.objectMapper = objectMapper;
    }

    @Override
    public CompletableFuture<ResponseEnvelope> execute(RequestDescriptor descriptor, ExecutionOptions options) {
        ExecutionOptions effective = options != null ? options : ExecutionOptions.unauthenticated();
        if (!descriptor.publicAccess() && !effective.hasAuthToken()) {
            return CompletableFuture.failedFuture(new AuthenticationRequiredException(descriptor.operation()));
        }

        SlotTicket ticket = raceGuarded(descriptor, effective)
                ? slotSequencer.issue(descriptor.slotKey(effective.slotScope()))
                : null;
        CompletableFuture<ResponseEnvelope> result = new CompletableFuture<>();
        try {
            taskExecutor.execute(() -> run(descriptor, effective, ticket, result));
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(new NetworkException(descriptor.operation(),
                    ErrorEnvelope.of(ErrorKind.NETWORK, "Backend executor rejected the request"), 0, e));
        }
        return result;
    }

    private void run(RequestDescriptor descriptor, ExecutionOptions options, SlotTicket ticket,
                     CompletableFuture<ResponseEnvelope> result) {
        try {
            ResponseEnvelope response = executeWithRetry(descriptor, options, ticket);
            if (isCurrent(ticket)) {
                result.complete(response);
            } else {
                discardStale(descriptor, ticket, result);
            }
        } catch (BackendCallException e) {
            if (isCurrent(ticket)) {
                result.completeExceptionally(e);
            } else {
                discardStale(descriptor, ticket, result);
            }
        } catch (Throwable e) {
            // the worker thread must never leave the caller's future pending
            log.error("Unexpected failure executing backend operation '{}'", descriptor.operation(), e);
            result.completeExceptionally(e);
        }
    }

    private static boolean raceGuarded(RequestDescriptor descriptor, ExecutionOptions options) {
        return options.hasSlotScope() && descriptor.idempotent();
    }

    private boolean isCurrent(SlotTicket ticket) {
        return ticket == null || slotSequencer.isCurrent(ticket);
    }

    private ResponseEnvelope executeWithRetry(RequestDescriptor descriptor, ExecutionOptions options, SlotTicket ticket) {
        int maxAttempts = descriptor.idempotent() ? properties.getRetry().getMaxRetries() + 1 : 1;
        URI uri = descriptor.toUri(properties.getBaseUrl());
        Object body = options.body() != null ? options.body() : descriptor.body();
        int attempt = 0;

        while (true) {
            attempt++;
            long startNanos = System.nanoTime();
            notifyStarted(new RequestStartedEvent(descriptor.operation(), descriptor.method(), uri.toString(),
                    descriptor.slotKey(), attempt, Instant.now()));

            try {
                ResponseEnvelope response = exchange(descriptor, uri, options.authToken(), body);
                notifyCompleted(new RequestCompletedEvent(descriptor.operation(), descriptor.method(), descriptor.slotKey(),
                        attempt, response.status(), elapsedSince(startNanos), null, false));
                return response;
            } catch (BackendCallException e) {
                notifyCompleted(new RequestCompletedEvent(descriptor.operation(), descriptor.method(), descriptor.slotKey(),
                        attempt, e.getError().status(), elapsedSince(startNanos), e.getError(), false));
                BackendStructuredLogger.logAttempt(log, "warn", "Backend returned error status {}: {}",
                        descriptor.operation(), descriptor.slotKey(), attempt, e.getError().status(), e.getMessage());
                throw e;
            } catch (ResourceAccessException | CancellationException e) {
                boolean timeout = isTimeout(e);
                ErrorEnvelope error = ErrorEnvelope.of(timeout ? ErrorKind.TIMEOUT : ErrorKind.NETWORK,
                        timeout
                                ? "Backend did not respond within " + properties.getReadTimeoutMs() + " ms"
                                : "Backend unreachable: " + rootMessage(e));
                // a superseded call stops retrying, its result would be discarded anyway
                boolean willRetry = attempt < maxAttempts && isCurrent(ticket);
                notifyCompleted(new RequestCompletedEvent(descriptor.operation(), descriptor.method(), descriptor.slotKey(),
                        attempt, null, elapsedSince(startNanos), error, willRetry));

                if (!willRetry) {
                    BackendStructuredLogger.logAttempt(log, "warn", "Backend call failed after {} attempt(s): {}",
                            descriptor.operation(), descriptor.slotKey(), attempt, attempt, error.message());
                    throw new NetworkException(descriptor.operation(), error, attempt, e);
                }

                long delayMs = calculateBackoffDelay(attempt - 1);
                BackendStructuredLogger.logAttempt(log, "info", "Transport failure ({}), retrying in {} ms",
                        descriptor.operation(), descriptor.slotKey(), attempt, error.kind(), delayMs);
                try {
                    sleepBeforeRetry(delayMs);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    ErrorEnvelope aborted = ErrorEnvelope.of(ErrorKind.NETWORK,
                            "Interrupted while waiting to retry: " + error.message());
                    throw new NetworkException(descriptor.operation(), aborted, attempt, interrupted);
                }
            }
        }
    }

    private ResponseEnvelope exchange(RequestDescriptor descriptor, URI uri, String authToken, Object body) {
        RestClient.RequestBodySpec spec = restClient.method(descriptor.method())
                .uri(uri)
                .accept(MediaType.APPLICATION_JSON);
        if (authToken != null && !authToken.isBlank()) {
            spec.header(HttpHeaders.AUTHORIZATION, "Bearer " + authToken);
        }
        if (body instanceof Map<?, ?> map && containsBinary(map)) {
            spec.contentType(MediaType.MULTIPART_FORM_DATA).body(multipartBody(map));
        } else if (body != null) {
            spec.contentType(MediaType.APPLICATION_JSON).body(body);
        }

        return spec.exchange((request, response) -> {
            int status = response.getStatusCode().value();
            JsonNode raw = parseBody(response.getBody().readAllBytes());
            if (response.getStatusCode().isError()) {
                throw errorNormalizer.normalize(descriptor.operation(), status, raw);
            }
            return ResponseEnvelope.of(status, raw);
        });
    }

    private JsonNode parseBody(byte[] bytes) {
        if (bytes.length == 0) {
            return NullNode.getInstance();
        }
        try {
            return objectMapper.reader()
                    .with(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                    .without(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES)
                    .readTree(bytes);
        } catch (IOException e) {
            // non-JSON payloads (HTML error pages, plain text) are kept verbatim
            return TextNode.valueOf(new String(bytes, StandardCharsets.UTF_8));
        }
    }

    private static boolean containsBinary(Map<?, ?> body) {
        return body.values().stream().anyMatch(BinaryPayload.class::isInstance);
    }

    private static MultiValueMap<String, Object> multipartBody(Map<?, ?> body) {
        MultiValueMap<String, Object> parts = new LinkedMultiValueMap<>();
        body.forEach((key, value) -> {
            if (value == null) {
                return;
            }
            String name = String.valueOf(key);
            if (value instanceof BinaryPayload payload) {
                HttpHeaders partHeaders = new HttpHeaders();
                partHeaders.setContentType(MediaType.parseMediaType(payload.contentType()));
                partHeaders.setContentDisposition(ContentDisposition.formData()
                        .name(name)
                        .filename(payload.fileName())
                        .build());
                parts.add(name, new HttpEntity<>(new ByteArrayResource(payload.content()), partHeaders));
            } else {
                parts.add(name, String.valueOf(value));
            }
        });
        return parts;
    }

    private void discardStale(RequestDescriptor descriptor, SlotTicket ticket, CompletableFuture<ResponseEnvelope> result) {
        BackendStructuredLogger.logAttempt(log, "debug", "Discarding result of superseded call (ticket {})",
                descriptor.operation(), ticket.slot(), 0, ticket.sequence());
        for (RequestLifecycleListener listener : listeners) {
            try {
                listener.onRequestSuperseded(descriptor.operation(), ticket.slot());
            } catch (RuntimeException e) {
                log.warn("Request listener {} failed on superseded call", listener.getClass().getSimpleName(), e);
            }
        }
        result.completeExceptionally(new SupersededRequestException(descriptor.operation(), ticket.slot()));
    }

    private void notifyStarted(RequestStartedEvent event) {
        for (RequestLifecycleListener listener : listeners) {
            try {
                listener.onRequestStarted(event);
            } catch (RuntimeException e) {
                log.warn("Request listener {} failed on start event", listener.getClass().getSimpleName(), e);
            }
        }
    }

    private void notifyCompleted(RequestCompletedEvent event) {
        for (RequestLifecycleListener listener : listeners) {
            try {
                listener.onRequestCompleted(event);
            } catch (RuntimeException e) {
                log.warn("Request listener {} failed on completion event", listener.getClass().getSimpleName(), e);
            }
        }
    }

    /**
     * Exponential backoff with jitter: base * multiplier^retry, capped at the configured maximum.
     */
    long calculateBackoffDelay(int retryCount) {
        BackendProperties.Retry retry = properties.getRetry();
        double exponentialDelay = retry.getBaseDelayMs() * Math.pow(retry.getMultiplier(), retryCount);

        double jitterRange = retry.getJitterFactor();
        double jitter = (1.0 - jitterRange) + (ThreadLocalRandom.current().nextDouble() * 2 * jitterRange);

        long delayWithJitter = (long) (exponentialDelay * jitter);
        return Math.min(delayWithJitter, retry.getMaxDelayMs());
    }

    /**
     * Sleep between retry attempts.
     * This method can be overridden in tests to avoid actual sleeping.
     */
    protected void sleepBeforeRetry(long delayMs) throws InterruptedException {
        Thread.sleep(delayMs);
    }

    /**
     * The JDK client cancels the exchange when the read timeout elapses.
     */
    private static boolean isTimeout(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof HttpTimeoutException || current instanceof SocketTimeoutException
                    || current instanceof CancellationException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static String rootMessage(Throwable error) {
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
