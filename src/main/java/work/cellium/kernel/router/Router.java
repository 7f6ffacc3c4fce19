package work.cellium.kernel.router;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.cellium.kernel.bus.EventBus;
import work.cellium.kernel.error.ErrorKind;
import work.cellium.kernel.error.KernelException;
import work.cellium.kernel.runtime.Registry;

/**
 * Single entry point for inbound view messages.
 *
 * <p>A message whose first non-blank character is <code>{</code> or {@code [} is an event
 * envelope {@code {"event_name": ..., "payload": {...}}} and is published on the
 * {@link EventBus}; anything else is a {@code cell:command:args} command dispatched synchronously
 * to the registered cell. {@link #handle} always returns a reply string: failures are encoded as
 * {@code {"error": "<Kind>", "message": "<detail>"}}.
 */
public final class Router {
    private static final Logger log = LoggerFactory.getLogger(Router.class);
    private static final ObjectMapper JSON = new ObjectMapper()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final Registry registry;
    private final EventBus eventBus;

    public Router(Registry registry, EventBus eventBus) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
    }

    public String handle(String message) {
        try {
            if (message == null) {
                return Replies.error(ErrorKind.INVALID_MESSAGE, "Message is null");
            }
            if (isEventEnvelope(message)) {
                return handleEvent(message);
            }
            return handleCommand(message);
        } catch (KernelException ex) {
            log.warn("Rejected message: {}", ex.getMessage());
            return Replies.error(ex);
        } catch (RuntimeException | StackOverflowError | LinkageError | AssertionError ex) {
            log.error("Unexpected failure while routing a message", ex);
            return Replies.error(ErrorKind.INTERNAL_ERROR, describe(ex));
        }
    }

    private String handleCommand(String message) {
        var address = Address.parse(message);
        var handler = registry.command(address.cellName(), address.command());
        var args = ArgumentDecoder.decode(address.rawArgs());
        Object result;
        try {
            result = handler.handle(args);
        } catch (KernelException ex) {
            log.warn("{} failed with {}: {}", address, ex.kind().code(), ex.getMessage());
            return Replies.error(ex);
        } catch (Exception | StackOverflowError | LinkageError | AssertionError ex) {
            // other VirtualMachineErrors leave the JVM unusable and are not handler failures
            log.error("Handler {} failed", address, ex);
            return Replies.error(ErrorKind.HANDLER_FAILURE, describe(ex));
        }
        var reply = Replies.result(result);
        log.debug("{} -> {} char(s)", address, reply.length());
        return reply;
    }

    private String handleEvent(String message) {
        JsonNode root;
        try {
            root = JSON.readTree(message);
        } catch (JsonProcessingException ex) {
            return invalidEvent("Malformed event envelope: " + ex.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            return invalidEvent("Event envelope must be a JSON object");
        }
        var nameNode = root.get("event_name");
        if (nameNode == null || !nameNode.isTextual() || nameNode.asText().isBlank()) {
            return invalidEvent("Event envelope requires a non-empty string 'event_name'");
        }
        var payloadNode = root.get("payload");
        Map<String, Object> payload;
        if (payloadNode == null || payloadNode.isNull()) {
            payload = Map.of();
        } else if (payloadNode.isObject()) {
            payload = JSON.convertValue(payloadNode, MAP_TYPE);
        } else {
            return invalidEvent("Event 'payload' must be a JSON object");
        }
        var eventName = nameNode.asText();
        var report = eventBus.publish(eventName, payload);
        log.debug("Event '{}' delivered to {} subscriber(s), {} failure(s)", eventName, report.delivered(), report.failures().size());
        return Replies.eventAck(eventName, report.delivered());
    }

    private static String invalidEvent(String detail) {
        log.warn("Rejected event: {}", detail);
        return Replies.error(ErrorKind.INVALID_MESSAGE, detail);
    }

    private static boolean isEventEnvelope(String message) {
        for (int i = 0; i < message.length(); i++) {
            char c = message.charAt(i);
            if (!Character.isWhitespace(c)) {
                return c == '{' || c == '[';
            }
        }
        return false;
    }

    private static String describe(Throwable ex) {
        var message = ex.getMessage();
        return message == null || message.isBlank() ? ex.getClass().getSimpleName() : ex.getClass().getSimpleName() + ": " + message;
    }
}
