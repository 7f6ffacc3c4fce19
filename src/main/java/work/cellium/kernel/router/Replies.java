package work.cellium.kernel.router;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import work.cellium.kernel.cell.ArgumentValue;
import work.cellium.kernel.error.ErrorKind;
import work.cellium.kernel.error.KernelException;

/**
 * Reply encoding shared by the command and event paths.
 */
public final class Replies {
    private static final ObjectMapper JSON = new ObjectMapper();

    private Replies() {}

    /**
     * Stringifies a handler result: strings as is, {@code null} and an empty {@link Optional} as the
     * empty string, a present {@code Optional} as its content. Maps, collections, arrays, argument
     * values and records are JSON; any other value goes through {@link String#valueOf}.
     *
     * @throws KernelException of kind {@link ErrorKind#HANDLER_FAILURE} when the result cannot be
     *     serialised
     */
    public static String result(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof String text) {
            return text;
        }
        if (value instanceof Optional<?> optional) {
            return result(optional.orElse(null));
        }
        if (value instanceof ArgumentValue argument) {
            return argument instanceof ArgumentValue.Text text ? text.value() : json(argument.toPlain());
        }
        if (value instanceof Map<?, ?> || value instanceof Collection<?> || value.getClass().isArray() || value.getClass().isRecord()) {
            return json(value);
        }
        return String.valueOf(value);
    }

    public static String error(ErrorKind kind, String message) {
        var body = new LinkedHashMap<String, Object>();
        body.put("error", kind.code());
        body.put("message", message == null ? "" : message);
        return writeQuietly(body);
    }

    public static String error(KernelException ex) {
        return error(ex.kind(), ex.getMessage());
    }

    public static String eventAck(String eventName, int delivered) {
        var body = new LinkedHashMap<String, Object>();
        body.put("status", "ok");
        body.put("event", eventName);
        body.put("delivered", delivered);
        return writeQuietly(body);
    }

    private static String json(Object value) {
        try {
            return JSON.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new KernelException(
                ErrorKind.HANDLER_FAILURE,
                "Result of type " + value.getClass().getName() + " is not serialisable: " + ex.getOriginalMessage(),
                ex
            );
        }
    }

    private static String writeQuietly(Map<String, Object> body) {
        try {
            return JSON.writeValueAsString(body);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to encode reply envelope", ex);
        }
    }
}
