package work.cellium.kernel.router;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.cellium.kernel.cell.ArgumentValue;
import work.cellium.kernel.error.ErrorKind;

/**
 * Turns the raw argument string of an {@link Address} into an {@link ArgumentValue}.
 *
 * <p>Text starting with <code>{</code> is tried as a JSON object and text starting with
 * {@code [} as a JSON array. Anything else, and any structure that fails to parse, is passed
 * through as {@link ArgumentValue.Text} of the original string. Decoding never throws.
 */
public final class ArgumentDecoder {
    private static final Logger log = LoggerFactory.getLogger(ArgumentDecoder.class);
    private static final ObjectMapper JSON = new ObjectMapper()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<Object>> LIST_TYPE = new TypeReference<>() {};

    private ArgumentDecoder() {}

    public static ArgumentValue decode(String raw) {
        if (raw == null || raw.isEmpty()) {
            return ArgumentValue.text("");
        }
        var trimmed = raw.strip();
        if (trimmed.isEmpty()) {
            return ArgumentValue.text(raw);
        }
        char first = trimmed.charAt(0);
        if (first != '{' && first != '[') {
            return ArgumentValue.text(raw);
        }
        try {
            Object parsed = first == '{' ? JSON.readValue(trimmed, MAP_TYPE) : JSON.readValue(trimmed, LIST_TYPE);
            if (parsed == null) {
                return ArgumentValue.text(raw);
            }
            return ArgumentValue.fromPlain(parsed);
        } catch (JsonProcessingException ex) {
            log.debug("{}: keeping '{}' as text ({})", ErrorKind.ARGUMENT_DECODE_FALLBACK.code(), Address.abbreviate(raw), ex.getOriginalMessage());
            return ArgumentValue.text(raw);
        }
    }
}
