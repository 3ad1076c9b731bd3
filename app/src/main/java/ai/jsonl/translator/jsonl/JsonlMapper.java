package ai.jsonl.translator.jsonl;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Builds the {@link ObjectMapper} shared by the JSON Lines reader and writer.
 */
final class JsonlMapper {

    private JsonlMapper() {
    }

    static ObjectMapper create() {
        // decimals stay BigDecimal so that they are written back with the digits they were read with
        return new ObjectMapper()
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }
}
