package dumb.narsese.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

public class Json {
    private static final Logger logger = LoggerFactory.getLogger(Json.class);

    public static final ObjectMapper the = JsonMapper.builder()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .build();

    /** Single-line form, for one value per output line. */
    private static final ObjectMapper compact = JsonMapper.builder().build();

    public static String str(Object obj) {
        return str(obj, true);
    }

    public static String str(Object obj, boolean pretty) {
        try {
            return (pretty ? the : compact).writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            logger.error("Error serializing {} to JSON", obj.getClass().getSimpleName(), e);
            return "{}";
        }
    }

    public static <T> T obj(String json, Class<T> valueType) throws JsonProcessingException {
        return the.readValue(json, valueType);
    }

    public static <T> T obj(InputStream json, Class<T> valueType) throws IOException {
        return the.readValue(json, valueType);
    }

    public static ObjectNode node() {
        return the.createObjectNode();
    }

    public static JsonNode tree(String json) throws JsonProcessingException {
        return the.readTree(json);
    }
}
