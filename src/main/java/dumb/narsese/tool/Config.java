package dumb.narsese.tool;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dumb.narsese.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Settings of the {@link StructureIllustrator}: read from {@code narsese.json} on the classpath,
 * then overridden by {@code -Dnarsese.<key>} system properties. Missing keys take the defaults.
 * {@code format} names the {@link dumb.narsese.fold.Vocabulary} folded values are also shown in.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Config(
        @JsonProperty("prompt") String prompt,
        @JsonProperty("fold") boolean fold,
        @JsonProperty("json") boolean json,
        @JsonProperty("pretty") boolean pretty,
        @JsonProperty("format") String format
) {
    private static final Logger logger = LoggerFactory.getLogger(Config.class);

    public static final String RESOURCE = "narsese.json";
    static final String PROPERTY_PREFIX = "narsese.";

    static final String DEFAULT_PROMPT = "> ";
    static final boolean DEFAULT_FOLD = true;
    static final boolean DEFAULT_JSON = false;
    static final boolean DEFAULT_PRETTY = true;
    static final String DEFAULT_FORMAT = "ascii";

    @JsonCreator
    public Config(
            @JsonProperty("prompt") String prompt,
            @JsonProperty("fold") Boolean fold,
            @JsonProperty("json") Boolean json,
            @JsonProperty("pretty") Boolean pretty,
            @JsonProperty("format") String format
    ) {
        this(
                prompt != null ? prompt : DEFAULT_PROMPT,
                fold != null ? fold : DEFAULT_FOLD,
                json != null ? json : DEFAULT_JSON,
                pretty != null ? pretty : DEFAULT_PRETTY,
                format != null ? format : DEFAULT_FORMAT
        );
    }

    public Config() {
        this(DEFAULT_PROMPT, DEFAULT_FOLD, DEFAULT_JSON, DEFAULT_PRETTY, DEFAULT_FORMAT);
    }

    /** Classpath file, then system properties. */
    public static Config load() {
        return load(RESOURCE, System.getProperties());
    }

    static Config load(String resource, Properties overrides) {
        var base = new Config();
        try (var in = Config.class.getClassLoader().getResourceAsStream(resource)) {
            if (in != null) base = Json.obj(in, Config.class);
            else logger.debug("no {} on the classpath, using defaults", resource);
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading " + resource, e);
        }
        return base.override(overrides);
    }

    Config override(Properties p) {
        return new Config(
                p.getProperty(PROPERTY_PREFIX + "prompt", prompt),
                bool(p, "fold", fold),
                bool(p, "json", json),
                bool(p, "pretty", pretty),
                p.getProperty(PROPERTY_PREFIX + "format", format)
        );
    }

    private static boolean bool(Properties p, String key, boolean fallback) {
        var v = p.getProperty(PROPERTY_PREFIX + key);
        return v == null ? fallback : Boolean.parseBoolean(v.trim());
    }
}
