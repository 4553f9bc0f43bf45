package pl.marcinmilkowski.vocab_store.config;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/**
 * Loads {@link VocabConfig} from JSON.
 *
 * Expected JSON structure (every key optional, defaults shown):
 * {
 *   "oov_warmup": 10000,
 *   "min_oov_length": 3,
 *   "max_vector_components": 100000,
 *   "oov_prob": -20.0
 * }
 */
public final class VocabConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(VocabConfigLoader.class);

    static final String DEFAULTS_RESOURCE = "/vocab-defaults.json";

    private static final Set<String> KNOWN_KEYS = Set.of(
        "oov_warmup", "min_oov_length", "max_vector_components", "oov_prob"
    );

    private VocabConfigLoader() {
    }

    /**
     * @throws IOException              if the file cannot be read
     * @throws IllegalArgumentException if the content is invalid
     */
    public static VocabConfig load(Path configPath) throws IOException {
        if (!Files.exists(configPath)) {
            throw new IOException("Vocab config file not found: " + configPath);
        }
        VocabConfig config = parse(Files.readString(configPath, StandardCharsets.UTF_8));
        logger.info("Loaded vocab config from {}: {}", configPath, config);
        return config;
    }

    /**
     * Reads the bundled vocab-defaults.json.
     */
    public static VocabConfig loadDefaults() throws IOException {
        try (InputStream in = VocabConfigLoader.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new IOException("Missing classpath resource " + DEFAULTS_RESOURCE);
            }
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        }
    }

    public static VocabConfig parse(String content) {
        JSONObject root;
        try {
            root = JSON.parseObject(content);
        } catch (JSONException e) {
            throw new IllegalArgumentException("Invalid vocab config JSON: " + e.getMessage(), e);
        }
        if (root == null) {
            throw new IllegalArgumentException("Vocab config must be a JSON object");
        }

        for (String key : root.keySet()) {
            if (!KNOWN_KEYS.contains(key)) {
                throw new IllegalArgumentException("Unknown vocab config key: '" + key + "'");
            }
        }

        VocabConfig defaults = VocabConfig.defaults();
        int warmup = root.containsKey("oov_warmup")
            ? root.getIntValue("oov_warmup") : defaults.oovWarmup();
        int minLength = root.containsKey("min_oov_length")
            ? root.getIntValue("min_oov_length") : defaults.minOovLength();
        int maxComponents = root.containsKey("max_vector_components")
            ? root.getIntValue("max_vector_components") : defaults.maxVectorComponents();
        float oovProb = root.containsKey("oov_prob")
            ? root.getFloatValue("oov_prob") : defaults.oovProb();

        return new VocabConfig(warmup, minLength, maxComponents, oovProb);
    }
}
