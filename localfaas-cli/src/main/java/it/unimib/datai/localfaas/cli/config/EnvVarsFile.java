package it.unimib.datai.localfaas.cli.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads function environment overrides from a JSON file of the form
 * {@code {"Parameters": {...}, "<FunctionName>": {...}}}. Function-specific values win over
 * {@code Parameters}; non-string values are rendered as text.
 */
public final class EnvVarsFile {
    static final String GLOBAL_SECTION = "Parameters";

    private static final ObjectMapper JSON = new ObjectMapper();

    private EnvVarsFile() {}

    public static Map<String, String> load(Path path, String functionName) {
        JsonNode root;
        try {
            root = JSON.readTree(path.toFile());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read env vars file: " + path, e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Env vars file must contain a JSON object: " + path);
        }
        Map<String, String> env = new LinkedHashMap<>();
        copySection(root.get(GLOBAL_SECTION), env);
        copySection(root.get(functionName), env);
        return env;
    }

    private static void copySection(JsonNode section, Map<String, String> env) {
        if (section == null || !section.isObject()) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = section.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value.isValueNode() && !value.isNull()) {
                env.put(field.getKey(), value.asText());
            }
        }
    }
}
