package it.unimib.datai.localfaas.cli.commands.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.Map;

/**
 * Sample trigger payloads loaded from {@code /events/<name>.json}. Every {@code {{key}}} inside a
 * string value is replaced with the matching parameter.
 */
public final class EventTemplates {
    private static final ObjectMapper JSON = new ObjectMapper();

    private EventTemplates() {}

    public static JsonNode render(String name, Map<String, String> parameters) {
        JsonNode template;
        try (InputStream in = EventTemplates.class.getResourceAsStream("/events/" + name + ".json")) {
            if (in == null) {
                throw new IllegalArgumentException("Unknown event template: " + name);
            }
            template = JSON.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load event template " + name, e);
        }
        return substitute(template, parameters);
    }

    public static String renderPretty(String name, Map<String, String> parameters) {
        try {
            return JSON.writerWithDefaultPrettyPrinter().writeValueAsString(render(name, parameters));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write event " + name, e);
        }
    }

    private static JsonNode substitute(JsonNode node, Map<String, String> parameters) {
        if (node.isTextual()) {
            String text = node.textValue();
            for (Map.Entry<String, String> p : parameters.entrySet()) {
                text = text.replace("{{" + p.getKey() + "}}", p.getValue());
            }
            return TextNode.valueOf(text);
        }
        if (node.isObject()) {
            ObjectNode object = (ObjectNode) node;
            Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                field.setValue(substitute(field.getValue(), parameters));
            }
            return object;
        }
        if (node.isArray()) {
            ArrayNode array = (ArrayNode) node;
            for (int i = 0; i < array.size(); i++) {
                array.set(i, substitute(array.get(i), parameters));
            }
            return array;
        }
        return node;
    }
}
