package it.unimib.datai.localfaas.emulator.controlplane;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.unimib.datai.localfaas.common.model.FunctionError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the error document a worker posts. Anything that is not a JSON object with a textual
 * {@code errorMessage} becomes {@link FunctionError#invalidShape()}.
 */
final class ErrorPayloadParser {
    private static final Logger log = LoggerFactory.getLogger(ErrorPayloadParser.class);
    private static final int MAX_CAUSE_DEPTH = 16;

    private final ObjectMapper objectMapper;

    ErrorPayloadParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    FunctionError parseUnhandled(byte[] body, String headerType) {
        JsonNode root = readObject(body);
        if (root == null) {
            return FunctionError.invalidShape();
        }
        FunctionError error = toError(root, 0);
        if (error == null) {
            return FunctionError.invalidShape();
        }
        String type = error.errorType() != null ? error.errorType() : blankToNull(headerType);
        return FunctionError.unhandled(error.errorMessage(), type, error.stackTrace(), error.cause());
    }

    FunctionError parseInitError(byte[] body, String headerType) {
        JsonNode root = readObject(body);
        FunctionError error = root == null ? null : toError(root, 0);
        if (error == null) {
            return FunctionError.invalidShape();
        }
        String type = error.errorType() != null ? error.errorType() : blankToNull(headerType);
        return FunctionError.initError(error.errorMessage(), type, error.stackTrace());
    }

    private JsonNode readObject(byte[] body) {
        if (body == null || body.length == 0) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            return node != null && node.isObject() ? node : null;
        } catch (IOException e) {
            log.debug("Unparseable error payload: {}", e.getMessage());
            return null;
        }
    }

    private FunctionError toError(JsonNode node, int depth) {
        JsonNode message = node.get("errorMessage");
        if (message == null || !message.isTextual()) {
            return null;
        }
        JsonNode type = node.get("errorType");
        List<String> stack = new ArrayList<>();
        JsonNode trace = node.get("stackTrace");
        if (trace != null && trace.isArray()) {
            trace.forEach(frame -> stack.add(frame.isTextual() ? frame.asText() : frame.toString()));
        }
        FunctionError cause = null;
        JsonNode causeNode = node.get("cause");
        if (causeNode != null && causeNode.isObject() && depth < MAX_CAUSE_DEPTH) {
            cause = toError(causeNode, depth + 1);
        }
        String typeText = type != null && type.isTextual() ? type.asText() : null;
        return FunctionError.unhandled(message.asText(), typeText, stack, cause);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
