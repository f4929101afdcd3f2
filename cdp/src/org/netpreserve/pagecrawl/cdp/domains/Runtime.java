package org.netpreserve.pagecrawl.cdp.domains;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.netpreserve.pagecrawl.cdp.protocol.RPC;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

public interface Runtime {
    Evaluate evaluate(String expression, Integer timeout, boolean returnByValue, boolean awaitPromise,
                      ExecutionContextUniqueId uniqueContextId);

    void enable();

    record Evaluate(RemoteObject result, ExceptionDetails exceptionDetails) {
    }

    record RemoteObject(String type, String subtype, JsonNode value) {
        public Object toJavaObject() {
            if (value == null || value.isNull()) return null;
            switch (type) {
                case "string":
                    return value.asText();
                case "number":
                    return value.numberValue();
                case "boolean":
                    return value.asBoolean();
                case "object":
                    try {
                        if (value.isArray()) {
                            return RPC.JSON.treeToValue(value, List.class);
                        }
                        return RPC.JSON.treeToValue(value, Map.class);
                    } catch (JsonProcessingException e) {
                        throw new UncheckedIOException(e);
                    }
                case "undefined":
                    return null;
                default:
                    throw new IllegalStateException("Don't know how to convert to Java object: " + type);
            }
        }
    }

    record ExceptionDetails(int exceptionId, String text, int lineNumber, int columnNumber, RemoteObject exception) {
    }

    record ExecutionContextUniqueId(@JsonValue String value) {
        @JsonCreator
        public ExecutionContextUniqueId {
        }
    }
}
