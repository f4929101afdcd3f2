package org.netpreserve.pagecrawl.util;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a command line either as a list of arguments or as a single string split the way a POSIX shell would split
 * it, so {@code "ssh -i 'key file' user@host"} and {@code [ssh, -i, key file, user@host]} are equivalent.
 */
public class CommandLineDeserializer extends JsonDeserializer<List<String>> {
    @Override
    public List<String> deserialize(JsonParser jsonParser, DeserializationContext context) throws IOException, JacksonException {
        JsonNode node = jsonParser.getCodec().readTree(jsonParser);
        if (node.isArray()) {
            List<String> args = new ArrayList<>(node.size());
            node.forEach(element -> args.add(element.asText()));
            return args;
        }
        if (!node.isTextual()) {
            throw new InvalidFormatException(jsonParser, "Expected a command line string or a list of arguments",
                    node.toString(), List.class);
        }
        try {
            return split(node.asText());
        } catch (IllegalArgumentException e) {
            throw new InvalidFormatException(jsonParser, e.getMessage(), node.asText(), List.class);
        }
    }

    /**
     * Splits on unquoted whitespace. Single quotes preserve everything literally; inside double quotes and unquoted
     * text a backslash escapes the next character.
     *
     * @throws IllegalArgumentException on an unterminated quote or a trailing backslash
     */
    public static List<String> split(String commandLine) {
        List<String> args = new ArrayList<>();
        var current = new StringBuilder();
        boolean inArg = false;
        char quote = 0;
        for (int i = 0; i < commandLine.length(); i++) {
            char c = commandLine.charAt(i);
            if (quote == '\'') {
                if (c == '\'') quote = 0;
                else current.append(c);
            } else if (c == '\\') {
                if (++i == commandLine.length()) throw new IllegalArgumentException("Trailing backslash in: " + commandLine);
                current.append(commandLine.charAt(i));
                inArg = true;
            } else if (quote == '"') {
                if (c == '"') quote = 0;
                else current.append(c);
            } else if (c == '\'' || c == '"') {
                quote = c;
                inArg = true;
            } else if (Character.isWhitespace(c)) {
                if (inArg) {
                    args.add(current.toString());
                    current.setLength(0);
                    inArg = false;
                }
            } else {
                current.append(c);
                inArg = true;
            }
        }
        if (quote != 0) throw new IllegalArgumentException("Unterminated " + quote + " quote in: " + commandLine);
        if (inArg) args.add(current.toString());
        return args;
    }
}
