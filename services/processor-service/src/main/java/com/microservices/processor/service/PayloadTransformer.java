package com.microservices.processor.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * The fixed transform applied to every submitted payload.
 * <p>
 * Text input yields word and character counts plus an upper-cased copy. Any other
 * JSON value yields zero counts and is passed through unchanged as {@code uppercase}.
 */
@Component
public class PayloadTransformer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private final JsonNodeFactory nodes = JsonNodeFactory.instance;

    public ObjectNode transform(JsonNode data) {
        ObjectNode result = nodes.objectNode();
        result.set("original_data", data);
        result.put("processed_at", LocalDateTime.now().toString());

        if (data != null && data.isTextual()) {
            String text = data.textValue();
            result.put("word_count", countWords(text));
            result.put("char_count", text.codePointCount(0, text.length()));
            result.put("uppercase", text.toUpperCase(Locale.ROOT));
        } else {
            result.put("word_count", 0);
            result.put("char_count", 0);
            result.set("uppercase", data);
        }
        return result;
    }

    // Unicode whitespace, so no-break and ideographic spaces separate words too
    static int countWords(String text) {
        return (int) WHITESPACE.splitAsStream(text)
                .filter(token -> !token.isEmpty())
                .count();
    }
}
