package io.agentmail.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.agentmail.model.AttachmentKind;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Rewrites audit details before they are hashed into the log.
 *
 * <ul>
 *   <li>Credential-like keys are replaced by {@link #MASK}.</li>
 *   <li>Message content keeps only its length.</li>
 *   <li>Attachment pointers lose inline payloads and URL query strings.</li>
 *   <li>Long opaque tokens in any other string are replaced by {@link #MASK}.</li>
 * </ul>
 */
public final class SensitiveDataMasker {
    public static final String MASK = "***";
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final Set<String> CREDENTIAL_HINTS = Set.of(
            "password", "passwd", "secret", "token", "authorization", "apikey", "api_key", "credential"
    );
    private static final Set<String> CONTENT_KEYS = Set.of("body_md", "body");
    private static final Pattern OPAQUE_TOKEN = Pattern.compile("[A-Za-z0-9+=_\\-]{32,}");

    private SensitiveDataMasker() {
    }

    public static JsonNode masked(JsonNode input) {
        if (input == null || input.isNull()) {
            return NODES.nullNode();
        }
        if (input.isObject()) {
            return isAttachment(input) ? maskedAttachment(input) : maskedObject(input);
        }
        if (input.isArray()) {
            ArrayNode out = NODES.arrayNode();
            for (JsonNode value : input) {
                out.add(masked(value));
            }
            return out;
        }
        if (input.isTextual() && looksLikeToken(input.asText(""))) {
            return TextNode.valueOf(MASK);
        }
        return input;
    }

    static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        if (CONTENT_KEYS.contains(key)) {
            return true;
        }
        for (String hint : CREDENTIAL_HINTS) {
            if (key.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    static String maskPointer(AttachmentKind kind, String pointer) {
        if (pointer == null) {
            return null;
        }
        switch (kind) {
            case INLINE: {
                int comma = pointer.indexOf(',');
                return comma < 0 ? MASK : pointer.substring(0, comma + 1) + MASK;
            }
            case URL: {
                int cut = indexOfAny(pointer, '?', '#');
                return cut < 0 ? pointer : pointer.substring(0, cut);
            }
            default:
                return pointer;
        }
    }

    private static ObjectNode maskedObject(JsonNode input) {
        ObjectNode out = NODES.objectNode();
        Iterator<Map.Entry<String, JsonNode>> it = input.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            String key = entry.getKey();
            JsonNode value = entry.getValue();
            if (CONTENT_KEYS.contains(key.toLowerCase(Locale.ROOT)) && value.isTextual()) {
                out.put(key, MASK + "(" + value.asText().length() + " chars)");
            } else if (isSensitiveKey(key)) {
                out.put(key, MASK);
            } else {
                out.set(key, masked(value));
            }
        }
        return out;
    }

    private static boolean isAttachment(JsonNode node) {
        return node.path("kind").isTextual() && node.path("pointer").isTextual();
    }

    private static ObjectNode maskedAttachment(JsonNode attachment) {
        ObjectNode out = maskedObject(attachment);
        AttachmentKind kind;
        try {
            kind = AttachmentKind.fromString(attachment.path("kind").asText());
        } catch (RuntimeException e) {
            out.put("pointer", MASK);
            return out;
        }
        out.put("pointer", maskPointer(kind, attachment.path("pointer").asText()));
        return out;
    }

    private static boolean looksLikeToken(String value) {
        String v = value.trim();
        return OPAQUE_TOKEN.matcher(v).matches()
                && v.chars().anyMatch(Character::isDigit)
                && v.chars().anyMatch(Character::isLetter);
    }

    private static int indexOfAny(String s, char first, char second) {
        int a = s.indexOf(first);
        int b = s.indexOf(second);
        if (a < 0) {
            return b;
        }
        return b < 0 ? a : Math.min(a, b);
    }
}
