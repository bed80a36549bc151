package com.sdclogin.auth.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.util.ContentCachingRequestWrapper;
import org.springframework.web.util.WebUtils;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Renders a request body for logging with credential fields masked.
 * <p>
 * JSON bodies are parsed and any field whose name contains password, token or secret
 * (case-insensitive, at any depth) is replaced by {@value #REDACTED}. A body that is not
 * JSON is summarised by its size only, since it cannot be masked reliably.
 */
@Component
@RequiredArgsConstructor
public class RequestPayloadRedactor {

    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> SENSITIVE_PATTERNS = Set.of("password", "token", "secret");

    private final ObjectMapper objectMapper;

    /**
     * Redacted body of the current request, or an empty string if none was read.
     */
    public String describe(HttpServletRequest request) {
        ContentCachingRequestWrapper wrapper =
                WebUtils.getNativeRequest(request, ContentCachingRequestWrapper.class);
        if (wrapper == null) {
            return "";
        }
        return redact(wrapper.getContentAsByteArray());
    }

    public String redact(byte[] content) {
        if (content == null || content.length == 0) {
            return "";
        }
        try {
            JsonNode node = objectMapper.readTree(content);
            mask(node);
            return objectMapper.writeValueAsString(node);
        } catch (IOException ex) {
            return "<" + content.length + " bytes, not JSON>";
        }
    }

    boolean isSensitive(String fieldName) {
        String lower = fieldName.toLowerCase(Locale.ROOT);
        return SENSITIVE_PATTERNS.stream().anyMatch(lower::contains);
    }

    private void mask(JsonNode node) {
        if (node instanceof ObjectNode object) {
            List<String> names = new ArrayList<>();
            object.fieldNames().forEachRemaining(names::add);
            for (String name : names) {
                if (isSensitive(name)) {
                    object.put(name, REDACTED);
                } else {
                    mask(object.get(name));
                }
            }
        } else if (node instanceof ArrayNode array) {
            array.forEach(this::mask);
        }
    }
}
