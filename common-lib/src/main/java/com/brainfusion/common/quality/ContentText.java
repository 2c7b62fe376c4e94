package com.brainfusion.common.quality;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Locale;
import java.util.Map;

/**
 * Serialized form of update content, used for size checks and keyword scans.
 */
final class ContentText {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private ContentText() {}

    static String serialize(Map<String, Object> content) {
        if (content == null) {
            return "";
        }
        try {
            return MAPPER.writeValueAsString(content);
        } catch (JsonProcessingException e) {
            return String.valueOf(content);
        }
    }

    static String lowercase(Map<String, Object> content) {
        return serialize(content).toLowerCase(Locale.ROOT);
    }
}
