package com.vidnyan.ust.adapter.out.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.ust.domain.model.UniversalSyntaxTree;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.util.Map;

/**
 * JSON form of the canonical tree map.
 *
 * Jackson reads integral numbers back as Integer, Long or BigInteger and
 * fractions as Double, the same types the parsers store, so
 * {@code fromJson(toJson(t))} reproduces {@code t}.
 */
@Component
@RequiredArgsConstructor
public class UstJsonCodec {

    private static final TypeReference<Map<String, Object>> CANONICAL_MAP = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public String toJson(UniversalSyntaxTree tree) {
        try {
            return objectMapper.writeValueAsString(tree.toCanonical());
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize syntax tree", e);
        }
    }

    /**
     * @throws IllegalArgumentException if the text is not a canonical tree
     */
    public UniversalSyntaxTree fromJson(String json) {
        Map<String, Object> map;
        try {
            map = objectMapper.readValue(json, CANONICAL_MAP);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed syntax tree JSON: " + e.getOriginalMessage(), e);
        }
        if (map == null) {
            throw new IllegalArgumentException("Malformed syntax tree JSON: empty document");
        }
        return UniversalSyntaxTree.fromCanonical(map);
    }
}
