package com.metricscache.domain.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.metricscache.domain.exception.PageFormatException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON reading and writing of dataset pages.
 *
 * Accepted shapes:
 * - bare record list: {@code [{...}, {...}]}
 * - envelope: {@code {"key": "...", "value": [{...}]}}
 * - list of envelopes (corpus files only): {@code [{"key": ..., "value": [...]}, ...]}
 *
 * An object is an envelope when its {@code value} field is an array; records only
 * hold scalars, so a record's own {@code value} field never qualifies.
 */
@Component
@RequiredArgsConstructor
public class DatasetPageCodec {

    private static final TypeReference<LinkedHashMap<String, Object>> RECORD_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public String writeRecords(List<Map<String, Object>> records) {
        try {
            return objectMapper.writeValueAsString(records);
        } catch (JsonProcessingException e) {
            throw new PageFormatException("Failed to serialize records", e);
        }
    }

    /**
     * Reads a single page stored under {@code key}.
     */
    public DatasetPage read(String key, String json) {
        return toPage(key, parse(key, json));
    }

    /**
     * Reads every page of a corpus document. {@code source} names the page
     * when the document is a bare record list.
     */
    public List<DatasetPage> readCorpus(String source, String json) {
        JsonNode root = parse(source, json);
        if (root.isArray() && root.size() > 0 && isEnvelope(root.get(0))) {
            List<DatasetPage> pages = new ArrayList<>(root.size());
            for (JsonNode element : root) {
                pages.add(toPage(source, element));
            }
            return pages;
        }
        if (root.isArray() && root.size() == 0) {
            return List.of();
        }
        return List.of(toPage(source, root));
    }

    private JsonNode parse(String source, String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new PageFormatException("Value of " + source + " is not JSON", e);
        }
    }

    private DatasetPage toPage(String key, JsonNode node) {
        if (node.isArray()) {
            return new DatasetPage(key, toRecords(key, node));
        }
        if (isEnvelope(node)) {
            String pageKey = node.hasNonNull("key") ? node.get("key").asText() : key;
            return new DatasetPage(pageKey, toRecords(pageKey, node.get("value")));
        }
        throw new PageFormatException("Value of " + key + " is neither a record list nor a {key, value} envelope");
    }

    private List<Map<String, Object>> toRecords(String key, JsonNode array) {
        List<Map<String, Object>> records = new ArrayList<>(array.size());
        for (JsonNode element : array) {
            if (!element.isObject()) {
                throw new PageFormatException("Page " + key + " contains a non-object record: " + element.getNodeType());
            }
            records.add(objectMapper.convertValue(element, RECORD_TYPE));
        }
        return records;
    }

    private static boolean isEnvelope(JsonNode node) {
        return node.isObject() && node.has("value") && node.get("value").isArray();
    }
}
