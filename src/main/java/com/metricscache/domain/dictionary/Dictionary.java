package com.metricscache.domain.dictionary;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bijective code tables for field names and stringified field values.
 *
 * Codes are dense from 1 in first-seen order. The instance is immutable; the
 * reverse index (code to token) is built once at construction. A dictionary is
 * only meaningful against the corpus snapshot it was built from.
 *
 * Persisted as {@code {"keys": {fieldName: code}, "values": {value: code}}}.
 */
public final class Dictionary {

    private final Map<String, Integer> keyCodes;
    private final Map<String, Integer> valueCodes;
    private final Map<String, String> keysByCode;
    private final Map<String, String> valuesByCode;

    @JsonCreator
    public Dictionary(@JsonProperty("keys") Map<String, Integer> keyCodes,
                      @JsonProperty("values") Map<String, Integer> valueCodes) {
        this.keyCodes = Collections.unmodifiableMap(new LinkedHashMap<>(keyCodes == null ? Map.of() : keyCodes));
        this.valueCodes = Collections.unmodifiableMap(new LinkedHashMap<>(valueCodes == null ? Map.of() : valueCodes));
        this.keysByCode = reverse(this.keyCodes);
        this.valuesByCode = reverse(this.valueCodes);
    }

    @JsonProperty("keys")
    public Map<String, Integer> getKeyCodes() {
        return keyCodes;
    }

    @JsonProperty("values")
    public Map<String, Integer> getValueCodes() {
        return valueCodes;
    }

    public Integer keyCode(String fieldName) {
        return keyCodes.get(fieldName);
    }

    public Integer valueCode(String value) {
        return valueCodes.get(value);
    }

    /**
     * Field name for an encoded key, or null when the code is unknown.
     */
    public String fieldName(String code) {
        return keysByCode.get(code);
    }

    public String value(String code) {
        return valuesByCode.get(code);
    }

    private static Map<String, String> reverse(Map<String, Integer> codes) {
        Map<String, String> reversed = new HashMap<>(codes.size() * 2);
        codes.forEach((token, code) -> reversed.put(String.valueOf(code), token));
        return Collections.unmodifiableMap(reversed);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Dictionary that = (Dictionary) o;
        return keyCodes.equals(that.keyCodes) && valueCodes.equals(that.valueCodes);
    }

    @Override
    public int hashCode() {
        return 31 * keyCodes.hashCode() + valueCodes.hashCode();
    }

    @Override
    public String toString() {
        return "Dictionary{keys=" + keyCodes.size() + ", values=" + valueCodes.size() + '}';
    }
}
