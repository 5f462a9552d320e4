package com.metricscache.domain.dictionary;

import com.metricscache.domain.model.DatasetPage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tokenizes records against a {@link Dictionary}.
 *
 * Encoding replaces each field name with its code (as a string, since it becomes
 * a JSON object key) and each value with its integer code. Tokens missing from
 * the dictionary pass through unchanged in both directions.
 *
 * Decoding yields the stringified form of every covered value: numbers and
 * booleans are not reconstructed, so {@code 2024} comes back as {@code "2024"}.
 * A pass-through value that happens to equal a code is decoded as that code.
 */
@Slf4j
@Component
public class DictionaryCodec {

    /**
     * Scans pages in page, record, field order and assigns the next code to every
     * field name and stringified value on first sight.
     */
    public Dictionary build(Iterable<DatasetPage> corpus) {
        Map<String, Integer> keyCodes = new LinkedHashMap<>();
        Map<String, Integer> valueCodes = new LinkedHashMap<>();

        for (DatasetPage page : corpus) {
            if (page.getRecords() == null) {
                continue;
            }
            for (Map<String, Object> record : page.getRecords()) {
                for (Map.Entry<String, Object> field : record.entrySet()) {
                    keyCodes.putIfAbsent(field.getKey(), keyCodes.size() + 1);
                    valueCodes.putIfAbsent(stringify(field.getValue()), valueCodes.size() + 1);
                }
            }
        }

        log.info("Built dictionary: {} keys, {} values", keyCodes.size(), valueCodes.size());
        return new Dictionary(keyCodes, valueCodes);
    }

    public Map<String, Object> encode(Map<String, Object> record, Dictionary dictionary) {
        Map<String, Object> encoded = new LinkedHashMap<>(record.size() * 2);
        int misses = 0;
        for (Map.Entry<String, Object> field : record.entrySet()) {
            Integer keyCode = dictionary.keyCode(field.getKey());
            Integer valueCode = dictionary.valueCode(stringify(field.getValue()));
            if (keyCode == null || valueCode == null) {
                misses++;
            }
            encoded.put(keyCode != null ? String.valueOf(keyCode) : field.getKey(),
                    valueCode != null ? valueCode : field.getValue());
        }
        if (misses > 0) {
            log.debug("Dictionary miss on {} field(s), passed through unchanged", misses);
        }
        return encoded;
    }

    public Map<String, Object> decode(Map<String, Object> record, Dictionary dictionary) {
        Map<String, Object> decoded = new LinkedHashMap<>(record.size() * 2);
        for (Map.Entry<String, Object> field : record.entrySet()) {
            String fieldName = dictionary.fieldName(field.getKey());
            Object value = field.getValue();
            String token = value == null ? null : dictionary.value(stringify(value));
            decoded.put(fieldName != null ? fieldName : field.getKey(), token != null ? token : value);
        }
        return decoded;
    }

    public DatasetPage encodePage(DatasetPage page, Dictionary dictionary) {
        return new DatasetPage(page.getKey(), transform(page, dictionary, true));
    }

    public DatasetPage decodePage(DatasetPage page, Dictionary dictionary) {
        return new DatasetPage(page.getKey(), transform(page, dictionary, false));
    }

    private List<Map<String, Object>> transform(DatasetPage page, Dictionary dictionary, boolean encode) {
        List<Map<String, Object>> records = new ArrayList<>(page.size());
        if (page.getRecords() != null) {
            for (Map<String, Object> record : page.getRecords()) {
                records.add(encode ? encode(record, dictionary) : decode(record, dictionary));
            }
        }
        return records;
    }

    static String stringify(Object value) {
        return String.valueOf(value);
    }
}
