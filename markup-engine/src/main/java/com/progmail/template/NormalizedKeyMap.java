package com.progmail.template;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Insertion-ordered map whose keys compare case-insensitively and ignoring all
 * whitespace, so "Full Name", "full name" and "fullname" are the same key.
 * The first spelling seen for a key is kept for display.
 */
public class NormalizedKeyMap<V> {

    private final Map<String, V> values = new LinkedHashMap<>();
    private final Map<String, String> spellings = new LinkedHashMap<>();

    public static String normalize(String key) {
        if (key == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(key.length());
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            if (!Character.isWhitespace(c)) {
                sb.append(c);
            }
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }

    /**
     * @return the previous value for the key, or null
     */
    public V put(String key, V value) {
        String normalized = normalize(key);
        spellings.putIfAbsent(normalized, key.trim());
        return values.put(normalized, value);
    }

    public V get(String key) {
        return values.get(normalize(key));
    }

    public boolean containsKey(String key) {
        return values.containsKey(normalize(key));
    }

    /**
     * Keys as first spelled, in insertion order.
     */
    public List<String> keys() {
        return Collections.unmodifiableList(new ArrayList<>(spellings.values()));
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (Map.Entry<String, V> entry : values.entrySet()) {
            if (sb.length() > 1) {
                sb.append(", ");
            }
            sb.append(spellings.get(entry.getKey())).append('=').append(entry.getValue());
        }
        return sb.append('}').toString();
    }
}
