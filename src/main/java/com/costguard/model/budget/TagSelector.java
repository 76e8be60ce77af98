package com.costguard.model.budget;

import lombok.Value;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parsed tag selector: a key plus either an exact value or a wildcard.
 */
@Value
public class TagSelector {

    private static final Pattern SELECTOR_PATTERN = Pattern.compile("^[a-zA-Z0-9_-]+:(\\*|[a-zA-Z0-9_-]+)$");

    private static final String WILDCARD = "*";

    String key;

    String value;

    boolean wildcard;

    /**
     * Parse "key:value" or "key:*".
     *
     * @throws IllegalArgumentException if the selector doesn't match the format
     */
    public static TagSelector parse(String selector) {
        if (selector == null || !SELECTOR_PATTERN.matcher(selector).matches()) {
            throw new IllegalArgumentException(String.format(
                    "invalid tag selector format: \"%s\" must match pattern 'key:value' or 'key:*'", selector));
        }

        int idx = selector.indexOf(':');
        String key = selector.substring(0, idx);
        String value = selector.substring(idx + 1);
        return new TagSelector(key, value, WILDCARD.equals(value));
    }

    public boolean matches(Map<String, String> tags) {
        if (tags == null || !tags.containsKey(key)) {
            return false;
        }
        return wildcard || value.equals(tags.get(key));
    }
}
