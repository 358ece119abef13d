package com.seqmine.core.model;

import com.seqmine.core.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Canonical field naming shared by every pipeline stage.
 * 
 * A canonical name is lower-case snake case: camel case is split, every run of
 * non-alphanumeric characters becomes a single underscore and leading or trailing
 * underscores are dropped. User-supplied field names go through the same rule,
 * so {@code "DateTime"}, {@code "date time"} and {@code "date_time"} all resolve
 * to the column {@code date_time}.
 */
public final class FieldNames {

    private static final Pattern CAMEL_LOWER_UPPER = Pattern.compile("([a-z0-9])([A-Z])");
    private static final Pattern CAMEL_ACRONYM = Pattern.compile("([A-Z]+)([A-Z][a-z])");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");

    private FieldNames() {
    }

    /**
     * Canonicalize a single field name. Idempotent.
     */
    public static String canonicalize(String name) {
        if (name == null) {
            return "x";
        }
        String split = CAMEL_ACRONYM.matcher(name).replaceAll("$1_$2");
        split = CAMEL_LOWER_UPPER.matcher(split).replaceAll("$1_$2");
        String snake = NON_ALPHANUMERIC.matcher(split.toLowerCase(Locale.ROOT)).replaceAll("_");
        snake = stripUnderscores(snake);
        if (snake.isEmpty()) {
            return "x";
        }
        if (Character.isDigit(snake.charAt(0))) {
            return "x" + snake;
        }
        return snake;
    }

    /**
     * Canonicalize a column list, suffixing later duplicates with {@code _2}, {@code _3}, ...
     */
    public static List<String> canonicalizeAll(List<String> names) {
        List<String> result = new ArrayList<>(names.size());
        Set<String> taken = new HashSet<>();
        Map<String, Integer> seen = new HashMap<>();
        for (String name : names) {
            String base = canonicalize(name);
            int n = seen.getOrDefault(base, 0);
            String candidate = n == 0 ? base : base + "_" + (n + 1);
            while (!taken.add(candidate)) {
                n++;
                candidate = base + "_" + (n + 1);
            }
            seen.put(base, n + 1);
            result.add(candidate);
        }
        return result;
    }

    /**
     * Resolve a user-supplied field name against canonical columns.
     *
     * @throws ConfigurationException if the canonical form is not among the columns
     */
    public static String resolve(String field, Collection<String> canonicalColumns) {
        String canonical = canonicalize(field);
        if (!canonicalColumns.contains(canonical)) {
            throw new ConfigurationException(field, canonical, canonicalColumns);
        }
        return canonical;
    }

    private static String stripUnderscores(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '_') {
            start++;
        }
        while (end > start && s.charAt(end - 1) == '_') {
            end--;
        }
        return s.substring(start, end);
    }
}
