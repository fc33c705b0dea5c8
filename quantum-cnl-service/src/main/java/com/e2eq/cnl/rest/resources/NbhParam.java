package com.e2eq.cnl.rest.resources;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code nbh=node:morph,node:morph} query values into active morph overrides.
 * Node and morph are split at the first lone colon, so the {@code ::} inside morph ids survives.
 */
final class NbhParam {
    private NbhParam() {}

    private static final Pattern LONE_COLON = Pattern.compile("(?<!:):(?!:)");

    static Map<String, String> parse(String value) {
        Map<String, String> out = new LinkedHashMap<>();
        if (value == null || value.isBlank()) {
            return out;
        }
        for (String pair : value.split(",")) {
            String p = pair.trim();
            if (p.isEmpty()) continue;
            Matcher m = LONE_COLON.matcher(p);
            int colon = m.find() ? m.start() : -1;
            if (colon <= 0 || colon == p.length() - 1) {
                throw new IllegalArgumentException("Expected node:morph in nbh but got '" + p + "'");
            }
            out.put(p.substring(0, colon).trim(), p.substring(colon + 1).trim());
        }
        return out;
    }
}
