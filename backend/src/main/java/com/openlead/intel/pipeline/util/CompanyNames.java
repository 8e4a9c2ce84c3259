package com.openlead.intel.pipeline.util;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

public final class CompanyNames {
    // Applied one after another, so "Acme Co Inc" loses both suffixes.
    private static final List<Pattern> LEGAL_SUFFIXES = List.of(
        suffix("\\s+Inc\\.?$"),
        suffix("\\s+LLC\\.?$"),
        suffix("\\s+Ltd\\.?$"),
        suffix("\\s+Limited$"),
        suffix("\\s+Corp\\.?$"),
        suffix("\\s+Corporation$"),
        suffix("\\s+Co\\.?$"),
        suffix("\\s+Company$"),
        suffix("\\s+GmbH$"),
        suffix("\\s+S\\.A\\.?$"),
        suffix("\\s+AG$"),
        suffix("\\s+PLC$")
    );
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern DISALLOWED = Pattern.compile("[^\\w\\s\\-.,!?()&]", Pattern.UNICODE_CHARACTER_CLASS);

    private CompanyNames() {
    }

    /**
     * Strips legal-entity suffixes and punctuation noise, keeping the original case.
     */
    public static String clean(String name) {
        if (name == null || name.isEmpty()) {
            return "";
        }
        String cleaned = name;
        for (Pattern suffix : LEGAL_SUFFIXES) {
            cleaned = suffix.matcher(cleaned).replaceAll("");
        }
        return cleanText(cleaned);
    }

    /**
     * Comparison key used for fuzzy matching: {@link #clean(String)} lower-cased.
     */
    public static String normalize(String name) {
        return clean(name).toLowerCase(Locale.ROOT);
    }

    public static String cleanText(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String collapsed = WHITESPACE.matcher(text.strip()).replaceAll(" ");
        return DISALLOWED.matcher(collapsed).replaceAll("").strip();
    }

    private static Pattern suffix(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}
