package com.github.salilvnair.advisorengine.validate;

import java.util.regex.Pattern;

/**
 * Canonical passage ids of the form {@code PREFIX_<chapter 1..18>_<verse >= 1>}.
 * The prefix is matched case-sensitively.
 */
public final class CanonicalIds {

    public static final String DEFAULT_PREFIX = "BG";

    private final String prefix;
    private final Pattern pattern;

    public CanonicalIds(String prefix) {
        this.prefix = prefix == null || prefix.isBlank() ? DEFAULT_PREFIX : prefix.trim();
        this.pattern = Pattern.compile("^" + Pattern.quote(this.prefix) + "_([1-9]|1[0-8])_([1-9][0-9]*)$");
    }

    public boolean isValid(Object candidate) {
        return candidate instanceof String text && pattern.matcher(text).matches();
    }

    public String format(int chapter, int verse) {
        return prefix + "_" + chapter + "_" + verse;
    }

    public String getPrefix() {
        return prefix;
    }
}
