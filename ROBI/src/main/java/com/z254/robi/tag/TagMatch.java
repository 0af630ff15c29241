package com.z254.robi.tag;

/**
 * Result of trying one header parser against the start of a text.
 *
 * @param matched   whether the tag was found at the start of the text
 * @param value     parsed value, or the parser's default when not matched
 * @param remaining text after the tag and its trailing whitespace; the input when not matched
 */
public record TagMatch<T>(boolean matched, T value, String remaining) {

    public static <T> TagMatch<T> of(T value, String remaining) {
        return new TagMatch<>(true, value, remaining);
    }

    public static <T> TagMatch<T> none(T defaultValue, String text) {
        return new TagMatch<>(false, defaultValue, text);
    }
}
