package com.z254.robi.tag;

/**
 * Parser for one control tag that may lead the model output.
 * Implementations are pure and keep no state between calls.
 */
public interface HeaderTagParser<T> {

    ControlTag tag();

    /**
     * Try to match the tag at the very start of {@code text} (leading whitespace allowed).
     */
    TagMatch<T> parse(String text);
}
