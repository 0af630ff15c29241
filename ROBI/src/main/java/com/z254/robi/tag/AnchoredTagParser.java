package com.z254.robi.tag;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Base for header parsers of the form {@code [name:value]} anchored at the start of the text.
 * Whitespace following a matched tag is consumed.
 */
public abstract class AnchoredTagParser<T> implements HeaderTagParser<T> {

    private final ControlTag tag;
    private final Pattern pattern;

    protected AnchoredTagParser(ControlTag tag) {
        this.tag = tag;
        this.pattern = Pattern.compile(
                "^\\s*\\[" + Pattern.quote(tag.getTagName()) + ":([^\\[\\]]*)]\\s*",
                Pattern.CASE_INSENSITIVE);
    }

    @Override
    public ControlTag tag() {
        return tag;
    }

    @Override
    public TagMatch<T> parse(String text) {
        if (text == null || text.isEmpty()) {
            return TagMatch.none(defaultValue(), text == null ? "" : text);
        }
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return TagMatch.none(defaultValue(), text);
        }
        return TagMatch.of(convert(matcher.group(1)), text.substring(matcher.end()));
    }

    /**
     * Convert the raw content between the colon and the closing bracket.
     */
    protected abstract T convert(String raw);

    protected abstract T defaultValue();
}
