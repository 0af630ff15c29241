package com.z254.robi.tag;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * {@code [emojis:CODE,CODE,...]}. Codes are trimmed and upper-cased, blanks dropped.
 */
public class EmojisTagParser extends AnchoredTagParser<List<String>> {

    public EmojisTagParser() {
        super(ControlTag.EMOJIS);
    }

    @Override
    protected List<String> convert(String raw) {
        return parseCodes(raw);
    }

    @Override
    protected List<String> defaultValue() {
        return List.of();
    }

    static List<String> parseCodes(String raw) {
        List<String> codes = new ArrayList<>();
        for (String code : raw.split(",")) {
            String trimmed = code.trim();
            if (!trimmed.isEmpty()) {
                codes.add(trimmed.toUpperCase(Locale.ROOT));
            }
        }
        return codes;
    }
}
