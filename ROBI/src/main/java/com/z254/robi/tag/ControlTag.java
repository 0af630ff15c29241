package com.z254.robi.tag;

import java.util.Optional;

/**
 * Control tags the model may embed in its output. None of them is ever shown to the user.
 */
public enum ControlTag {

    EMOTION("emotion"),
    EMOJIS("emojis"),
    ACTIONS("actions"),
    MEDIA_SUMMARY("media_summary"),
    MEMORY("memory"),
    PERSON_NAME("person_name"),
    ZONE_LEARN("zone_learn");

    private final String tagName;
    private final String opener;

    ControlTag(String tagName) {
        this.tagName = tagName;
        this.opener = "[" + tagName + ":";
    }

    public String getTagName() {
        return tagName;
    }

    /**
     * The literal that starts the tag, e.g. {@code [emotion:}.
     */
    public String getOpener() {
        return opener;
    }

    /**
     * Find the control tag whose complete opener starts at {@code index}, ignoring case.
     */
    public static Optional<ControlTag> openerAt(CharSequence text, int index) {
        String s = text.toString();
        for (ControlTag tag : values()) {
            if (s.regionMatches(true, index, tag.opener, 0, tag.opener.length())) {
                return Optional.of(tag);
            }
        }
        return Optional.empty();
    }

    /**
     * True when the text from {@code index} to its end is a strict prefix of some opener,
     * i.e. more input could still turn it into a control tag.
     */
    public static boolean partialOpenerAt(CharSequence text, int index) {
        String s = text.toString();
        int available = s.length() - index;
        if (available <= 0) {
            return false;
        }
        for (ControlTag tag : values()) {
            if (available < tag.opener.length()
                    && s.regionMatches(true, index, tag.opener, 0, available)) {
                return true;
            }
        }
        return false;
    }

    /**
     * True when {@code text} contains the opener of any control tag.
     */
    public static boolean containsOpener(CharSequence text) {
        String s = text.toString();
        for (int i = s.indexOf('['); i >= 0; i = s.indexOf('[', i + 1)) {
            if (openerAt(s, i).isPresent()) {
                return true;
            }
        }
        return false;
    }
}
