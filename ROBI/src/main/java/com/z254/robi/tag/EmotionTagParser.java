package com.z254.robi.tag;

/**
 * {@code [emotion:TAG]}. Unknown tags are consumed and read as neutral.
 */
public class EmotionTagParser extends AnchoredTagParser<Emotion> {

    public EmotionTagParser() {
        super(ControlTag.EMOTION);
    }

    @Override
    protected Emotion convert(String raw) {
        return Emotion.fromTag(raw);
    }

    @Override
    protected Emotion defaultValue() {
        return Emotion.NEUTRAL;
    }
}
