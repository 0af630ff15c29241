package com.z254.robi.tag;

import com.z254.robi.motion.MotionStep;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Incremental decoder for one model response.
 * <p>
 * The header (leading emotion, emojis and actions tags) is accumulated until it can be
 * resolved, then the emotion is emitted. After that, text is forwarded as soon as it
 * arrives; only a suffix that is or may become a control-tag opener is held back until the
 * tag closes or turns out to be plain text. The decoded values and the concatenated text are
 * the same however the response is chunked.
 * <p>
 * Not thread-safe. Create one instance per response.
 */
@Slf4j
public class StreamingTagDecoder {

    public static final int DEFAULT_BUFFER_CAP = 500;

    private static final int OPEN = -1;
    private static final int BROKEN = -2;

    private final int bufferCap;
    private final List<HeaderTagParser<?>> pipeline;

    private final StringBuilder raw = new StringBuilder();
    private final StringBuilder header = new StringBuilder();
    private final StringBuilder pending = new StringBuilder();
    private final StringBuilder visible = new StringBuilder();

    private boolean headerResolved;
    private boolean finished;
    private boolean trimLeading;

    private Emotion emotion = Emotion.NEUTRAL;
    private List<String> emojis = List.of();
    private List<MotionStep> actions = List.of();
    private String mediaSummary;

    public StreamingTagDecoder() {
        this(DEFAULT_BUFFER_CAP);
    }

    public StreamingTagDecoder(int bufferCap) {
        this(bufferCap, defaultPipeline());
    }

    public StreamingTagDecoder(int bufferCap, List<HeaderTagParser<?>> pipeline) {
        if (bufferCap <= 0) {
            throw new IllegalArgumentException("bufferCap must be positive");
        }
        this.bufferCap = bufferCap;
        this.pipeline = List.copyOf(pipeline);
    }

    /**
     * Header parsers in the order they are tried: emotion, emojis, actions.
     */
    public static List<HeaderTagParser<?>> defaultPipeline() {
        return List.of(new EmotionTagParser(), new EmojisTagParser(), new ActionsTagParser());
    }

    /**
     * Decode a complete response in one go.
     */
    public static DecodedResponse decodeComplete(String text) {
        StreamingTagDecoder decoder = new StreamingTagDecoder();
        decoder.feed(text);
        decoder.finish();
        return decoder.result();
    }

    /**
     * Pipe a fragment stream through this decoder. The emotion fragment is always emitted,
     * also for an empty stream.
     */
    public Flux<DecodedFragment> decode(Flux<String> chunks) {
        return chunks.concatMapIterable(this::feed)
                .concatWith(Flux.defer(() -> Flux.fromIterable(finish())));
    }

    public List<DecodedFragment> feed(String chunk) {
        if (finished) {
            throw new IllegalStateException("Decoder already finished");
        }
        List<DecodedFragment> out = new ArrayList<>(2);
        if (chunk == null || chunk.isEmpty()) {
            return out;
        }
        raw.append(chunk);

        if (!headerResolved) {
            header.append(chunk);
            HeaderResult result = parseHeader(header.toString());
            if (readyToResolve(result)) {
                resolveHeader(result, out);
            }
            return out;
        }

        emitText(scanBody(chunk, false), out);
        return out;
    }

    /**
     * Flush everything still buffered. An unresolved header is resolved with whatever it
     * holds; an opener that never closed is dropped and what follows it is kept as text.
     */
    public List<DecodedFragment> finish() {
        if (finished) {
            return List.of();
        }
        List<DecodedFragment> out = new ArrayList<>(2);
        if (!headerResolved) {
            resolveHeader(parseHeader(header.toString()), out);
        }
        emitText(scanBody("", true), out);
        finished = true;
        return out;
    }

    public DecodedResponse result() {
        if (!finished) {
            throw new IllegalStateException("Decoder not finished");
        }
        String rawText = raw.toString();
        return DecodedResponse.builder()
                .emotion(emotion)
                .emojis(emojis)
                .actions(actions)
                .mediaSummary(mediaSummary)
                .visibleText(visible.toString())
                .rawText(rawText)
                .directives(DirectiveExtractor.extract(rawText))
                .build();
    }

    public Emotion getEmotion() {
        return emotion;
    }

    public boolean isHeaderResolved() {
        return headerResolved;
    }

    private HeaderResult parseHeader(String text) {
        HeaderResult result = new HeaderResult();
        result.rest = text;
        boolean progress = true;
        while (progress) {
            progress = false;
            for (HeaderTagParser<?> parser : pipeline) {
                if (result.matched.contains(parser.tag())) {
                    continue;
                }
                TagMatch<?> match = parser.parse(result.rest);
                if (match.matched()) {
                    result.matched.add(parser.tag());
                    result.values.add(match.value());
                    result.rest = match.remaining();
                    progress = true;
                }
            }
        }
        return result;
    }

    /**
     * Whitespace around header tags does not count towards the buffer cap, only the
     * unparsed remainder does.
     */
    private boolean readyToResolve(HeaderResult result) {
        String rest = result.rest.stripLeading();
        if (rest.length() >= bufferCap) {
            return true;
        }
        if (rest.isEmpty()) {
            return false;
        }
        if (rest.charAt(0) != '[') {
            return true;
        }
        if (ControlTag.openerAt(rest, 0).isPresent()) {
            return closingIndex(rest, 0) != OPEN;
        }
        return !ControlTag.partialOpenerAt(rest, 0);
    }

    @SuppressWarnings("unchecked")
    private void resolveHeader(HeaderResult result, List<DecodedFragment> out) {
        headerResolved = true;
        for (int i = 0; i < result.matched.size(); i++) {
            Object value = result.values.get(i);
            switch (result.matched.get(i)) {
                case EMOTION -> emotion = (Emotion) value;
                case EMOJIS -> emojis = (List<String>) value;
                case ACTIONS -> actions = (List<MotionStep>) value;
                default -> log.debug("Ignoring header value for {}", result.matched.get(i));
            }
        }
        header.setLength(0);
        out.add(DecodedFragment.ofEmotion(emotion));
        emitText(scanBody(result.rest, false), out);
    }

    private String scanBody(String chunk, boolean endOfStream) {
        String s = pending + chunk;
        pending.setLength(0);
        StringBuilder text = new StringBuilder(s.length());
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (trimLeading) {
                if (Character.isWhitespace(c)) {
                    i++;
                    continue;
                }
                trimLeading = false;
            }
            if (c != '[') {
                text.append(c);
                i++;
                continue;
            }

            Optional<ControlTag> tag = ControlTag.openerAt(s, i);
            if (tag.isPresent()) {
                int close = closingIndex(s, i);
                if (close >= 0) {
                    handleBodyTag(tag.get(), s.substring(i + tag.get().getOpener().length(), close));
                    i = close + 1;
                    continue;
                }
                if (close == OPEN && !endOfStream) {
                    pending.append(s, i, s.length());
                    break;
                }
                log.debug("Dropping unterminated {} tag opener", tag.get().getTagName());
                i += tag.get().getOpener().length();
                continue;
            }
            if (!endOfStream && ControlTag.partialOpenerAt(s, i)) {
                pending.append(s, i, s.length());
                break;
            }
            text.append(c);
            i++;
        }
        return text.toString();
    }

    /**
     * Index of the bracket closing the tag opened at {@code start}; {@link #OPEN} while it may
     * still close, {@link #BROKEN} once a nested opener or the length cap rules that out.
     */
    private int closingIndex(CharSequence s, int start) {
        for (int j = start + 1; j < s.length(); j++) {
            if (j - start > bufferCap) {
                return BROKEN;
            }
            char c = s.charAt(j);
            if (c == ']') {
                return j;
            }
            if (c == '[') {
                return BROKEN;
            }
        }
        return s.length() - start > bufferCap ? BROKEN : OPEN;
    }

    private void handleBodyTag(ControlTag tag, String value) {
        switch (tag) {
            case MEDIA_SUMMARY -> {
                if (mediaSummary == null && !value.isBlank()) {
                    mediaSummary = value.trim();
                }
                trimLeading = true;
            }
            case EMOJIS -> {
                if (emojis.isEmpty()) {
                    emojis = EmojisTagParser.parseCodes(value);
                }
            }
            case ACTIONS -> {
                if (actions.isEmpty()) {
                    actions = ActionsTagParser.parseSteps(value);
                }
            }
            default -> {
                // directives are extracted from the raw text; emotion is fixed once emitted
            }
        }
    }

    private void emitText(String text, List<DecodedFragment> out) {
        if (!text.isEmpty()) {
            visible.append(text);
            out.add(DecodedFragment.ofText(text));
        }
    }

    private static final class HeaderResult {
        private final List<ControlTag> matched = new ArrayList<>(3);
        private final List<Object> values = new ArrayList<>(3);
        private String rest;
    }
}
