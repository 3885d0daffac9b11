package io.queryweaver.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits accumulated response text into delimiter-bounded frames.
 *
 * <p>The splitter is stateless: callers thread the returned {@link Split#remainder()} into the next call
 * after appending newly decoded text. Joining every segment followed by the delimiter, then the remainder,
 * reproduces the input exactly.
 */
public final class FrameSplitter {

    private final String delimiter;

    public FrameSplitter(String delimiter) {
        Objects.requireNonNull(delimiter, "delimiter");
        if (delimiter.isEmpty()) {
            throw new IllegalArgumentException("delimiter must not be empty");
        }
        this.delimiter = delimiter;
    }

    /**
     * Creates a splitter for the server's {@link Protocol#MESSAGE_BOUNDARY}.
     */
    public static FrameSplitter standard() {
        return new FrameSplitter(Protocol.MESSAGE_BOUNDARY);
    }

    public String delimiter() {
        return delimiter;
    }

    /**
     * Splits {@code buffer} on every occurrence of the delimiter.
     *
     * @param buffer the text remainder of the previous call with newly decoded text appended
     * @return complete segments plus the trailing text after the last delimiter
     */
    public Split split(CharSequence buffer) {
        String text = buffer == null ? "" : buffer.toString();
        List<String> segments = new ArrayList<>();
        int from = 0;
        int idx;
        while ((idx = text.indexOf(delimiter, from)) >= 0) {
            segments.add(text.substring(from, idx));
            from = idx + delimiter.length();
        }
        return new Split(segments, text.substring(from));
    }

    /**
     * Result of one {@link #split(CharSequence)} call.
     *
     * @param segments raw text before each delimiter occurrence, in order, including blank ones
     * @param remainder text after the last delimiter occurrence (the whole input if there was none)
     */
    public record Split(List<String> segments, String remainder) {
        public Split {
            segments = List.copyOf(segments);
            Objects.requireNonNull(remainder, "remainder");
        }

        /**
         * Trimmed segments with blank ones removed; these are the frames handed to the message decoder.
         */
        public List<String> frames() {
            List<String> frames = new ArrayList<>(segments.size());
            for (String segment : segments) {
                String trimmed = segment.trim();
                if (!trimmed.isEmpty()) {
                    frames.add(trimmed);
                }
            }
            return frames;
        }
    }
}
