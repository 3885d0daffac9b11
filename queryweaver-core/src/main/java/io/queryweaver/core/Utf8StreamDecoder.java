package io.queryweaver.core;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Incremental UTF-8 decoder for chunked response bodies.
 *
 * <p>A multi-byte character split across two chunks is held back until its remaining bytes arrive.
 * Malformed input is replaced with U+FFFD rather than rejected. Not thread-safe.
 */
public final class Utf8StreamDecoder {

    private static final ByteBuffer EMPTY = ByteBuffer.allocate(0);

    private final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE);

    private ByteBuffer pending = EMPTY;

    public String decode(byte[] chunk) {
        return decode(chunk, 0, chunk.length);
    }

    /**
     * Decodes {@code len} bytes of {@code chunk} together with any bytes held back from the previous call.
     *
     * @return the text that could be fully decoded; may be empty
     */
    public String decode(byte[] chunk, int off, int len) {
        ByteBuffer in;
        if (pending.hasRemaining()) {
            in = ByteBuffer.allocate(pending.remaining() + len);
            in.put(pending).put(chunk, off, len).flip();
        } else {
            in = ByteBuffer.wrap(chunk, off, len);
        }
        String text = run(in, false);
        pending = in.hasRemaining() ? copyOf(in) : EMPTY;
        return text;
    }

    /**
     * Ends the input: any incomplete trailing sequence is emitted as a replacement character.
     */
    public String flush() {
        ByteBuffer in = pending;
        pending = EMPTY;
        String text = run(in, true);
        decoder.reset();
        return text;
    }

    /** @return number of bytes held back awaiting the rest of a multi-byte character */
    public int pendingBytes() {
        return pending.remaining();
    }

    private String run(ByteBuffer in, boolean endOfInput) {
        CharBuffer out = CharBuffer.allocate(in.remaining() + 2);
        while (true) {
            CoderResult result = decoder.decode(in, out, endOfInput);
            if (result.isOverflow()) {
                out = grow(out);
                continue;
            }
            if (endOfInput) {
                while (decoder.flush(out).isOverflow()) {
                    out = grow(out);
                }
            }
            break;
        }
        out.flip();
        return out.toString();
    }

    private static CharBuffer grow(CharBuffer out) {
        CharBuffer bigger = CharBuffer.allocate(out.capacity() * 2 + 2);
        out.flip();
        bigger.put(out);
        return bigger;
    }

    private static ByteBuffer copyOf(ByteBuffer in) {
        ByteBuffer copy = ByteBuffer.allocate(in.remaining());
        copy.put(in).flip();
        return copy;
    }
}
