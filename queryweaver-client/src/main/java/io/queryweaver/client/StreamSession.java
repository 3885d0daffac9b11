package io.queryweaver.client;

import io.queryweaver.core.FrameSplitter;
import io.queryweaver.core.QueryWeaverException;
import io.queryweaver.core.StreamMessage;
import io.queryweaver.core.StreamMessages;
import io.queryweaver.core.Utf8StreamDecoder;
import io.queryweaver.http.spi.HttpClientAdapter;
import io.queryweaver.http.spi.HttpClientException;
import io.queryweaver.http.spi.HttpClientRequest;
import io.queryweaver.http.spi.HttpClientResponse;
import io.queryweaver.http.spi.HttpTimeoutException;
import io.queryweaver.json.spi.JsonCodec;
import io.queryweaver.json.spi.JsonException;
import org.slf4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link MessageStream} over one HTTP exchange: sends the request, then decodes the body chunk by chunk.
 *
 * <p>Messages decoded from a chunk are queued until consumed, and the next chunk is read only once the
 * queue is empty.
 */
final class StreamSession implements MessageStream {

    static final int EXCERPT_LIMIT = 100;
    private static final int MAX_ERROR_BODY = 64 * 1024;

    private final String label;
    private final String rejection;
    private final HttpClientRequest request;
    private final HttpClientAdapter http;
    private final JsonCodec codec;
    private final FrameSplitter splitter;
    private final Logger log;
    private final byte[] buffer;

    private final Utf8StreamDecoder decoder = new Utf8StreamDecoder();
    private final StringBuilder text = new StringBuilder();
    private final Deque<StreamMessage> pending = new ArrayDeque<>();
    private final AtomicReference<HttpClientResponse> response = new AtomicReference<>();
    private final AtomicBoolean cancelled = new AtomicBoolean();

    private volatile SessionState state = SessionState.IDLE;
    private InputStream body;
    private QueryWeaverException.StreamFailure failure;

    /**
     * @param rejection if non-null, the session sends nothing and yields this text as its only error message
     */
    StreamSession(String label, String rejection, HttpClientRequest request, HttpClientAdapter http,
                  JsonCodec codec, FrameSplitter splitter, int readBufferSize, Logger log) {
        this.label = label;
        this.rejection = rejection;
        this.request = request;
        this.http = http;
        this.codec = codec;
        this.splitter = splitter;
        this.log = log;
        this.buffer = new byte[readBufferSize];
    }

    @Override
    public boolean hasNext() {
        while (!cancelled.get()) {
            if (!pending.isEmpty()) {
                return true;
            }
            switch (state) {
                case IDLE:
                    open();
                    break;
                case STREAMING:
                    readChunk();
                    break;
                case FAILED:
                    state = SessionState.CLOSED;
                    break;
                case CLOSED:
                    if (failure != null) {
                        throw failure;
                    }
                    return false;
                default:
                    throw new IllegalStateException("unexpected session state " + state);
            }
        }
        return false;
    }

    @Override
    public StreamMessage next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return pending.poll();
    }

    @Override
    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        state = SessionState.CLOSED;
        log.debug("{} cancelled", label);
        release();
    }

    @Override
    public boolean isCancelled() {
        return cancelled.get();
    }

    @Override
    public SessionState state() {
        return cancelled.get() ? SessionState.CLOSED : state;
    }

    @Override
    public void close() {
        if (state != SessionState.CLOSED) {
            cancel();
        }
    }

    private void open() {
        state = SessionState.REQUESTING;
        if (rejection != null) {
            log.debug("{} rejected before sending: {}", label, rejection);
            fail(rejection, null);
            return;
        }

        HttpClientResponse resp;
        try {
            log.debug("{} sending {} {}", label, request.method(), request.uri());
            resp = http.sendStreaming(request);
        } catch (HttpTimeoutException e) {
            log.warn("{} timed out waiting for a response", label);
            fail("Request timed out waiting for the server to respond", null);
            return;
        } catch (HttpClientException e) {
            if (cancelled.get()) {
                return;
            }
            log.warn("{} failed before a response arrived", label, e);
            fail("Request failed: " + e.getMessage(),
                    new QueryWeaverException.StreamFailure(label + " failed before a response arrived", e));
            return;
        }

        response.set(resp);
        if (cancelled.get()) {
            release();
            return;
        }

        int status = resp.statusCode();
        log.debug("{} responded with status {}", label, status);
        if (status < 200 || status > 299) {
            String description = ErrorPayloads.describe(status, readErrorBody(resp), codec);
            release();
            fail(description, null);
            return;
        }

        body = resp.bodyAsStream();
        if (body == null) {
            release();
            fail("No response body", null);
            return;
        }
        state = SessionState.STREAMING;
    }

    private void readChunk() {
        int n;
        try {
            n = body.read(buffer);
        } catch (IOException e) {
            if (cancelled.get()) {
                return;
            }
            log.warn("{} broke while streaming", label, e);
            release();
            pending.add(StreamMessage.error("Stream error: " + describe(e)));
            failure = new QueryWeaverException.StreamFailure(label + " broke while streaming", e);
            state = SessionState.CLOSED;
            return;
        }
        if (cancelled.get()) {
            return;
        }
        if (n < 0) {
            drain();
            return;
        }

        text.append(decoder.decode(buffer, 0, n));
        FrameSplitter.Split split = splitter.split(text);
        text.setLength(0);
        text.append(split.remainder());
        for (String frame : split.frames()) {
            pending.add(decode(frame, "Failed to parse server response: "));
        }
    }

    private void drain() {
        state = SessionState.DRAINING;
        text.append(decoder.flush());
        String tail = text.toString().trim();
        text.setLength(0);
        if (!tail.isEmpty()) {
            pending.add(decode(tail, "Failed to parse final server response: "));
        }
        release();
        state = SessionState.CLOSED;
        log.debug("{} completed", label);
    }

    private StreamMessage decode(String frame, String errorPrefix) {
        try {
            StreamMessage message = StreamMessages.fromFields(codec.readObject(frame));
            log.trace("{} received {} message", label, message.type());
            return message;
        } catch (JsonException | QueryWeaverException.MalformedMessage e) {
            log.warn("{} received a malformed frame: {}", label, e.getMessage());
            return StreamMessage.error(errorPrefix + excerpt(frame));
        }
    }

    private void fail(String description, QueryWeaverException.StreamFailure cause) {
        pending.add(StreamMessage.error(description));
        failure = cause;
        state = SessionState.FAILED;
    }

    private byte[] readErrorBody(HttpClientResponse resp) {
        try (InputStream in = resp.bodyAsStream()) {
            return in == null ? new byte[0] : in.readNBytes(MAX_ERROR_BODY);
        } catch (IOException e) {
            log.debug("{} could not read the error body", label, e);
            return new byte[0];
        }
    }

    private void release() {
        HttpClientResponse resp = response.getAndSet(null);
        if (resp == null) {
            return;
        }
        try {
            resp.close();
        } catch (IOException e) {
            log.debug("{} failed to release the connection", label, e);
        }
    }

    static String excerpt(String frame) {
        if (frame.length() <= EXCERPT_LIMIT) {
            return frame;
        }
        int end = Character.isHighSurrogate(frame.charAt(EXCERPT_LIMIT - 1)) ? EXCERPT_LIMIT - 1 : EXCERPT_LIMIT;
        return frame.substring(0, end) + "...";
    }

    private static String describe(IOException e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
