package io.queryweaver.client;

import io.queryweaver.core.QueryWeaverException;
import io.queryweaver.core.StreamMessage;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazily produced, cancellable sequence of messages from one streaming request.
 *
 * <p>The request is sent on the first {@link #hasNext()} and the body is read on the consuming thread,
 * one chunk at a time, so the consumer sets the pace. Failures are delivered as
 * {@link StreamMessage.Error} messages. If the connection breaks mid-stream, the error message is
 * followed by a {@link QueryWeaverException.StreamFailure} thrown from {@link #hasNext()}.
 *
 * <p>Iteration is single-threaded; {@link #cancel()} may be called from any thread.
 */
public interface MessageStream extends Iterator<StreamMessage>, AutoCloseable {

    /**
     * Stops the session: no further reads are issued, the connection is released and no further
     * messages are delivered, including ones already decoded. Calling it again has no effect.
     */
    void cancel();

    boolean isCancelled();

    SessionState state();

    /**
     * Cancels the session unless it already ended.
     */
    @Override
    void close();

    /**
     * Drains the remaining messages into a list.
     *
     * @throws QueryWeaverException.StreamFailure if the connection broke mid-stream
     */
    default List<StreamMessage> toList() {
        List<StreamMessage> messages = new ArrayList<>();
        while (hasNext()) {
            messages.add(next());
        }
        return messages;
    }

    /**
     * Returns a sequential stream over the remaining messages; closing it cancels the session.
     */
    default Stream<StreamMessage> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false)
                .onClose(this::close);
    }
}
