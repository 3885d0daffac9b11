package io.queryweaver.client;

import io.queryweaver.core.StreamMessage;

import java.util.Objects;
import java.util.concurrent.Flow;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.SubmissionPublisher;
import java.util.function.Supplier;

/**
 * Cold {@link Flow.Publisher} over a {@link MessageStream}.
 *
 * <p>Every subscription opens a fresh session and pumps it on its own daemon thread into a bounded
 * {@link SubmissionPublisher}; {@code submit} blocks while the buffer is full, so a slow subscriber
 * holds back further reads. Cancelling the subscription cancels the session at once, which also
 * aborts a read in progress.
 *
 * <p>This class is not intended to be used directly by clients.
 */
public final class SessionPublisher implements Flow.Publisher<StreamMessage> {

    static final int BUFFER_CAPACITY = 16;

    private final Supplier<MessageStream> sessions;

    public SessionPublisher(Supplier<MessageStream> sessions) {
        this.sessions = Objects.requireNonNull(sessions, "sessions");
    }

    @Override
    public void subscribe(Flow.Subscriber<? super StreamMessage> subscriber) {
        Objects.requireNonNull(subscriber, "subscriber");
        MessageStream session = sessions.get();
        SessionSubscriber relay = new SessionSubscriber(subscriber, session);
        SubmissionPublisher<StreamMessage> pub =
                new SubmissionPublisher<>(ForkJoinPool.commonPool(), BUFFER_CAPACITY);
        pub.subscribe(relay);
        Thread t = new Thread(() -> run(session, pub, relay), "queryweaver-session");
        t.setDaemon(true);
        t.start();
    }

    private static void run(MessageStream session, SubmissionPublisher<StreamMessage> pub, SessionSubscriber relay) {
        try (session) {
            while (session.hasNext()) {
                pub.submit(session.next());
            }
        } catch (RuntimeException e) {
            relay.failure = e;
        }
        pub.close();
    }

    /**
     * Relays signals to the downstream subscriber. Cancellation reaches the session directly, and a
     * session failure is signalled only after every buffered message has been delivered.
     */
    private static final class SessionSubscriber implements Flow.Subscriber<StreamMessage> {
        private final Flow.Subscriber<? super StreamMessage> downstream;
        private final MessageStream session;
        volatile RuntimeException failure;

        SessionSubscriber(Flow.Subscriber<? super StreamMessage> downstream, MessageStream session) {
            this.downstream = downstream;
            this.session = session;
        }

        @Override
        public void onSubscribe(Flow.Subscription subscription) {
            downstream.onSubscribe(new Flow.Subscription() {
                @Override
                public void request(long n) {
                    subscription.request(n);
                }

                @Override
                public void cancel() {
                    session.cancel();
                    subscription.cancel();
                }
            });
        }

        @Override
        public void onNext(StreamMessage item) {
            downstream.onNext(item);
        }

        @Override
        public void onError(Throwable throwable) {
            session.cancel();
            downstream.onError(throwable);
        }

        @Override
        public void onComplete() {
            RuntimeException e = failure;
            if (e != null) {
                downstream.onError(e);
            } else {
                downstream.onComplete();
            }
        }
    }
}
