package io.queryweaver.client;

import io.queryweaver.core.QueryWeaverException;
import io.queryweaver.core.StreamMessage;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class SessionPublisherTest {

    private static final String B = "|||FALKORDB_MESSAGE_BOUNDARY|||";

    private static QueryWeaverClient client(ScriptedHttpClientAdapter http) {
        return QueryWeaverClient.builder().baseUrl("http://localhost:5000").httpClient(http).build();
    }

    @Test
    void deliversEveryMessageThenCompletes() throws Exception {
        ScriptedHttpClientAdapter http = ScriptedHttpClientAdapter.ok(
                "{\"type\":\"status\",\"message\":\"a\"}" + B + "{\"type\":\"content\",\"content\":\"b\"}" + B,
                "{\"type\":\"done\"}" + B);
        Collecting subscriber = new Collecting(Long.MAX_VALUE);

        client(http).subscribeQuery(new QueryRequest("db1", "q")).subscribe(subscriber);

        subscriber.done.get(5, TimeUnit.SECONDS);
        assertThat(subscriber.items).extracting(StreamMessage::type).containsExactly("status", "content", "done");
    }

    @Test
    void eachSubscriptionOpensItsOwnSession() throws Exception {
        ScriptedHttpClientAdapter http = ScriptedHttpClientAdapter.ok("{\"type\":\"done\"}" + B);
        Flow.Publisher<StreamMessage> publisher = client(http).subscribeQuery(new QueryRequest("db1", "q"));

        Collecting first = new Collecting(Long.MAX_VALUE);
        publisher.subscribe(first);
        first.done.get(5, TimeUnit.SECONDS);
        Collecting second = new Collecting(Long.MAX_VALUE);
        publisher.subscribe(second);
        second.done.get(5, TimeUnit.SECONDS);

        assertThat(http.requests).hasSize(2);
        assertThat(first.items).hasSize(1);
        assertThat(second.items).hasSize(1);
    }

    @Test
    void brokenPipeSignalsOnError() throws Exception {
        ScriptedHttpClientAdapter http = ScriptedHttpClientAdapter.breaksAfter(
                new IOException("reset"), "{\"type\":\"status\",\"message\":\"a\"}" + B);
        Collecting subscriber = new Collecting(Long.MAX_VALUE);

        client(http).subscribeQuery(new QueryRequest("db1", "q")).subscribe(subscriber);

        assertThat(subscriber.done).failsWithin(5, TimeUnit.SECONDS)
                .withThrowableOfType(java.util.concurrent.ExecutionException.class)
                .withCauseInstanceOf(QueryWeaverException.StreamFailure.class);
        assertThat(subscriber.items).extracting(StreamMessage::content).containsExactly("a", "Stream error: reset");
    }

    @Test
    void cancellingTheSubscriptionReleasesTheSession() throws Exception {
        StringBuilder body = new StringBuilder();
        for (int i = 0; i < 200; i++) {
            body.append("{\"type\":\"status\",\"message\":\"").append(i).append("\"}").append(B);
        }
        ScriptedHttpClientAdapter http = ScriptedHttpClientAdapter.ok(body.toString().split("(?<=\\|\\|\\|)(?=\\{)"));
        Collecting subscriber = new Collecting(1);

        client(http).subscribeQuery(new QueryRequest("db1", "q")).subscribe(subscriber);
        assertThat(subscriber.first.await(5, TimeUnit.SECONDS)).isTrue();
        subscriber.subscription.cancel();

        awaitClosed(http);
        assertThat(subscriber.items).hasSize(1);
    }

    @Test
    void cancelStopsReadingWhileNoFrameCompletes() throws Exception {
        ScriptedHttpClientAdapter http = ScriptedHttpClientAdapter.trickling("{\"type\":\"status\",\"message\":\"a\"}" + B);
        Collecting subscriber = new Collecting(1);

        client(http).subscribeQuery(new QueryRequest("db1", "q")).subscribe(subscriber);
        assertThat(subscriber.first.await(5, TimeUnit.SECONDS)).isTrue();
        subscriber.subscription.cancel();

        assertThat(http.closed).isTrue();
        int readsAtCancel = http.reads.get();
        Thread.sleep(200);
        assertThat(http.reads.get()).isLessThanOrEqualTo(readsAtCancel + 1);
        assertThat(subscriber.items).hasSize(1);
    }

    @Test
    void failureWaitsForDemandWithoutBlockingTheSession() throws Exception {
        ScriptedHttpClientAdapter http = ScriptedHttpClientAdapter.breaksAfter(
                new IOException("reset"), "{\"type\":\"status\",\"message\":\"a\"}" + B);
        Collecting subscriber = new Collecting(1);

        client(http).subscribeQuery(new QueryRequest("db1", "q")).subscribe(subscriber);
        assertThat(subscriber.first.await(5, TimeUnit.SECONDS)).isTrue();
        awaitClosed(http);
        Thread.sleep(100);
        assertThat(subscriber.done).isNotDone();
        assertThat(subscriber.items).hasSize(1);

        subscriber.subscription.request(1);

        assertThat(subscriber.done).failsWithin(5, TimeUnit.SECONDS)
                .withThrowableOfType(java.util.concurrent.ExecutionException.class)
                .withCauseInstanceOf(QueryWeaverException.StreamFailure.class);
        assertThat(subscriber.items).extracting(StreamMessage::content).containsExactly("a", "Stream error: reset");
    }

    private static void awaitClosed(ScriptedHttpClientAdapter http) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!http.closed.get() && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertThat(http.closed).isTrue();
    }

    private static final class Collecting implements Flow.Subscriber<StreamMessage> {
        final List<StreamMessage> items = new CopyOnWriteArrayList<>();
        final CompletableFuture<Void> done = new CompletableFuture<>();
        final CountDownLatch first = new CountDownLatch(1);
        private final long demand;
        volatile Flow.Subscription subscription;

        Collecting(long demand) {
            this.demand = demand;
        }

        @Override
        public void onSubscribe(Flow.Subscription subscription) {
            this.subscription = subscription;
            subscription.request(demand);
        }

        @Override
        public void onNext(StreamMessage item) {
            items.add(item);
            first.countDown();
        }

        @Override
        public void onError(Throwable throwable) {
            done.completeExceptionally(throwable);
        }

        @Override
        public void onComplete() {
            done.complete(null);
        }
    }
}
