package io.queryweaver.client;

import io.queryweaver.core.QueryWeaverException;
import io.queryweaver.core.StreamMessage;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryWeaverClientBuilderTest {

    @Test
    void baseUrlIsRequired() {
        assertThatThrownBy(() -> QueryWeaverClient.builder().build())
                .isInstanceOf(QueryWeaverException.InvalidConfiguration.class);
    }

    @Test
    void rejectsInvalidSettings() {
        assertThatThrownBy(() -> QueryWeaverClient.builder().requestTimeout(Duration.ZERO))
                .isInstanceOf(QueryWeaverException.InvalidConfiguration.class);
        assertThatThrownBy(() -> QueryWeaverClient.builder().readBufferSize(0))
                .isInstanceOf(QueryWeaverException.InvalidConfiguration.class);
        assertThatThrownBy(() -> QueryWeaverClient.builder().boundary(""))
                .isInstanceOf(QueryWeaverException.InvalidConfiguration.class);
        assertThatThrownBy(() -> QueryWeaverClient.builder().baseUrl("http://bad host"))
                .isInstanceOf(QueryWeaverException.InvalidConfiguration.class);
    }

    @Test
    void configurationDrivesTheClient() {
        ScriptedHttpClientAdapter http = ScriptedHttpClientAdapter.ok("{\"type\":\"done\"}");
        QueryWeaverClient client = QueryWeaverClient.builder()
                .configuration(QueryWeaverConfiguration.load("queryweaver.properties"))
                .httpClient(http)
                .build();

        assertThat(client.executeQuery(new QueryRequest("db1", "q")))
                .extracting(StreamMessage::type).containsExactly("done");
        assertThat(http.requests).singleElement().satisfies(request -> {
            assertThat(request.uri().toString()).isEqualTo("http://localhost:5000/graphs/db1");
            assertThat(request.timeout()).isEqualTo(Duration.ofSeconds(45));
            assertThat(request.headers()).containsEntry("Authorization", "Bearer test-token")
                    .containsEntry("Content-Type", "application/json")
                    .doesNotContainKey("Accept");
        });
    }

    @Test
    void noAuthorizationHeaderWithoutToken() {
        ScriptedHttpClientAdapter http = ScriptedHttpClientAdapter.ok("{\"type\":\"done\"}");
        QueryWeaverClient.builder().baseUrl("http://localhost:5000").httpClient(http).build()
                .executeQuery(new QueryRequest("db1", "q"));

        assertThat(http.requests).singleElement()
                .satisfies(request -> assertThat(request.headers()).doesNotContainKey("Authorization"));
    }
}
