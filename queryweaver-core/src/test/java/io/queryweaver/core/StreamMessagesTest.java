package io.queryweaver.core;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StreamMessagesTest {

    @Test
    void contentMessageUsesContentField() {
        StreamMessage message = StreamMessages.fromFields(Map.of("type", "content", "content", "A"));

        assertThat(message).isInstanceOf(StreamMessage.Content.class);
        assertThat(message.kind()).isEqualTo(MessageKind.CONTENT);
        assertThat(message.content()).isEqualTo("A");
    }

    @Test
    void serverWireTypesMapOntoKinds() {
        assertThat(StreamMessages.fromFields(Map.of("type", "reasoning_step", "message", "Step 1")))
                .isInstanceOf(StreamMessage.Status.class)
                .extracting(StreamMessage::content).isEqualTo("Step 1");
        assertThat(StreamMessages.fromFields(Map.of("type", "ai_response", "message", "42 rows")))
                .isInstanceOf(StreamMessage.Content.class);
        assertThat(StreamMessages.fromFields(Map.of("type", "schema_refresh", "message", "refreshed")))
                .isInstanceOf(StreamMessage.Status.class);
        assertThat(StreamMessages.fromFields(Map.of("type", "done")))
                .isInstanceOf(StreamMessage.Done.class);
        assertThat(StreamMessages.fromFields(Map.of("type", "something_new")))
                .isInstanceOf(StreamMessage.Status.class);
    }

    @Test
    void sqlQueryContentFallsBackToData() {
        StreamMessage message = StreamMessages.fromFields(Map.of(
                "type", "sql_query",
                "data", "SELECT 1",
                "conf", 95,
                "is_valid", true,
                "final_response", false));

        assertThat(message.content()).isEqualTo("SELECT 1");
        assertThat(message.field("conf")).contains(95);
        assertThat(message.finalResponse()).isFalse();
    }

    @Test
    void destructiveConfirmationCarriesSqlAsOperationId() {
        StreamMessage message = StreamMessages.fromFields(Map.of(
                "type", "destructive_confirmation",
                "message", "This will delete rows",
                "sql_query", "DELETE FROM t",
                "operation_type", "DELETE"));

        assertThat(message).isInstanceOf(StreamMessage.ConfirmationRequired.class);
        StreamMessage.ConfirmationRequired confirmation = (StreamMessage.ConfirmationRequired) message;
        assertThat(confirmation.operationId()).isEqualTo("DELETE FROM t");
        assertThat(confirmation.operationType()).contains("DELETE");
    }

    @Test
    void confirmationIdWinsOverSqlQuery() {
        StreamMessage.ConfirmationRequired confirmation = (StreamMessage.ConfirmationRequired) StreamMessages.fromFields(Map.of(
                "type", "confirmation-required",
                "confirmation_id", "op-7",
                "sql_query", "DROP TABLE t"));

        assertThat(confirmation.operationId()).isEqualTo("op-7");
    }

    @Test
    void errorMessageFallsBackToErrorField() {
        StreamMessage message = StreamMessages.fromFields(Map.of("type", "error", "error", "boom"));

        assertThat(message).isInstanceOf(StreamMessage.Error.class);
        assertThat(message.content()).isEqualTo("boom");
    }

    @Test
    void fieldsAreDeeplyImmutableAndKeepNulls() {
        List<Object> rows = new ArrayList<>(List.of(Map.of("id", 1)));
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("type", "query_result");
        fields.put("data", rows);
        fields.put("miss", null);

        StreamMessage message = StreamMessages.fromFields(fields);
        rows.add(Map.of("id", 2));

        assertThat(message.fields()).containsKey("miss");
        assertThat((List<?>) message.fields().get("data")).hasSize(1);
        assertThatThrownBy(() -> message.fields().put("x", 1))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void acceptsNarrowlyTypedMapsAndSnapshotsThem() {
        Map<String, String> fields = new HashMap<>(Map.of("type", "status", "message", "loading"));

        StreamMessage message = StreamMessages.fromFields(fields);
        fields.put("message", "changed");

        assertThat(message.fields()).containsEntry("message", "loading");
        assertThat(message.content()).isEqualTo("loading");
    }

    @Test
    void rejectsMissingType() {
        assertThatThrownBy(() -> StreamMessages.fromFields(new HashMap<>(Map.of("content", "A"))))
                .isInstanceOf(QueryWeaverException.MalformedMessage.class);
        assertThatThrownBy(() -> StreamMessages.fromFields(Map.of("type", 3)))
                .isInstanceOf(QueryWeaverException.MalformedMessage.class);
        assertThatThrownBy(() -> StreamMessages.fromFields(null))
                .isInstanceOf(QueryWeaverException.MalformedMessage.class);
    }

    @Test
    void syntheticErrorHasErrorKind() {
        StreamMessage.Error error = StreamMessage.error("Request timed out");

        assertThat(error.type()).isEqualTo("error");
        assertThat(error.content()).isEqualTo("Request timed out");
        assertThat(error.kind()).isEqualTo(MessageKind.ERROR);
    }
}
