package io.queryweaver.client;

import io.queryweaver.core.Protocol;
import io.queryweaver.core.StreamMessage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Answer to a {@link StreamMessage.ConfirmationRequired} message.
 *
 * @param operationId the identifier carried by the confirmation message (the pending SQL statement)
 * @param decision whether the operation should run
 * @param chat the question history that led to the operation (may be empty)
 */
public record ConfirmRequest(String operationId, Decision decision, List<String> chat) {

    public ConfirmRequest {
        chat = chat == null || chat.isEmpty() ? List.of() : Collections.unmodifiableList(new ArrayList<>(chat));
    }

    public static ConfirmRequest confirm(StreamMessage.ConfirmationRequired message, List<String> chat) {
        return new ConfirmRequest(message.operationId(), Decision.CONFIRM, chat);
    }

    public static ConfirmRequest cancel(StreamMessage.ConfirmationRequired message, List<String> chat) {
        return new ConfirmRequest(message.operationId(), Decision.CANCEL, chat);
    }

    public enum Decision {
        CONFIRM(Protocol.CONFIRM),
        CANCEL(Protocol.CANCEL);

        private final String wireValue;

        Decision(String wireValue) {
            this.wireValue = wireValue;
        }

        public String wireValue() {
            return wireValue;
        }
    }
}
