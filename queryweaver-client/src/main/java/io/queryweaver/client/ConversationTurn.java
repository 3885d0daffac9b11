package io.queryweaver.client;

/**
 * One earlier turn of the conversation, replayed to the server as context.
 *
 * @param role who produced the turn
 * @param content the turn's text
 */
public record ConversationTurn(Role role, String content) {

    public static ConversationTurn user(String content) {
        return new ConversationTurn(Role.USER, content);
    }

    public static ConversationTurn assistant(String content) {
        return new ConversationTurn(Role.ASSISTANT, content);
    }

    public enum Role {
        USER,
        ASSISTANT
    }
}
