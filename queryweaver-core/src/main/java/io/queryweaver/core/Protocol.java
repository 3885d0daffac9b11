package io.queryweaver.core;

/**
 * QueryWeaver streaming protocol constants (paths, header names, JSON field names and well-known values).
 *
 * <p>This module intentionally contains no HTTP client bindings and no JSON library dependencies.
 * It only models protocol-level concerns shared by every client flavour.
 */
public final class Protocol {
    private Protocol() {}

    /** Boundary marker the server writes after every JSON message of a streaming response. */
    public static final String MESSAGE_BOUNDARY = "|||FALKORDB_MESSAGE_BOUNDARY|||";

    // Path segments
    public static final String PATH_GRAPHS = "graphs";
    public static final String PATH_CONFIRM = "confirm";
    public static final String PATH_DATABASE = "database";

    // HTTP headers
    public static final String H_CONTENT_TYPE = "Content-Type";
    public static final String H_AUTHORIZATION = "Authorization";

    // Content types
    public static final String CT_JSON = "application/json";

    public static final String BEARER = "Bearer ";

    // Message fields
    public static final String F_TYPE = "type";
    public static final String F_CONTENT = "content";
    public static final String F_MESSAGE = "message";
    public static final String F_DATA = "data";
    public static final String F_ERROR = "error";
    public static final String F_DETAIL = "detail";
    public static final String F_FINAL_RESPONSE = "final_response";
    public static final String F_CONFIRMATION_ID = "confirmation_id";
    public static final String F_SQL_QUERY = "sql_query";
    public static final String F_OPERATION_TYPE = "operation_type";

    // Request body fields
    public static final String F_CHAT = "chat";
    public static final String F_RESULT = "result";
    public static final String F_INSTRUCTIONS = "instructions";
    public static final String F_CONFIRMATION = "confirmation";
    public static final String F_URL = "url";

    // Confirmation decisions
    public static final String CONFIRM = "CONFIRM";
    public static final String CANCEL = "CANCEL";
}
