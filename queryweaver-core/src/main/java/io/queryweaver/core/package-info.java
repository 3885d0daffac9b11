/**
 * Protocol-centric core for QueryWeaver streaming responses.
 *
 * <p>This module is deliberately framework-neutral. It contains only:
 * <ul>
 *   <li>Protocol constants and the {@link io.queryweaver.core.StreamMessage} model</li>
 *   <li>The frame splitter and an incremental UTF-8 decoder</li>
 *   <li>Lightweight utilities (endpoint URLs, the exception hierarchy)</li>
 * </ul>
 *
 * <p>JSON and HTTP bindings live in other modules.
 */
package io.queryweaver.core;
