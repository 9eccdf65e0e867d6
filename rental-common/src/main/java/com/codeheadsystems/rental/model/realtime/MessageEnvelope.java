package com.codeheadsystems.rental.model.realtime;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * JSON frame exchanged on the real-time channel in both directions.
 * <p>
 * The {@code payload} shape depends on {@code type}:
 * <ul>
 *   <li>{@code authorization}: the bearer token string</li>
 *   <li>{@code notification}, {@code error}, {@code chat}: free text</li>
 *   <li>{@code logout}: ignored</li>
 *   <li>{@code item-created}, {@code item-updated}, {@code item-deleted}: a JSON object</li>
 * </ul>
 * The server stamps {@code sender} on everything it forwards; a client-supplied value is
 * discarded.
 *
 * @param type    message kind
 * @param payload kind-dependent body
 * @param sender  identity the message originates from, or {@code server}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record MessageEnvelope(
    @JsonProperty("type") String type,
    @JsonProperty("payload") JsonNode payload,
    @JsonProperty("sender") String sender) {
}
