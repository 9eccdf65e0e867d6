package com.codeheadsystems.rental.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of every error response and of success responses that carry no entity.
 *
 * @param message human-readable outcome
 */
public record MessageResponse(@JsonProperty("message") String message) {
}
