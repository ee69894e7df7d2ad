package com.prudhvi.llm_gateway.events;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;

/**
 * Common shape of everything the gateway emits to its collaborators.
 *
 * Serialized to JSON for Kafka and SSE with a "type" discriminator.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = StateTransitionEvent.class, name = "transition"),
        @JsonSubTypes.Type(value = AttemptEvent.class, name = "attempt"),
        @JsonSubTypes.Type(value = CallCompletedEvent.class, name = "call")
})
public sealed interface GatewayEvent permits StateTransitionEvent, AttemptEvent, CallCompletedEvent {

    String provider();

    Instant timestamp();
}
