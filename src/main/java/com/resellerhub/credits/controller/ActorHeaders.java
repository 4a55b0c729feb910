package com.resellerhub.credits.controller;

/**
 * Headers set by the authenticating gateway in front of this service.
 */
final class ActorHeaders {

    static final String ACTOR_ID = "X-Actor-Id";
    static final String ACTOR_ROLE = "X-Actor-Role";
    static final String IDEMPOTENCY_KEY = "Idempotency-Key";

    private ActorHeaders() {
    }
}
