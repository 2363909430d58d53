package com.flagship.job_ledger.common;

/**
 * Request headers naming the acting user. Authentication happens upstream;
 * this service trusts what the gateway forwards.
 */
public final class ActorHeaders {

    public static final String ACTOR = "X-Actor";
    public static final String ACTOR_ROLE = "X-Actor-Role";
    public static final String DEFAULT_ACTOR = "system";
    public static final String DEFAULT_ROLE = "admin";

    private ActorHeaders() {
        // Utility class
    }
}
