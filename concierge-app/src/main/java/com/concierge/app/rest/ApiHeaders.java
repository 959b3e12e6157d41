package com.concierge.app.rest;

/**
 * Request headers shared by the REST controllers.
 */
final class ApiHeaders {

    /**
     * Caller identity, set by the gateway in front of this service.
     */
    static final String USER_ID = "X-User-Id";

    static final String DEFAULT_USER = "system";

    private ApiHeaders() {
    }

    static String userOrDefault(String userId) {
        return userId != null && !userId.isBlank() ? userId : DEFAULT_USER;
    }
}
