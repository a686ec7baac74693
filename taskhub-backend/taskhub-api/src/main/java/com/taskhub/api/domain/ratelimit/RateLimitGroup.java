package com.taskhub.api.domain.ratelimit;

import com.taskhub.api.config.TaskHubProperties;

/**
 * Route groups that carry their own request budget.
 */
public enum RateLimitGroup {
    /** Anonymous credential endpoints: register and login. */
    AUTH("auth"),
    /** Everything else. */
    API("api");

    private final String value;

    RateLimitGroup(String value) {
        this.value = value;
    }

    public TaskHubProperties.Window windowFrom(TaskHubProperties.RateLimit settings) {
        return this == AUTH ? settings.getAuth() : settings.getApi();
    }

    @Override
    public String toString() {
        return value;
    }
}
