package com.taskhub.api.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

import java.time.Duration;

/**
 * Application settings bound from the {@code taskhub.*} namespace.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "taskhub")
public class TaskHubProperties {

    private final Auth auth = new Auth();
    private final RateLimit rateLimit = new RateLimit();
    private final Storage storage = new Storage();
    private final Pagination pagination = new Pagination();

    @Getter
    @Setter
    public static class Auth {
        /**
         * Lifetime of issued tokens. Null keeps tokens valid until logout.
         */
        private Duration tokenTtl;
        private Duration tokenCleanupInterval = Duration.ofHours(1);
        private int bcryptCost = 12;
    }

    @Getter
    @Setter
    public static class RateLimit {
        private boolean enabled = true;
        /**
         * Counter backend: "memory" or "redis"
         */
        private String store = "memory";
        private boolean failOpen = true;
        private boolean trustForwardedHeaders = false;
        private Window auth = new Window(5, Duration.ofMinutes(1));
        private Window api = new Window(60, Duration.ofMinutes(1));
    }

    @Getter
    @Setter
    public static class Window {
        private int limit;
        private Duration window;

        public Window() {
        }

        public Window(int limit, Duration window) {
            this.limit = limit;
            this.window = window;
        }
    }

    @Getter
    @Setter
    public static class Storage {
        private String avatarDir = "storage/public";
        private DataSize maxAvatarSize = DataSize.ofMegabytes(2);
    }

    @Getter
    @Setter
    public static class Pagination {
        private int defaultPageSize = 10;
        private int maxPageSize = 100;
    }
}
