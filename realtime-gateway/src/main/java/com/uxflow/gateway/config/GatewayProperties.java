package com.uxflow.gateway.config;

import com.uxflow.gateway.domain.Tier;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "gateway")
@Data
@Validated
public class GatewayProperties {

    /** Blank means: NODE_ID env var, or a random id. */
    private String instanceId = "";

    private final WebSocket websocket = new WebSocket();
    private final Liveness liveness = new Liveness();
    private final RateLimit rateLimit = new RateLimit();
    private final SharedCache sharedCache = new SharedCache();
    private final Security security = new Security();
    private final Router router = new Router();
    private final Events events = new Events();

    @Data
    public static class WebSocket {
        @NotBlank
        private String path = "/ws";
        private String[] allowedOrigins = {"*"};
        @Positive
        private int maxFrameBytes = 512 * 1024;
        @Positive
        private int maxImageBytes = 384 * 1024;
        @Positive
        private int sendTimeLimitMs = 5000;
        @Positive
        private int sendBufferBytes = 512 * 1024;
    }

    @Data
    public static class Liveness {
        @NotNull
        private Duration interval = Duration.ofSeconds(30);
    }

    @Data
    public static class RateLimit {
        @NotNull
        private Duration window = Duration.ofSeconds(60);
        private final Tiers tiers = new Tiers();

        public TierLimits limitsFor(Tier tier) {
            if (tier == null) {
                return tiers.getFree();
            }
            switch (tier) {
                case PRO:
                    return tiers.getPro();
                case ENTERPRISE:
                    return tiers.getEnterprise();
                default:
                    return tiers.getFree();
            }
        }
    }

    @Data
    public static class Tiers {
        private TierLimits free = new TierLimits(1, 20, 10);
        private TierLimits pro = new TierLimits(5, 100, 30);
        private TierLimits enterprise = new TierLimits(100, 1000, 300);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TierLimits {
        /** Simultaneous connections per user. */
        @Positive
        private int maxConnections;
        /** Inbound frames per connection per rate-limit window. */
        @Positive
        private int messagesPerWindow;
        /** Connection admissions per user per rate-limit window. */
        @Positive
        private int connectsPerWindow;
    }

    @Data
    public static class SharedCache {
        @NotNull
        private Duration timeout = Duration.ofMillis(500);
        @NotNull
        private Duration sessionTtl = Duration.ofHours(1);
        @NotNull
        private Duration cursorTtl = Duration.ofSeconds(60);
        @NotBlank
        private String keyPrefix = "gateway:";
        @NotBlank
        private String relayChannel = "gateway_broadcast";
    }

    @Data
    public static class Security {
        @NotBlank
        private String jwtSecret = "default-secret-key-change-this-in-production-minimum-256-bits";
        @NotBlank
        private String revocationKeyPrefix = "token:blacklist:";
        /** Admit connections when the revocation list cannot be read. */
        private boolean revocationFailOpen = false;
    }

    @Data
    public static class Router {
        @NotNull
        private Duration duplicateCooldown = Duration.ofSeconds(2);
    }

    @Data
    public static class Events {
        @NotBlank
        private String topic = "gateway-events";
    }
}
