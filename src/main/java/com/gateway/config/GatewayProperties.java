package com.gateway.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed settings bound from the {@code gateway.*} namespace of {@code application.yml}.
 * <p>
 * Every outbound wire call is bounded by one of the timeouts below.
 */
@Data
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

    /**
     * The JSON file the store mirrors its state to. Blank keeps everything in memory.
     */
    private String stateFile = "";

    /**
     * The maximum number of call log entries kept in memory.
     */
    private int callLogCapacity = 1000;

    private Http http = new Http();

    private OAuth2 oauth2 = new OAuth2();

    private PubSub pubsub = new PubSub();

    @Data
    public static class Http {

        /**
         * Upper bound for a whole request/response exchange.
         */
        private Duration timeout = Duration.ofSeconds(30);

        private Duration connectTimeout = Duration.ofSeconds(10);

        /**
         * Sent as {@code User-Agent} unless the caller supplies one.
         */
        private String userAgent = "Spec-Gateway/1.0.0";
    }

    @Data
    public static class OAuth2 {

        /**
         * How long a pending authorization state accepts its callback.
         */
        private Duration stateExpiry = Duration.ofMinutes(10);

        /**
         * Requested when the configuration does not name a scope.
         */
        private String defaultScope = "openid profile email";

        private Duration tokenTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class PubSub {

        private Duration connectTimeout = Duration.ofSeconds(10);

        /**
         * Bound for publish acknowledgements from brokers that provide them.
         */
        private Duration publishTimeout = Duration.ofSeconds(10);

        /**
         * Capacity of each adapter's hand-off queue between network threads and handlers.
         */
        private int dispatchQueueCapacity = 1024;

        /**
         * Messages buffered per gateway subscription before the oldest are dropped.
         */
        private int inboxCapacity = 256;
    }
}
