package io.blogapi.spring.boot.starter;

import io.blogapi.server.core.BCryptPasswordHasher;
import io.blogapi.server.core.BlogApiHandler;
import io.blogapi.server.core.JwtTokenService;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

import java.time.Duration;

/**
 * Settings bound from {@code blog-api.*}.
 */
@ConfigurationProperties("blog-api")
public class BlogApiProperties {

    /**
     * Path the API servlet is mounted at.
     */
    private String basePath = "/api";

    /**
     * Largest accepted request body.
     */
    private DataSize maxBodySize = DataSize.ofBytes(BlogApiHandler.DEFAULT_MAX_BODY_SIZE);

    private final Auth auth = new Auth();
    private final Cors cors = new Cors();
    private final RateLimit rateLimit = new RateLimit();

    public String getBasePath() {
        return basePath;
    }

    public void setBasePath(String basePath) {
        this.basePath = basePath;
    }

    public DataSize getMaxBodySize() {
        return maxBodySize;
    }

    public void setMaxBodySize(DataSize maxBodySize) {
        this.maxBodySize = maxBodySize;
    }

    public Auth getAuth() {
        return auth;
    }

    public Cors getCors() {
        return cors;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public static class Auth {

        /**
         * Token signing secret, at least 32 bytes. Required.
         */
        private String secret;

        /**
         * Token signing algorithm. Only HS256 is supported.
         */
        private String algorithm = JwtTokenService.ALGORITHM_HS256;

        /**
         * Lifetime of issued access tokens.
         */
        private Duration tokenTtl = JwtTokenService.DEFAULT_TTL;

        /**
         * BCrypt cost factor.
         */
        private int bcryptStrength = BCryptPasswordHasher.DEFAULT_STRENGTH;

        public String getSecret() {
            return secret;
        }

        public void setSecret(String secret) {
            this.secret = secret;
        }

        public String getAlgorithm() {
            return algorithm;
        }

        public void setAlgorithm(String algorithm) {
            this.algorithm = algorithm;
        }

        public Duration getTokenTtl() {
            return tokenTtl;
        }

        public void setTokenTtl(Duration tokenTtl) {
            this.tokenTtl = tokenTtl;
        }

        public int getBcryptStrength() {
            return bcryptStrength;
        }

        public void setBcryptStrength(int bcryptStrength) {
            this.bcryptStrength = bcryptStrength;
        }
    }

    public static class Cors {

        /**
         * Value sent in Access-Control-Allow-Origin.
         */
        private String allowedOrigin = BlogApiHandler.ANY_ORIGIN;

        public String getAllowedOrigin() {
            return allowedOrigin;
        }

        public void setAllowedOrigin(String allowedOrigin) {
            this.allowedOrigin = allowedOrigin;
        }
    }

    public static class RateLimit {

        /**
         * Whether to limit requests per client address.
         */
        private boolean enabled = false;

        /**
         * Burst size per client.
         */
        private int capacity = 100;

        /**
         * Sustained requests per second per client.
         */
        private double refillPerSecond = 10.0;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = capacity;
        }

        public double getRefillPerSecond() {
            return refillPerSecond;
        }

        public void setRefillPerSecond(double refillPerSecond) {
            this.refillPerSecond = refillPerSecond;
        }
    }
}
