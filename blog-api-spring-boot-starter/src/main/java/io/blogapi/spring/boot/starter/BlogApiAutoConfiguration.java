package io.blogapi.spring.boot.starter;

import io.blogapi.json.jackson.JacksonJsonCodec;
import io.blogapi.json.spi.JsonCodec;
import io.blogapi.server.core.AuthService;
import io.blogapi.server.core.BCryptPasswordHasher;
import io.blogapi.server.core.BlogApiHandler;
import io.blogapi.server.core.InMemoryBlogState;
import io.blogapi.server.core.InMemoryCommentStore;
import io.blogapi.server.core.InMemoryCredentialStore;
import io.blogapi.server.core.InMemoryLikeStore;
import io.blogapi.server.core.InMemoryPostStore;
import io.blogapi.server.core.JwtTokenService;
import io.blogapi.server.core.TokenBucketRateLimiter;
import io.blogapi.server.spi.CommentStore;
import io.blogapi.server.spi.CredentialStore;
import io.blogapi.server.spi.LikeStore;
import io.blogapi.server.spi.PasswordHasher;
import io.blogapi.server.spi.PostStore;
import io.blogapi.server.spi.RateLimiter;
import io.blogapi.server.spi.TokenService;
import io.blogapi.servlet.BlogApiServlet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.ServletRegistrationBean;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

/**
 * Auto-configuration for the Blog API on a servlet web application.
 *
 * <p>Provides in-memory stores, BCrypt password hashing, JWT bearer tokens, the
 * {@link BlogApiHandler} and a {@link BlogApiServlet} registered at {@code blog-api.base-path}.
 * Every bean can be overridden by defining your own.
 *
 * <p>{@code blog-api.auth.secret} must be set; startup fails otherwise.
 */
@AutoConfiguration
@ConditionalOnClass({BlogApiHandler.class, BlogApiServlet.class})
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@EnableConfigurationProperties(BlogApiProperties.class)
public class BlogApiAutoConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(BlogApiAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock blogApiClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public PasswordHasher blogApiPasswordHasher(BlogApiProperties properties) {
        return new BCryptPasswordHasher(properties.getAuth().getBcryptStrength());
    }

    @Bean
    @ConditionalOnMissingBean
    public CredentialStore blogApiCredentialStore(PasswordHasher hasher) {
        return new InMemoryCredentialStore(hasher);
    }

    @Bean
    @ConditionalOnMissingBean
    public TokenService blogApiTokenService(BlogApiProperties properties, Clock clock) {
        BlogApiProperties.Auth auth = properties.getAuth();
        if (auth.getSecret() == null || auth.getSecret().isBlank()) {
            throw new IllegalStateException("blog-api.auth.secret must be set");
        }
        return JwtTokenService.builder(auth.getSecret())
                .algorithm(auth.getAlgorithm())
                .ttl(auth.getTokenTtl())
                .clock(clock)
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public AuthService blogApiAuthService(CredentialStore credentials, TokenService tokens) {
        return new AuthService(credentials, tokens);
    }

    /**
     * Shared lock and id sequences behind the default post, like and comment stores.
     */
    @Bean
    @ConditionalOnMissingBean
    public InMemoryBlogState blogApiState(Clock clock) {
        return new InMemoryBlogState(clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public PostStore blogApiPostStore(InMemoryBlogState state) {
        return new InMemoryPostStore(state);
    }

    @Bean
    @ConditionalOnMissingBean
    public LikeStore blogApiLikeStore(InMemoryBlogState state) {
        return new InMemoryLikeStore(state);
    }

    @Bean
    @ConditionalOnMissingBean
    public CommentStore blogApiCommentStore(InMemoryBlogState state) {
        return new InMemoryCommentStore(state);
    }

    @Bean
    @ConditionalOnMissingBean
    public JsonCodec blogApiJsonCodec() {
        return new JacksonJsonCodec();
    }

    @Bean
    @ConditionalOnMissingBean
    public RateLimiter blogApiRateLimiter(BlogApiProperties properties, Clock clock) {
        BlogApiProperties.RateLimit limit = properties.getRateLimit();
        if (!limit.isEnabled()) {
            return RateLimiter.permitAll();
        }
        LOG.info("Rate limiting enabled: capacity={}, refill={}/s", limit.getCapacity(), limit.getRefillPerSecond());
        return new TokenBucketRateLimiter(limit.getCapacity(), limit.getRefillPerSecond(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public BlogApiHandler blogApiHandler(
            AuthService auth,
            PostStore posts,
            LikeStore likes,
            CommentStore comments,
            JsonCodec jsonCodec,
            RateLimiter rateLimiter,
            Clock clock,
            BlogApiProperties properties) {
        return BlogApiHandler.builder(auth, posts, likes, comments)
                .jsonCodec(jsonCodec)
                .rateLimiter(rateLimiter)
                .clock(clock)
                .maxBodySize(properties.getMaxBodySize().toBytes())
                .allowedOrigin(properties.getCors().getAllowedOrigin())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public BlogApiServlet blogApiServlet(BlogApiHandler handler) {
        return new BlogApiServlet(handler);
    }

    @Bean
    @ConditionalOnMissingBean(name = "blogApiServletRegistration")
    public ServletRegistrationBean<BlogApiServlet> blogApiServletRegistration(
            BlogApiServlet servlet, BlogApiProperties properties) {
        String mapping = mapping(properties.getBasePath());
        LOG.info("Blog API mounted at {}", mapping);
        ServletRegistrationBean<BlogApiServlet> registration = new ServletRegistrationBean<>(servlet, mapping);
        registration.setName("blogApiServlet");
        return registration;
    }

    static String mapping(String basePath) {
        String base = basePath == null ? "" : basePath.trim();
        while (base.endsWith("/")) base = base.substring(0, base.length() - 1);
        if (!base.isEmpty() && !base.startsWith("/")) base = "/" + base;
        return base + "/*";
    }
}
