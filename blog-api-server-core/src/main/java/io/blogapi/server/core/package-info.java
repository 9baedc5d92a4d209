/**
 * Framework-neutral server core for the Blog API.
 *
 * <p>Contains:
 * <ul>
 *   <li>{@link io.blogapi.server.core.BlogApiHandler} (routing, auth, error mapping)</li>
 *   <li>{@link io.blogapi.server.core.AuthService} with {@link io.blogapi.server.core.JwtTokenService}
 *       and {@link io.blogapi.server.core.BCryptPasswordHasher}</li>
 *   <li>In-memory stores sharing {@link io.blogapi.server.core.InMemoryBlogState}</li>
 * </ul>
 *
 * <p>Framework integrations adapt {@link io.blogapi.server.core.ServerRequest} and
 * {@link io.blogapi.server.core.ServerResponse} to their HTTP runtimes.
 */
package io.blogapi.server.core;
