/**
 * Wire-level building blocks shared by the Blog API server and its adapters.
 *
 * <p>Contains:
 * <ul>
 *   <li>{@link io.blogapi.core.Protocol} (paths, header names, well-known values)</li>
 *   <li>{@link io.blogapi.core.Headers} (case-insensitive lookup, bearer extraction)</li>
 *   <li>{@link io.blogapi.core.BlogApiException} (error taxonomy surfaced to callers)</li>
 * </ul>
 */
package io.blogapi.core;
