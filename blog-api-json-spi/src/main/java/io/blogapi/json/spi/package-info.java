/**
 * JSON SPI for the Blog API.
 *
 * <p>The server core depends only on {@link io.blogapi.json.spi.JsonCodec}; implementations are
 * discovered through {@link java.util.ServiceLoader} or passed explicitly.
 */
package io.blogapi.json.spi;
