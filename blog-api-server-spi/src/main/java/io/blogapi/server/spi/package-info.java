/**
 * Server-side SPI for the Blog API.
 *
 * <p>Store contracts return outcome values instead of throwing for expected conditions (missing post,
 * wrong owner, duplicate like); the server core maps outcomes to HTTP errors. The SPI is blocking and
 * minimal, intended to be backed by in-memory maps or any other storage.
 */
package io.blogapi.server.spi;
