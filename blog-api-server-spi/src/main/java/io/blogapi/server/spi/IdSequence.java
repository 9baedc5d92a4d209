package io.blogapi.server.spi;

/**
 * Source of strictly increasing identifiers.
 *
 * <p>Implementations must never return the same value twice, including under concurrent use, and must
 * never reuse a value after the entity holding it is deleted.
 */
public interface IdSequence {

    /**
     * @return the next identifier, greater than every value returned before
     */
    long next();
}
