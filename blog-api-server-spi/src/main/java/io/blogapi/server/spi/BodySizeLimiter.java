package io.blogapi.server.spi;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Utility for reading request bodies under a maximum size.
 *
 * <p>Servers return 413 Payload Too Large when a body exceeds the configured limit.
 */
public final class BodySizeLimiter {

    /** Disables limiting. */
    public static final long UNLIMITED = Long.MAX_VALUE;

    private static final int BUFFER_SIZE = 8192;

    private BodySizeLimiter() {}

    /**
     * Reads the whole stream, failing as soon as more than {@code maxBytes} have been read.
     *
     * @param in body stream (may be null)
     * @param maxBytes maximum number of bytes allowed; non-positive or {@link #UNLIMITED} disables the check
     * @return body bytes; empty for a null stream
     * @throws PayloadTooLargeException if the limit is exceeded
     */
    public static byte[] readAll(InputStream in, long maxBytes) throws IOException {
        if (in == null) return new byte[0];
        boolean limited = maxBytes > 0 && maxBytes != UNLIMITED;

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buf = new byte[BUFFER_SIZE];
        long total = 0;
        int n;
        while ((n = in.read(buf)) >= 0) {
            total += n;
            if (limited && total > maxBytes) {
                throw new PayloadTooLargeException(maxBytes);
            }
            out.write(buf, 0, n);
        }
        return out.toByteArray();
    }

    /**
     * Exception thrown when payload size exceeds the configured limit.
     */
    public static final class PayloadTooLargeException extends IOException {
        private final long maxBytes;

        public PayloadTooLargeException(long maxBytes) {
            super("Payload exceeds maximum size of " + maxBytes + " bytes");
            this.maxBytes = maxBytes;
        }

        public long maxBytes() {
            return maxBytes;
        }
    }
}
