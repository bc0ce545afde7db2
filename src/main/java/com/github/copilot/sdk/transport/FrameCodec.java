package com.github.copilot.sdk.transport;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Header-delimited framing used by the CLI server:
 * {@code Content-Length: <n>\r\n\r\n} followed by {@code n} bytes of UTF-8 JSON.
 *
 * <p>Header lines other than {@code Content-Length} are ignored. A header block that does
 * not yield a usable length produces a malformed {@link Frame} and reading resumes at the
 * next header block.
 */
public final class FrameCodec {

    public static final String CONTENT_LENGTH = "Content-Length";

    static final int MAX_HEADER_LINE = 8 * 1024;
    static final int MAX_FRAME_SIZE = 64 * 1024 * 1024;

    private FrameCodec() {
    }

    /**
     * Write one frame and flush. Callers serialise concurrent writers.
     */
    public static void writeFrame(OutputStream out, String json) throws IOException {
        byte[] payload = json.getBytes(StandardCharsets.UTF_8);
        byte[] header = (CONTENT_LENGTH + ": " + payload.length + "\r\n\r\n").getBytes(StandardCharsets.US_ASCII);
        out.write(header);
        out.write(payload);
        out.flush();
    }

    /**
     * Create a reader for the given stream. The reader owns its own buffering, so it
     * must be the only consumer of the stream.
     */
    public static Reader reader(InputStream in) {
        return new Reader(in);
    }

    /**
     * Sequential frame reader. Not thread-safe; one reader loop per connection.
     */
    public static final class Reader {

        private final InputStream in;

        private Reader(InputStream in) {
            this.in = in;
        }

        /**
         * Read the next frame, blocking until it has fully arrived.
         *
         * @return the next frame, or {@code null} once the stream ended cleanly
         * @throws IOException if the underlying stream fails
         */
        public Frame readFrame() throws IOException {
            Integer contentLength = null;
            String headerError = null;
            boolean sawHeader = false;

            while (true) {
                String line = readHeaderLine();
                if (line == null) {
                    return sawHeader ? Frame.malformed("Stream ended inside a header block") : null;
                }
                if (line.isEmpty()) {
                    if (!sawHeader) {
                        // Tolerate stray blank lines between frames
                        continue;
                    }
                    break;
                }
                sawHeader = true;
                if (line.length() > MAX_HEADER_LINE) {
                    headerError = "Header line too long";
                    continue;
                }
                int colon = line.indexOf(':');
                if (colon <= 0) {
                    headerError = "Invalid header line: " + truncate(line);
                    continue;
                }
                String name = line.substring(0, colon).trim();
                String value = line.substring(colon + 1).trim();
                if (CONTENT_LENGTH.toLowerCase(Locale.ROOT).equals(name.toLowerCase(Locale.ROOT))) {
                    try {
                        contentLength = Integer.parseInt(value);
                    } catch (NumberFormatException e) {
                        headerError = "Invalid Content-Length: " + truncate(value);
                    }
                }
            }

            if (contentLength == null) {
                return Frame.malformed(headerError != null ? headerError : "Missing Content-Length header");
            }
            if (contentLength < 0) {
                return Frame.malformed("Invalid Content-Length: " + contentLength);
            }
            if (contentLength > MAX_FRAME_SIZE) {
                skipFully(contentLength);
                return Frame.malformed("Frame too large: " + contentLength);
            }

            byte[] payload = new byte[contentLength];
            int offset = 0;
            while (offset < contentLength) {
                int read = in.read(payload, offset, contentLength - offset);
                if (read == -1) {
                    return Frame.malformed("Stream ended after " + offset + " of " + contentLength + " payload bytes");
                }
                offset += read;
            }
            return Frame.of(new String(payload, StandardCharsets.UTF_8));
        }

        /**
         * Read one CRLF (or LF) terminated header line as ASCII. A line cut short by
         * EOF is returned as-is; {@code null} means EOF before any byte of the line.
         */
        private String readHeaderLine() throws IOException {
            StringBuilder sb = new StringBuilder();
            boolean any = false;
            while (true) {
                int b = in.read();
                if (b == -1) {
                    return any ? sb.toString() : null;
                }
                any = true;
                if (b == '\n') {
                    int len = sb.length();
                    if (len > 0 && sb.charAt(len - 1) == '\r') {
                        sb.setLength(len - 1);
                    }
                    return sb.toString();
                }
                if (sb.length() <= MAX_HEADER_LINE) {
                    sb.append((char) b);
                }
            }
        }

        private void skipFully(long length) throws IOException {
            long remaining = length;
            while (remaining > 0) {
                long skipped = in.skip(remaining);
                if (skipped <= 0) {
                    if (in.read() == -1) {
                        return;
                    }
                    skipped = 1;
                }
                remaining -= skipped;
            }
        }

        private static String truncate(String value) {
            return value.length() <= 80 ? value : value.substring(0, 80) + "...";
        }
    }
}
