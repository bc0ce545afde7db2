package com.github.copilot.sdk.transport;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class FrameCodecTest {

    @Test
    void writesContentLengthInBytesNotChars() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        FrameCodec.writeFrame(out, "{\"text\":\"héllo\"}");

        String written = out.toString(StandardCharsets.UTF_8);
        assertThat(written).startsWith("Content-Length: 17\r\n\r\n");
        assertThat(written).endsWith("{\"text\":\"héllo\"}");
    }

    @Test
    void readsFramesDeliveredOneByteAtATime() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        FrameCodec.writeFrame(out, "{\"a\":1}");
        FrameCodec.writeFrame(out, "{\"b\":\"ünïcode\"}");

        FrameCodec.Reader reader = FrameCodec.reader(new OneByteInputStream(out.toByteArray()));

        assertThat(reader.readFrame().getPayload()).isEqualTo("{\"a\":1}");
        assertThat(reader.readFrame().getPayload()).isEqualTo("{\"b\":\"ünïcode\"}");
        assertThat(reader.readFrame()).isNull();
    }

    @Test
    void ignoresOtherHeadersAndHeaderCase() throws IOException {
        String raw = "content-length: 2\r\nContent-Type: application/vscode-jsonrpc; charset=utf-8\r\n\r\n{}";

        Frame frame = reader(raw).readFrame();

        assertThat(frame.isMalformed()).isFalse();
        assertThat(frame.getPayload()).isEqualTo("{}");
    }

    @Test
    void toleratesStrayBlankLinesBetweenFrames() throws IOException {
        String raw = "Content-Length: 2\r\n\r\n{}\r\n\r\nContent-Length: 4\r\n\r\n[1 ]";
        FrameCodec.Reader reader = reader(raw);

        assertThat(reader.readFrame().getPayload()).isEqualTo("{}");
        assertThat(reader.readFrame().getPayload()).isEqualTo("[1 ]");
        assertThat(reader.readFrame()).isNull();
    }

    @Test
    void reportsMissingLengthAndResumesAtNextFrame() throws IOException {
        String raw = "X-Other: 1\r\n\r\nContent-Length: 2\r\n\r\n{}";
        FrameCodec.Reader reader = reader(raw);

        Frame bad = reader.readFrame();
        assertThat(bad.isMalformed()).isTrue();
        assertThat(bad.getError()).contains("Missing Content-Length");

        assertThat(reader.readFrame().getPayload()).isEqualTo("{}");
    }

    @Test
    void reportsNonNumericLength() throws IOException {
        Frame frame = reader("Content-Length: abc\r\n\r\n").readFrame();

        assertThat(frame.isMalformed()).isTrue();
        assertThat(frame.getError()).contains("Invalid Content-Length");
    }

    @Test
    void reportsStreamEndingMidPayload() throws IOException {
        FrameCodec.Reader reader = reader("Content-Length: 10\r\n\r\n{\"a\"");

        Frame frame = reader.readFrame();

        assertThat(frame.isMalformed()).isTrue();
        assertThat(frame.getError()).contains("4 of 10");
        assertThat(reader.readFrame()).isNull();
    }

    @Test
    void reportsStreamEndingInsideHeaders() throws IOException {
        Frame frame = reader("Content-Length: 5").readFrame();

        assertThat(frame.isMalformed()).isTrue();
    }

    @Test
    void cleanEofReturnsNull() throws IOException {
        assertThat(reader("").readFrame()).isNull();
    }

    private static FrameCodec.Reader reader(String raw) {
        return FrameCodec.reader(new ByteArrayInputStream(raw.getBytes(StandardCharsets.UTF_8)));
    }

    private static final class OneByteInputStream extends FilterInputStream {

        OneByteInputStream(byte[] bytes) {
            super(new ByteArrayInputStream(bytes));
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            return super.read(b, off, Math.min(1, len));
        }
    }
}
