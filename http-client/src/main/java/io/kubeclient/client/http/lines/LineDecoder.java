package io.kubeclient.client.http.lines;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import io.kubeclient.model.KubeProtocolException;
import io.kubeclient.util.Assert;

/**
 * Splits a chunked byte stream into text lines.
 * <p>
 * Chunk boundaries are irrelevant to the result: a line, a multi-byte character or a CR LF
 * pair may be split across any number of chunks. LF, CR and CR LF all terminate a line.
 * Malformed input is replaced with the charset's replacement character.
 * <p>
 * Instances are not thread-safe and belong to exactly one body subscription.
 */
public final class LineDecoder {

    /**
     * Size of the intermediate character buffer.
     */
    public static final int DEFAULT_BUFFER_SIZE = 2048;

    private static final ByteBuffer EMPTY = ByteBuffer.allocate(0);

    private final CharsetDecoder decoder;
    private final CharBuffer chars;
    private final StringBuilder pending = new StringBuilder();
    private ByteBuffer leftover = EMPTY;
    private boolean pendingCr;
    private boolean flushed;

    public LineDecoder(Charset charset) {
        this(charset, DEFAULT_BUFFER_SIZE);
    }

    public LineDecoder(Charset charset, int bufferSize) {
        Assert.checkNotNullParam("charset", charset);
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("Buffer size must be greater than 0");
        }
        this.decoder = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        this.chars = CharBuffer.allocate(bufferSize);
    }

    /**
     * Resolves the charset named by a {@code Content-Type} header.
     *
     * @param contentType the header value
     * @return the charset named by the {@code charset} parameter, UTF-8 when there is none or it is empty
     * @throws KubeProtocolException if the charset is unknown to this JVM
     */
    public static Charset charsetOf(String contentType) {
        for (String parameter : contentType.split(";")) {
            int separator = parameter.indexOf('=');
            if (separator < 0 || !parameter.substring(0, separator).trim().equalsIgnoreCase("charset")) {
                continue;
            }
            String name = parameter.substring(separator + 1).trim();
            if (name.length() >= 2 && name.startsWith("\"") && name.endsWith("\"")) {
                name = name.substring(1, name.length() - 1).trim();
            }
            if (name.isEmpty()) {
                continue;
            }
            try {
                return Charset.forName(name);
            } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                throw new KubeProtocolException(
                        "Unsupported charset '" + name + "' in Content-Type '" + contentType + "'.", e);
            }
        }
        return StandardCharsets.UTF_8;
    }

    /**
     * Decodes one chunk.
     *
     * @param chunk the bytes received; fully consumed by this call
     * @return the lines completed by this chunk, possibly none
     */
    public List<String> decode(ByteBuffer chunk) {
        if (flushed) {
            throw new IllegalStateException("Decoder has already been flushed");
        }
        ByteBuffer input = leftover.hasRemaining() ? concat(leftover, chunk) : chunk;
        List<String> lines = new ArrayList<>();
        CoderResult result;
        do {
            result = decoder.decode(input, chars, false);
            drain(lines);
        } while (result.isOverflow());

        // an incomplete multi-byte sequence waits for the next chunk
        leftover = input.hasRemaining() ? copy(input) : EMPTY;
        return lines;
    }

    /**
     * Ends the stream.
     *
     * @return the unterminated trailing line, if it is not empty
     */
    public Optional<String> flush() {
        if (flushed) {
            return Optional.empty();
        }
        flushed = true;
        List<String> lines = new ArrayList<>();
        ByteBuffer input = leftover;
        leftover = EMPTY;
        CoderResult result;
        do {
            result = decoder.decode(input, chars, true);
            drain(lines);
        } while (result.isOverflow());
        do {
            result = decoder.flush(chars);
            drain(lines);
        } while (result.isOverflow());

        if (!lines.isEmpty()) {
            // only replacement characters can come out of a truncated sequence
            throw new IllegalStateException("Unexpected line terminator in trailing bytes");
        }
        if (pending.length() == 0) {
            return Optional.empty();
        }
        String last = pending.toString();
        pending.setLength(0);
        return Optional.of(last);
    }

    private void drain(List<String> lines) {
        chars.flip();
        while (chars.hasRemaining()) {
            char c = chars.get();
            if (pendingCr) {
                pendingCr = false;
                if (c == '\n') {
                    continue;
                }
            }
            if (c == '\r') {
                pendingCr = true;
                emit(lines);
            } else if (c == '\n') {
                emit(lines);
            } else {
                pending.append(c);
            }
        }
        chars.clear();
    }

    private void emit(List<String> lines) {
        lines.add(pending.toString());
        pending.setLength(0);
    }

    private static ByteBuffer concat(ByteBuffer first, ByteBuffer second) {
        ByteBuffer combined = ByteBuffer.allocate(first.remaining() + second.remaining());
        combined.put(first).put(second).flip();
        return combined;
    }

    private static ByteBuffer copy(ByteBuffer buffer) {
        ByteBuffer copy = ByteBuffer.allocate(buffer.remaining());
        copy.put(buffer).flip();
        return copy;
    }
}
