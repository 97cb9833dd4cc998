package ai.rshell.treesitter;

import com.google.common.base.CharMatcher;
import com.google.common.base.Utf8;
import java.nio.charset.StandardCharsets;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSPoint;

/**
 * UTF-8 view of a source string. Tree-sitter reports byte offsets and byte columns, Java strings index by char.
 */
final class SourceText {
    private static final Logger log = LogManager.getLogger(SourceText.class);

    private final String source;
    private final byte[] bytes;

    SourceText(String source) {
        this.source = source;
        this.bytes = source.getBytes(StandardCharsets.UTF_8);
    }

    String source() {
        return source;
    }

    int byteLength() {
        return bytes.length;
    }

    /** Text between two UTF-8 byte offsets; out-of-range offsets are clamped. */
    String slice(int startByte, int endByte) {
        if (startByte < 0 || endByte < startByte) {
            log.warn(
                    "Requested bytes outside valid range for source text (length: {} bytes): startByte={}, endByte={}",
                    bytes.length,
                    startByte,
                    endByte);
            return "";
        }
        if (startByte == endByte || startByte >= bytes.length) {
            return "";
        }
        if (endByte > bytes.length) {
            log.warn("End byte offset {} exceeds source byte length {}, truncating", endByte, bytes.length);
            endByte = bytes.length;
        }
        return new String(bytes, startByte, endByte - startByte, StandardCharsets.UTF_8);
    }

    /** Row and byte column just past the last character of {@code text}. */
    static TSPoint endPoint(String text) {
        int row = CharMatcher.is('\n').countIn(text);
        int lastNewline = text.lastIndexOf('\n');
        int column = Utf8.encodedLength(text.substring(lastNewline + 1));
        return new TSPoint(row, column);
    }
}
