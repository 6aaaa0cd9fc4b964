package ai.pipestream.history.diff;

import java.util.Arrays;
import java.util.List;

/**
 * Splits stored content into the lines fed to {@link DiffEngine}.
 * <p>
 * {@code \r\n} and lone {@code \r} are normalized to {@code \n}. A trailing newline ends the last
 * line rather than starting an empty one, and empty content has no lines.
 */
public final class TextLines {

    private TextLines() {
    }

    public static List<String> split(String content) {
        if (content == null) {
            throw new IllegalArgumentException("content must not be null");
        }
        String normalized = normalize(content);
        if (normalized.isEmpty()) {
            return List.of();
        }
        if (normalized.endsWith("\n")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return List.copyOf(Arrays.asList(normalized.split("\n", -1)));
    }

    /**
     * Drops a line terminator left on an already split line.
     */
    public static String stripTerminator(String line) {
        if (line.endsWith("\r\n")) {
            return line.substring(0, line.length() - 2);
        }
        if (line.endsWith("\n") || line.endsWith("\r")) {
            return line.substring(0, line.length() - 1);
        }
        return line;
    }

    public static String normalize(String content) {
        if (content.indexOf('\r') < 0) {
            return content;
        }
        return content.replace("\r\n", "\n").replace('\r', '\n');
    }
}
