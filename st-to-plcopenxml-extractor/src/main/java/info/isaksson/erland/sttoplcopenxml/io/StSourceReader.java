package info.isaksson.erland.sttoplcopenxml.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads Structured Text source files as UTF-8.
 */
public final class StSourceReader {

    private static final char BOM = '\uFEFF';

    private StSourceReader() {}

    /**
     * Read the whole file in one call. A leading byte order mark is dropped.
     *
     * @throws NoSuchFileException when {@code path} does not exist or is a directory
     */
    public static String read(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        if (!Files.isRegularFile(path)) {
            throw new NoSuchFileException(path.toString(), null, "input file does not exist");
        }
        String text = Files.readString(path, StandardCharsets.UTF_8);
        if (!text.isEmpty() && text.charAt(0) == BOM) {
            text = text.substring(1);
        }
        return text;
    }
}
