package io.github.yok.marlea.parser;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * Enumeration of supported reaction network source formats.
 *
 * <p>
 * Each format lists the file extensions recognized as belonging to it, so that callers such as
 * {@link NetworkLoader} do not need to hardcode string comparisons.
 * </p>
 *
 * @author marlea-parser contributors
 */
@Getter
public enum SourceFormat {

    // Comma-delimited reaction notation.
    CSV("csv");

    // Set of valid extensions for this format (all lowercase).
    private final Set<String> extensions;

    SourceFormat(String... exts) {
        this.extensions = Arrays.stream(exts).map(e -> e.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }

    /**
     * Determines whether the given file extension belongs to this format.
     *
     * @param ext file extension to check (case-insensitive, without dot)
     * @return {@code true} if the extension matches this format, {@code false} otherwise
     */
    public boolean matches(String ext) {
        return ext != null && extensions.contains(ext.toLowerCase(Locale.ROOT));
    }

    /**
     * Finds the format for a file extension.
     *
     * @param ext file extension (case-insensitive, without dot)
     * @return the matching format, or empty if no format claims the extension
     */
    public static Optional<SourceFormat> fromExtension(String ext) {
        return Arrays.stream(values()).filter(f -> f.matches(ext)).findFirst();
    }
}
