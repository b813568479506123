package io.github.yok.marlea.parser;

import io.github.yok.marlea.model.ReactionNetwork;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Loads a reaction network from a source file, choosing the parser from the file extension.
 *
 * <p>
 * The file is read as UTF-8 and handed to the {@link NetworkParser} registered for its
 * {@link SourceFormat}. Failures are reported as:
 * </p>
 * <ul>
 * <li>{@link ParseErrorKind#INVALID_FILE} when there is no readable file or it has no
 * extension</li>
 * <li>{@link ParseErrorKind#UNSUPPORTED_EXT} when no format claims the extension</li>
 * <li>{@link ParseErrorKind#PARSE_FAILED} when the content is malformed</li>
 * </ul>
 */
@Slf4j
@Component
public class NetworkLoader {

    /**
     * Reads and parses the given file.
     *
     * @param source source file, may be {@code null}
     * @return the parsed network
     * @throws NetworkParseException if no source can be read, its format is unsupported, or it is
     *         malformed
     */
    public ReactionNetwork load(File source) throws NetworkParseException {
        if (source == null) {
            throw new NetworkParseException(ParseErrorKind.INVALID_FILE,
                    "No source file was given");
        }
        if (!source.isFile()) {
            throw new NetworkParseException(ParseErrorKind.INVALID_FILE,
                    "Source file not found: " + source.getPath());
        }

        String ext = FilenameUtils.getExtension(source.getName());
        if (StringUtils.isEmpty(ext)) {
            throw new NetworkParseException(ParseErrorKind.INVALID_FILE,
                    "Source file has no extension: " + source.getName());
        }
        SourceFormat format = SourceFormat.fromExtension(ext)
                .orElseThrow(() -> new NetworkParseException(ParseErrorKind.UNSUPPORTED_EXT,
                        "Unsupported source file extension: ." + ext));

        String text;
        try {
            text = FileUtils.readFileToString(source, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new NetworkParseException(ParseErrorKind.INVALID_FILE,
                    "Failed to read source file: " + source.getPath(), e);
        }

        log.info("Resolved reaction network source: {} ({})", source.getName(), format);
        try {
            return createParser(format).parse(text);
        } catch (NetworkParseException e) {
            throw new NetworkParseException(e.getKind(),
                    source.getName() + ": " + e.getMessage(), e.getCause());
        }
    }

    /**
     * Creates the appropriate {@link NetworkParser} for the given {@link SourceFormat}.
     *
     * @param format the format to create a parser for
     * @return parser for the format
     */
    NetworkParser createParser(SourceFormat format) {
        switch (format) {
            case CSV:
                return new CsvNetworkParser();
            default:
                throw new IllegalArgumentException("Unsupported format: " + format);
        }
    }
}
