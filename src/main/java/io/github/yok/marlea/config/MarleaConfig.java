package io.github.yok.marlea.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that binds the {@code marlea} section in {@code application.yml}.
 *
 * <pre>
 * marlea:
 *   source-path: networks/counter.csv
 *   show-network: true
 * </pre>
 *
 * @author marlea-parser contributors
 */
@ConfigurationProperties(prefix = "marlea")
@Data
public class MarleaConfig {

    /**
     * Source file loaded when no {@code --source} argument is given.
     */
    private String sourcePath;

    /**
     * When {@code true}, the parsed network is written to standard output in source notation.
     * Defaults to {@code false}.
     */
    private boolean showNetwork = false;
}
