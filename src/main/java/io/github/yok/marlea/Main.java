package io.github.yok.marlea;

import io.github.yok.marlea.config.MarleaConfig;
import io.github.yok.marlea.model.ReactionNetwork;
import io.github.yok.marlea.parser.NetworkLoader;
import io.github.yok.marlea.parser.NetworkParseException;
import io.github.yok.marlea.util.ErrorHandler;
import io.github.yok.marlea.util.NetworkFormatter;
import java.io.File;
import java.util.Arrays;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Provides the application entry point.
 *
 * <p>
 * Loads one reaction network source file through {@link NetworkLoader} and reports how many
 * reactions and species it defines.
 * </p>
 *
 * <p>
 * Argument specification:
 * </p>
 * <ul>
 * <li>{@code --source <file>} or {@code -s <file>} selects the source file. If omitted, the
 * {@code marlea.source-path} setting in {@code application.yml} is used.</li>
 * <li>{@code --show} writes the parsed network to standard output in source notation, as does
 * {@code marlea.show-network: true}.</li>
 * </ul>
 *
 * <p>
 * The exit code is 0 on success, otherwise the code chosen by {@link ErrorHandler}.
 * </p>
 *
 * @see MarleaConfig
 * @see NetworkLoader
 * @author marlea-parser contributors
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties(MarleaConfig.class)
@RequiredArgsConstructor
public class Main implements CommandLineRunner, ExitCodeGenerator {

    private final MarleaConfig marleaConfig;
    private final NetworkLoader networkLoader;

    private int exitCode = ErrorHandler.EXIT_OK;

    /**
     * Bootstraps the application and ends the process with the resulting exit code.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        System.exit(SpringApplication.exit(app.run(args)));
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        String source = null;
        boolean show = marleaConfig.isShowNetwork();
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--source":
                case "-s":
                    source = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--show":
                    show = true;
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }

        // Defaults
        if (StringUtils.isBlank(source)) {
            source = marleaConfig.getSourcePath();
        }
        File file = StringUtils.isBlank(source) ? null : new File(source);

        try {
            ReactionNetwork network = networkLoader.load(file);
            log.info("Loaded reaction network: source={}, reactions={}, species={}", source,
                    network.getReactions().size(), network.getSolution().size());
            if (show) {
                System.out.print(NetworkFormatter.format(network));
            }
            exitCode = ErrorHandler.EXIT_OK;
        } catch (NetworkParseException e) {
            exitCode = ErrorHandler.report("Failed to load reaction network: " + source, e);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
