package com.mdpress;

import ch.qos.logback.classic.Level;
import com.mdpress.core.config.ConfigLoader;
import com.mdpress.core.config.ConverterConfig;
import com.mdpress.core.convert.ConversionResult;
import com.mdpress.core.convert.FileConverter;
import com.mdpress.core.convert.MarkdownConverter;
import com.mdpress.core.html.StyleProfile;
import com.mdpress.core.renderer.OutputRenderer;
import com.mdpress.core.renderer.OutputRenderers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Main CLI entry point for mdpress.
 *
 * <p>Converts one Markdown file, optionally preceded by a {@code ---} front
 * matter block, into an HTML page.
 *
 * <p><b>Exit status:</b> 1 when the positional arguments are missing or
 * invalid, otherwise 0. The conversion outcome is reported as
 * {@code Converted!} or {@code Error: <detail>} followed by
 * {@code Failed to convert}.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Convert with the default page
 * mdpress post.md post.html
 *
 * # Convert into a custom page
 * mdpress post.md post.html --template layout.html
 *
 * # Print bare HTML to standard output
 * mdpress post.md - --style plain
 * }</pre>
 */
@Command(
    name = "mdpress",
    mixinStandardHelpOptions = true,
    version = "mdpress 1.0.0-SNAPSHOT",
    description = "Converts a Markdown file with optional front matter into HTML",
    exitCodeOnInvalidInput = 1
)
public class MdPressCLI implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(MdPressCLI.class);

    static final String STDOUT = "-";

    @Parameters(index = "0", paramLabel = "<input-file>", description = "Markdown input file")
    private Path inputFile;

    @Parameters(index = "1", paramLabel = "<output-file>", description = "HTML output file, or '-' for standard output")
    private Path outputFile;

    @Option(names = {"-t", "--template"}, paramLabel = "<path>",
        description = "HTML template containing {{content}}; {{title}} and {{<metadataKey>}} are also replaced")
    private Path templatePath;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: mdpress.yaml)")
    private Path configPath = Paths.get(ConverterConfig.DEFAULT_FILE_NAME);

    @Option(names = {"--style"}, description = "Attribute style: ${COMPLETION-CANDIDATES} (overrides config)")
    private StyleProfile style;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all log output except errors")
    private boolean quiet;

    @Override
    public Integer call() {
        configureLogging();

        boolean toConsole = STDOUT.equals(outputFile.toString());
        // Status lines must not mix with a page printed to standard output
        PrintStream status = toConsole ? System.err : System.out;

        ConversionResult result;
        try {
            ConverterConfig config = ConfigLoader.load(configPath);
            if (style != null) {
                config = config.withStyle(style);
            }
            log.debug("Using style profile: {}", config.style());

            OutputRenderer renderer = OutputRenderers.find(toConsole ? OutputRenderers.CONSOLE : OutputRenderers.FILESYSTEM);
            result = new FileConverter(new MarkdownConverter(config), renderer)
                .convert(inputFile, outputFile, templatePath);
        } catch (RuntimeException e) {
            log.error("Failed to set up conversion", e);
            System.err.println("Error: " + e.getMessage());
            status.println("Failed to convert");
            return 0;
        }

        if (result.success()) {
            status.println("Converted!");
        } else {
            System.err.println("Error: " + result.message());
            status.println("Failed to convert");
        }
        return 0;
    }

    /**
     * Configures logging level based on global options.
     */
    private void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
    }

    /**
     * Builds the command line with case-insensitive enum values.
     *
     * @return configured command line
     */
    static CommandLine commandLine() {
        return new CommandLine(new MdPressCLI())
            .setCaseInsensitiveEnumValuesAllowed(true);
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
