package org.kaleidoscope.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.kaleidoscope.compiler.Frontend;
import org.kaleidoscope.compiler.api.IFrontend;
import org.kaleidoscope.compiler.api.ParseSummary;
import org.kaleidoscope.compiler.frontend.TopLevelConstruct;
import org.kaleidoscope.compiler.frontend.parser.ast.AstPrinter;
import org.kaleidoscope.compiler.frontend.source.CharacterSource;
import org.kaleidoscope.compiler.frontend.source.ReaderCharacterSource;
import org.kaleidoscope.config.ConfigLoader;
import org.kaleidoscope.config.FrontendSettings;
import org.kaleidoscope.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "kaleidoscope",
    mixinStandardHelpOptions = true,
    version = "Kaleidoscope front-end 1.0",
    description = "Parses Kaleidoscope programs and reports every top-level construct."
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);
    private static final String STDIN = "-";

    @Parameters(
        paramLabel = "INPUT",
        arity = "0..*",
        description = "Program text. Multiple inputs are joined with the configured separator."
    )
    private List<String> inputs = new ArrayList<>();

    @Option(
        names = {"-f", "--file"},
        paramLabel = "PATH",
        description = "Read the program from a file instead of the arguments; '-' reads standard input."
    )
    private String file;

    @Option(names = "--dump-ast", description = "Print every parsed construct to standard output.")
    private boolean dumpAst;

    @Option(
        names = {"-c", "--config"},
        description = "Path to a configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + " if present)"
    )
    private File configFile;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        if (file != null && !inputs.isEmpty()) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Program text cannot be given both as arguments and with --file");
        }

        final FrontendSettings settings;
        try {
            final Config config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
            settings = FrontendSettings.from(config);
        } catch (ConfigException | IllegalArgumentException e) {
            LOG.error("Failed to load configuration: {}", e.getMessage());
            return 1;
        }

        final IFrontend frontend = new Frontend(settings.operators());
        final ParseSummary summary;
        try {
            summary = parse(frontend, settings);
        } catch (IOException | UncheckedIOException e) {
            LOG.error("Failed to read program input: {}", e.getMessage());
            return 1;
        }

        if (dumpAst) {
            final PrintWriter out = spec.commandLine().getOut();
            final AstPrinter printer = new AstPrinter();
            for (TopLevelConstruct construct : summary.constructs()) {
                out.println(render(printer, construct));
            }
            out.flush();
        }

        // Syntax errors were already reported; reaching the end of input is a success.
        return 0;
    }

    private ParseSummary parse(IFrontend frontend, FrontendSettings settings) throws IOException {
        if (file == null) {
            return frontend.parse(CharacterSource.ofInputs(inputs, settings.inputSeparator()));
        }
        if (STDIN.equals(file)) {
            // System.in stays open.
            return frontend.parse(new ReaderCharacterSource(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
        }
        try (Reader reader = Files.newBufferedReader(Path.of(file), StandardCharsets.UTF_8)) {
            return frontend.parse(new ReaderCharacterSource(reader));
        }
    }

    private static String render(AstPrinter printer, TopLevelConstruct construct) {
        if (construct instanceof TopLevelConstruct.Extern extern) {
            return printer.printExtern(extern.node());
        }
        return printer.print(construct.node());
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }
}
