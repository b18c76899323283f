package at.sv.color.cli;

import at.sv.color.Color;
import at.sv.color.ColorException;
import at.sv.color.ColorInterpolator;
import at.sv.color.InterpolationMethod;
import at.sv.color.gamut.GamutMapMethod;
import at.sv.color.space.ColorSpace;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "color-engine", version = "0.1.0", mixinStandardHelpOptions = true, sortOptions = false,
        description = "Converts, gamut maps and mixes CSS colors.",
        subcommands = {
                ColorTool.ConvertCommand.class,
                ColorTool.MixCommand.class,
                ColorTool.GamutCommand.class,
                ColorTool.BatchCommand.class
        })
public final class ColorTool implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(ColorTool.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Exit code for invalid colors, spaces or methods given to a subcommand.
     */
    static final int INVALID_INPUT = 2;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        int execute = createCommandLine().execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    static CommandLine createCommandLine() {
        CommandLine commandLine = new CommandLine(new ColorTool());
        commandLine.registerConverter(ColorSpace.class, ColorSpace::fromName);
        commandLine.registerConverter(GamutMapMethod.class, GamutMapMethod::fromName);
        commandLine.registerConverter(InterpolationMethod.class, InterpolationMethod::parse);
        commandLine.setExecutionExceptionHandler(ColorTool::handleExecutionException);
        return commandLine;
    }

    private static int handleExecutionException(Exception e, CommandLine commandLine,
                                                CommandLine.ParseResult parseResult) throws Exception {
        if (e instanceof ColorException || e instanceof IllegalArgumentException) {
            LOG.debug("Command '{}' failed", commandLine.getCommandName(), e);
            commandLine.getErr().println(commandLine.getColorScheme().errorText("Error: " + e.getMessage()));
            return INVALID_INPUT;
        }
        throw e;
    }

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing required subcommand.");
    }

    abstract static class ColorCommand implements Callable<Integer> {

        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        @Option(names = "--json", description = "Print the result as JSON.")
        boolean json;

        void print(Color color) throws JsonProcessingException {
            if (json) {
                spec.commandLine().getOut().println(MAPPER.writeValueAsString(ColorView.of(color)));
            } else {
                spec.commandLine().getOut().println(color);
            }
            spec.commandLine().getOut().flush();
        }
    }

    @Command(name = "convert", mixinStandardHelpOptions = true, description = "Converts a color to another space.")
    static final class ConvertCommand extends ColorCommand {

        @Parameters(index = "0", paramLabel = "COLOR", description = "The color in CSS syntax.")
        String color;
        @Option(names = "--to", required = true, paramLabel = "<space>",
                description = "The destination color space, e.g. srgb, display-p3, oklch.")
        ColorSpace to;
        @Option(names = "--gamut-map", paramLabel = "<method>",
                defaultValue = "${env:COLOR_GAMUT_MAP}",
                description = "Optionally maps the result into the gamut of the destination space: clip or local-minde.")
        GamutMapMethod gamutMap;

        @Override
        public Integer call() throws JsonProcessingException {
            Color converted = ColorParser.parse(color).toSpace(to);
            if (gamutMap != null) {
                converted = converted.toGamut(gamutMap);
            }
            LOG.debug("Converted {} to {}", color, converted);
            print(converted);
            return 0;
        }
    }

    @Command(name = "mix", mixinStandardHelpOptions = true,
            description = "Interpolates between two colors and prints the result in the interpolation space.")
    static final class MixCommand extends ColorCommand {

        @Parameters(index = "0", paramLabel = "COLOR1")
        String color1;
        @Parameters(index = "1", paramLabel = "COLOR2")
        String color2;
        @Option(names = "--in", paramLabel = "<method>", defaultValue = "oklab",
                description = "The interpolation method, e.g. 'oklch longer hue'. Default: ${DEFAULT-VALUE}")
        InterpolationMethod method;
        @Option(names = "--weight", paramLabel = "<weight>", defaultValue = "0.5",
                description = "How far to move from COLOR1 towards COLOR2, in [0, 1]. Default: ${DEFAULT-VALUE}")
        double weight;

        @Override
        public Integer call() throws JsonProcessingException {
            Color mixed = new ColorInterpolator(method).interpolateInSpace(ColorParser.parse(color1),
                    ColorParser.parse(color2), weight);
            LOG.debug("Mixed {} and {} in {} at {}: {}", color1, color2, method, weight, mixed);
            print(mixed);
            return 0;
        }
    }

    @Command(name = "gamut", mixinStandardHelpOptions = true, description = "Maps a color into a gamut.")
    static final class GamutCommand extends ColorCommand {

        @Parameters(index = "0", paramLabel = "COLOR")
        String color;
        @Option(names = "--space", paramLabel = "<space>",
                description = "The space whose gamut to map into. Defaults to the space of the color itself.")
        ColorSpace space;
        @Option(names = "--method", paramLabel = "<method>",
                defaultValue = "${env:COLOR_GAMUT_MAP:-local-minde}",
                description = "The gamut mapping method: clip or local-minde. Default: ${DEFAULT-VALUE}")
        GamutMapMethod method;

        @Override
        public Integer call() throws JsonProcessingException {
            Color parsed = ColorParser.parse(color);
            Color mapped = space == null ? parsed.toGamut(method) : parsed.toGamut(method, space);
            print(mapped);
            return 0;
        }
    }

    @Command(name = "batch", mixinStandardHelpOptions = true,
            description = "Converts every color of a file, one per line. Blank lines and lines starting with # are skipped.")
    static final class BatchCommand implements Callable<Integer> {

        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        @Parameters(index = "0", paramLabel = "FILE")
        Path file;
        @Option(names = "--to", required = true, paramLabel = "<space>")
        ColorSpace to;
        @Option(names = "--gamut-map", paramLabel = "<method>",
                defaultValue = "${env:COLOR_GAMUT_MAP}")
        GamutMapMethod gamutMap;
        @Option(names = "--cache-size", paramLabel = "<entries>",
                defaultValue = "${env:COLOR_CACHE_SIZE:-1000}",
                description = "The maximum number of distinct colors to remember. Default: ${DEFAULT-VALUE}")
        long cacheSize;

        @Override
        public Integer call() {
            ColorConversionCache cache = new ColorConversionCache(to, gamutMap, cacheSize);
            List<String> lines = readLines();
            int failures = 0;
            for (int i = 0; i < lines.size(); i++) {
                String line = lines.get(i).trim();
                if (line.isEmpty() || line.startsWith("#")) {
                    continue;
                }
                MDC.put("context", "line " + (i + 1));
                try {
                    spec.commandLine().getOut().println(cache.convert(line));
                } catch (ColorException | IllegalArgumentException e) {
                    failures++;
                    LOG.warn("Skipped '{}': {}", line, e.getMessage());
                    spec.commandLine().getErr().println("line " + (i + 1) + ": " + e.getMessage());
                } finally {
                    MDC.remove("context");
                }
            }
            spec.commandLine().getOut().flush();
            cache.logStats();
            return failures == 0 ? 0 : 1;
        }

        private List<String> readLines() {
            try {
                return Files.readAllLines(file);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read color file '" + file + "'", e);
            }
        }
    }
}
