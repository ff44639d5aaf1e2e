package work.lcod.converter.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.converter.api.ConversionResult;
import work.lcod.converter.api.ConverterConfiguration;
import work.lcod.converter.api.LogLevel;
import work.lcod.converter.api.WorkflowConverter;
import work.lcod.converter.config.ConverterSettingsLoader;

@CommandLine.Command(
    name = "wf-convert",
    description = "Convert Alteryx workflows (.yxmd) into pandas Python scripts.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class ConvertCommand implements Callable<Integer> {
    static final String STDIN = "-";
    static final String LOG_LEVEL_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";
    private static final String SCRIPT_EXTENSION = ".py";

    enum ReportFormat { JSON, YAML }

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-w", "--workflow"},
        required = true,
        paramLabel = "PATH|-",
        description = "Workflow file; use '-' to read from stdin.",
        arity = "1..*"
    )
    private List<String> workflows = new ArrayList<>();

    @CommandLine.Option(
        names = {"-o", "--output"},
        description = "Script output path (single workflow only).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String output;

    @CommandLine.Option(
        names = "--out-dir",
        description = "Directory receiving <workflow-name>.py (default: next to the workflow).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String outDir;

    @CommandLine.Option(
        names = "--stdout",
        description = "Print generated scripts instead of writing files."
    )
    private boolean toStdout;

    @CommandLine.Option(
        names = "--config",
        description = "TOML settings file.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String configPath;

    @CommandLine.Option(
        names = "--prefix",
        description = "Variable name prefix for generated DataFrames.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String prefix;

    @CommandLine.Option(
        names = "--timestamp",
        description = "Add a 'Generated:' line to the script header."
    )
    private boolean timestamp;

    @CommandLine.Option(
        names = "--format",
        description = "Report format (json|yaml).",
        defaultValue = "json"
    )
    private String formatRaw;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @Override
    public Integer call() throws Exception {
        if (output != null && workflows.size() > 1) {
            throw new CommandLine.ParameterException(
                spec.commandLine(),
                "When using multiple --workflow values, --output is not supported."
            );
        }
        if (output != null && outDir != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--output and --out-dir are exclusive.");
        }
        ReportFormat format = resolveFormat();
        ConverterConfiguration configuration = resolveConfiguration();
        // Must run before any converter class creates its logger.
        System.setProperty(LOG_LEVEL_PROPERTY, configuration.logLevel().simpleLoggerLevel());

        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        int exitCode = 0;
        for (String workflow : workflows) {
            ConversionResult result = convertOne(workflow, configuration, out);
            exitCode = Math.max(exitCode, result.status().exitCode());
            PrintWriter reportTarget = scriptsToStdout(workflow) ? err : out;
            reportTarget.println(format == ReportFormat.YAML ? result.toYaml() : result.toPrettyJson());
        }
        out.flush();
        err.flush();
        return exitCode;
    }

    private ConversionResult convertOne(String workflow, ConverterConfiguration configuration, PrintWriter out)
        throws IOException {
        String sourceName = STDIN.equals(workflow) ? "<stdin>" : workflow;
        byte[] raw = readWorkflow(workflow);
        ConversionResult result = new WorkflowConverter(configuration).convert(raw, sourceName);
        Optional<String> script = result.script();
        if (script.isEmpty()) {
            return result;
        }
        if (scriptsToStdout(workflow)) {
            out.print(script.get());
            return result;
        }
        Path target = resolveTarget(workflow);
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, script.get(), StandardCharsets.UTF_8);
        return result.withMetadata("output", target.toString());
    }

    private byte[] readWorkflow(String workflow) throws IOException {
        if (STDIN.equals(workflow)) {
            try (InputStream in = System.in) {
                return in.readAllBytes();
            }
        }
        Path path = Paths.get(workflow).toAbsolutePath().normalize();
        if (!Files.isRegularFile(path)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Workflow file not found: " + path);
        }
        return Files.readAllBytes(path);
    }

    private boolean scriptsToStdout(String workflow) {
        return toStdout || (STDIN.equals(workflow) && output == null && outDir == null);
    }

    private Path resolveTarget(String workflow) {
        if (output != null) {
            return Paths.get(output).toAbsolutePath().normalize();
        }
        String name = STDIN.equals(workflow) ? "workflow" : scriptName(Paths.get(workflow));
        if (outDir != null) {
            return Paths.get(outDir).resolve(name + SCRIPT_EXTENSION).toAbsolutePath().normalize();
        }
        Path source = Paths.get(workflow).toAbsolutePath().normalize();
        return source.resolveSibling(name + SCRIPT_EXTENSION);
    }

    static String scriptName(Path workflow) {
        String fileName = workflow.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private ConverterConfiguration resolveConfiguration() {
        ConverterConfiguration.Builder builder = ConverterConfiguration.builder();
        if (configPath != null) {
            builder = ConverterSettingsLoader.load(Paths.get(configPath), builder);
        }
        if (prefix != null) {
            builder.variablePrefix(prefix);
        }
        if (timestamp) {
            builder.generatedAt(Optional.of(Instant.now()));
        }
        String level = logLevelRaw;
        if (level == null || level.isBlank()) {
            level = System.getenv("WFCONVERT_LOG_LEVEL");
        }
        if (level != null && !level.isBlank()) {
            builder.logLevel(LogLevel.from(level));
        }
        return builder.build();
    }

    private ReportFormat resolveFormat() {
        try {
            return ReportFormat.valueOf(formatRaw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Unsupported report format: " + formatRaw);
        }
    }
}
