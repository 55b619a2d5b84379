package tools.csv2json.app;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import tools.csv2json.csv.ConvertError;
import tools.csv2json.exec.ConvertService;
import tools.csv2json.exec.RunAbortedException;
import tools.csv2json.exec.RunConfig;
import tools.csv2json.exec.RunReport;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * 应用入口：从 stdin（或文件）读取 CSV，每行输出一行 JSON 到 stdout。
 */
@Command(
        name = "csv2json",
        mixinStandardHelpOptions = true,
        version = "csv2json 1.0.0",
        description = {
                "Convert csv data from stdin into json.",
                "",
                "Each input line becomes one JSON array, or one JSON object when @|bold --header|@ is given.",
                "Empty fields become null; digit-only fields become numbers.",
                ""
        },
        exitCodeOnExecutionException = 1
)
public class Main implements Callable<Integer> {
    static final int EXIT_ABORTED = 1;

    @Spec
    private CommandSpec spec;

    @Option(names = {"-i", "--header"}, description = "Read header line.")
    private boolean header;

    @Option(names = "--failfast", description = "Exit on error.")
    private boolean failfast;

    @Option(names = "--verbose", description = "Log debug output to stderr.")
    private boolean verbose;

    @Option(names = "--max-line-length", paramLabel = "N",
            description = "Max characters of an input line (default: scan.maxLineLength, 4096).")
    private Integer maxLineLength;

    @Parameters(arity = "0..1", paramLabel = "FILE", description = "Input file, stdin if omitted.")
    private Path file;

    private final InputStream stdin;
    private final OutputStream stdout;
    private final OutputStream stderr;

    public Main() {
        this(System.in, System.out, System.err);
    }

    Main(InputStream stdin, OutputStream stdout, OutputStream stderr) {
        this.stdin = stdin;
        this.stdout = stdout;
        this.stderr = stderr;
    }

    @Override
    public Integer call() throws IOException {
        if (verbose) {
            System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
        }
        // created after --verbose so the level applies
        Logger log = LoggerFactory.getLogger(Main.class);

        RunConfig config = buildConfig();
        Writer out = new BufferedWriter(new OutputStreamWriter(stdout, StandardCharsets.UTF_8));
        Writer err = new OutputStreamWriter(stderr, StandardCharsets.UTF_8);
        try (Reader in = openInput()) {
            RunReport report = new ConvertService(config).convert(in, out, err, file == null ? null : file.toString());
            log.info("\n{}", report.toText());
            return 0;
        } catch (RunAbortedException e) {
            log.debug("运行中止于第 {} 行", e.getLineNumber(), e);
            return EXIT_ABORTED;
        } catch (ConvertError e) {
            log.debug("表头解析失败", e);
            report(err, "Header " + e.getMessage());
            return EXIT_ABORTED;
        } catch (IOException e) {
            log.debug("读取输入失败", e);
            report(err, e.getMessage());
            return EXIT_ABORTED;
        } finally {
            out.flush();
            err.flush();
        }
    }

    private RunConfig buildConfig() {
        RunConfig.Builder builder = RunConfig.fromConfig().header(header);
        if (failfast) {
            builder.exitOnError(true);
        }
        if (maxLineLength != null) {
            builder.maxLineLength(maxLineLength);
        }
        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage());
        }
    }

    private Reader openInput() throws IOException {
        if (file == null) {
            return new InputStreamReader(stdin, StandardCharsets.UTF_8);
        }
        if (!Files.isRegularFile(file)) {
            throw new ParameterException(spec.commandLine(), "not a file: " + file);
        }
        return Files.newBufferedReader(file, StandardCharsets.UTF_8);
    }

    private static void report(Writer err, String message) throws IOException {
        err.write(message);
        err.write('\n');
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
