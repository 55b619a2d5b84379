package tools.csv2json.exec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.csv2json.csv.ConvertError;

import java.io.IOException;
import java.io.Writer;

/**
 * 逐行读取、调用 {@link LineFunction}，把结果写入输出流，错误写入错误流。
 * <ul>
 *     <li>单行失败（转换失败或写出失败）时输出 "Line &lt;n&gt; &lt;line&gt; &lt;error&gt;"；</li>
 *     <li>exitOnError 为 true 时以 {@link RunAbortedException} 终止，否则跳过该行继续；</li>
 *     <li>读取失败（含超长行）总是终止运行。</li>
 * </ul>
 */
public class LineRunner {
    private static final Logger log = LoggerFactory.getLogger(LineRunner.class);

    private final LineScanner scanner;
    private final RunConfig config;

    public LineRunner(LineScanner scanner, RunConfig config) {
        this.scanner = scanner;
        this.config = config;
    }

    public RunReport run(LineFunction func, Writer out, Writer err) throws IOException, RunAbortedException {
        return run(func, out, err, new RunReport());
    }

    public RunReport run(LineFunction func, Writer out, Writer err, RunReport report)
            throws IOException, RunAbortedException {
        String line;
        while ((line = scanner.next()) != null) {
            long linum = scanner.getLineNumber();
            report.incrementLineCount();
            log.debug("[LineRunner] Line {} - {}", linum, line);

            String result;
            try {
                result = func.apply(line);
            } catch (ConvertError | IOException e) {
                log.debug("[LineRunner] Line {} func returned error {}", linum, e.toString());
                fail(linum, line, e, err, report);
                continue;
            }
            log.debug("[LineRunner] Line {} func returned {}", linum, result);

            try {
                out.write(result);
                out.write('\n');
            } catch (IOException e) {
                log.debug("[LineRunner] Line {} failed to write result", linum);
                fail(linum, line, e, err, report);
                continue;
            }
            report.incrementConvertedCount();
        }
        out.flush();
        return report;
    }

    private void fail(long linum, String line, Exception error, Writer err, RunReport report)
            throws RunAbortedException {
        report.incrementFailedCount();
        String diagnostic = "Line " + linum + " " + line + " " + RunAbortedException.describe(error);
        try {
            err.write(diagnostic);
            err.write('\n');
            err.flush();
        } catch (IOException e) {
            log.warn("写入错误信息失败: {} ({})", diagnostic, e.getMessage());
        }
        if (config.isExitOnError()) {
            report.setAborted(true);
            throw new RunAbortedException(linum, line, error);
        }
        log.warn("跳过第 {} 行: {}", linum, RunAbortedException.describe(error));
        report.addWarning(diagnostic);
    }
}
