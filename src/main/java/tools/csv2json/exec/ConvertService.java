package tools.csv2json.exec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.csv2json.convert.Header;
import tools.csv2json.csv.ConvertError;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;

/**
 * 一次完整的转换：按需读取表头，然后逐行转换。
 */
public class ConvertService {
    private static final Logger log = LoggerFactory.getLogger(ConvertService.class);

    private final RunConfig config;

    public ConvertService(RunConfig config) {
        this.config = config;
    }

    /**
     * @param sourcePath 仅用于报告，stdin 传 null
     * @throws ConvertError        表头行格式错误，此时不会处理任何数据行
     * @throws RunAbortedException exitOnError 模式下遇到失败行
     * @throws IOException         读取失败或行超长
     */
    public RunReport convert(Reader in, Writer out, Writer err, String sourcePath)
            throws ConvertError, RunAbortedException, IOException {
        RunReport report = new RunReport();
        report.setSourcePath(sourcePath);
        report.setHeader(config.isHeader());
        report.markStart();
        log.debug("开始转换: {}", config);

        LineScanner scanner = new LineScanner(in, config.getMaxLineLength());
        try {
            Header header = null;
            if (config.isHeader()) {
                String first = scanner.next();
                if (first == null) {
                    log.debug("输入为空，未读取到表头");
                    return report;
                }
                header = Header.fromLine(first);
                log.debug("表头: {}", header);
            }
            LineRunner runner = new LineRunner(scanner, config);
            return runner.run(new CsvLineConverter(header, config.getMaxOutputLength()), out, err, report);
        } catch (ConvertError | IOException e) {
            report.setAborted(true);
            throw e;
        } finally {
            report.markEnd();
        }
    }
}
