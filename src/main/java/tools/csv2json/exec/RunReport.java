package tools.csv2json.exec;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class RunReport {
    private String sourcePath;
    private boolean header;
    private boolean aborted;
    private long lineCount;
    private long convertedCount;
    private long failedCount;
    private Instant startTime = Instant.now();
    private Instant endTime;
    private final List<String> warnings = new ArrayList<>();

    public String getSourcePath() {
        return sourcePath;
    }

    public void setSourcePath(String sourcePath) {
        this.sourcePath = sourcePath;
    }

    public boolean isHeader() {
        return header;
    }

    public void setHeader(boolean header) {
        this.header = header;
    }

    public boolean isAborted() {
        return aborted;
    }

    public void setAborted(boolean aborted) {
        this.aborted = aborted;
    }

    /** 读取的数据行数，不含表头。 */
    public long getLineCount() {
        return lineCount;
    }

    public void incrementLineCount() {
        this.lineCount++;
    }

    public long getConvertedCount() {
        return convertedCount;
    }

    public void incrementConvertedCount() {
        this.convertedCount++;
    }

    public long getFailedCount() {
        return failedCount;
    }

    public void incrementFailedCount() {
        this.failedCount++;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public void markStart() {
        this.startTime = Instant.now();
    }

    public Instant getEndTime() {
        return endTime;
    }

    public void markEnd() {
        this.endTime = Instant.now();
    }

    public void addWarning(String warning) {
        this.warnings.add(warning);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public String toText() {
        String duration = endTime != null ? Duration.between(startTime, endTime).toMillis() + " ms" : "";
        return "csv2json 运行报告" +
                "\n源: " + (sourcePath != null ? sourcePath : "<stdin>") +
                "\n表头: " + (header ? "是" : "否") +
                "\n行数: 读取=" + lineCount + " 转换=" + convertedCount + " 失败=" + failedCount +
                "\n耗时: " + duration +
                (aborted ? "\n状态: 已中止" : "\n状态: 完成") +
                (warnings.isEmpty() ? "" : "\n警告:\n" + String.join("\n", warnings));
    }
}
