package tools.csv2json.exec;

import tools.csv2json.util.Config;

/**
 * 一次转换运行的参数。默认值来自 {@link Config}，命令行参数再覆盖。
 */
public class RunConfig {
    private final boolean header;
    private final boolean exitOnError;
    private final int maxLineLength;
    private final int maxOutputLength;

    private RunConfig(Builder builder) {
        this.header = builder.header;
        this.exitOnError = builder.exitOnError;
        this.maxLineLength = builder.maxLineLength;
        this.maxOutputLength = builder.maxOutputLength;
    }

    /** 第一行是否作为表头。 */
    public boolean isHeader() {
        return header;
    }

    /** 出现错误行时是否终止运行。 */
    public boolean isExitOnError() {
        return exitOnError;
    }

    public int getMaxLineLength() {
        return maxLineLength;
    }

    /** 0 表示不限制。 */
    public int getMaxOutputLength() {
        return maxOutputLength;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 以配置文件中的值作为初始值。
     */
    public static Builder fromConfig() {
        return new Builder()
                .exitOnError(Config.isExitOnError())
                .maxLineLength(Config.getMaxLineLength())
                .maxOutputLength(Config.getMaxOutputLength());
    }

    @Override
    public String toString() {
        return "RunConfig{header=" + header
                + ", exitOnError=" + exitOnError
                + ", maxLineLength=" + maxLineLength
                + ", maxOutputLength=" + maxOutputLength + "}";
    }

    public static class Builder {
        private boolean header;
        private boolean exitOnError;
        private int maxLineLength = Config.DEFAULT_MAX_LINE_LENGTH;
        private int maxOutputLength = Config.DEFAULT_MAX_OUTPUT_LENGTH;

        public Builder header(boolean header) {
            this.header = header;
            return this;
        }

        public Builder exitOnError(boolean exitOnError) {
            this.exitOnError = exitOnError;
            return this;
        }

        public Builder maxLineLength(int maxLineLength) {
            this.maxLineLength = maxLineLength;
            return this;
        }

        public Builder maxOutputLength(int maxOutputLength) {
            this.maxOutputLength = maxOutputLength;
            return this;
        }

        public RunConfig build() {
            if (maxLineLength < 1) {
                throw new IllegalArgumentException("maxLineLength must be positive: " + maxLineLength);
            }
            if (maxOutputLength < 0) {
                throw new IllegalArgumentException("maxOutputLength must not be negative: " + maxOutputLength);
            }
            return new RunConfig(this);
        }
    }
}
