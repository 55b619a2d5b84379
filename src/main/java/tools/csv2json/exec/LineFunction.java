package tools.csv2json.exec;

import tools.csv2json.csv.ConvertError;

import java.io.IOException;

/**
 * 把一行输入映射为一行输出（不含换行符）。
 */
@FunctionalInterface
public interface LineFunction {
    String apply(String line) throws ConvertError, IOException;
}
