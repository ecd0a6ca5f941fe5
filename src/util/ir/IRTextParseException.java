package util.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * IR 文本解析异常
 *
 * 收集一次加载中遇到的全部错误，每个错误带行号
 */
public class IRTextParseException extends Exception {

    /**
     * 解析错误详情类
     */
    public static class ParseError {
        private final int lineNumber;
        private final String line;
        private final String errorMessage;

        public ParseError(int lineNumber, String line, String errorMessage) {
            this.lineNumber = lineNumber;
            this.line = line;
            this.errorMessage = errorMessage;
        }

        public int getLineNumber() {
            return lineNumber;
        }

        public String getLine() {
            return line;
        }

        public String getErrorMessage() {
            return errorMessage;
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append("Line ").append(lineNumber).append(": ").append(errorMessage);
            if (line != null && !line.isEmpty()) {
                sb.append("\n  -> ").append(line.trim());
            }
            return sb.toString();
        }
    }

    private final String sourceName;
    private final List<ParseError> errors;

    public IRTextParseException(String sourceName, List<ParseError> errors) {
        super(formatMultipleErrors(sourceName, errors));
        this.sourceName = sourceName;
        this.errors = new ArrayList<>(errors);
    }

    public String getSourceName() {
        return sourceName;
    }

    /**
     * 获取所有解析错误
     */
    public List<ParseError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    /**
     * 格式化多个错误消息
     */
    private static String formatMultipleErrors(String sourceName, List<ParseError> errors) {
        StringBuilder sb = new StringBuilder("Failed to load ").append(sourceName);
        sb.append("\nFound ").append(errors.size()).append(" error(s):");

        for (int i = 0; i < errors.size() && i < 5; i++) {
            sb.append("\n").append(i + 1).append(". ").append(errors.get(i).toString());
        }

        if (errors.size() > 5) {
            sb.append("\n... and ").append(errors.size() - 5).append(" more error(s)");
        }

        return sb.toString();
    }
}
