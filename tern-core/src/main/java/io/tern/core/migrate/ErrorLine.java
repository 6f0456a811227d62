package io.tern.core.migrate;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The line of a SQL text that a database error position points to.
 */
public class ErrorLine
{
    private final int lineNum;
    private final int columnNum;
    private final String text;

    private ErrorLine(int lineNum, int columnNum, String text)
    {
        this.lineNum = lineNum;
        this.columnNum = columnNum;
        this.text = text;
    }

    /**
     * Locates a 1-based character {@code position} in {@code sql}. Positions
     * and columns count code points, as PostgreSQL does.
     */
    public static ErrorLine extract(String sql, int position)
    {
        int length = sql.codePointCount(0, sql.length());
        checkArgument(position >= 1 && position <= length,
                "position %s is out of range of the sql text (length %s)", position, length);

        int offset = sql.offsetByCodePoints(0, position - 1);
        int lineNum = 1;
        int lineStart = 0;
        for (int i = 0; i < offset; i++) {
            if (sql.charAt(i) == '\n') {
                lineNum++;
                lineStart = i + 1;
            }
        }

        int lineEnd = sql.indexOf('\n', lineStart);
        if (lineEnd < 0) {
            lineEnd = sql.length();
        }
        String text = sql.substring(lineStart, lineEnd);
        if (text.endsWith("\r")) {
            text = text.substring(0, text.length() - 1);
        }

        return new ErrorLine(lineNum, sql.codePointCount(lineStart, offset) + 1, text);
    }

    public int getLineNum()
    {
        return lineNum;
    }

    public int getColumnNum()
    {
        return columnNum;
    }

    public String getText()
    {
        return text;
    }

    /**
     * Formats this line the way psql does, with a caret under the column.
     */
    public String format()
    {
        String prefix = "LINE " + lineNum + ": ";
        StringBuilder sb = new StringBuilder();
        sb.append(prefix).append(text).append('\n');
        for (int i = 0; i < prefix.length() + columnNum - 1; i++) {
            sb.append(' ');
        }
        sb.append('^');
        return sb.toString();
    }

    @Override
    public String toString()
    {
        return String.format("ErrorLine{line=%d, column=%d, text=%s}", lineNum, columnNum, text);
    }
}
