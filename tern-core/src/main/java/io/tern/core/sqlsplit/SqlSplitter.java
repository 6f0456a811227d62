package io.tern.core.sqlsplit;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Splits a blob of SQL into individually executable statements.
 *
 * This is not a parser. It only tracks enough lexical state (string literals,
 * quoted identifiers, dollar-quoted bodies and comments) to know whether a
 * semicolon terminates a statement.
 */
public final class SqlSplitter
{
    private SqlSplitter()
    { }

    private enum State
    {
        RAW,
        SINGLE_QUOTE,
        ESCAPE_STRING,
        DOUBLE_QUOTE,
        DOLLAR_QUOTE,
        ONE_LINE_COMMENT,
        BLOCK_COMMENT,
    }

    /**
     * Returns the statements of {@code sql} in order. Each statement keeps its
     * trailing semicolon and is trimmed. If no statement could be closed the
     * whole input is returned as the only element.
     */
    public static List<String> split(String sql)
    {
        Lexer lexer = new Lexer(sql);
        lexer.run();

        if (lexer.empty) {
            return ImmutableList.of(sql);
        }
        return lexer.statements.build();
    }

    private static class Lexer
    {
        private final String src;
        private final ImmutableList.Builder<String> statements = ImmutableList.builder();
        private boolean empty = true;

        private int start = 0;
        private int pos = 0;
        private int nested = 0;  // block comment nesting level
        private String dollarTag = null;

        Lexer(String src)
        {
            this.src = src;
        }

        void run()
        {
            State state = State.RAW;
            while (pos < src.length()) {
                char c = src.charAt(pos++);
                switch (state) {
                case RAW:
                    state = raw(c);
                    break;
                case SINGLE_QUOTE:
                    state = quoted(c, '\'');
                    break;
                case ESCAPE_STRING:
                    state = escapeString(c);
                    break;
                case DOUBLE_QUOTE:
                    state = quoted(c, '"');
                    break;
                case DOLLAR_QUOTE:
                    state = dollarQuote(c);
                    break;
                case ONE_LINE_COMMENT:
                    state = oneLineComment(c);
                    break;
                case BLOCK_COMMENT:
                    state = blockComment(c);
                    break;
                default:
                    throw new AssertionError("Unknown lexer state: " + state);
                }
            }

            if (pos > start) {
                addStatement(src.substring(start, pos));
                start = pos;
            }
        }

        private State raw(char c)
        {
            switch (c) {
            case 'e':
            case 'E':
                if (peek() == '\'') {
                    pos++;
                    return State.ESCAPE_STRING;
                }
                return State.RAW;
            case '\'':
                return State.SINGLE_QUOTE;
            case '"':
                return State.DOUBLE_QUOTE;
            case '$': {
                String tag = readDollarTag(pos);
                if (tag != null) {
                    pos += tag.length() + 1;
                    dollarTag = tag;
                    return State.DOLLAR_QUOTE;
                }
                return State.RAW;
            }
            case ';':
                addStatement(src.substring(start, pos));
                start = pos;
                return State.RAW;
            case '-':
                if (peek() == '-') {
                    pos++;
                    return State.ONE_LINE_COMMENT;
                }
                return State.RAW;
            case '/':
                if (peek() == '*') {
                    pos++;
                    nested = 0;
                    return State.BLOCK_COMMENT;
                }
                return State.RAW;
            default:
                return State.RAW;
            }
        }

        // '' inside a literal (or "" inside an identifier) is an escaped quote
        private State quoted(char c, char quote)
        {
            if (c == quote) {
                if (peek() == quote) {
                    pos++;
                    return currentQuoteState(quote);
                }
                return State.RAW;
            }
            return currentQuoteState(quote);
        }

        private static State currentQuoteState(char quote)
        {
            return quote == '"' ? State.DOUBLE_QUOTE : State.SINGLE_QUOTE;
        }

        private State escapeString(char c)
        {
            if (c == '\\') {
                if (pos < src.length()) {
                    pos++;
                }
                return State.ESCAPE_STRING;
            }
            if (c == '\'') {
                if (peek() == '\'') {
                    pos++;
                    return State.ESCAPE_STRING;
                }
                return State.RAW;
            }
            return State.ESCAPE_STRING;
        }

        private State dollarQuote(char c)
        {
            if (c == '$') {
                String tag = readDollarTag(pos);
                if (tag != null && tag.equals(dollarTag)) {
                    pos += tag.length() + 1;
                    dollarTag = null;
                    return State.RAW;
                }
            }
            return State.DOLLAR_QUOTE;
        }

        private static State oneLineComment(char c)
        {
            if (c == '\n' || c == '\r') {
                return State.RAW;
            }
            return State.ONE_LINE_COMMENT;
        }

        private State blockComment(char c)
        {
            if (c == '/' && peek() == '*') {
                pos++;
                nested++;
            }
            else if (c == '*' && peek() == '/') {
                pos++;
                if (nested == 0) {
                    return State.RAW;
                }
                nested--;
            }
            return State.BLOCK_COMMENT;
        }

        private char peek()
        {
            if (pos < src.length()) {
                return src.charAt(pos);
            }
            return 0;
        }

        /**
         * Reads the tag of a dollar quote whose opening '$' is right before
         * {@code from}. Returns null if the text is not a dollar quote, for
         * example a positional parameter such as $1.
         */
        private String readDollarTag(int from)
        {
            if (from >= src.length()) {
                return null;
            }
            char first = src.charAt(from);
            if (first == '$') {
                return "";
            }
            if (!Character.isLetter(first) && first != '_') {
                return null;
            }
            for (int i = from + 1; i < src.length(); i++) {
                char c = src.charAt(i);
                if (c == '$') {
                    return src.substring(from, i);
                }
                if (!Character.isLetterOrDigit(c) && c != '_') {
                    return null;
                }
            }
            return null;
        }

        private void addStatement(String statement)
        {
            String trimmed = statement.trim();
            if (!trimmed.isEmpty()) {
                statements.add(trimmed);
                empty = false;
            }
        }
    }
}
