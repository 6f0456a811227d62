package io.tern.cli;

import io.tern.core.TernException;
import io.tern.core.migrate.Migrator;

/**
 * Target of {@code migrate -d}.
 *
 * <ul>
 * <li>{@code last}: the latest version</li>
 * <li>{@code N}: version N</li>
 * <li>{@code +N}: N versions forward</li>
 * <li>{@code -N}: N versions back</li>
 * <li>{@code -+N}: N versions back and then forward again to the current version</li>
 * </ul>
 */
public class Destination
{
    enum Kind
    {
        LAST,
        ABSOLUTE,
        RELATIVE,
        REDO,
    }

    private final Kind kind;
    private final int value;

    private Destination(Kind kind, int value)
    {
        this.kind = kind;
        this.value = value;
    }

    public static Destination parse(String text)
    {
        if (text.equals("last")) {
            return new Destination(Kind.LAST, 0);
        }
        else if (text.length() >= 3 && text.startsWith("-+")) {
            return new Destination(Kind.REDO, parseInt(text, text.substring(2)));
        }
        else if (text.length() >= 2 && text.charAt(0) == '-') {
            return new Destination(Kind.RELATIVE, -parseInt(text, text.substring(1)));
        }
        else if (text.length() >= 2 && text.charAt(0) == '+') {
            return new Destination(Kind.RELATIVE, parseInt(text, text.substring(1)));
        }
        else {
            return new Destination(Kind.ABSOLUTE, parseInt(text, text));
        }
    }

    private static int parseInt(String text, String number)
    {
        try {
            return Integer.parseInt(number);
        }
        catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Bad destination: " + text, ex);
        }
    }

    Kind getKind()
    {
        return kind;
    }

    int getValue()
    {
        return value;
    }

    /**
     * Migrates to this destination relative to {@code currentVersion}.
     */
    public void migrate(Migrator migrator, int currentVersion)
        throws TernException
    {
        switch (kind) {
        case LAST:
            migrator.migrate();
            break;
        case ABSOLUTE:
            migrator.migrateTo(value);
            break;
        case RELATIVE:
            migrator.migrateTo(currentVersion + value);
            break;
        case REDO:
            migrator.migrateTo(currentVersion - value);
            migrator.migrateTo(currentVersion);
            break;
        default:
            throw new AssertionError("Unknown destination kind: " + kind);
        }
    }

    @Override
    public String toString()
    {
        return kind + "(" + value + ")";
    }
}
