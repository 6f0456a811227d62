package io.tern.cli;

public class SystemExitException
        extends Exception
{
    // 128 + SIGINT, the status shells report for a Ctrl-C'd process
    public static final int CANCELLED_CODE = 130;

    private final int code;

    public SystemExitException(int code, String message)
    {
        super(message);
        this.code = code;
    }

    public static SystemExitException systemExit(String errorMessage)
    {
        if (errorMessage != null) {
            return new SystemExitException(1, errorMessage);
        }
        else {
            return new SystemExitException(0, null);
        }
    }

    /**
     * Exit of a migration stopped by Ctrl-C. The error is printed before this
     * is thrown, so the exception carries no message.
     */
    public static SystemExitException cancelled()
    {
        return new SystemExitException(CANCELLED_CODE, null);
    }

    public int getCode()
    {
        return code;
    }
}
