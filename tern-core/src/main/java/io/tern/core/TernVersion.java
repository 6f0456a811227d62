package io.tern.core;

import com.google.common.io.Resources;

import java.io.IOException;
import java.io.UncheckedIOException;

import static java.nio.charset.StandardCharsets.UTF_8;

public class TernVersion
{
    private final String version;

    private TernVersion(String version)
    {
        this.version = version;
    }

    public static TernVersion buildVersion()
    {
        return TernVersion.of(loadVersionString());
    }

    private static String loadVersionString()
    {
        try {
            return Resources.toString(Resources.getResource(TernVersion.class, "version.txt"), UTF_8).trim();
        }
        catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public String version()
    {
        return version;
    }

    public static TernVersion of(String versionString)
    {
        return new TernVersion(versionString);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return version.equals(((TernVersion) o).version);
    }

    @Override
    public int hashCode()
    {
        return version.hashCode();
    }

    @Override
    public String toString()
    {
        return version;
    }
}
