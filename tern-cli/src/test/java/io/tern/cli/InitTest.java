package io.tern.cli;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Files;
import java.nio.file.Path;

import static io.tern.cli.TestUtils.main;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;

public class InitTest
{
    @Rule
    public final TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void createsDirectoryWithSamples()
        throws Exception
    {
        Path dir = folder.getRoot().toPath().resolve("migrations");

        CommandStatus status = main("init", dir.toString());
        status.assertSuccess();

        assertThat(status.outUtf8(), containsString("Creating " + dir.resolve("tern.conf")));
        assertThat(Files.isRegularFile(dir.resolve("tern.conf")), is(true));
        assertThat(new String(Files.readAllBytes(dir.resolve("001_create_people.sql.example")), UTF_8),
                containsString("---- create above / drop below ----"));
    }

    @Test
    public void sampleConfigLoads()
        throws Exception
    {
        Path dir = folder.getRoot().toPath().resolve("migrations");
        main("init", dir.toString()).assertSuccess();

        CommandStatus status = main("print-connstring", "-c", dir.resolve("tern.conf").toString(), "--user", "u");
        status.assertSuccess();
        assertThat(status.outUtf8(), is("postgres://u:@:5432/?"));
    }

    @Test
    public void existingDirectoryFails()
    {
        CommandStatus status = main("init", folder.getRoot().toString());
        assertThat(status.code(), is(1));
    }

    @Test
    public void tooManyArguments()
    {
        CommandStatus status = main("init", "a", "b");
        assertThat(status.code(), is(1));
        assertThat(status.errUtf8(), containsString("Usage: tern init [dir] [options...]"));
        assertThat(status.errUtf8(), containsString("error: Unexpected arguments: b"));
    }
}
