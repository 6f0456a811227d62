package io.tern.core.database;

import org.junit.Test;

import java.util.Properties;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.startsWith;

public class DatabaseConfigTest
{
    @Test
    public void postgresqlUrl()
    {
        DatabaseConfig config = DatabaseConfig.builder()
            .type(DatabaseConfig.POSTGRESQL)
            .host("db.example.com")
            .database("app")
            .build();
        assertThat(DatabaseConfig.buildJdbcUrl(config), is("jdbc:postgresql://db.example.com/app"));

        DatabaseConfig withPort = DatabaseConfig.builder().from(config).port(6543).build();
        assertThat(DatabaseConfig.buildJdbcUrl(withPort), is("jdbc:postgresql://db.example.com:6543/app"));
    }

    @Test
    public void connStringWins()
    {
        DatabaseConfig config = DatabaseConfig.builder()
            .type(DatabaseConfig.POSTGRESQL)
            .host("ignored")
            .database("ignored")
            .connString("jdbc:postgresql://other/app?sslmode=require")
            .build();
        assertThat(DatabaseConfig.buildJdbcUrl(config), is("jdbc:postgresql://other/app?sslmode=require"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void postgresqlRequiresHost()
    {
        DatabaseConfig.buildJdbcUrl(DatabaseConfig.builder()
                .type(DatabaseConfig.POSTGRESQL)
                .database("app")
                .build());
    }

    @Test
    public void h2InMemoryDatabasesAreDistinct()
    {
        DatabaseConfig config = DatabaseConfig.builder().type(DatabaseConfig.H2).build();
        String url = DatabaseConfig.buildJdbcUrl(config);
        assertThat(url, startsWith("jdbc:h2:mem:tern-"));
        assertThat(DatabaseConfig.buildJdbcUrl(config), not(url));
    }

    @Test
    public void postgresqlProperties()
    {
        DatabaseConfig config = DatabaseConfig.builder()
            .type(DatabaseConfig.POSTGRESQL)
            .host("localhost")
            .database("app")
            .user("alice")
            .password("secret")
            .sslmode("verify-full")
            .sslrootcert("/etc/ssl/root.crt")
            .build();
        Properties props = DatabaseConfig.buildJdbcProperties(config);
        assertThat(props.getProperty("user"), is("alice"));
        assertThat(props.getProperty("password"), is("secret"));
        assertThat(props.getProperty("sslmode"), is("verify-full"));
        assertThat(props.getProperty("sslrootcert"), is("/etc/ssl/root.crt"));
        assertThat(props.getProperty("ApplicationName"), is("tern"));
    }
}
