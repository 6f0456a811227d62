package io.tern.core.database;

import com.google.common.base.Throwables;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.h2.jdbcx.JdbcDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;

import java.sql.SQLException;

public class DataSourceProvider
        implements AutoCloseable
{
    private final Logger logger = LoggerFactory.getLogger(getClass());

    private final DatabaseConfig config;
    private DataSource ds;
    private AutoCloseable closer;

    public DataSourceProvider(DatabaseConfig config)
    {
        this.config = config;
    }

    /**
     * Creates the data source on first use.
     */
    public synchronized DataSource get()
    {
        if (ds == null) {
            switch (config.getType()) {
            case DatabaseConfig.H2:
                // h2 database doesn't need connection pool
                createSimpleDataSource();
                break;
            default:
                createPooledDataSource();
                break;
            }
        }
        return ds;
    }

    private void createSimpleDataSource()
    {
        String url = DatabaseConfig.buildJdbcUrl(config);

        // An in-memory H2 database is dropped when its last connection is closed.
        // One connection is held until close() so that the database lives as long
        // as this provider.
        JdbcDataSource ds = new JdbcDataSource();
        ds.setUrl(url + ";DB_CLOSE_ON_EXIT=FALSE");
        if (config.getUser().isPresent()) {
            ds.setUser(config.getUser().get());
        }
        if (config.getPassword().isPresent()) {
            ds.setPassword(config.getPassword().get());
        }

        logger.debug("Using database URL {}", url);

        try {
            this.closer = ds.getConnection();
        }
        catch (SQLException ex) {
            throw new IllegalStateException("Unable to open database " + url, ex);
        }
        this.ds = ds;
    }

    private void createPooledDataSource()
    {
        String url = DatabaseConfig.buildJdbcUrl(config);

        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(url);
        hikari.setDriverClassName(DatabaseConfig.getDriverClassName(config.getType()));
        hikari.setDataSourceProperties(DatabaseConfig.buildJdbcProperties(config));

        hikari.setConnectionTimeout(config.getConnectionTimeout() * 1000L);
        hikari.setMaximumPoolSize(config.getMaximumPoolSize());
        hikari.setMinimumIdle(0);
        hikari.setPoolName("tern");

        logger.debug("Using database URL {}", hikari.getJdbcUrl());

        HikariDataSource ds = new HikariDataSource(hikari);
        this.ds = ds;
        this.closer = ds;
    }

    @Override
    public synchronized void close()
    {
        if (ds != null) {
            try {
                closer.close();
            }
            catch (Exception ex) {
                Throwables.throwIfUnchecked(ex);
                throw new IllegalStateException(ex);
            }
            ds = null;
            closer = null;
        }
    }
}
