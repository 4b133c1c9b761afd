package com.dcruver.medi.config;

import com.dcruver.medi.error.StorageException;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.sqlite.SQLiteConfig;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Configuration for the SQLite data source backing the primary store.
 */
@Configuration
public class DataSourceConfig {

    public static final String DB_FILE_NAME = "medi.sqlite";

    @Bean
    public DataSource dataSource(MediProperties properties) {
        return sqliteDataSource(properties.resolveDbPath(), properties.getStore().getBusyTimeoutMs());
    }

    /**
     * Open a data source on {@code <dbDir>/medi.sqlite}, creating the directory if needed.
     * Every connection runs in WAL mode with full fsync on commit, and explicit
     * transactions take the write lock up front.
     */
    public static DataSource sqliteDataSource(Path dbDir, int busyTimeoutMs) {
        try {
            Files.createDirectories(dbDir);
        } catch (IOException e) {
            throw new StorageException("Cannot create database directory " + dbDir, e);
        }

        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.setJournalMode(SQLiteConfig.JournalMode.WAL);
        sqlite.setSynchronous(SQLiteConfig.SynchronousMode.FULL);
        sqlite.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        sqlite.setBusyTimeout(busyTimeoutMs);

        DriverManagerDataSource dataSource = new DriverManagerDataSource();
        dataSource.setDriverClassName("org.sqlite.JDBC");
        dataSource.setUrl("jdbc:sqlite:" + dbDir.resolve(DB_FILE_NAME).toAbsolutePath());
        dataSource.setConnectionProperties(sqlite.toProperties());

        return dataSource;
    }
}
