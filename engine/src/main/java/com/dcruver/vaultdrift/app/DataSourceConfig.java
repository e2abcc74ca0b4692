package com.dcruver.vaultdrift.app;

import com.dcruver.vaultdrift.config.EngineProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Configuration for SQLite data source.
 */
@Configuration
public class DataSourceConfig {

    @Bean
    public DataSource dataSource(EngineProperties properties) throws IOException {
        Path dbPath = Paths.get(properties.getDatabase().replace("${user.home}", System.getProperty("user.home")));
        return sqliteDataSource(dbPath);
    }

    /**
     * File-backed SQLite with WAL so readers never see a half-written session.
     */
    public static DataSource sqliteDataSource(Path dbPath) throws IOException {
        // Ensure parent directory exists
        if (dbPath.getParent() != null) {
            Files.createDirectories(dbPath.getParent());
        }

        Properties connectionProperties = new Properties();
        connectionProperties.setProperty("journal_mode", "WAL");
        connectionProperties.setProperty("busy_timeout", "10000");

        DriverManagerDataSource dataSource = new DriverManagerDataSource();
        dataSource.setDriverClassName("org.sqlite.JDBC");
        dataSource.setUrl("jdbc:sqlite:" + dbPath.toAbsolutePath());
        dataSource.setConnectionProperties(connectionProperties);

        return dataSource;
    }
}
