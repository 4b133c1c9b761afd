package com.dcruver.medi.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

/**
 * Settings bound from {@code medi.*}. Environment variables such as
 * {@code MEDI_DB_PATH} override the file values through relaxed binding.
 */
@ConfigurationProperties(prefix = "medi")
@Data
public class MediProperties {

    private String dbPath = System.getProperty("user.home") + "/.medi/medi_db";

    /**
     * Search index directory. Empty means {@code <db-path>/search_index}.
     */
    private String indexPath = "";

    private String exportDir = System.getProperty("user.home") + "/medi_exports";

    private Search search = new Search();
    private Index index = new Index();
    private Store store = new Store();

    public Path resolveDbPath() {
        return Path.of(dbPath).toAbsolutePath().normalize();
    }

    public Path resolveIndexPath() {
        if (indexPath == null || indexPath.isBlank()) {
            return resolveDbPath().resolve("search_index");
        }
        return Path.of(indexPath).toAbsolutePath().normalize();
    }

    @Data
    public static class Search {
        private int limit = 10;
    }

    @Data
    public static class Index {
        private double writerBufferMb = 50.0;
    }

    @Data
    public static class Store {
        private int busyTimeoutMs = 5000;
    }
}
