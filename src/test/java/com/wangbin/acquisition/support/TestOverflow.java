package com.wangbin.acquisition.support;

import com.wangbin.acquisition.core.overflow.JdbcOverflowRepository;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import java.nio.file.Path;

public final class TestOverflow {

    private TestOverflow() {
    }

    public static JdbcOverflowRepository repository(Path file) {
        SQLiteConfig config = new SQLiteConfig();
        config.setBusyTimeout(5000);
        SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl("jdbc:sqlite:" + file.toAbsolutePath());
        return new JdbcOverflowRepository(dataSource);
    }
}
