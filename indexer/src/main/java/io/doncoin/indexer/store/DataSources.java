package io.doncoin.indexer.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.doncoin.indexer.config.IndexerConfig;

public final class DataSources {

    private DataSources() {
    }

    public static HikariDataSource create(IndexerConfig config) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setPoolName("doncoin-indexer");
        hikariConfig.setJdbcUrl(config.dbUrl());
        hikariConfig.setUsername(config.dbUser());
        hikariConfig.setPassword(config.dbPassword());
        hikariConfig.setMaximumPoolSize(config.dbPoolSize());
        hikariConfig.setMinimumIdle(1);
        return new HikariDataSource(hikariConfig);
    }
}
