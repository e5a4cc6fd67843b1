package com.tessera.database;

import java.util.UUID;
import javax.sql.DataSource;
import org.h2.jdbcx.JdbcDataSource;

/** Fresh in-memory H2 databases in PostgreSQL mode. */
public final class H2Databases {

    private H2Databases() {}

    public static String newUrl() {
        return "jdbc:h2:mem:tessera-" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1";
    }

    public static DataSource newDataSource() {
        var dataSource = new JdbcDataSource();
        dataSource.setURL(newUrl());
        dataSource.setUser("sa");
        dataSource.setPassword("");
        return dataSource;
    }
}
