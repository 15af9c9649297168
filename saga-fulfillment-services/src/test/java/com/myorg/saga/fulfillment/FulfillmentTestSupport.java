package com.myorg.saga.fulfillment;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.flywaydb.core.Flyway;
import org.h2.jdbcx.JdbcDataSource;

import javax.sql.DataSource;
import java.util.Arrays;
import java.util.UUID;

public final class FulfillmentTestSupport {

    private FulfillmentTestSupport() {}

    public static ObjectMapper mapper() {
        return JsonMapper.builder().findAndAddModules().build();
    }

    /** Fresh in-memory MySQL-mode database with the given service schemas applied. */
    public static DataSource migratedDataSource(String... services) {
        JdbcDataSource ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:" + String.join("_", services) + "_" + UUID.randomUUID().toString().replace("-", "")
                + ";MODE=MySQL;DATABASE_TO_UPPER=false;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000");
        ds.setUser("sa");
        ds.setPassword("sa");

        String[] locations = Arrays.stream(services).map(s -> "classpath:db/" + s).toArray(String[]::new);
        Flyway.configure()
                .dataSource(ds)
                .locations(locations)
                .load()
                .migrate();
        return ds;
    }
}
