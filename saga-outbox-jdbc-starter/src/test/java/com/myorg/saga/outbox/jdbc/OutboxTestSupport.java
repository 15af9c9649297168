package com.myorg.saga.outbox.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.saga.contracts.core.envelope.EventEnvelope;
import org.flywaydb.core.Flyway;
import org.h2.jdbcx.JdbcDataSource;

import javax.sql.DataSource;
import java.util.UUID;

final class OutboxTestSupport {

    private OutboxTestSupport() {}

    static DataSource migratedDataSource() {
        JdbcDataSource ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:outbox_" + UUID.randomUUID() + ";MODE=MySQL;DATABASE_TO_UPPER=false;DB_CLOSE_DELAY=-1");
        ds.setUser("sa");
        ds.setPassword("sa");

        Flyway.configure()
                .dataSource(ds)
                .locations("classpath:db/outbox")
                .load()
                .migrate();
        return ds;
    }

    static EventEnvelope envelope(ObjectMapper mapper, String eventId, String correlationId) {
        return EventEnvelope.builder()
                .eventId(eventId)
                .eventType("order.placed")
                .version(1)
                .aggregateId(correlationId)
                .correlationId(correlationId)
                .occurredAtMs(System.currentTimeMillis())
                .producer("test")
                .payload(mapper.createObjectNode().put("orderId", correlationId))
                .build();
    }
}
