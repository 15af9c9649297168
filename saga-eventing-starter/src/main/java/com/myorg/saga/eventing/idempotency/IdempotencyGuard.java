package com.myorg.saga.eventing.idempotency;

import com.myorg.saga.eventing.SagaEventingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.core.env.Environment;

/**
 * Startup check for {@code store=auto}: falling back to the in-memory store only dedups inside
 * one instance. That is a warning in dev and a startup failure with the {@code prod} profile
 * or {@code require-shared=true}.
 */
@Slf4j
@RequiredArgsConstructor
public class IdempotencyGuard implements ApplicationListener<ApplicationReadyEvent> {

    private final SagaEventingProperties props;
    private final Environment env;
    private final IdempotencyStore store;

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        check();
    }

    void check() {
        var idem = props.getIdempotency();
        if (!idem.isEnabled()) return;

        String configured = idem.getStore() == null ? "auto" : idem.getStore().toLowerCase();
        if (!"auto".equals(configured) || !(store instanceof InMemoryIdempotencyStore)) return;

        boolean prod = false;
        for (String p : env.getActiveProfiles()) {
            if ("prod".equalsIgnoreCase(p) || "production".equalsIgnoreCase(p)) {
                prod = true;
                break;
            }
        }

        String msg = "Idempotency store=auto found neither Redis nor JDBC and fell back to memory (dedup within one instance only)";
        if (idem.isRequireShared() || prod) {
            throw new IllegalStateException(msg + "; refusing to start");
        }
        log.warn(msg);
    }
}
