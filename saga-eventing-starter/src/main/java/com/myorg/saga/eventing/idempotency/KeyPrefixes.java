package com.myorg.saga.eventing.idempotency;

import org.springframework.core.env.Environment;
import org.springframework.util.StringUtils;

/**
 * Idempotency keys are namespaced per service: {@code <prefix><service>:<eventId>}.
 */
public final class KeyPrefixes {

    private KeyPrefixes() {}

    public static String forService(String configuredPrefix, Environment env) {
        String service = env.getProperty("spring.application.name");
        if (!StringUtils.hasText(service)) service = "default-service";
        service = service.trim().replaceAll("\\s+", "_");

        String base = normalize(StringUtils.hasText(configuredPrefix) ? configuredPrefix : "saga:idemp:");
        if (base.contains("{service}")) {
            return normalize(base.replace("{service}", service));
        }
        if (base.endsWith(service + ":")) return base;
        return base + service + ":";
    }

    static String normalize(String prefix) {
        if (prefix == null || prefix.isBlank()) return "";
        String p = prefix.trim();
        return p.endsWith(":") ? p : (p + ":");
    }
}
