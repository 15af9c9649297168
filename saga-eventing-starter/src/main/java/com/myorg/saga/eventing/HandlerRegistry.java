package com.myorg.saga.eventing;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

// eventType -> the single handler method for it
public class HandlerRegistry {

    private final Map<String, HandlerMethodInvoker> handlers = new ConcurrentHashMap<>();

    public void register(String eventType, HandlerMethodInvoker invoker) {
        HandlerMethodInvoker prev = handlers.putIfAbsent(eventType, invoker);
        if (prev != null && !prev.getMethod().equals(invoker.getMethod())) {
            throw new IllegalStateException("Two handlers for eventType=" + eventType + ": "
                    + prev.getMethod() + " and " + invoker.getMethod());
        }
    }

    public HandlerMethodInvoker get(String eventType) {
        return handlers.get(eventType);
    }

    public Set<String> eventTypes() {
        return Set.copyOf(handlers.keySet());
    }
}
