package com.myorg.saga.eventing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.saga.contracts.core.envelope.EventEnvelope;
import com.myorg.saga.contracts.core.exception.SagaNonRetryableException;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;

/**
 * Calls one {@link SagaEventHandler} method. Supported signatures:
 * {@code handle(Payload p)} and {@code handle(EventEnvelope env, Payload p)}.
 */
public class HandlerMethodInvoker {

    private final Object target;
    private final Method method;
    private final Class<?> payloadClass;
    private final ObjectMapper mapper;

    public HandlerMethodInvoker(Object target, Method method, Class<?> payloadClass, ObjectMapper mapper) {
        int params = method.getParameterCount();
        if (params != 1 && params != 2) {
            throw new IllegalStateException("Handler method must have 1 or 2 params: (payload) or (envelope,payload): " + method);
        }
        if (params == 2 && !EventEnvelope.class.equals(method.getParameterTypes()[0])) {
            throw new IllegalStateException("First param of a 2-arg handler must be EventEnvelope: " + method);
        }
        this.target = target;
        this.method = method;
        this.payloadClass = payloadClass;
        this.mapper = mapper;
        this.method.setAccessible(true);
    }

    public void invoke(EventEnvelope env) {
        Object payload;
        try {
            payload = mapper.treeToValue(env.getPayload(), payloadClass);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new SagaNonRetryableException("PAYLOAD_CONVERSION",
                    "Cannot read payload of eventType=" + env.getEventType() + " as " + payloadClass.getSimpleName()
                            + ": " + e.getMessage(), e);
        }

        try {
            if (method.getParameterCount() == 1) {
                method.invoke(target, payload);
            } else {
                method.invoke(target, env, payload);
            }
        } catch (InvocationTargetException e) {
            Throwable cause = e.getTargetException();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new IllegalStateException("Handler " + method + " failed", cause);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Handler " + method + " is not accessible", e);
        }
    }

    public Method getMethod() {
        return method;
    }
}
