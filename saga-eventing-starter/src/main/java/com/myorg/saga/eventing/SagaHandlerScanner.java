package com.myorg.saga.eventing;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.framework.AopProxyUtils;
import org.springframework.aop.support.AopUtils;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.context.ApplicationContext;
import org.springframework.core.MethodIntrospector;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;
import java.util.Map;

/**
 * Fills the {@link HandlerRegistry} from {@code @Component} beans once all singletons exist,
 * before any consumer container starts.
 */
@Slf4j
public class SagaHandlerScanner implements SmartInitializingSingleton {

    private final ApplicationContext ctx;
    private final HandlerRegistry registry;
    private final ObjectMapper mapper;

    public SagaHandlerScanner(ApplicationContext ctx, HandlerRegistry registry, ObjectMapper mapper) {
        this.ctx = ctx;
        this.registry = registry;
        this.mapper = mapper;
    }

    @Override
    public void afterSingletonsInstantiated() {
        ctx.getBeansWithAnnotation(Component.class).values().forEach(this::register);
        log.info("Registered saga handlers for {}", registry.eventTypes());
    }

    public void register(Object bean) {
        // annotations live on the target class, not on a CGLIB/JDK proxy
        Class<?> targetClass = AopProxyUtils.ultimateTargetClass(bean);

        Map<Method, SagaEventHandler> methods = MethodIntrospector.selectMethods(
                targetClass,
                (MethodIntrospector.MetadataLookup<SagaEventHandler>) m ->
                        AnnotatedElementUtils.findMergedAnnotation(m, SagaEventHandler.class)
        );

        methods.forEach((method, ann) -> {
            Method invocable = AopUtils.selectInvocableMethod(method, bean.getClass());
            registry.register(ann.value(), new HandlerMethodInvoker(bean, invocable, ann.payload(), mapper));
        });
    }
}
