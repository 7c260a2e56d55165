package com.governance.orchestration.workflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * 步骤处理器注册中心，容器中的 {@link StepHandler} Bean 会自动注册
 */
@Component
public class StepHandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(StepHandlerRegistry.class);

    private final Map<StepType, StepHandler> handlers = new EnumMap<>(StepType.class);

    public StepHandlerRegistry() {
    }

    @Autowired
    public StepHandlerRegistry(ObjectProvider<StepHandler> discovered) {
        discovered.orderedStream().forEach(this::register);
    }

    public synchronized void register(StepHandler handler) {
        StepHandler previous = handlers.put(handler.type(), handler);
        if (previous != null) {
            log.warn("Step handler for {} replaced: {} -> {}", handler.type(),
                previous.getClass().getSimpleName(), handler.getClass().getSimpleName());
        } else {
            log.info("Step handler registered: {} -> {}", handler.type(), handler.getClass().getSimpleName());
        }
    }

    public synchronized Optional<StepHandler> handlerFor(StepType type) {
        return Optional.ofNullable(handlers.get(type));
    }
}
