package com.governance.orchestration.config;

import com.governance.orchestration.resource.ResourceKind;
import com.governance.orchestration.resource.ResourcePool;
import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.ClassLoaderMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmInfoMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.FileDescriptorMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.core.instrument.binder.system.UptimeMetrics;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 监控指标配置
 * 提供：
 * 1. JVM 指标（GC、内存、线程）
 * 2. 系统指标（CPU、文件描述符）
 * 3. 资源池容量与利用率
 */
@Configuration
public class MetricsConfig {

    private static final Logger log = LoggerFactory.getLogger(MetricsConfig.class);

    private final MeterRegistry meterRegistry;
    private final ResourcePool resourcePool;

    public MetricsConfig(MeterRegistry meterRegistry, ResourcePool resourcePool) {
        this.meterRegistry = meterRegistry;
        this.resourcePool = resourcePool;
    }

    @PostConstruct
    public void initMetrics() {
        registerJvmMetrics();
        registerSystemMetrics();
        registerResourcePoolMetrics();
        log.info("Orchestration metrics configuration initialized");
    }

    private void registerJvmMetrics() {
        new JvmMemoryMetrics().bindTo(meterRegistry);
        new JvmGcMetrics().bindTo(meterRegistry);
        new JvmThreadMetrics().bindTo(meterRegistry);
        new ClassLoaderMetrics().bindTo(meterRegistry);
        new JvmInfoMetrics().bindTo(meterRegistry);
    }

    private void registerSystemMetrics() {
        new ProcessorMetrics().bindTo(meterRegistry);
        new FileDescriptorMetrics().bindTo(meterRegistry);
        new UptimeMetrics().bindTo(meterRegistry);
    }

    /**
     * 每种资源的容量与当前利用率
     */
    private void registerResourcePoolMetrics() {
        for (ResourceKind kind : ResourceKind.values()) {
            String tag = kind.name().toLowerCase();
            Gauge.builder("orchestration.resource.capacity", resourcePool, pool -> pool.capacity().get(kind))
                .description("Resource pool capacity")
                .tag("kind", tag)
                .register(meterRegistry);
            Gauge.builder("orchestration.resource.utilization", resourcePool,
                    pool -> pool.snapshot().utilization(kind))
                .description("Resource pool utilization (0-1)")
                .tag("kind", tag)
                .register(meterRegistry);
        }
    }

    /**
     * @Timed 注解支持
     */
    @Bean
    public TimedAspect timedAspect(MeterRegistry meterRegistry) {
        return new TimedAspect(meterRegistry);
    }
}
