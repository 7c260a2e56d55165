package com.governance.orchestration.resource;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 资源池单元测试
 */
class ResourcePoolTest {

    private static final ResourceRequirement CAPACITY = new ResourceRequirement(8, 16384, 1000, 500);

    private ResourcePool pool;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        pool = new ResourcePool(CAPACITY, meterRegistry);
    }

    @Test
    @DisplayName("预留后可用量减少")
    void testAllocateReducesAvailable() {
        AllocationResult result = pool.allocate("plan-1", new ResourceRequirement(2, 4096, 100, 50));

        assertTrue(result.isGranted());
        assertEquals(AllocationState.RESERVED, result.allocation().getState());
        assertEquals(6, pool.available().cpuCores(), 1e-9);
        assertEquals(2, pool.snapshot().level(ResourceKind.CPU).reserved(), 1e-9);
    }

    @Test
    @DisplayName("任一资源不足整体失败，返回缺口且不产生部分预留")
    void testInsufficientIsAllOrNothing() {
        AllocationResult result = pool.allocate("plan-1", new ResourceRequirement(4, 32768, 100, 50));

        assertFalse(result.isGranted());
        assertEquals(List.of(ResourceKind.MEMORY), result.insufficientKinds());
        assertEquals(16384, result.shortfall().memoryMb(), 1e-9);
        assertEquals(CAPACITY, pool.available());
        assertEquals(0, pool.snapshot().activeAllocations());
    }

    @Test
    @DisplayName("提交把预留量转为已使用量，重复提交无效")
    void testCommit() {
        Allocation allocation = pool.allocate("plan-1", new ResourceRequirement(2, 1024, 10, 10)).allocation();

        assertTrue(pool.commit(allocation));
        assertFalse(pool.commit(allocation));

        ResourceLevel cpu = pool.snapshot().level(ResourceKind.CPU);
        assertEquals(2, cpu.used(), 1e-9);
        assertEquals(0, cpu.reserved(), 1e-9);
    }

    @Test
    @DisplayName("释放幂等：第二次释放不再归还资源")
    void testReleaseIdempotent() {
        Allocation allocation = pool.allocate("plan-1", new ResourceRequirement(2, 1024, 10, 10)).allocation();
        pool.commit(allocation);

        assertTrue(pool.release(allocation));
        assertFalse(pool.release(allocation));

        assertTrue(allocation.isReleased());
        assertEquals(CAPACITY, pool.available());
    }

    @Test
    @DisplayName("按归属方批量释放，不影响其它归属方")
    void testReleaseAll() {
        pool.allocate("plan-1", new ResourceRequirement(1, 1024, 10, 10));
        pool.allocate("plan-1", new ResourceRequirement(1, 1024, 10, 10));
        pool.allocate("plan-2", new ResourceRequirement(1, 1024, 10, 10));

        assertEquals(2, pool.releaseAll("plan-1"));
        assertEquals(0, pool.releaseAll("plan-1"));

        assertTrue(pool.allocationsOf("plan-1").isEmpty());
        assertEquals(1, pool.allocationsOf("plan-2").size());
        assertEquals(7, pool.available().cpuCores(), 1e-9);
    }

    @Test
    @DisplayName("试算不改变池状态")
    void testDryRunChecks() {
        ResourceRequirement tooBig = new ResourceRequirement(9, 0, 0, 0);

        assertFalse(pool.canEverSatisfy(tooBig));
        assertTrue(pool.canSatisfyNow(new ResourceRequirement(8, 0, 0, 0)));
        assertEquals(0, pool.snapshot().activeAllocations());
    }

    @Test
    @DisplayName("并发预留不超卖")
    void testConcurrentAllocationNeverOversubscribes() throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch latch = new CountDownLatch(50);
        AtomicInteger granted = new AtomicInteger();
        List<Allocation> allocations = new ArrayList<>();

        for (int i = 0; i < 50; i++) {
            executor.submit(() -> {
                try {
                    AllocationResult result = pool.allocate("plan-x", new ResourceRequirement(1, 0, 0, 0));
                    if (result.isGranted()) {
                        granted.incrementAndGet();
                        synchronized (allocations) {
                            allocations.add(result.allocation());
                        }
                    }
                } finally {
                    latch.countDown();
                }
            });
        }
        assertTrue(latch.await(5, TimeUnit.SECONDS));
        executor.shutdown();

        assertEquals(8, granted.get());
        assertEquals(0, pool.available().cpuCores(), 1e-9);
        allocations.forEach(pool::release);
        assertEquals(CAPACITY, pool.available());
    }

    @Test
    @DisplayName("分配计数指标")
    void testAllocationCounters() {
        pool.allocate("plan-1", new ResourceRequirement(1, 0, 0, 0));
        pool.allocate("plan-1", new ResourceRequirement(100, 0, 0, 0));

        assertEquals(1.0, meterRegistry.get("orchestration.resource.allocations")
            .tag("result", "granted").counter().count());
        assertEquals(1.0, meterRegistry.get("orchestration.resource.allocations")
            .tag("result", "insufficient").counter().count());
    }

    @Test
    @DisplayName("非法资源量被拒绝")
    void testMalformedRequirement() {
        assertThrows(IllegalArgumentException.class, () -> new ResourceRequirement(-1, 0, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> new ResourceRequirement(Double.NaN, 0, 0, 0));
    }
}
