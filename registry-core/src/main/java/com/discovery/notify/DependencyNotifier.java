package com.discovery.notify;

import cn.hutool.core.thread.ExecutorBuilder;
import cn.hutool.core.thread.ThreadFactoryBuilder;
import com.discovery.client.RegistryClient;
import com.discovery.config.RegistryConfig;
import com.discovery.exception.DeliveryException;
import com.discovery.model.Patch;
import com.discovery.model.Registration;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 依赖通知：把服务变更按依赖关系过滤后推送给依赖方
 * <p>
 * 每个订阅者一个推送任务，运行在有界线程池中，调用方不等待推送完成。
 * 推送失败只记录日志，不重试，也不影响注册表状态。
 * <p>
 * 同一个订阅者的多次推送由不同线程执行，彼此之间不保证顺序：
 * 紧接着的注册和注销可能先到达 Removed 再到达 Added。
 * 单次调用内给同一订阅者的子 patch 按顺序发送
 *
 * @author sakame
 * @version 1.0
 */
@Slf4j
public class DependencyNotifier implements AutoCloseable {

    private final RegistryClient client;

    private final ThreadPoolExecutor executor;

    private final long shutdownTimeoutMillis;

    public DependencyNotifier(RegistryClient client, RegistryConfig registryConfig) {
        this.client = client;
        this.shutdownTimeoutMillis = registryConfig.getShutdownTimeoutMillis();
        this.executor = ExecutorBuilder.create()
                .setCorePoolSize(registryConfig.getNotifyThreads())
                .setMaxPoolSize(registryConfig.getNotifyThreads())
                .setWorkQueue(new LinkedBlockingQueue<>(registryConfig.getNotifyQueueCapacity()))
                .setThreadFactory(ThreadFactoryBuilder.create()
                        .setNamePrefix("registry-notify-")
                        .setDaemon(true)
                        .setUncaughtExceptionHandler((t, e) -> log.error("Uncaught exception in '{}'", t.getName(), e))
                        .build())
                .setHandler((task, pool) -> {
                    if (pool.isShutdown()) {
                        log.warn("notifier is closed, drop one delivery");
                    } else {
                        log.warn("notify queue is full, drop one delivery");
                    }
                })
                .build();
    }

    /**
     * 通知所有依赖方，立即返回
     *
     * @param fullPatch   完整变更
     * @param subscribers 调用方在锁内拷贝的注册信息列表
     */
    public void notifyDependents(Patch fullPatch, List<Registration> subscribers) {
        if (fullPatch.isEmpty()) {
            return;
        }
        for (Registration subscriber : subscribers) {
            List<Patch> patches = patchesFor(fullPatch, subscriber);
            if (patches.isEmpty()) {
                continue;
            }
            executor.execute(() -> deliver(subscriber, patches));
        }
    }

    /**
     * 按订阅者依赖的每个服务名过滤出子 patch，空的子 patch 不推送
     *
     * @param fullPatch
     * @param subscriber
     * @return 需要推送的子 patch，按依赖声明的顺序
     */
    public static List<Patch> patchesFor(Patch fullPatch, Registration subscriber) {
        List<Patch> patches = new ArrayList<>();
        for (String requiredName : new LinkedHashSet<>(subscriber.getRequiredServices())) {
            Patch subPatch = fullPatch.filterByName(requiredName);
            if (!subPatch.isEmpty()) {
                patches.add(subPatch);
            }
        }
        return patches;
    }

    private void deliver(Registration subscriber, List<Patch> patches) {
        for (Patch patch : patches) {
            try {
                client.sendPatch(patch, subscriber.getServiceUpdateUrl());
            } catch (DeliveryException e) {
                log.warn("fail to notify {} ({}): {}", subscriber.getServiceName(),
                        subscriber.getServiceUpdateUrl(), e.getMessage());
                return;
            } catch (RuntimeException e) {
                log.error("unexpected error while notifying {}", subscriber.getServiceUpdateUrl(), e);
                return;
            }
        }
    }

    /**
     * 停止接收新的推送，等待已提交的推送完成，超时后中断
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeoutMillis, TimeUnit.MILLISECONDS)) {
                List<Runnable> dropped = executor.shutdownNow();
                log.warn("notifier closed with {} pending deliveries dropped", dropped.size());
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("notifier closed");
    }
}
