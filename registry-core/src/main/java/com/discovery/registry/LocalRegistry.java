package com.discovery.registry;

import cn.hutool.core.util.StrUtil;
import com.discovery.client.RegistryClient;
import com.discovery.exception.DeliveryException;
import com.discovery.exception.StoreException;
import com.discovery.exception.ValidationException;
import com.discovery.model.Patch;
import com.discovery.model.PatchEntry;
import com.discovery.model.Registration;
import com.discovery.notify.DependencyNotifier;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * 进程内注册中心
 * <p>
 * 注册列表只在读写锁内访问，锁内只做内存修改并拷贝出通知需要的数据，
 * 所有 http 调用都在释放锁之后进行。ServiceUrl 作为唯一键，重复注册会替换旧的注册信息
 *
 * @author sakame
 * @version 1.0
 */
@Slf4j
public class LocalRegistry implements Registry {

    private final List<Registration> registrations = new ArrayList<>();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final RegistryClient client;

    private final DependencyNotifier notifier;

    public LocalRegistry(RegistryClient client, DependencyNotifier notifier) {
        this.client = client;
        this.notifier = notifier;
    }

    @Override
    public void register(Registration registration) {
        doRegister(registration, false);
    }

    @Override
    public boolean registerIfAbsent(Registration registration) {
        return doRegister(registration, true);
    }

    /**
     * @param registration
     * @param onlyIfAbsent 地址已有注册信息时放弃注册
     * @return 是否注册
     */
    private boolean doRegister(Registration registration, boolean onlyIfAbsent) {
        validate(registration);

        List<Registration> replaced;
        List<PatchEntry> catchUp;
        List<Registration> subscribers;
        lock.writeLock().lock();
        try {
            if (onlyIfAbsent && containsUnlocked(registration.getServiceUrl())) {
                log.info("service url {} already registered, skip {}",
                        registration.getServiceUrl(), registration.getServiceName());
                return false;
            }
            replaced = removeUnlocked(registration.getServiceUrl());
            registrations.add(registration);
            catchUp = registrations.stream()
                    .filter(r -> r != registration && registration.requires(r.getServiceName()))
                    .map(Registration::toEntry)
                    .collect(Collectors.toList());
            subscribers = registrations.stream()
                    .filter(r -> r != registration)
                    .collect(Collectors.toList());
        } catch (RuntimeException e) {
            throw new StoreException("fail to add service " + registration.getServiceUrl(), e);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("add service {} with url {}", registration.getServiceName(), registration.getServiceUrl());
        if (!replaced.isEmpty()) {
            log.info("service url {} registered again, replace {} old registration(s)",
                    registration.getServiceUrl(), replaced.size());
        }

        // 补发依赖的已有服务
        if (!registration.getRequiredServices().isEmpty()) {
            try {
                client.sendPatch(new Patch(catchUp, new ArrayList<>()), registration.getServiceUpdateUrl());
            } catch (DeliveryException e) {
                log.warn("fail to send required services to {}, rollback: {}",
                        registration.getServiceUrl(), e.getMessage());
                rollback(registration, replaced);
                throw e;
            }
        }

        // 服务发现通知
        PatchEntry entry = registration.toEntry();
        List<PatchEntry> removed = replaced.stream()
                .map(Registration::toEntry)
                .filter(old -> !old.equals(entry))
                .collect(Collectors.toList());
        List<PatchEntry> added = new ArrayList<>();
        added.add(entry);
        notifier.notifyDependents(new Patch(added, removed), subscribers);
        return true;
    }

    @Override
    public void unRegister(String serviceUrl) {
        List<Registration> removed;
        List<Registration> subscribers;
        lock.writeLock().lock();
        try {
            removed = removeUnlocked(serviceUrl);
            subscribers = new ArrayList<>(registrations);
        } catch (RuntimeException e) {
            throw new StoreException("fail to remove service " + serviceUrl, e);
        } finally {
            lock.writeLock().unlock();
        }

        if (removed.isEmpty()) {
            log.debug("no service registered with url {}", serviceUrl);
            return;
        }
        log.info("remove service {} with url {}", removed.get(0).getServiceName(), serviceUrl);
        notifier.notifyDependents(removedPatch(removed), subscribers);
    }

    @Override
    public boolean unRegisterIfCurrent(Registration registration) {
        boolean removed;
        List<Registration> subscribers;
        lock.writeLock().lock();
        try {
            removed = registrations.removeIf(r -> r == registration);
            subscribers = new ArrayList<>(registrations);
        } finally {
            lock.writeLock().unlock();
        }

        if (!removed) {
            log.debug("service url {} no longer holds {}", registration.getServiceUrl(), registration.getServiceName());
            return false;
        }
        log.info("remove service {} with url {}", registration.getServiceName(), registration.getServiceUrl());
        notifier.notifyDependents(removedPatch(List.of(registration)), subscribers);
        return true;
    }

    @Override
    public List<Registration> snapshot() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(registrations));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void destroy() {
        lock.writeLock().lock();
        try {
            log.info("destroy registry with {} registration(s)", registrations.size());
            registrations.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 补发失败时撤销本次注册。补发期间注册的服务可能已在自己的补发中看到本次注册，
     * 撤销的和被替换掉的注册信息都要作为 Removed 通知依赖方
     *
     * @param registration
     * @param replaced
     */
    private void rollback(Registration registration, List<Registration> replaced) {
        boolean removed;
        List<Registration> subscribers;
        lock.writeLock().lock();
        try {
            removed = registrations.removeIf(r -> r == registration);
            subscribers = new ArrayList<>(registrations);
        } finally {
            lock.writeLock().unlock();
        }

        List<Registration> gone = new ArrayList<>(replaced);
        if (removed) {
            gone.add(registration);
        }
        if (!gone.isEmpty()) {
            notifier.notifyDependents(removedPatch(gone), subscribers);
        }
    }

    /**
     * 需持有写锁
     *
     * @param serviceUrl
     * @return 被移除的注册信息
     */
    private List<Registration> removeUnlocked(String serviceUrl) {
        List<Registration> removed = new ArrayList<>();
        Iterator<Registration> iterator = registrations.iterator();
        while (iterator.hasNext()) {
            Registration registration = iterator.next();
            if (registration.getServiceUrl().equals(serviceUrl)) {
                removed.add(registration);
                iterator.remove();
            }
        }
        return removed;
    }

    /**
     * 需持有锁
     */
    private boolean containsUnlocked(String serviceUrl) {
        return registrations.stream().anyMatch(r -> r.getServiceUrl().equals(serviceUrl));
    }

    private static Patch removedPatch(List<Registration> removed) {
        List<PatchEntry> entries = removed.stream()
                .map(Registration::toEntry)
                .collect(Collectors.toList());
        return new Patch(new ArrayList<>(), entries);
    }

    private static void validate(Registration registration) {
        if (registration == null) {
            throw new ValidationException("registration is null");
        }
        if (StrUtil.isBlank(registration.getServiceName())) {
            throw new ValidationException("ServiceName is required");
        }
        if (StrUtil.isBlank(registration.getServiceUrl())) {
            throw new ValidationException("ServiceUrl is required");
        }
        if (StrUtil.isBlank(registration.getHeartbeatUrl())) {
            throw new ValidationException("HeartbeatUrl is required");
        }
        if (!registration.getRequiredServices().isEmpty() && StrUtil.isBlank(registration.getServiceUpdateUrl())) {
            throw new ValidationException("ServiceUpdateUrl is required when RequiredServices is not empty");
        }
    }
}
