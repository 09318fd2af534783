package org.checkout.util;

import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * 分布式锁工具类
 * - 基于Redisson实现
 * - 未配置 RedissonClient 时退化为单机模式：加锁总是成功
 */
@Slf4j
@Component
public class DistributedLockUtil {

    private static DistributedLockUtil instance;
    private final RedissonClient redissonClient;

    private static final String LOCK_KEY_PREFIX = "lock:";

    public DistributedLockUtil(@Autowired(required = false) RedissonClient redissonClient) {
        this.redissonClient = redissonClient;
        instance = this;
    }

    /**
     * 尝试加锁
     *
     * @param resourceKey 资源标识
     * @param waitTime    最长等待时间
     * @param leaseTime   持有时间，到期自动释放
     * @param unit        时间单位
     * @return 是否获得锁
     */
    public static boolean tryLock(String resourceKey, long waitTime, long leaseTime, TimeUnit unit) {
        if (instance == null || instance.redissonClient == null) {
            return true;
        }
        return instance.tryLockInternal(resourceKey, waitTime, leaseTime, unit);
    }

    private boolean tryLockInternal(String resourceKey, long waitTime, long leaseTime, TimeUnit unit) {
        RLock lock = redissonClient.getLock(buildLockKey(resourceKey));
        try {
            return lock.tryLock(waitTime, leaseTime, unit);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[加锁被中断] resourceKey={}", resourceKey);
            return false;
        }
    }

    public static void unlock(String resourceKey) {
        if (instance == null || instance.redissonClient == null) {
            return;
        }
        instance.unlockInternal(resourceKey);
    }

    private void unlockInternal(String resourceKey) {
        RLock lock = redissonClient.getLock(buildLockKey(resourceKey));
        // 持有时间到期后锁可能已自动释放
        if (lock.isHeldByCurrentThread()) {
            lock.unlock();
        }
    }

    private static String buildLockKey(String resourceKey) {
        return LOCK_KEY_PREFIX + resourceKey;
    }
}
