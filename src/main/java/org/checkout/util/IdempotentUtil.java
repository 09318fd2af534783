package org.checkout.util;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * 幂等结果缓存
 * - 使用Redis缓存已完成操作的结果（如 幂等键 -> orderId）
 * - 只是加速重试请求的读路径，数据库中的幂等记录才是最终依据
 * - Redis 不可用时记录告警并按"未命中"处理，不影响主流程
 */
@Slf4j
@Component
public class IdempotentUtil {

    private static final String IDEMPOTENT_KEY_PREFIX = "idempotent:";

    private final StringRedisTemplate redisTemplate;
    private final long expireSeconds;

    public IdempotentUtil(@Autowired(required = false) StringRedisTemplate redisTemplate,
                          @Value("${checkout.idempotency.cache-ttl-seconds:86400}") long expireSeconds) {
        this.redisTemplate = redisTemplate;
        this.expireSeconds = expireSeconds;
    }

    /**
     * 读取已完成操作的结果
     *
     * @param businessId    业务ID（幂等键）
     * @param operationType 操作类型（如 CHECKOUT）
     * @return 缓存的结果，未命中或Redis不可用时返回 null
     */
    public String getOperatedValue(String businessId, String operationType) {
        if (redisTemplate == null) {
            return null;
        }
        String key = buildKey(businessId, operationType);
        try {
            return redisTemplate.opsForValue().get(key);
        } catch (RuntimeException e) {
            log.warn("[幂等缓存读取失败] key={}, error={}", key, e.getMessage());
            return null;
        }
    }

    /**
     * 记录操作结果，key已存在时不覆盖
     *
     * @return true: 写入成功；false: 已存在或Redis不可用
     */
    public boolean markAsOperated(String businessId, String operationType, String value) {
        if (redisTemplate == null) {
            return false;
        }
        String key = buildKey(businessId, operationType);
        try {
            Boolean success = redisTemplate.opsForValue().setIfAbsent(key, value, expireSeconds, TimeUnit.SECONDS);
            return Boolean.TRUE.equals(success);
        } catch (RuntimeException e) {
            log.warn("[幂等缓存写入失败] key={}, error={}", key, e.getMessage());
            return false;
        }
    }

    private String buildKey(String businessId, String operationType) {
        return IDEMPOTENT_KEY_PREFIX + operationType + ":" + businessId;
    }
}
