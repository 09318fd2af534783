package org.checkout.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IdempotentUtilTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    @Test
    void readsCachedValueUnderPrefixedKey() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("idempotent:CHECKOUT:u1:tok")).thenReturn("ORD1");

        IdempotentUtil util = new IdempotentUtil(redisTemplate, 60);

        assertThat(util.getOperatedValue("u1:tok", "CHECKOUT")).isEqualTo("ORD1");
    }

    @Test
    void writesWithTtlAndDoesNotOverwrite() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent(anyString(), anyString(), anyLong(), eq(TimeUnit.SECONDS)))
                .thenReturn(Boolean.FALSE);

        IdempotentUtil util = new IdempotentUtil(redisTemplate, 60);

        assertThat(util.markAsOperated("u1:tok", "CHECKOUT", "ORD1")).isFalse();
        verify(valueOperations).setIfAbsent("idempotent:CHECKOUT:u1:tok", "ORD1", 60, TimeUnit.SECONDS);
    }

    @Test
    void redisFailureIsTreatedAsMiss() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(anyString())).thenThrow(new RedisConnectionFailureException("down"));

        IdempotentUtil util = new IdempotentUtil(redisTemplate, 60);

        assertThat(util.getOperatedValue("u1:tok", "CHECKOUT")).isNull();
    }

    @Test
    void worksWithoutRedis() {
        IdempotentUtil util = new IdempotentUtil(null, 60);

        assertThat(util.getOperatedValue("u1:tok", "CHECKOUT")).isNull();
        assertThat(util.markAsOperated("u1:tok", "CHECKOUT", "ORD1")).isFalse();
    }
}
