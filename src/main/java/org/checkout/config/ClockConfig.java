package org.checkout.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 时间源配置
 * - 所有业务时间戳（购物车行修改时间、订单创建时间）统一从该时钟获取
 * - 使用 UTC，数据库中的 TIMESTAMP 均为 UTC 时间
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
