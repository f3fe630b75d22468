package com.moldstudio.reservation.config;

import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Redisson client for the distributed ledger lock strategy. Only created when
 * {@code studio.incentive.lock-strategy=distributed}.
 */
@Configuration
@ConditionalOnProperty(name = "studio.incentive.lock-strategy", havingValue = "distributed")
public class RedissonConfig {

    @Value("${studio.redisson.address:redis://localhost:6379}")
    private String address;

    @Value("${studio.redisson.password:}")
    private String password;

    @Bean(destroyMethod = "shutdown")
    public RedissonClient redissonClient() {
        Config config = new Config();
        config.useSingleServer()
                .setAddress(address)
                .setPassword(password.isEmpty() ? null : password);
        return Redisson.create(config);
    }
}
