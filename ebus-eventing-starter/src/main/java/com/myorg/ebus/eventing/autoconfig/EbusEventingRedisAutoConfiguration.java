package com.myorg.ebus.eventing.autoconfig;

import com.myorg.ebus.eventing.EbusEventingProperties;
import com.myorg.ebus.eventing.idempotency.IdempotencyCache;
import com.myorg.ebus.eventing.idempotency.RedisIdempotencyCache;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis-backed idempotency cache.
 *
 * <p>Kept apart from {@link EbusEventingAutoConfiguration} so applications without
 * Redis on the classpath can still use the starter (store=memory).
 */
@AutoConfiguration(after = RedisAutoConfiguration.class, before = EbusEventingAutoConfiguration.class)
@EnableConfigurationProperties(EbusEventingProperties.class)
@ConditionalOnClass(RedisConnectionFactory.class)
public class EbusEventingRedisAutoConfiguration {

    /**
     * store=redis or store=auto with a RedisConnectionFactory available.
     */
    @Configuration
    @ConditionalOnExpression("'${ebus.eventing.idempotency.store:auto}'.toLowerCase() != 'memory'")
    @ConditionalOnBean(RedisConnectionFactory.class)
    static class RedisIdempotencyConfig {

        @Bean
        @ConditionalOnMissingBean(StringRedisTemplate.class)
        public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory cf) {
            return new StringRedisTemplate(cf);
        }

        @Bean
        @ConditionalOnMissingBean(IdempotencyCache.class)
        public IdempotencyCache idempotencyCache(EbusEventingProperties props, StringRedisTemplate redis, Environment env) {
            String prefix = EbusEventingAutoConfiguration.effectiveKeyPrefix(props.getIdempotency().getKeyPrefix(), env);
            return new RedisIdempotencyCache(redis, prefix);
        }
    }
}
