package com.myorg.ebus.eventing.autoconfig;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.ebus.eventing.*;
import com.myorg.ebus.eventing.idempotency.IdempotencyCache;
import com.myorg.ebus.eventing.idempotency.IdempotencyGuard;
import com.myorg.ebus.eventing.idempotency.InMemoryIdempotencyCache;
import com.myorg.ebus.eventing.resilience.HandlerPolicyFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.framework.AopProxyUtils;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.*;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.core.env.Environment;

import java.util.Map;

@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(EbusEventingProperties.class)
public class EbusEventingAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public HandlerRegistry handlerRegistry() {
        return new HandlerRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public PayloadConverter ebusPayloadConverter(ObjectProvider<ObjectMapper> mapperProvider) {
        return new JacksonPayloadConverter(mapperProvider.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public HandlerPolicyFactory handlerPolicyFactory(EbusEventingProperties props) {
        return new HandlerPolicyFactory(props.getHandlerPolicy());
    }

    @Bean
    @ConditionalOnMissingBean(name = "ebusSubscriberScanner")
    @ConditionalOnProperty(prefix = "ebus.eventing", name = "scan-subscribers", havingValue = "true", matchIfMissing = true)
    public Object ebusSubscriberScanner(ApplicationContext ctx, HandlerRegistry registry) {
        Map<String, Object> beans = ctx.getBeansWithAnnotation(EbusSubscriber.class);

        beans.forEach((beanName, bean) -> {
            // look at the target class so proxied handlers are still found
            Class<?> targetClass = AopProxyUtils.ultimateTargetClass(bean);
            EbusSubscriber ann = AnnotatedElementUtils.findMergedAnnotation(targetClass, EbusSubscriber.class);
            if (ann == null) return;

            String queue = ann.queue().isBlank() ? targetClass.getName() : ann.queue();
            HandlerRegistration registration;
            if (bean instanceof BatchEventHandler<?> batch) {
                registration = new HandlerRegistration(queue, ann.eventType(), ann.payload(), null, batch, ann.batchSize());
            } else if (bean instanceof EventHandler<?> single) {
                registration = new HandlerRegistration(queue, ann.eventType(), ann.payload(), single, null, 0);
            } else {
                throw new IllegalStateException("@EbusSubscriber bean " + beanName
                        + " must implement EventHandler or BatchEventHandler");
            }
            registry.register(registration);
            log.info("Registered subscriber bean={} queue={} eventType={} batch={}",
                    beanName, registration.queueName(), registration.eventType(), registration.isBatch());
        });

        // marker bean so the scan runs once
        return new Object();
    }

    // ---------------- Idempotency cache auto-configuration ----------------

    /**
     * store=redis but Redis is not on classpath -> fail fast.
     */
    @Configuration
    @ConditionalOnProperty(prefix = "ebus.eventing.idempotency", name = "store", havingValue = "redis")
    @ConditionalOnMissingClass("org.springframework.data.redis.connection.RedisConnectionFactory")
    static class MissingRedisDependencyFailFastConfig {
        @Bean
        public Object failFastRedisMissing() {
            throw new IllegalStateException(
                    "ebus.eventing.idempotency.store=redis but the Redis dependency is missing. " +
                            "Add spring-boot-starter-data-redis (and configure spring.data.redis.*)."
            );
        }
    }

    /**
     * store=memory OR store=auto without Redis -> fallback to in-memory cache.
     */
    @Configuration
    @ConditionalOnExpression("'${ebus.eventing.idempotency.store:auto}'.toLowerCase() != 'redis'")
    static class MemoryFallbackIdempotencyConfig {

        @Bean(destroyMethod = "close")
        @ConditionalOnMissingBean(IdempotencyCache.class)
        public IdempotencyCache idempotencyCache(EbusEventingProperties props, Environment env) {
            var idem = props.getIdempotency();
            return new InMemoryIdempotencyCache(
                    effectiveKeyPrefix(idem.getKeyPrefix(), env),
                    idem.getMaxEntries(),
                    idem.getCleanupInterval()
            );
        }
    }

    @Bean
    public IdempotencyGuard idempotencyGuard(EbusEventingProperties props, Environment env,
                                             ObjectProvider<IdempotencyCache> cacheProvider) {
        return new IdempotencyGuard(props, env, cacheProvider);
    }

    static String effectiveKeyPrefix(String configuredPrefix, Environment env) {
        String base = (configuredPrefix == null || configuredPrefix.isBlank()) ? "ebus:idemp" : configuredPrefix.trim();
        if (!base.endsWith(":")) base = base + ":";

        String app = env.getProperty("spring.application.name", "default-app").trim().replaceAll("\\s+", "_");
        if (base.contains("{app}")) {
            return base.replace("{app}", app);
        }
        return base;
    }
}
