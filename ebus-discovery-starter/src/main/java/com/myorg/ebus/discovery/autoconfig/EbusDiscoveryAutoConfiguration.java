package com.myorg.ebus.discovery.autoconfig;

import com.myorg.ebus.discovery.ConsulServiceLocator;
import com.myorg.ebus.discovery.EbusDiscoveryProperties;
import com.myorg.ebus.discovery.ServiceLocator;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.web.client.RestTemplate;

@AutoConfiguration
@ConditionalOnClass(RestTemplate.class)
@ConditionalOnProperty(prefix = "ebus.discovery", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(EbusDiscoveryProperties.class)
public class EbusDiscoveryAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ServiceLocator serviceLocator(EbusDiscoveryProperties props, ObjectProvider<RestTemplateBuilder> builders) {
        RestTemplate restTemplate = builders.getIfAvailable(RestTemplateBuilder::new)
                .setConnectTimeout(props.getTimeout())
                .setReadTimeout(props.getTimeout())
                .build();
        return new ConsulServiceLocator(restTemplate, props);
    }
}
