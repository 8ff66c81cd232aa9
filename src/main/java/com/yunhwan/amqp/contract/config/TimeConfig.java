package com.yunhwan.amqp.contract.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration(proxyBeanMethods = false)
public class TimeConfig {
    @Bean
    @ConditionalOnMissingBean
    public Clock utcClock() {
        return Clock.systemUTC();
    }
}
