package com.chainmirror.aggregate.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(AggregateProperties.class)
public class AggregateConfig {
}
