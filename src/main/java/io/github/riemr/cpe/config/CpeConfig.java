package io.github.riemr.cpe.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(CpeProperties.class)
public class CpeConfig {
}
