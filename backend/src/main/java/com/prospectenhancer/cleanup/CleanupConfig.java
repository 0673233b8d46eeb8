package com.prospectenhancer.cleanup;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(CleanupProperties.class)
public class CleanupConfig {
}
