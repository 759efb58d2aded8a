package com.example.reconciliation.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Registers the validated {@link ReconciliationProperties} bean.
 */
@Configuration
@EnableConfigurationProperties(ReconciliationProperties.class)
public class ReconciliationConfiguration {
}
