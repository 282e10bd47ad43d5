package com.careinsight.careinsight.imports;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables binding of import-specific configuration properties.
 */
@Configuration
@EnableConfigurationProperties(ImportProperties.class)
public class ImportConfig {
}
