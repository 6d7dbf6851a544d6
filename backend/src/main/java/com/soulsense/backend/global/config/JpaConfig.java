package com.soulsense.backend.global.config;

import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

@Configuration
@EnableTransactionManagement
@EntityScan(basePackages = "com.soulsense.backend.modules")
@EnableJpaRepositories(basePackages = "com.soulsense.backend.modules")
public class JpaConfig {
}
