package com.roadassist.common.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/**
 * JPA auditing.
 *
 * <p>Fills {@code @CreatedDate} and {@code @LastModifiedDate} columns on every entity
 * listening with {@code AuditingEntityListener}.</p>
 */
@Configuration
@EnableJpaAuditing
public class JpaConfig {
}
