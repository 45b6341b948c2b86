package com.starscape.classtag.common.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Configuration to enable Spring's scheduled task execution.
 * Drives token retention cleanup and rate-limit key eviction.
 */
@Configuration
@EnableScheduling
public class SchedulingConfig {
}
