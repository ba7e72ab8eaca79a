package com.kafkacascade.demo;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Turns on the demo pipeline with cascade.demo.enabled=true.
 */
@Configuration
@ConditionalOnProperty(name = "cascade.demo.enabled", havingValue = "true")
@EnableScheduling
public class DemoConfig {
}
