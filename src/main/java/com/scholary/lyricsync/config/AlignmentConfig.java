package com.scholary.lyricsync.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for alignment beans.
 *
 * <p>Enables the AlignmentProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(AlignmentProperties.class)
public class AlignmentConfig {}
