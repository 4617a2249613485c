package com.example.roundtable.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({FeaturesProperties.class, RoundtableProperties.class})
public class FeaturesConfig { }
