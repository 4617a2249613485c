package com.example.roundtable.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "features")
public record FeaturesProperties(@DefaultValue Analytics analytics) {

    public static record Analytics(@DefaultValue("true") boolean enabled) { }
}
