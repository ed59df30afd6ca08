package com.planwatch.notifier.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "discord")
public record DiscordProperties(String apiBaseUrl, String botToken, long requestTimeoutMs) {}
