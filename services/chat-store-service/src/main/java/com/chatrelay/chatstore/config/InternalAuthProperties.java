package com.chatrelay.chatstore.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/** {@code internal.auth.*}: shared token expected on every {@code /internal/**} call. */
@ConfigurationProperties(prefix = "internal.auth")
public record InternalAuthProperties(String token) {}
