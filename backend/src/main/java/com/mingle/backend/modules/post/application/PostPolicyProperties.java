package com.mingle.backend.modules.post.application;

import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Publication rules bound from {@code mingle.posts.*}.
 *
 * @param topics               optional closed topic catalog; empty (the default) accepts free-form topics
 * @param defaultExpiryMinutes lifetime used when a request omits {@code expiresInMinutes}
 * @param maxExpiryMinutes     upper bound for {@code expiresInMinutes}
 */
@ConfigurationProperties(prefix = "mingle.posts")
public record PostPolicyProperties(
        List<String> topics,
        @DefaultValue("60") int defaultExpiryMinutes,
        @DefaultValue("10080") int maxExpiryMinutes
) {

    public PostPolicyProperties {
        topics = topics == null ? List.of() : List.copyOf(topics);
        if (defaultExpiryMinutes <= 0 || maxExpiryMinutes <= 0 || defaultExpiryMinutes > maxExpiryMinutes) {
            throw new IllegalArgumentException("mingle.posts expiry bounds must satisfy 0 < default <= max");
        }
    }
}
