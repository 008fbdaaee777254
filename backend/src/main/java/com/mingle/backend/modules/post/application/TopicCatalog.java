package com.mingle.backend.modules.post.application;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.mingle.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

/**
 * Resolves user-supplied topic names. Topics are free-form tags unless a closed catalog is
 * configured, in which case names resolve case-insensitively to the catalog spelling.
 */
@Component
public class TopicCatalog {

    static final int TOPIC_MAX_LENGTH = 40;

    private final Map<String, String> canonicalByKey = new LinkedHashMap<>();

    public TopicCatalog(PostPolicyProperties properties) {
        for (String topic : properties.topics()) {
            if (topic != null && !topic.isBlank()) {
                canonicalByKey.putIfAbsent(key(topic), topic.trim());
            }
        }
    }

    public boolean isOpen() {
        return canonicalByKey.isEmpty();
    }

    public List<String> knownTopics() {
        return List.copyOf(canonicalByKey.values());
    }

    public String resolve(String rawTopic) {
        if (rawTopic == null || rawTopic.isBlank()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_TOPIC", "Topic must not be blank");
        }
        String trimmed = rawTopic.trim();
        if (isOpen()) {
            if (trimmed.length() > TOPIC_MAX_LENGTH) {
                throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_TOPIC",
                        "Topic must be at most " + TOPIC_MAX_LENGTH + " characters");
            }
            return trimmed;
        }
        String canonical = canonicalByKey.get(key(trimmed));
        if (canonical == null) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "UNKNOWN_TOPIC",
                    "Topic must be one of: " + String.join(", ", canonicalByKey.values()));
        }
        return canonical;
    }

    /**
     * Read-side lookup. Never rejects: a topic nobody can have posted under yields empty.
     */
    public Optional<String> find(String rawTopic) {
        if (rawTopic == null || rawTopic.isBlank()) {
            return Optional.empty();
        }
        if (isOpen()) {
            return Optional.of(rawTopic.trim());
        }
        return Optional.ofNullable(canonicalByKey.get(key(rawTopic)));
    }

    /**
     * Resolves every topic, collapsing duplicates while keeping first-seen order.
     */
    public List<String> resolveAll(List<String> rawTopics) {
        if (rawTopics == null || rawTopics.isEmpty()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "TOPICS_REQUIRED", "At least one topic is required");
        }
        Set<String> resolved = new LinkedHashSet<>();
        for (String rawTopic : rawTopics) {
            resolved.add(resolve(rawTopic));
        }
        return List.copyOf(resolved);
    }

    private static String key(String topic) {
        return topic.trim().toLowerCase(Locale.ROOT);
    }
}
