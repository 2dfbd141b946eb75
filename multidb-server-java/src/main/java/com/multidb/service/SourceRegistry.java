package com.multidb.service;

import com.multidb.config.MultiDbProperties;
import com.multidb.model.SourceProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Static source descriptors, in configuration order. Built once at startup.
 */
@Service
public class SourceRegistry {
    private static final Logger logger = LoggerFactory.getLogger(SourceRegistry.class);

    private final Map<String, SourceProfile> profiles;
    private final Map<String, MultiDbProperties.Source> connectionSettings;

    public SourceRegistry(MultiDbProperties properties) {
        Map<String, SourceProfile> byName = new LinkedHashMap<>();
        Map<String, MultiDbProperties.Source> settings = new LinkedHashMap<>();
        for (MultiDbProperties.Source source : properties.getSources()) {
            if (source.getName() == null || source.getName().isBlank()) {
                throw new IllegalStateException("Every configured source needs a name");
            }
            if (byName.containsKey(source.getName())) {
                throw new IllegalStateException("Duplicate source name: " + source.getName());
            }
            List<String> keywords = Objects.requireNonNullElse(source.getKeywords(), List.<String>of()).stream()
                .map(keyword -> keyword.toLowerCase(Locale.ROOT))
                .distinct()
                .collect(Collectors.toList());
            byName.put(source.getName(),
                new SourceProfile(source.getName(), Objects.requireNonNullElse(source.getDescription(), ""),
                    source.getHost(), keywords));
            settings.put(source.getName(), source);
        }
        this.profiles = Collections.unmodifiableMap(byName);
        this.connectionSettings = Collections.unmodifiableMap(settings);
        logger.info("Configured sources: {}", profiles.keySet());
    }

    public List<SourceProfile> getProfiles() {
        return List.copyOf(profiles.values());
    }

    public List<String> getSourceNames() {
        return List.copyOf(profiles.keySet());
    }

    public Optional<SourceProfile> getProfile(String name) {
        return Optional.ofNullable(name).map(profiles::get);
    }

    public boolean contains(String name) {
        return name != null && profiles.containsKey(name);
    }

    public String getDescription(String name) {
        return getProfile(name).map(SourceProfile::getDescription).orElse("");
    }

    public Optional<MultiDbProperties.Source> getConnectionSettings(String name) {
        return Optional.ofNullable(name).map(connectionSettings::get);
    }

    /**
     * "name (description), ..." over the given sources, for clarification prompts.
     */
    public String describe(List<String> names) {
        return names.stream()
            .map(name -> getProfile(name).map(SourceProfile::describe).orElse(name))
            .collect(Collectors.joining(", "));
    }
}
