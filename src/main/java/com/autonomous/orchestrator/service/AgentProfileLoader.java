package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.config.OrchestratorProperties;
import com.autonomous.orchestrator.model.AgentDescriptor;
import com.autonomous.orchestrator.model.AgentType;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Locale;

/**
 * Loads agent profiles into the {@link CapabilityRegistry} at startup.
 * <p>
 * Profiles are YAML files with snake_case keys in {@code orchestrator.agents-path}. When that
 * directory does not exist the built-in profiles under {@code classpath:agents/} are used.
 * The registry is frozen once loading finishes.
 */
@Slf4j
@Service
public class AgentProfileLoader {

    private final CapabilityRegistry registry;
    private final ObjectMapper yamlMapper;
    private String agentsPath;

    public AgentProfileLoader(CapabilityRegistry registry, OrchestratorProperties properties) {
        this.registry = registry;
        this.agentsPath = properties.getAgentsPath();
        this.yamlMapper = YAMLMapper.builder()
            .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .build();
    }

    public void setAgentsPath(String path) {
        this.agentsPath = path;
    }

    @PostConstruct
    public void loadProfiles() {
        File profileDir = new File(agentsPath);
        if (profileDir.isDirectory()) {
            loadFromDirectory(profileDir);
        } else {
            log.info("Agent profile directory not found, using built-in profiles. path={}", agentsPath);
            loadBuiltIn();
        }
        registry.freeze();
    }

    private void loadFromDirectory(File profileDir) {
        File[] yamlFiles = profileDir.listFiles((dir, name) -> name.endsWith(".yaml") || name.endsWith(".yml"));
        if (yamlFiles == null) {
            return;
        }
        Arrays.sort(yamlFiles, Comparator.comparing(File::getName));
        for (File file : yamlFiles) {
            try {
                register(yamlMapper.readValue(file, AgentDescriptor.class), file.getName());
            } catch (IOException e) {
                // a broken profile must stop startup rather than leave a type unroutable
                throw new UncheckedIOException("Failed to load agent profile " + file.getName(), e);
            }
        }
    }

    private void loadBuiltIn() {
        for (AgentType type : AgentType.values()) {
            String resourcePath = "agents/" + type.name().toLowerCase(Locale.ROOT) + ".yaml";
            ClassPathResource resource = new ClassPathResource(resourcePath);
            if (!resource.exists()) {
                continue;
            }
            try (InputStream in = resource.getInputStream()) {
                register(yamlMapper.readValue(in, AgentDescriptor.class), resourcePath);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to load built-in agent profile " + resourcePath, e);
            }
        }
    }

    private void register(AgentDescriptor descriptor, String source) {
        if (descriptor.getType() == null) {
            log.warn("Skipping agent profile without type. source={}", source);
            return;
        }
        registry.register(descriptor.getType(), descriptor);
    }
}
