package com.vidnyan.slate.adapter.out.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.slate.application.port.out.LintConfigurationLoader;
import com.vidnyan.slate.domain.rule.InvalidConfigurationException;
import com.vidnyan.slate.domain.rule.LintConfiguration;
import com.vidnyan.slate.domain.rule.RuleParameters;
import com.vidnyan.slate.domain.rule.RuleSettings;
import com.vidnyan.slate.domain.rule.Severity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads the rule configuration from a JSON file.
 *
 * <pre>
 * {"rules": {"max-line-length": {"enabled": true, "severity": "error", "parameters": {"max": 100}}}}
 * </pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonLintConfigurationLoader implements LintConfigurationLoader {

    private final ObjectMapper objectMapper;

    @Override
    public LintConfiguration load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new InvalidConfigurationException("Configuration file not found: " + file);
        }

        ConfigDto dto;
        try {
            dto = objectMapper.readValue(file.toFile(), ConfigDto.class);
        } catch (JsonProcessingException e) {
            throw new InvalidConfigurationException(
                    "Malformed configuration file " + file + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new InvalidConfigurationException("Cannot read configuration file " + file, e);
        }

        LintConfiguration configuration = parse(dto);
        log.info("Loaded configuration for {} rules from {}", configuration.rules().size(), file);
        return configuration;
    }

    /**
     * Map a configuration document that has already been read.
     */
    LintConfiguration parse(ConfigDto dto) {
        if (dto == null || dto.rules == null) {
            return LintConfiguration.defaults();
        }

        Map<String, RuleSettings> rules = new LinkedHashMap<>();
        dto.rules.forEach((ruleId, settings) -> rules.put(ruleId, mapSettings(ruleId, settings)));
        return new LintConfiguration(rules);
    }

    private RuleSettings mapSettings(String ruleId, RuleSettingsDto dto) {
        if (dto == null) {
            return RuleSettings.defaults();
        }
        return new RuleSettings(
                dto.enabled != null ? dto.enabled : true,
                mapSeverity(ruleId, dto.severity),
                new RuleParameters(dto.parameters));
    }

    private Severity mapSeverity(String ruleId, String severity) {
        if (severity == null) {
            return null;
        }
        try {
            return Severity.parse(severity);
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException(
                    "Rule '" + ruleId + "' has an invalid severity '" + severity + "'", e);
        }
    }

    // DTO classes for JSON deserialization
    static class ConfigDto {
        public Map<String, RuleSettingsDto> rules;
    }

    static class RuleSettingsDto {
        public Boolean enabled;
        public String severity;
        public Map<String, Object> parameters;
    }
}
