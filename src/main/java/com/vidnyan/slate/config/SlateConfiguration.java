package com.vidnyan.slate.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.slate.LintProperties;
import com.vidnyan.slate.application.port.in.LintUseCase;
import com.vidnyan.slate.application.port.out.LintConfigurationLoader;
import com.vidnyan.slate.application.port.out.RuleCatalog;
import com.vidnyan.slate.application.port.out.SourceParser;
import com.vidnyan.slate.application.service.BatchLintService;
import com.vidnyan.slate.domain.engine.FixApplier;
import com.vidnyan.slate.domain.rule.LintConfiguration;
import com.vidnyan.slate.domain.rule.RuleRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.List;

/**
 * Spring configuration for SLATE components.
 * Builds the immutable run configuration and registry before any file is processed, so
 * configuration errors stop the application at startup.
 */
@Slf4j
@Configuration
public class SlateConfiguration {

    /**
     * ObjectMapper for JSON configuration and reports.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    @Bean
    public LintConfiguration lintConfiguration(LintProperties properties, LintConfigurationLoader loader) {
        String configFile = properties.getConfigFile();
        if (configFile == null || configFile.isBlank()) {
            log.info("No rule configuration file set; all rules use their defaults");
            return LintConfiguration.defaults();
        }
        return loader.load(Path.of(configFile));
    }

    @Bean
    public RuleRegistry ruleRegistry(RuleCatalog catalog, LintConfiguration configuration) {
        RuleRegistry registry = RuleRegistry.build(catalog.findAll(), configuration);
        log.info("Registered {} active rules:", registry.activeRules().size());
        registry.activeRules().forEach(r -> log.info("  - {} v{} [{}]{}",
                r.id(), r.rule().version(), r.severity(), r.fixable() ? " (fixable)" : ""));
        return registry;
    }

    @Bean
    public FixApplier fixApplier(LintProperties properties) {
        return new FixApplier(properties.getConflictPolicy());
    }

    @Bean
    public BatchLintService batchLintService(LintUseCase lintUseCase, LintProperties properties) {
        return new BatchLintService(lintUseCase, properties.getParallelism());
    }

    /**
     * Log available parsers on startup.
     */
    @Bean
    public String logParsers(List<SourceParser> parsers) {
        log.info("Registered {} source parsers:", parsers.size());
        parsers.forEach(p -> log.info("  - {}", p.getName()));
        return "parsers-logged";
    }
}
