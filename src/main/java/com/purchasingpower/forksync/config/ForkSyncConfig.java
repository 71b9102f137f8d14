package com.purchasingpower.forksync.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.purchasingpower.forksync.configuration.ForkSyncProperties;
import com.purchasingpower.forksync.configuration.PolicyRuleProperties;
import com.purchasingpower.forksync.model.ClassificationPolicy;
import com.purchasingpower.forksync.model.DriftRule;
import com.purchasingpower.forksync.model.FileClassification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Turns the bound {@link ForkSyncProperties} into the immutable policy objects a run uses.
 */
@Slf4j
@Configuration
public class ForkSyncConfig {

    @Bean
    public ClassificationPolicy classificationPolicy(ForkSyncProperties props) {
        List<FileClassification> entries = props.getPolicy().stream()
                .map(ForkSyncConfig::toClassification)
                .toList();
        log.info("Loaded classification policy with {} entries", entries.size());
        return new ClassificationPolicy(entries);
    }

    /**
     * Drift vocabulary, in declaration order. Other beans may replace this list wholesale.
     */
    @Bean
    public List<DriftRule> driftRules(ForkSyncProperties props) {
        List<DriftRule> rules = props.getDrift().getPatterns().stream()
                .map(p -> DriftRule.regex(p.getName(), p.getRegex()))
                .toList();
        log.info("Loaded {} drift rules", rules.size());
        return rules;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public ObjectMapper reportObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    private static FileClassification toClassification(PolicyRuleProperties rule) {
        return new FileClassification(rule.getPattern(), rule.getCategory(), rule.getStrategy());
    }
}
