package com.example.docaudit.config;

import com.example.docaudit.domain.model.LicenseAnchors;
import com.example.docaudit.domain.model.PersonalDataRuleSet;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the read-only rule and anchor tables shared by both engines.
 */
@Configuration
@EnableConfigurationProperties(DocAuditProperties.class)
public class DocAuditConfig {

    @Bean
    public PersonalDataRuleSet personalDataRuleSet() {
        return PersonalDataRuleSet.defaults();
    }

    @Bean
    public LicenseAnchors licenseAnchors() {
        return LicenseAnchors.defaults();
    }
}
