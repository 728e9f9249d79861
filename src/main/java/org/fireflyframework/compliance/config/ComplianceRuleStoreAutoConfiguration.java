/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.compliance.config;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.compliance.source.ComplianceRuleRepository;
import org.fireflyframework.compliance.source.InMemoryComplianceRuleRepository;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the compliance rule store.
 *
 * <p>Provides an in-memory {@link ComplianceRuleRepository} when the application
 * defines none. Production deployments should provide their own repository backed
 * by the organization's rule catalog.</p>
 */
@Slf4j
@AutoConfiguration
@ConditionalOnProperty(
    prefix = "firefly.compliance",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true
)
public class ComplianceRuleStoreAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ComplianceRuleRepository complianceRuleRepository() {
        log.info("Configuring in-memory compliance rule repository (production: implement ComplianceRuleRepository with persistent store)");
        return new InMemoryComplianceRuleRepository();
    }
}
