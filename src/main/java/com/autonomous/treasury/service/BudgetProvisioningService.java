package com.autonomous.treasury.service;

import com.autonomous.treasury.model.AgentBudget;
import com.autonomous.treasury.model.AgentBudgetDefinition;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

/**
 * Provisions agent budgets declared as YAML files under {@code treasury.provisioning.path}.
 * Agents that already have a budget are left alone.
 *
 * <pre>
 * agent_id: research_agent
 * seed_amount: 10000
 * daily_limit: 5000
 * per_action_limit: 2000
 * time_zone: Europe/Berlin
 * </pre>
 */
@Slf4j
@Service
public class BudgetProvisioningService {

    @Value("${treasury.provisioning.path:config/agents}")
    private String provisioningPath = "config/agents";

    private final BudgetRegistryService registry;
    private final ObjectMapper yamlMapper;

    public BudgetProvisioningService(BudgetRegistryService registry) {
        this.registry = registry;
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.yamlMapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        this.yamlMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public void setProvisioningPath(String path) {
        this.provisioningPath = path;
    }

    @PostConstruct
    public void provisionFromConfig() {
        loadDefinitions().forEach(this::provision);
    }

    public List<AgentBudgetDefinition> loadDefinitions() {
        List<AgentBudgetDefinition> definitions = new ArrayList<>();
        File configDir = new File(provisioningPath);

        if (!configDir.exists() || !configDir.isDirectory()) {
            log.info("Provisioning directory not found: {}", provisioningPath);
            return definitions;
        }

        File[] yamlFiles = configDir.listFiles((dir, name) -> name.endsWith(".yaml") || name.endsWith(".yml"));
        if (yamlFiles == null) return definitions;

        for (File file : yamlFiles) {
            try {
                AgentBudgetDefinition definition = yamlMapper.readValue(file, AgentBudgetDefinition.class);
                if (definition.getAgentId() != null) {
                    definitions.add(definition);
                } else {
                    log.warn("Skipping {}: no agent_id", file.getName());
                }
            } catch (Exception e) {
                log.error("Failed to load agent budget from {}: {}", file.getName(), e.getMessage());
            }
        }
        return definitions;
    }

    private void provision(AgentBudgetDefinition definition) {
        try {
            AgentBudget budget = registry.provision(definition.getAgentId(), definition.getSeedAmount(),
                definition.getDailyLimit(), definition.getPerActionLimit(), definition.getTimeZone(), "config");
            log.info("Agent budget ready: {} (balance {})", budget.getAgentId(), budget.getCurrentBalance());
        } catch (RuntimeException e) {
            log.error("Failed to provision {}: {}", definition.getAgentId(), e.getMessage());
        }
    }
}
