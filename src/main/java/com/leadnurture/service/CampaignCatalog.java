package com.leadnurture.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadnurture.model.CampaignDefinition;
import com.leadnurture.model.CampaignStep;
import com.leadnurture.model.CampaignType;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-only table of nurture campaigns, one per CampaignType.
 *
 * Built once at startup (see CampaignCatalogConfig) and never mutated.
 * Construction validates the table and fails fast on:
 *   - a missing campaign type
 *   - a duplicate templateId within a campaign
 *   - a negative dayOffset or an hourWindow outside 0..23
 *
 * Steps that do not declare a scoreBoost inherit their campaign's boost.
 */
@Slf4j
public class CampaignCatalog {

    private final Map<CampaignType, CampaignDefinition> campaigns;

    public CampaignCatalog(List<CampaignDefinition> definitions) {
        Map<CampaignType, CampaignDefinition> table = new EnumMap<>(CampaignType.class);
        for (CampaignDefinition definition : definitions) {
            if (definition.getType() == null) {
                throw new IllegalArgumentException("Campaign '" + definition.getName() + "' has no type");
            }
            if (table.containsKey(definition.getType())) {
                throw new IllegalArgumentException("Duplicate campaign type: " + definition.getType());
            }
            table.put(definition.getType(), normalize(definition));
        }
        for (CampaignType type : CampaignType.values()) {
            if (!table.containsKey(type)) {
                throw new IllegalArgumentException("Campaign catalog is missing type: " + type.tag());
            }
        }
        this.campaigns = Collections.unmodifiableMap(table);
    }

    public static CampaignCatalog load(InputStream json, ObjectMapper objectMapper) throws IOException {
        List<CampaignDefinition> definitions = objectMapper.readValue(json, new TypeReference<>() {});
        CampaignCatalog catalog = new CampaignCatalog(definitions);
        log.info("Loaded campaign catalog: {}", catalog.campaigns.values().stream()
                .map(c -> c.getType().tag() + "=" + c.getSteps().size() + " steps")
                .collect(Collectors.joining(", ")));
        return catalog;
    }

    public CampaignDefinition get(CampaignType type) {
        return campaigns.get(type);
    }

    public List<CampaignStep> steps(CampaignType type) {
        return campaigns.get(type).getSteps();
    }

    public Optional<CampaignStep> findStep(CampaignType type, String templateId) {
        return steps(type).stream()
                .filter(step -> step.getTemplateId().equals(templateId))
                .findFirst();
    }

    public Map<CampaignType, CampaignDefinition> all() {
        return campaigns;
    }

    private static CampaignDefinition normalize(CampaignDefinition definition) {
        Set<String> seen = new HashSet<>();
        List<CampaignStep> steps = definition.getSteps().stream()
                .map(step -> {
                    if (step.getTemplateId() == null || step.getTemplateId().isBlank()) {
                        throw new IllegalArgumentException("Step without templateId in " + definition.getType());
                    }
                    if (!seen.add(step.getTemplateId())) {
                        throw new IllegalArgumentException("Duplicate templateId '" + step.getTemplateId()
                                + "' in campaign " + definition.getType().tag());
                    }
                    if (step.getDayOffset() < 0) {
                        throw new IllegalArgumentException("Negative dayOffset for " + step.getTemplateId());
                    }
                    if (step.getHourWindow() < 0 || step.getHourWindow() > 23) {
                        throw new IllegalArgumentException("hourWindow out of range for " + step.getTemplateId());
                    }
                    if (step.getPriority() == null) {
                        throw new IllegalArgumentException("Missing priority for " + step.getTemplateId());
                    }
                    return step.getScoreBoost() != null
                            ? step
                            : step.toBuilder().scoreBoost(definition.getScoreBoost()).build();
                })
                .collect(Collectors.toList());

        return definition.toBuilder().clearSteps().steps(steps).build();
    }
}
