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

package org.fireflyframework.compliance.custom;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.compliance.exception.RuleEvaluationException;
import org.fireflyframework.compliance.model.CustomRuleConfig;
import org.fireflyframework.compliance.model.EvaluationFinding;
import org.fireflyframework.compliance.model.FindingType;
import org.fireflyframework.compliance.model.RuleEvaluationContext;
import org.fireflyframework.compliance.model.ThresholdOperator;
import org.fireflyframework.compliance.model.ThresholdValue;
import org.fireflyframework.compliance.registry.CustomEvaluation;
import org.fireflyframework.compliance.registry.CustomEvaluator;
import org.fireflyframework.compliance.registry.CustomEvaluatorRegistrar;
import org.fireflyframework.compliance.registry.CustomEvaluatorRegistry;
import org.fireflyframework.compliance.resiliency.CollaboratorResiliencyRegistry;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Evaluates declarative custom rules registered under {@value #NAME}.
 *
 * <p>The rule's {@link CustomRuleConfig#parameters()} hold a {@link CustomRuleDefinition}
 * selected by its {@code kind}. Definitions only describe lookups against the
 * {@link EntityDataSource}; free-form expressions are not supported.</p>
 *
 * <p>A definition that cannot be read yields a failing evaluation. Failures of the
 * entity source propagate, so the dispatcher reports them as collaborator errors.</p>
 */
@Slf4j
public class DefinedRuleEvaluator implements CustomEvaluator, CustomEvaluatorRegistrar {

    public static final String NAME = "custom_rule";

    private static final int MAX_LISTED_ENTITIES = 5;

    private final EntityDataSource entityDataSource;
    private final ObjectMapper objectMapper;
    private final CollaboratorResiliencyRegistry resiliencyRegistry;

    public DefinedRuleEvaluator(EntityDataSource entityDataSource, ObjectMapper objectMapper,
                                CollaboratorResiliencyRegistry resiliencyRegistry) {
        this.entityDataSource = entityDataSource;
        this.objectMapper = objectMapper;
        this.resiliencyRegistry = resiliencyRegistry;
    }

    @Override
    public void registerEvaluators(CustomEvaluatorRegistry registry) {
        registry.register(NAME, this);
    }

    @Override
    public Mono<CustomEvaluation> evaluate(CustomRuleConfig config, RuleEvaluationContext context) {
        Object kind = config.parameters().get("kind");
        if (!DefinitionKind.isSupported(kind)) {
            return Mono.just(failure("Custom Rule", "Unknown evaluator type: " + kind));
        }

        CustomRuleDefinition definition;
        try {
            definition = objectMapper.convertValue(config.parameters(), CustomRuleDefinition.class);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid '{}' definition: {}", kind, e.getMessage());
            return Mono.just(failure("Custom Rule",
                    "Invalid custom rule definition: " + RuleEvaluationException.describe(e)));
        }

        log.debug("Evaluating defined rule of kind {} for organization {}", kind, context.getOrganizationId());
        return switch (definition.kind()) {
            case DATA_EXISTS -> dataExists((DataExistsDefinition) definition, context);
            case DATA_COUNT -> dataCount((DataCountDefinition) definition, context);
            case FIELD_VALUE -> fieldValue((FieldValueDefinition) definition, context);
            case DATE_COMPARISON -> dateComparison((DateComparisonDefinition) definition, context);
            case RELATIONSHIP_EXISTS -> relationshipExists((RelationshipExistsDefinition) definition, context);
            case AGGREGATE -> aggregate((AggregateDefinition) definition, context);
        };
    }

    private Mono<CustomEvaluation> dataExists(DataExistsDefinition definition, RuleEvaluationContext context) {
        return count(definition.entityType(), definition.filter(), context)
                .map(count -> {
                    boolean passed = (count > 0) == definition.shouldExist();
                    return single(passed, definition.entityType(), definition.message().select(passed),
                            passed ? null : "Review " + definition.entityType() + " data");
                });
    }

    private Mono<CustomEvaluation> dataCount(DataCountDefinition definition, RuleEvaluationContext context) {
        if (!accepts(definition.operator(), definition.value())) {
            return Mono.just(invalidBound(definition.entityType(), definition.operator(), definition.value()));
        }
        return count(definition.entityType(), definition.filter(), context)
                .map(count -> {
                    boolean passed = definition.operator().test(count, definition.value());
                    return single(passed, definition.entityType(),
                            definition.message().render(passed, "count", count), null);
                });
    }

    private Mono<CustomEvaluation> fieldValue(FieldValueDefinition definition, RuleEvaluationContext context) {
        if (definition.field() == null || definition.operator() == null) {
            return Mono.just(failure(definition.entityType(), "Field value rule requires a field and an operator"));
        }
        Pattern regex = null;
        if (definition.operator() == FieldValueDefinition.Operator.REGEX) {
            try {
                regex = Pattern.compile(String.valueOf(definition.value()));
            } catch (PatternSyntaxException e) {
                return Mono.just(failure(definition.entityType(), "Invalid regex: " + e.getDescription()));
            }
        }
        Pattern fieldPattern = regex;

        return entities(definition.entityType(), context)
                .map(entities -> {
                    int matchCount = 0;
                    int nonMatchCount = 0;
                    List<String> nonMatching = new ArrayList<>();

                    for (Map<String, Object> entity : entities) {
                        Object fieldValue = nestedValue(entity, definition.field());
                        if (fieldMatches(definition.operator(), fieldValue, definition.value(), fieldPattern)) {
                            matchCount++;
                        } else {
                            nonMatchCount++;
                            if (nonMatching.size() < MAX_LISTED_ENTITIES) {
                                nonMatching.add(identify(entity));
                            }
                        }
                    }

                    boolean passed = switch (definition.scope()) {
                        case ALL -> nonMatchCount == 0;
                        case ANY -> matchCount > 0;
                        case NONE -> matchCount == 0;
                    };
                    return single(passed, definition.entityType(),
                            passed ? definition.message().pass()
                                    : definition.message().fail() + " (" + nonMatchCount + " non-matching)",
                            passed ? null : "Review entities: " + String.join(", ", nonMatching));
                });
    }

    private Mono<CustomEvaluation> dateComparison(DateComparisonDefinition definition, RuleEvaluationContext context) {
        if (definition.dateField() == null || definition.comparison() == null) {
            return Mono.just(failure(definition.entityType(), "Date comparison rule requires a date field and a comparison"));
        }
        Instant reference;
        try {
            reference = referenceInstant(definition.referenceDate(), context);
        } catch (DateTimeParseException e) {
            return Mono.just(failure(definition.entityType(), "Invalid reference date: " + definition.referenceDate()));
        }
        Duration span = Duration.ofDays(definition.days() != null ? definition.days() : 0);

        return entities(definition.entityType(), context)
                .map(entities -> {
                    int violationCount = 0;
                    List<String> violations = new ArrayList<>();

                    for (Map<String, Object> entity : entities) {
                        Instant date = toInstant(nestedValue(entity, definition.dateField()));
                        // an entity without a readable date cannot show compliance
                        boolean violation = date == null || violates(definition.comparison(), date, reference, span);
                        if (violation) {
                            violationCount++;
                            if (violations.size() < MAX_LISTED_ENTITIES) {
                                violations.add(identify(entity));
                            }
                        }
                    }

                    boolean passed = violationCount == 0;
                    return single(passed, definition.entityType(),
                            passed ? definition.message().pass()
                                    : definition.message().fail() + " (" + violationCount + " violations)",
                            passed ? null : "Review entities: " + String.join(", ", violations));
                });
    }

    private Mono<CustomEvaluation> relationshipExists(RelationshipExistsDefinition definition,
                                                      RuleEvaluationContext context) {
        Mono<Boolean> lookup = Mono.defer(() -> entityDataSource.relationshipExists(definition.sourceEntity(),
                        definition.targetEntity(), definition.relationshipType(), context.getOrganizationId()))
                .switchIfEmpty(Mono.error(new IllegalStateException(
                        "No relationship result for " + definition.sourceEntity() + "->" + definition.targetEntity())));

        return resiliencyRegistry.decorate(CollaboratorResiliencyRegistry.ENTITY_SOURCE, lookup)
                .map(exists -> {
                    boolean passed = exists == definition.shouldExist();
                    return single(passed, definition.sourceEntity() + "->" + definition.targetEntity(),
                            definition.message().select(passed), null);
                });
    }

    private Mono<CustomEvaluation> aggregate(AggregateDefinition definition, RuleEvaluationContext context) {
        if (definition.aggregation() == null) {
            return Mono.just(failure(definition.entityType(), "Aggregate rule requires an aggregation"));
        }
        if (!accepts(definition.operator(), definition.value())) {
            return Mono.just(invalidBound(definition.entityType(), definition.operator(), definition.value()));
        }

        Mono<Double> lookup = Mono.defer(() -> entityDataSource.aggregate(definition.entityType(),
                        definition.aggregation(), definition.field(), scopedFilter(definition.filter(), context)))
                .switchIfEmpty(Mono.error(new IllegalStateException(
                        "No aggregate value for " + definition.entityType())));

        return resiliencyRegistry.decorate(CollaboratorResiliencyRegistry.ENTITY_SOURCE, lookup)
                .map(value -> {
                    boolean passed = definition.operator().test(value, definition.value());
                    return single(passed, definition.entityType(),
                            definition.message().render(passed, "value", value), null);
                });
    }

    private Mono<Long> count(String entityType, Map<String, Object> filter, RuleEvaluationContext context) {
        Mono<Long> lookup = Mono.defer(() -> entityDataSource.countEntities(entityType, scopedFilter(filter, context)))
                .switchIfEmpty(Mono.error(new IllegalStateException("No entity count for " + entityType)));
        return resiliencyRegistry.decorate(CollaboratorResiliencyRegistry.ENTITY_SOURCE, lookup);
    }

    private Mono<List<Map<String, Object>>> entities(String entityType, RuleEvaluationContext context) {
        return resiliencyRegistry.decorateMany(CollaboratorResiliencyRegistry.ENTITY_SOURCE,
                        Flux.defer(() ->
                                entityDataSource.getEntities(entityType, scopedFilter(Map.of(), context))))
                .collectList();
    }

    private static Map<String, Object> scopedFilter(Map<String, Object> filter, RuleEvaluationContext context) {
        Map<String, Object> scoped = new LinkedHashMap<>(filter);
        scoped.put("organizationId", context.getOrganizationId());
        return scoped;
    }

    private static boolean accepts(ThresholdOperator operator, ThresholdValue value) {
        return operator != null && operator.accepts(value);
    }

    private static CustomEvaluation invalidBound(String entityType, ThresholdOperator operator, ThresholdValue value) {
        return failure(entityType, "Invalid comparison: operator " + operator + " cannot be applied to value " + value);
    }

    static boolean fieldMatches(FieldValueDefinition.Operator operator, Object fieldValue, Object expected,
                                Pattern regex) {
        return switch (operator) {
            case EQ -> valuesEqual(fieldValue, expected);
            case NE -> !valuesEqual(fieldValue, expected);
            case CONTAINS -> String.valueOf(fieldValue).contains(String.valueOf(expected));
            case NOT_CONTAINS -> !String.valueOf(fieldValue).contains(String.valueOf(expected));
            case IN -> containsValue(expected, fieldValue);
            case NOT_IN -> !containsValue(expected, fieldValue);
            case REGEX -> regex.matcher(String.valueOf(fieldValue)).find();
        };
    }

    private static boolean containsValue(Object candidates, Object value) {
        if (!(candidates instanceof Collection)) {
            return false;
        }
        return ((Collection<?>) candidates).stream().anyMatch(candidate -> valuesEqual(candidate, value));
    }

    private static boolean valuesEqual(Object left, Object right) {
        if (left instanceof Number && right instanceof Number) {
            return Double.compare(((Number) left).doubleValue(), ((Number) right).doubleValue()) == 0;
        }
        return Objects.equals(left, right);
    }

    private static boolean violates(DateComparisonDefinition.Comparison comparison, Instant date, Instant reference,
                                    Duration span) {
        return switch (comparison) {
            case BEFORE -> !date.isBefore(reference);
            case AFTER -> !date.isAfter(reference);
            case WITHIN_DAYS -> Duration.between(date, reference).abs().compareTo(span) > 0;
            case OLDER_THAN_DAYS -> Duration.between(date, reference).compareTo(span) > 0;
        };
    }

    private static Instant referenceInstant(String referenceDate, RuleEvaluationContext context) {
        if (referenceDate == null || referenceDate.isBlank() || "now".equals(referenceDate)) {
            return context.getEvaluationTime();
        }
        return Instant.parse(referenceDate);
    }

    static Instant toInstant(Object value) {
        if (value instanceof Instant) {
            return (Instant) value;
        }
        if (value instanceof Date) {
            return ((Date) value).toInstant();
        }
        if (value instanceof Number) {
            return Instant.ofEpochMilli(((Number) value).longValue());
        }
        if (value instanceof String) {
            try {
                return Instant.parse((String) value);
            } catch (DateTimeParseException e) {
                return null;
            }
        }
        return null;
    }

    static Object nestedValue(Map<String, Object> entity, String path) {
        Object current = entity;
        for (String part : path.split("\\.")) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<?, ?>) current).get(part);
        }
        return current;
    }

    private static String identify(Map<String, Object> entity) {
        Object id = entity.get("id") != null ? entity.get("id") : entity.get("name");
        return id != null ? id.toString() : "unknown";
    }

    private static CustomEvaluation single(boolean passed, String entity, String description, String remediation) {
        return new CustomEvaluation(passed, List.of(EvaluationFinding.builder()
                .type(passed ? FindingType.PASS : FindingType.FAIL)
                .entity(entity)
                .description(description)
                .remediation(remediation)
                .build()));
    }

    private static CustomEvaluation failure(String entity, String description) {
        return new CustomEvaluation(false, List.of(EvaluationFinding.fail(entity, description)));
    }
}
