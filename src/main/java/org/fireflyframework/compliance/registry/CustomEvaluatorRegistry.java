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

package org.fireflyframework.compliance.registry;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.compliance.exception.UnregisteredEvaluatorException;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name-keyed table of {@link CustomEvaluator}s.
 *
 * <p>An explicit object, constructed once and injected into the rule evaluator; it
 * is never accessed as global state. Checker modules populate it during startup,
 * after which it is only read. Entries cannot be removed.</p>
 */
@Slf4j
public class CustomEvaluatorRegistry {

    private final Map<String, CustomEvaluator> evaluators = new ConcurrentHashMap<>();

    /**
     * Registers an evaluator. A second registration under the same name replaces the first.
     *
     * @param name      the name custom rules refer to
     * @param evaluator the evaluator
     */
    public void register(String name, CustomEvaluator evaluator) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Custom evaluator name must not be blank");
        }
        if (evaluator == null) {
            throw new IllegalArgumentException("Custom evaluator '" + name + "' must not be null");
        }
        CustomEvaluator previous = evaluators.put(name, evaluator);
        if (previous != null) {
            log.warn("Custom evaluator '{}' was registered twice; the later registration wins", name);
        } else {
            log.debug("Registered custom evaluator '{}'", name);
        }
    }

    public Optional<CustomEvaluator> lookup(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(evaluators.get(name));
    }

    /**
     * Returns the evaluator registered under {@code name}.
     *
     * @param name the evaluator name
     * @return the evaluator
     * @throws UnregisteredEvaluatorException if nothing is registered under the name
     */
    public CustomEvaluator require(String name) {
        return lookup(name).orElseThrow(() -> new UnregisteredEvaluatorException(name));
    }

    /**
     * Returns the names of all registered evaluators, sorted.
     *
     * @return registered names
     */
    public List<String> listRegistered() {
        return evaluators.keySet().stream().sorted().toList();
    }
}
