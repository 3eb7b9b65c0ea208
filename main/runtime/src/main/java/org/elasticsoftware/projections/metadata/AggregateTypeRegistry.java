/*
 * Copyright 2022 - 2025 The Original Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 *     you may not use this file except in compliance with the License.
 *     You may obtain a copy of the License at
 *
 *           http://www.apache.org/licenses/LICENSE-2.0
 *
 *     Unless required by applicable law or agreed to in writing, software
 *     distributed under the License is distributed on an "AS IS" BASIS,
 *     WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *     See the License for the specific language governing permissions and
 *     limitations under the License.
 *
 */

package org.elasticsoftware.projections.metadata;

import org.elasticsoftware.projections.annotations.AggregateInfo;
import org.elasticsoftware.projections.log.EventMetadata;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps the aggregate type found in the record metadata to a registered aggregate class. Lookup is by type tag
 * first, then by class name (the part of the assembly qualified name before the first comma).
 */
public final class AggregateTypeRegistry {
    private final Map<String, Class<?>> byTag;
    private final Map<String, Class<?>> byClassName;

    private AggregateTypeRegistry(Map<String, Class<?>> byTag, Map<String, Class<?>> byClassName) {
        this.byTag = Collections.unmodifiableMap(byTag);
        this.byClassName = Collections.unmodifiableMap(byClassName);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Class<?>> resolve(EventMetadata metadata) {
        if (metadata.aggregateType() != null) {
            Class<?> type = byTag.get(metadata.aggregateType());
            if (type != null) {
                return Optional.of(type);
            }
        }
        String qualifiedName = metadata.aggregateAssemblyQualifiedName();
        if (qualifiedName != null && !qualifiedName.isBlank()) {
            int separator = qualifiedName.indexOf(',');
            String className = (separator >= 0 ? qualifiedName.substring(0, separator) : qualifiedName).trim();
            return Optional.ofNullable(byClassName.get(className));
        }
        return Optional.empty();
    }

    public Map<String, Class<?>> getRegisteredTypes() {
        return byTag;
    }

    public static class Builder {
        private final Map<String, Class<?>> byTag = new HashMap<>();
        private final Map<String, Class<?>> byClassName = new HashMap<>();

        public Builder register(Class<?> aggregateClass) {
            AggregateInfo info = aggregateClass.getAnnotation(AggregateInfo.class);
            if (info == null) {
                throw new IllegalArgumentException("Class " + aggregateClass.getName() + " is not annotated with @AggregateInfo");
            }
            return register(info.value(), aggregateClass);
        }

        public Builder register(String tag, Class<?> aggregateClass) {
            Class<?> existing = byTag.putIfAbsent(tag, aggregateClass);
            if (existing != null && !existing.equals(aggregateClass)) {
                throw new IllegalStateException("Aggregate type " + tag + " is already registered to " + existing.getName());
            }
            byClassName.put(aggregateClass.getName(), aggregateClass);
            return this;
        }

        public AggregateTypeRegistry build() {
            return new AggregateTypeRegistry(new HashMap<>(byTag), new HashMap<>(byClassName));
        }
    }
}
