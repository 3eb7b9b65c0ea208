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

package org.elasticsoftware.projections.projection;

/**
 * Produces the target handle handed to a projector for every record. Pooling and lifetime of the handle are
 * the concern of the factory.
 */
public interface ProjectionTargetFactory<C> {
    Class<C> getTargetType();

    C get();

    static <C> ProjectionTargetFactory<C> singleton(Class<C> targetType, C target) {
        return new ProjectionTargetFactory<>() {
            @Override
            public Class<C> getTargetType() {
                return targetType;
            }

            @Override
            public C get() {
                return target;
            }
        };
    }
}
