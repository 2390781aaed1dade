/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/pool/AssignmentPolicy.java
 description: Policies choosing a busy context for a shared call.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: yes
 tags: [robokeytags,v1]
 [/File Info]
*/
/*
 * Copyright (c) 2025 Rob Deas Ltd.
 * Licensed under the Apache License, Version 2.0 (the "License");
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
package tech.robd.jparallel.pool;

import java.util.Comparator;
import java.util.List;

/**
 * How a shared-mode call picks a context once the pool is full and none is idle.
 */
public enum AssignmentPolicy {

    /**
     * {@code taskId mod poolSize}: stable per id, can pile work onto a busy context.
     */
    MODULO {
        @Override
        PoolRecord pick(List<PoolRecord> candidates, long taskId) {
            return candidates.get((int) (taskId % candidates.size()));
        }
    },

    /**
     * Fewest in-flight tasks, oldest record first on ties.
     */
    LEAST_LOADED {
        @Override
        PoolRecord pick(List<PoolRecord> candidates, long taskId) {
            return candidates.stream()
                    .min(Comparator.comparingInt(PoolRecord::taskCountLocked))
                    .orElseThrow();
        }
    };

    abstract PoolRecord pick(List<PoolRecord> candidates, long taskId);
}
