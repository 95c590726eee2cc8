package me.golemcore.memory.domain.component;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.memory.domain.model.ComponentHealth;
import me.golemcore.memory.domain.model.RecallLayer;
import me.golemcore.memory.domain.model.RecallResult;

import java.util.List;

/**
 * A store that takes part in ambient recall. Every layer answers the same
 * query with results scored in [0, 1] and tagged with its {@link RecallLayer}.
 */
public interface RecallLayerComponent extends Component {

    @Override
    default String getComponentType() {
        return "recall_layer";
    }

    RecallLayer layer();

    /**
     * Search this layer.
     *
     * @throws me.golemcore.memory.domain.exception.SubstrateException
     *             when the layer's backend cannot answer
     */
    List<RecallResult> search(String query, int limit);

    /**
     * Items loaded at session start, independent of any query.
     */
    default List<RecallResult> startup() {
        return List.of();
    }

    /**
     * Whether the most recent search ran in degraded mode (for example an
     * unreachable backend answered with nothing instead of failing).
     */
    default boolean isDegraded() {
        return false;
    }

    ComponentHealth health();
}
