package me.golemcore.memory.port.outbound;

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

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Dense text embeddings for the anchor index. Futures complete exceptionally
 * when the backend rejects or cannot be reached; callers translate that into
 * a degraded index, never into a failed anchor write.
 */
public interface EmbeddingPort {

    CompletableFuture<float[]> embed(String text);

    /**
     * @return one vector per input, in input order
     */
    CompletableFuture<List<float[]>> embedBatch(List<String> texts);

    String getModel();

    /**
     * False when no backend is configured. A configured backend may still fail
     * individual calls.
     */
    boolean isAvailable();
}
