package me.golemcore.memory.domain.model;

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

/**
 * Fact flagged by the curator, with the rule that matched it.
 */
public record CurationCandidate(GraphFact fact, Reason reason, String detail) {

    public enum Reason {
        DUPLICATE, VAGUE_ENTITY,
        /** Endpoints could not be resolved; reported, never deleted. */
        AMBIGUOUS
    }

    public boolean deletable() {
        return reason != Reason.AMBIGUOUS;
    }
}
