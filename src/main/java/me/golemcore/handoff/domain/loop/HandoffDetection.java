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
package me.golemcore.handoff.domain.loop;

import me.golemcore.handoff.domain.model.HandoffPayload;

/**
 * Classification of one output event. {@code suppress} is set exactly when the
 * event is a handoff result carrying {@code payload}.
 */
public record HandoffDetection(HandoffPayload payload, boolean suppress) {

    private static final HandoffDetection NONE = new HandoffDetection(null, false);

    public static HandoffDetection none() {
        return NONE;
    }

    public static HandoffDetection handoff(HandoffPayload payload) {
        return new HandoffDetection(payload, true);
    }
}
