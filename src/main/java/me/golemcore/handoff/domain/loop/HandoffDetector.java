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

import me.golemcore.handoff.domain.model.CapabilityResult;
import me.golemcore.handoff.domain.model.OutputEvent;
import me.golemcore.handoff.domain.model.OutputEventType;
import org.springframework.stereotype.Component;

/**
 * Recognizes handoff results in a session's event stream. Pure: it only
 * classifies, the caller decides what to cancel.
 */
@Component
public class HandoffDetector {

    public HandoffDetection detect(OutputEvent event) {
        if (event == null || !event.is(OutputEventType.CAPABILITY_RESULT)) {
            return HandoffDetection.none();
        }
        CapabilityResult result = event.getResult();
        if (result == null || !result.isHandoff()) {
            return HandoffDetection.none();
        }
        return HandoffDetection.handoff(result.getHandoffPayload());
    }
}
