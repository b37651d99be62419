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

import lombok.RequiredArgsConstructor;
import me.golemcore.handoff.domain.model.HandoffPayload;
import me.golemcore.handoff.domain.model.OutputEvent;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.function.Consumer;

/**
 * Forwards a session's events unchanged until a handoff result appears.
 *
 * <p>
 * On a handoff the callback runs first, then the upstream subscription is
 * cancelled and the stream completes. The handoff event itself is never
 * forwarded. Events are not reordered, batched or deduplicated.
 */
@Component
@RequiredArgsConstructor
public class StreamComposer {

    private final HandoffDetector detector;

    public Flux<OutputEvent> compose(Flux<OutputEvent> events, Consumer<HandoffPayload> onHandoff) {
        return events.takeWhile(event -> {
            HandoffDetection detection = detector.detect(event);
            if (detection.suppress()) {
                onHandoff.accept(detection.payload());
                return false;
            }
            return true;
        });
    }
}
