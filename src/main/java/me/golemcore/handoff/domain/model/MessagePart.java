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
package me.golemcore.handoff.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A typed part of an inbound message. Only {@code text} parts contribute to the
 * normalized message text; other part types (tool calls, files) are ignored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessagePart {

    public static final String TYPE_TEXT = "text";

    private String type;
    private String text;

    public boolean isText() {
        return TYPE_TEXT.equals(type);
    }
}
