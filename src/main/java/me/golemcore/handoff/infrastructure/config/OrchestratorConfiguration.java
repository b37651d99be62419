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
package me.golemcore.handoff.infrastructure.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

/** Spring wiring for shared infrastructure used by the handoff loop. */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class OrchestratorConfiguration {

    private final HandoffProperties properties;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * Scheduler for blocking work (model calls, storage reads) performed while a
     * response is being streamed.
     */
    @Bean
    public Scheduler handoffScheduler() {
        return Schedulers.boundedElastic();
    }

    @PostConstruct
    public void init() {
        HandoffProperties.OrchestratorProperties orchestrator = properties.getOrchestrator();
        log.info("Handoff orchestrator starting...");
        log.info("LLM Provider: {} ({})", properties.getLlm().getProvider(), properties.getLlm().getModel());
        log.info("Max handoffs: {}, max steps per session: {}, default agent: {}",
                orchestrator.getMaxHandoffs(), orchestrator.getMaxStepsPerSession(),
                orchestrator.getDefaultAgent().getWireValue());
        log.info("Storage Path: {}", properties.getStorage().getLocal().getBasePath());
    }
}
