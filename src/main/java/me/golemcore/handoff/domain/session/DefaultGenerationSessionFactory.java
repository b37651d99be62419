package me.golemcore.handoff.domain.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.handoff.port.outbound.LlmPort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.scheduler.Scheduler;

/**
 * Opens {@link DefaultGenerationSession}s backed by the configured
 * {@link LlmPort}.
 */
@Component
public class DefaultGenerationSessionFactory implements GenerationSessionFactory {

    private final LlmPort llmPort;
    private final Scheduler scheduler;
    private final ObjectMapper objectMapper;

    public DefaultGenerationSessionFactory(LlmPort llmPort, @Qualifier("handoffScheduler") Scheduler scheduler,
            ObjectMapper objectMapper) {
        this.llmPort = llmPort;
        this.scheduler = scheduler;
        this.objectMapper = objectMapper;
    }

    @Override
    public GenerationSession open(GenerationRequest request, CancellationToken token) {
        return new DefaultGenerationSession(request, token, llmPort, scheduler, objectMapper);
    }
}
