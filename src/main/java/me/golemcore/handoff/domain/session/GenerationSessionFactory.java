package me.golemcore.handoff.domain.session;

public interface GenerationSessionFactory {

    GenerationSession open(GenerationRequest request, CancellationToken token);
}
