package com.ryuqq.agentsession.application.procedure;

import com.ryuqq.agentsession.core.procedure.Procedure;
import com.ryuqq.agentsession.core.procedure.ProcedureDecision;
import com.ryuqq.agentsession.core.procedure.ProcedureMetadata;
import com.ryuqq.agentsession.core.procedure.Subroutine;
import com.ryuqq.agentsession.core.session.Session;
import com.ryuqq.agentsession.core.spi.ProcedureEngine;
import com.ryuqq.agentsession.core.spi.RequestClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * {@link ProcedureRegistry} 기반 ProcedureEngine.
 *
 * <p>분류 자체는 외부 {@link RequestClassifier}에 위임하며, 분류기가 실패하거나
 * 등록되지 않은 분류를 돌려주면 {@code full-development}로 fallback 합니다.</p>
 *
 * <p><strong>단계 진행:</strong></p>
 * <ul>
 *   <li>현재 단계 = procedure.subroutines[currentSubroutineIndex]</li>
 *   <li>advance는 완료 기록을 남기고 인덱스를 1 증가 (검증 루프 상태 초기화)</li>
 *   <li>마지막 단계 이후에는 현재/다음 단계 모두 empty</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class DefaultProcedureEngine implements ProcedureEngine {

    private static final Logger log = LoggerFactory.getLogger(DefaultProcedureEngine.class);

    private final RequestClassifier classifier;
    private final ProcedureRegistry registry;

    public DefaultProcedureEngine(RequestClassifier classifier, ProcedureRegistry registry) {
        if (classifier == null) {
            throw new IllegalArgumentException("classifier cannot be null");
        }
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        this.classifier = classifier;
        this.registry = registry;
    }

    public DefaultProcedureEngine(RequestClassifier classifier) {
        this(classifier, ProcedureRegistry.defaults());
    }

    @Override
    public ProcedureDecision classify(String requestText) {
        try {
            ProcedureDecision decision = classifier.classify(requestText);
            String classification = decision.classification();
            String procedureName = registry.procedureNameFor(classification)
                .orElse(decision.procedureName());
            if (registry.find(procedureName).isEmpty()) {
                throw new IllegalStateException("Unknown procedure: " + procedureName);
            }
            String reasoning = decision.reasoning().isBlank()
                ? "Classified as \"" + classification + "\" → using procedure \"" + procedureName + "\""
                : decision.reasoning();
            return new ProcedureDecision(classification, procedureName, reasoning);
        } catch (RuntimeException e) {
            log.warn("Request classification failed, falling back to {}", ProcedureRegistry.DEFAULT_PROCEDURE, e);
            return new ProcedureDecision(
                ProcedureRegistry.DEFAULT_CLASSIFICATION,
                ProcedureRegistry.DEFAULT_PROCEDURE,
                "Fallback to full-development due to error: " + e.getMessage()
            );
        }
    }

    @Override
    public Optional<Procedure> getProcedure(String name) {
        return registry.find(name);
    }

    @Override
    public Optional<Subroutine> getCurrentSubroutine(Session session) {
        ProcedureMetadata metadata = session.getProcedureMetadata();
        if (metadata == null) {
            return Optional.empty();
        }
        return registry.find(metadata.procedureName())
            .flatMap(procedure -> procedure.subroutineAt(metadata.currentSubroutineIndex()));
    }

    @Override
    public Optional<Subroutine> getNextSubroutine(Session session) {
        ProcedureMetadata metadata = session.getProcedureMetadata();
        if (metadata == null) {
            return Optional.empty();
        }
        return registry.find(metadata.procedureName())
            .flatMap(procedure -> procedure.subroutineAt(metadata.currentSubroutineIndex() + 1));
    }

    @Override
    public void advance(Session session, String resumeSessionId, String result) {
        ProcedureMetadata metadata = session.getProcedureMetadata();
        if (metadata == null) {
            throw new IllegalStateException("Session " + session.getId() + " has no procedure");
        }
        String completed = getCurrentSubroutine(session)
            .map(Subroutine::name)
            .orElseThrow(() -> new IllegalStateException(
                "Session " + session.getId() + " has no current subroutine to complete"));
        session.setProcedureMetadata(metadata.advance(completed, resumeSessionId, result,
            System.currentTimeMillis()));
        log.info("Session {} advanced past subroutine {} (procedure: {}, next index: {})",
            session.getId(), completed, metadata.procedureName(), metadata.currentSubroutineIndex() + 1);
    }

    @Override
    public void initializeMetadata(Session session, Procedure procedure) {
        if (procedure == null) {
            throw new IllegalArgumentException("procedure cannot be null");
        }
        session.setProcedureMetadata(ProcedureMetadata.start(procedure.name()));
    }

    @Override
    public Optional<String> getLastSubroutineResult(Session session) {
        ProcedureMetadata metadata = session.getProcedureMetadata();
        if (metadata == null) {
            return Optional.empty();
        }
        String result = metadata.lastResult();
        return result == null || result.isBlank() ? Optional.empty() : Optional.of(result);
    }
}
