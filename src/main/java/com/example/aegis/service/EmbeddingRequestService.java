package com.example.aegis.service;

import com.example.aegis.dto.EmbeddingRequestDto;
import com.example.aegis.dto.EmbeddingResponseDto;
import com.example.aegis.exception.EmbeddingErrorMapper;
import com.example.aegis.exception.EmbeddingException;
import com.example.aegis.exception.EmbeddingException.ErrorCode;
import com.example.aegis.service.embedding.EmbeddingBackend;
import com.example.aegis.service.embedding.EmbeddingCapability;
import com.example.aegis.service.telemetry.EmbeddingsMetrics;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Embeddings pipeline: validate -> resolve alias -> backend under deadline -> assemble.
 * Every outcome is reported to telemetry exactly once.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmbeddingRequestService {

    static final String STATUS_OK = "ok";
    static final String UNKNOWN_MODEL = "unknown";

    private final EmbeddingInputValidator inputValidator;
    private final ModelAliasResolver aliasResolver;
    private final EmbeddingCapability capability;
    private final DeadlineSupervisor deadlineSupervisor;
    private final EmbeddingResponseAssembler responseAssembler;
    private final EmbeddingErrorMapper errorMapper;
    private final EmbeddingsMetrics metrics;

    public Mono<EmbeddingResponseDto> createEmbeddings(EmbeddingRequestDto request) {
        RequestRecord outcome = new RequestRecord(request);

        return Mono.defer(() -> {
                    ValidatedRequest validated = inputValidator.validate(request);
                    outcome.inputCount = validated.getTexts().size();

                    ResolvedModel model = aliasResolver.resolve(validated.getModel());
                    EmbeddingBackend backend = capability.require();
                    List<String> texts = validated.getTexts();
                    outcome.promptTokens = EmbeddingResponseAssembler.countPromptTokens(texts);

                    log.debug("Embedding request: model={}, inputs={}, backend={}",
                            model.getAlias(), texts.size(), backend.getName());
                    return deadlineSupervisor.supervise(() -> backend.embedBatch(texts))
                            .map(vectors -> responseAssembler.assemble(model, texts, vectors, backend.getDimension()));
                })
                .onErrorMap(errorMapper::classify)
                .doOnSuccess(response -> outcome.finish(STATUS_OK))
                .doOnError(EmbeddingException.class,
                        e -> outcome.finish(e.getErrorCode().getCode()))
                // the container gave up waiting before the deadline fired
                .doOnCancel(() -> outcome.finish(ErrorCode.UPSTREAM_TIMEOUT.getCode()));
    }

    /**
     * Per-request telemetry state, filled in as the pipeline progresses.
     * The model tag is always a configured backend model or {@link #UNKNOWN_MODEL}.
     */
    private final class RequestRecord {
        private final long startedAt = System.nanoTime();
        private final AtomicBoolean finished = new AtomicBoolean();
        private final String model;
        private int inputCount;
        private Integer promptTokens;

        RequestRecord(EmbeddingRequestDto request) {
            String requested = request != null ? request.getModel() : null;
            this.model = aliasResolver.find(requested)
                    .map(ResolvedModel::getBackendModel)
                    .orElse(UNKNOWN_MODEL);
            this.inputCount = rawInputCount(request);
        }

        void finish(String status) {
            if (!finished.compareAndSet(false, true)) {
                return;
            }
            double elapsedMs = (System.nanoTime() - startedAt) / 1_000_000.0;
            try {
                metrics.record(model, status, inputCount, promptTokens, elapsedMs);
            } catch (RuntimeException e) {
                log.warn("Failed to record embeddings metrics: {}", e.getMessage());
            }
        }

        private int rawInputCount(EmbeddingRequestDto request) {
            JsonNode input = request != null ? request.getInput() : null;
            if (input == null) {
                return 0;
            }
            if (input.isArray()) {
                return input.size();
            }
            return input.isTextual() ? 1 : 0;
        }
    }
}
