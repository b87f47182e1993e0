package com.example.aegis.service.embedding;

import ai.djl.ModelException;
import ai.djl.huggingface.translator.TextEmbeddingTranslatorFactory;
import ai.djl.inference.Predictor;
import ai.djl.repository.zoo.Criteria;
import ai.djl.repository.zoo.ZooModel;
import ai.djl.training.util.ProgressBar;
import ai.djl.translate.TranslateException;
import com.example.aegis.config.AppProperties;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Local embedding model loaded through DJL.
 *
 * <p>The model is loaded once at startup and shared by every request. A DJL
 * {@link Predictor} must not be used from several threads at once, so all calls
 * go through a single fair lock: one batch is embedded at a time and the rest
 * wait their turn. This caps throughput at one batch in flight.
 */
@Slf4j
public class LocalModelEmbeddingBackend implements EmbeddingBackend {

    public static final String NAME = "local-model";

    static final String DEFAULT_MODEL_ZOO = "djl://ai.djl.huggingface.pytorch/";
    private static final String DIMENSION_PROBE = "dimension probe";

    private final String modelName;
    private final ZooModel<String, float[]> model;
    private final Predictor<String, float[]> predictor;
    private final ReentrantLock lane = new ReentrantLock(true);
    private final int dimension;

    public LocalModelEmbeddingBackend(String modelName, ZooModel<String, float[]> model) throws TranslateException {
        this.modelName = modelName;
        this.model = model;
        this.predictor = model.newPredictor();
        this.dimension = probeDimension();
    }

    /**
     * Load the configured model. Blocks until the model is downloaded and ready.
     */
    public static LocalModelEmbeddingBackend load(AppProperties.EmbeddingConfig config)
            throws ModelException, IOException, TranslateException {
        String modelUrl = resolveModelUrl(config);
        log.info("Loading local embedding model: model={}, url={}, engine={}",
                config.getModelName(), modelUrl, config.getLocalModel().getEngine());

        Criteria<String, float[]> criteria = Criteria.builder()
                .setTypes(String.class, float[].class)
                .optModelUrls(modelUrl)
                .optEngine(config.getLocalModel().getEngine())
                .optTranslatorFactory(new TextEmbeddingTranslatorFactory())
                .optArgument("normalize", config.isNormalize())
                .optProgress(new ProgressBar())
                .build();

        ZooModel<String, float[]> model = criteria.loadModel();
        try {
            return new LocalModelEmbeddingBackend(config.getModelName(), model);
        } catch (TranslateException | RuntimeException e) {
            model.close();
            throw e;
        }
    }

    static String resolveModelUrl(AppProperties.EmbeddingConfig config) {
        String configured = config.getLocalModel().getModelUrl();
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        return DEFAULT_MODEL_ZOO + config.getModelName();
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getModelName() {
        return modelName;
    }

    @Override
    public int getDimension() {
        return dimension;
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) throws TranslateException {
        lane.lock();
        try {
            long start = System.nanoTime();
            List<float[]> vectors = predictor.batchPredict(texts);
            log.debug("Local model embedded {} texts in {} ms",
                    texts.size(), (System.nanoTime() - start) / 1_000_000);
            return vectors;
        } finally {
            lane.unlock();
        }
    }

    @Override
    public void close() {
        lane.lock();
        try {
            predictor.close();
            model.close();
            log.info("Local embedding model closed: {}", modelName);
        } finally {
            lane.unlock();
        }
    }

    private int probeDimension() throws TranslateException {
        List<float[]> probe = embedBatch(Collections.singletonList(DIMENSION_PROBE));
        if (probe == null || probe.size() != 1 || probe.get(0) == null || probe.get(0).length == 0) {
            throw new IllegalStateException("Local model returned no embedding for dimension probe");
        }
        int probed = probe.get(0).length;
        log.info("Local embedding model ready: model={}, dimension={}", modelName, probed);
        return probed;
    }
}
