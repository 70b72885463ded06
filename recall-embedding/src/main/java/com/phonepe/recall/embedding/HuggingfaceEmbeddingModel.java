/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.recall.embedding;

import ai.djl.huggingface.translator.TextEmbeddingTranslatorFactory;
import ai.djl.inference.Predictor;
import ai.djl.repository.zoo.Criteria;
import ai.djl.repository.zoo.ZooModel;
import ai.djl.training.util.ProgressBar;
import lombok.Builder;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.pool2.BasePooledObjectFactory;
import org.apache.commons.pool2.DestroyMode;
import org.apache.commons.pool2.PooledObject;
import org.apache.commons.pool2.impl.DefaultPooledObject;
import org.apache.commons.pool2.impl.GenericObjectPool;

import java.util.Objects;

/**
 * Sentence-transformer embeddings for callers that want real semantic similarity instead of the character frequency
 * features. The model is downloaded on first use.
 * Check <a href="https://docs.djl.ai/master/docs/load_model.html">...</a> for more information on how to load models
 */
@Slf4j
public class HuggingfaceEmbeddingModel implements EmbeddingModel {
    public static final String DEFAULT_MODEL_URL =
            "djl://ai.djl.huggingface.pytorch/sentence-transformers/all-MiniLM-L6-v2";

    private final String modelUrl;
    @Getter
    private final int dimension;
    private final ZooModel<String, float[]> zooModel;
    // The pool is needed as predictor is not threadsafe
    private final GenericObjectPool<Predictor<String, float[]>> predictors;

    public HuggingfaceEmbeddingModel() {
        this(null, 0);
    }

    @Builder
    @SneakyThrows
    public HuggingfaceEmbeddingModel(String modelUrl, int dimension) {
        this.modelUrl = Objects.requireNonNullElse(modelUrl, DEFAULT_MODEL_URL);
        this.dimension = dimension > 0 ? dimension : 384;
        System.setProperty("OPT_OUT_TRACKING", "true"); //DJL DIALS HOME ...

        final Criteria<String, float[]> criteria =
                Criteria.builder()
                        .setTypes(String.class, float[].class)
                        .optModelUrls(this.modelUrl)
                        .optEngine("PyTorch")
                        .optTranslatorFactory(new TextEmbeddingTranslatorFactory())
                        .optProgress(new ProgressBar())
                        .build();

        this.zooModel = criteria.loadModel();
        this.predictors = new GenericObjectPool<>(new PredictorFactory(zooModel));
        log.info("Loaded embedding model {} with output dimension {}", this.modelUrl, this.dimension);
    }

    @Override
    @SneakyThrows
    public float[] getEmbedding(String input) {
        final var text = Objects.requireNonNullElse(input, "");
        if (text.isBlank()) {
            return new float[dimension];
        }
        final var predictor = predictors.borrowObject();
        try {
            return VectorMath.normalize(VectorMath.fit(predictor.predict(text), dimension));
        }
        finally {
            predictors.returnObject(predictor);
        }
    }

    @Override
    public void close() {
        predictors.close();
        zooModel.close();
    }

    @RequiredArgsConstructor
    private static final class PredictorFactory extends BasePooledObjectFactory<Predictor<String, float[]>> {

        private final ZooModel<String, float[]> zooModel;

        @Override
        public Predictor<String, float[]> create() {
            log.debug("Creating new predictor");
            return zooModel.newPredictor();
        }

        @Override
        public PooledObject<Predictor<String, float[]>> wrap(Predictor<String, float[]> predictor) {
            return new DefaultPooledObject<>(predictor);
        }

        @Override
        public void destroyObject(PooledObject<Predictor<String, float[]>> predictor, DestroyMode destroyMode) {
            log.info("Closing predictor");
            predictor.getObject().close();
        }
    }
}
