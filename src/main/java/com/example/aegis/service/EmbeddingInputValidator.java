package com.example.aegis.service;

import com.example.aegis.config.AppProperties;
import com.example.aegis.dto.EmbeddingRequestDto;
import com.example.aegis.exception.EmbeddingException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Normalizes the raw request body and enforces the configured batch and size limits.
 */
@Component
@RequiredArgsConstructor
public class EmbeddingInputValidator {

    static final String FLOAT_ENCODING = "float";

    private final AppProperties appProperties;

    public ValidatedRequest validate(EmbeddingRequestDto request) {
        if (request == null) {
            throw EmbeddingException.invalidRequest("Request body is required.");
        }
        String model = request.getModel();
        if (model == null || model.isBlank()) {
            throw EmbeddingException.invalidRequest("Field 'model' is required.");
        }
        String encodingFormat = request.getEncodingFormat();
        if (encodingFormat != null && !FLOAT_ENCODING.equals(encodingFormat)) {
            throw EmbeddingException.invalidRequest(
                    "Unsupported encoding_format '" + encodingFormat + "'; only 'float' is supported.");
        }

        List<String> texts = normalizeInput(request.getInput());
        checkLimits(texts);
        return new ValidatedRequest(model, texts);
    }

    /**
     * A single string becomes a one-element batch; an array must contain only strings.
     */
    List<String> normalizeInput(JsonNode input) {
        if (input == null || input.isNull() || input.isMissingNode()) {
            throw EmbeddingException.invalidRequest("Field 'input' is required.");
        }
        if (input.isTextual()) {
            return Collections.singletonList(input.textValue());
        }
        if (!input.isArray()) {
            throw EmbeddingException.invalidRequest("Field 'input' must be a string or an array of strings.");
        }

        List<String> texts = new ArrayList<>(input.size());
        for (int i = 0; i < input.size(); i++) {
            JsonNode item = input.get(i);
            if (!item.isTextual()) {
                throw EmbeddingException.invalidRequest("Embedding input at index " + i + " is not a string.");
            }
            texts.add(item.textValue());
        }
        if (texts.isEmpty()) {
            throw EmbeddingException.invalidRequest("Embedding input list cannot be empty.");
        }
        return texts;
    }

    void checkLimits(List<String> texts) {
        AppProperties.EmbeddingConfig config = appProperties.getEmbedding();

        if (texts.size() > config.getMaxBatchSize()) {
            throw EmbeddingException.invalidRequest(String.format(
                    "Embedding input batch size %d exceeds configured limit %d.",
                    texts.size(), config.getMaxBatchSize()));
        }

        long totalChars = 0;
        for (int i = 0; i < texts.size(); i++) {
            int length = texts.get(i).length();
            if (length > config.getMaxInputChars()) {
                throw EmbeddingException.invalidRequest(String.format(
                        "Embedding input at index %d exceeds configured character limit %d.",
                        i, config.getMaxInputChars()));
            }
            totalChars += length;
        }

        if (totalChars > config.getMaxTotalChars()) {
            throw EmbeddingException.invalidRequest(String.format(
                    "Total embedding input size %d exceeds configured character limit %d.",
                    totalChars, config.getMaxTotalChars()));
        }
    }
}
