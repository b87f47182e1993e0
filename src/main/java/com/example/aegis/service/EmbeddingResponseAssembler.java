package com.example.aegis.service;

import com.example.aegis.dto.EmbeddingDataDto;
import com.example.aegis.dto.EmbeddingResponseDto;
import com.example.aegis.dto.UsageDto;
import com.example.aegis.exception.EmbeddingException;
import com.example.aegis.exception.EmbeddingException.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Verifies backend output and builds the success envelope in input order.
 */
@Slf4j
@Component
public class EmbeddingResponseAssembler {

    public EmbeddingResponseDto assemble(ResolvedModel model, List<String> texts,
                                         List<float[]> vectors, int expectedDimension) {
        verify(texts, vectors, expectedDimension);

        List<EmbeddingDataDto> data = new ArrayList<>(vectors.size());
        for (int i = 0; i < vectors.size(); i++) {
            data.add(EmbeddingDataDto.builder()
                    .index(i)
                    .embedding(vectors.get(i))
                    .build());
        }

        int promptTokens = countPromptTokens(texts);
        return EmbeddingResponseDto.builder()
                .data(data)
                .model(model.getAlias())
                .usage(new UsageDto(promptTokens, promptTokens))
                .build();
    }

    void verify(List<String> texts, List<float[]> vectors, int expectedDimension) {
        if (vectors == null || vectors.size() != texts.size()) {
            log.error("Backend returned {} vectors for {} inputs",
                    vectors == null ? "null" : vectors.size(), texts.size());
            throw new EmbeddingException(ErrorCode.INTERNAL, "Embedding backend returned mismatched vector count.");
        }
        for (int i = 0; i < vectors.size(); i++) {
            float[] vector = vectors.get(i);
            if (vector == null || (expectedDimension > 0 && vector.length != expectedDimension)) {
                log.error("Backend returned invalid vector at index {}: expected dimension {}, got {}",
                        i, expectedDimension, vector == null ? "null" : vector.length);
                throw new EmbeddingException(ErrorCode.INTERNAL,
                        "Embedding backend returned invalid vector dimension at index " + i + ".");
            }
            for (float value : vector) {
                if (!Float.isFinite(value)) {
                    log.error("Backend returned non-finite value at index {}", i);
                    throw new EmbeddingException(ErrorCode.INTERNAL,
                            "Embedding backend returned non-finite vector values at index " + i + ".");
                }
            }
        }
    }

    /**
     * Whitespace-separated token count summed over all inputs
     */
    public static int countPromptTokens(List<String> texts) {
        int tokens = 0;
        for (String text : texts) {
            String trimmed = text.strip();
            if (!trimmed.isEmpty()) {
                tokens += trimmed.split("\\s+").length;
            }
        }
        return tokens;
    }
}
