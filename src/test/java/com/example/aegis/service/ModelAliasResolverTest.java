package com.example.aegis.service;

import com.example.aegis.config.AppProperties;
import com.example.aegis.exception.EmbeddingException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelAliasResolverTest {

    @Test
    void builtInAliases_resolveToConfiguredModel() {
        var resolver = new ModelAliasResolver(new AppProperties());
        for (String alias : ModelAliasResolver.DEFAULT_ALIASES) {
            ResolvedModel resolved = resolver.resolve(alias);
            assertEquals(alias, resolved.getAlias());
            assertEquals("nomic-ai/nomic-embed-text-v1.5", resolved.getBackendModel());
        }
    }

    @Test
    void unknownAlias_isInvalidRequest() {
        var resolver = new ModelAliasResolver(new AppProperties());
        var e = assertThrows(EmbeddingException.class, () -> resolver.resolve("unknown-model"));
        assertEquals(EmbeddingException.ErrorCode.INVALID_REQUEST, e.getErrorCode());
        assertThrows(EmbeddingException.class, () -> resolver.resolve(null));
    }

    @Test
    void find_isEmptyForUnknownOrMissingModel() {
        var resolver = new ModelAliasResolver(new AppProperties());
        assertTrue(resolver.find("junk-1").isEmpty());
        assertTrue(resolver.find(null).isEmpty());
        assertEquals("nomic-ai/nomic-embed-text-v1.5",
                resolver.find("text-embedding-3-small").orElseThrow().getBackendModel());
    }

    @Test
    void configuredModelAndExtraAliases_areAcceptedAndAdvertised() {
        var properties = new AppProperties();
        properties.getEmbedding().setModelName("sentence-transformers/all-MiniLM-L6-v2");
        properties.getEmbedding().setAliases(Arrays.asList("minilm", " ", "nomic-embed-text"));
        var resolver = new ModelAliasResolver(properties);

        assertEquals("sentence-transformers/all-MiniLM-L6-v2", resolver.resolve("minilm").getBackendModel());
        assertEquals("sentence-transformers/all-MiniLM-L6-v2",
                resolver.resolve("sentence-transformers/all-MiniLM-L6-v2").getBackendModel());

        List<String> advertised = resolver.advertisedModels();
        assertEquals(ModelAliasResolver.DEFAULT_ALIASES, advertised.subList(0, 5));
        assertEquals(Arrays.asList("minilm", "sentence-transformers/all-MiniLM-L6-v2"), advertised.subList(5, 7));
        assertEquals(7, advertised.size());
    }

    @Test
    void configuredModelAlreadyInTable_isNotDuplicated() {
        var resolver = new ModelAliasResolver(new AppProperties());
        assertEquals(ModelAliasResolver.DEFAULT_ALIASES, resolver.advertisedModels());
    }
}
