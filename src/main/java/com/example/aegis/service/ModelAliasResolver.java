package com.example.aegis.service;

import com.example.aegis.config.AppProperties;
import com.example.aegis.exception.EmbeddingException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Maps public model aliases to the single configured backend model.
 * All aliases share one loaded model; this is a compatibility shim, not a router.
 */
@Component
public class ModelAliasResolver {

    static final List<String> DEFAULT_ALIASES = Collections.unmodifiableList(Arrays.asList(
            "nomic-embed-text",
            "nomic-ai/nomic-embed-text-v1.5",
            "nomic-embed-code",
            "nomic-ai/nomic-embed-code",
            "text-embedding-3-small"));

    private final String backendModel;
    private final Set<String> aliases;

    public ModelAliasResolver(AppProperties appProperties) {
        AppProperties.EmbeddingConfig config = appProperties.getEmbedding();
        this.backendModel = config.getModelName();

        Set<String> table = new LinkedHashSet<>(DEFAULT_ALIASES);
        for (String alias : config.getAliases()) {
            if (alias != null && !alias.isBlank()) {
                table.add(alias.trim());
            }
        }
        table.add(backendModel);
        this.aliases = Collections.unmodifiableSet(table);
    }

    public ResolvedModel resolve(String requestedModel) {
        return find(requestedModel).orElseThrow(() ->
                EmbeddingException.invalidRequest("Unsupported embedding model '" + requestedModel + "'."));
    }

    /**
     * Lookup without failing; empty for missing or unknown identifiers
     */
    public Optional<ResolvedModel> find(String requestedModel) {
        if (requestedModel == null || !aliases.contains(requestedModel)) {
            return Optional.empty();
        }
        return Optional.of(new ResolvedModel(requestedModel, backendModel));
    }

    /**
     * Public identifiers advertised by /v1/models, in table order
     */
    public List<String> advertisedModels() {
        return new ArrayList<>(aliases);
    }
}
