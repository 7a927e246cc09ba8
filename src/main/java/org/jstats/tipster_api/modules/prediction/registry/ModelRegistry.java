package org.jstats.tipster_api.modules.prediction.registry;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.jstats.tipster_api.modules.prediction.model.ModelDescriptor;
import org.jstats.tipster_api.modules.prediction.model.ModelTier;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.jstats.tipster_api.modules.prediction.model.ModelTier.FREE;
import static org.jstats.tipster_api.modules.prediction.model.ModelTier.PREMIUM;

/**
 * Compiled-in table of the prediction models, keyed by alias.
 * <p>
 * Only the host the model services run on is configurable; ports, tiers and aliases are fixed.
 * Iteration order is the order choices are offered in.
 */
@NullMarked
public final class ModelRegistry {

    public static final String DEFAULT_ALIAS = "Quick Pick";

    private record Entry(String id, String alias, int port, ModelTier tier, String description, boolean acceptsOdds) {}

    private static final List<Entry> ENTRIES = List.of(
            new Entry("lr", "Quick Pick", 8001, FREE, "Fast baseline prediction.", true),
            new Entry("lgbm", "Form Cruncher", 8002, FREE, "Balanced performance model.", true),
            // transformer is trained without bookmaker odds
            new Entry("transformer", "Deep Dive", 8004, PREMIUM, "Context-aware transformer model.", false),
            new Entry("stacker", "Stacked", 8003, PREMIUM, "Ensemble model for higher accuracy.", true),
            new Entry("rl", "Edge Finder", 8006, PREMIUM, "Reinforcement learning agent.", true)
    );

    private final Map<String, ModelDescriptor> byAlias;

    private ModelRegistry(Map<String, ModelDescriptor> byAlias) {
        this.byAlias = byAlias;
    }

    /**
     * @param baseUrl scheme and host of the model services, e.g. {@code http://localhost}
     */
    public static ModelRegistry forHost(String baseUrl) {
        var base = URI.create(baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl);
        if (base.getScheme() == null || base.getHost() == null) {
            throw new IllegalArgumentException("Model base URL needs a scheme and host: " + baseUrl);
        }
        Map<String, ModelDescriptor> models = new LinkedHashMap<>();
        for (Entry e : ENTRIES) {
            var endpoint = URI.create(base.getScheme() + "://" + base.getHost() + ":" + e.port() + "/predict");
            var previous = models.put(e.alias(), new ModelDescriptor(
                    e.id(), e.alias(), endpoint, e.tier(), e.description(), e.acceptsOdds()));
            if (previous != null) {
                throw new IllegalStateException("Duplicate model alias " + e.alias());
            }
        }
        return new ModelRegistry(Collections.unmodifiableMap(models));
    }

    public Optional<ModelDescriptor> find(@Nullable String alias) {
        return alias == null ? Optional.empty() : Optional.ofNullable(byAlias.get(alias));
    }

    public ModelDescriptor require(String alias) {
        return find(alias).orElseThrow(() -> new UnknownModelException(alias));
    }

    public List<ModelDescriptor> all() {
        return List.copyOf(byAlias.values());
    }

    public ModelDescriptor defaultModel() {
        return require(DEFAULT_ALIAS);
    }

    public List<ModelDescriptor> premiumModels() {
        return byAlias.values().stream().filter(ModelDescriptor::isPremium).toList();
    }
}
