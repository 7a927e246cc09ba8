package org.jstats.tipster_api.modules.prediction.model;

import java.net.URI;

/**
 * A prediction model known to the registry.
 *
 * @param id          short internal id of the model service
 * @param alias       human-readable, unique name used as the selection key
 * @param endpoint    absolute URI the prediction is POSTed to
 * @param tier        free or premium
 * @param description one-line description shown next to the choice
 * @param acceptsOdds whether bookmaker odds are sent as {@code odd_a}/{@code odd_b}
 */
public record ModelDescriptor(
        String id,
        String alias,
        URI endpoint,
        ModelTier tier,
        String description,
        boolean acceptsOdds
) {

    public boolean isPremium() {
        return tier == ModelTier.PREMIUM;
    }
}
