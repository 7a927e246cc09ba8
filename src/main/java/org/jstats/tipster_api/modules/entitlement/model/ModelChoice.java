package org.jstats.tipster_api.modules.entitlement.model;

import org.jstats.tipster_api.modules.prediction.model.ModelDescriptor;

/**
 * A model offered to the caller, with whether the caller may currently select it.
 * Locked choices are shown with an upgrade prompt instead of being hidden.
 */
public record ModelChoice(
        String id,
        String alias,
        String tier,
        String description,
        boolean premium,
        boolean allowed,
        boolean locked
) {

    public static ModelChoice of(ModelDescriptor model, boolean allowed) {
        return new ModelChoice(model.id(), model.alias(), model.tier().wireName(), model.description(),
                model.isPremium(), allowed, !allowed);
    }
}
