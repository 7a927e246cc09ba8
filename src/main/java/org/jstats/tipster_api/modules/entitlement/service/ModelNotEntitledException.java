package org.jstats.tipster_api.modules.entitlement.service;

/**
 * The caller asked for a registered model that is not in its entitlement set.
 */
public class ModelNotEntitledException extends RuntimeException {

    private final String alias;

    public ModelNotEntitledException(String alias) {
        super("Model \"" + alias + "\" requires a premium entitlement");
        this.alias = alias;
    }

    public String alias() {
        return alias;
    }
}
