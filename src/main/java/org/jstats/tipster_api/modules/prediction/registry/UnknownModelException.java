package org.jstats.tipster_api.modules.prediction.registry;

/**
 * The requested alias is not in the model registry. Fatal to the call; never retried.
 */
public class UnknownModelException extends RuntimeException {

    private final String alias;

    public UnknownModelException(String alias) {
        super("Model with alias \"" + alias + "\" not found");
        this.alias = alias;
    }

    public String alias() {
        return alias;
    }
}
