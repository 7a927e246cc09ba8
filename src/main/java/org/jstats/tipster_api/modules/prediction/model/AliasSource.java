package org.jstats.tipster_api.modules.prediction.model;

public enum AliasSource {
    /** {@code model_alias} from the response */
    RESPONSE_ALIAS,
    /** {@code model_name} from the response */
    RESPONSE_NAME,
    /** the alias the caller asked for */
    REQUESTED,
    /** the {@code model} column of a stored history record */
    STORED_MODEL
}
