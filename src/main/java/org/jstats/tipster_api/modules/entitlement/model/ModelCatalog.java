package org.jstats.tipster_api.modules.entitlement.model;

import java.util.List;

/**
 * Model picker contents for the caller.
 *
 * @param models              every registered model in display order, with lock state
 * @param defaultAlias        model preselected in the picker
 * @param redemptionAvailable whether redeeming a code would unlock anything
 */
public record ModelCatalog(List<ModelChoice> models, String defaultAlias, boolean redemptionAvailable) {}
