package com.system.packsolver.bll.adapter;

import com.system.packsolver.config.PackingProperties;
import com.system.packsolver.schemas.PackingRequest;
import com.system.packsolver.schemas.SynergyRuleSchema;
import com.system.packsolver.schemas.algorithm.Input.SynergyTable;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Maps configured and request-supplied synergy rules to the {@link SynergyTable} a solve runs with.
 */
@Component
@RequiredArgsConstructor
public class SynergyCatalogAdapter {

  private final PackingProperties packingProperties;

  public List<SynergyRuleSchema> getDefaultRules() {
    return getDefaultTable().toSchemas();
  }

  public SynergyTable getDefaultTable() {
    return SynergyTable.of(packingProperties.getSynergies());
  }

  /**
   * Request rules win; otherwise the configured defaults when the request asks for them;
   * otherwise no synergies at all.
   */
  public SynergyTable resolve(PackingRequest request) {
    if (request.getSynergies() != null) {
      return SynergyTable.of(request.getSynergies());
    }
    if (Boolean.TRUE.equals(request.getUseDefaultSynergies())) {
      return getDefaultTable();
    }
    return SynergyTable.empty();
  }
}
