package com.ltlcheck.model;

import java.util.Set;

/**
 * A state which carries its own set of true propositions.
 */
public interface Labelled {
  Set<PropositionId> labels();
}
