package com.specsim.infrastructure.sim.section;

import java.util.Optional;

/**
 * One heading-recognition rule. Rules are tried in registry order and the first match wins.
 */
public interface SectionRule {

    String name();

    Optional<SectionMatch> match(String heading);
}
