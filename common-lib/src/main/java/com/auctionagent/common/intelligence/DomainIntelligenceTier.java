package com.auctionagent.common.intelligence;

import java.util.Optional;

/**
 * One link of the domain-intelligence chain. Returns empty to hand over to the next tier.
 */
@FunctionalInterface
public interface DomainIntelligenceTier {

    Optional<DomainIntelligence> match(String domain, double estimatedValue);
}
