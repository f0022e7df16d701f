package com.auctionagent.common.intelligence;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view over the offline market-intelligence tables.
 *
 * <p>Implementations load their data once and must be safe for concurrent readers.
 */
public interface MarketIntelligenceSource {

    List<BidderProfile> bidderProfiles();

    List<DomainStat> domainStats();

    List<ArchetypeStat> auctionArchetypes();

    Optional<BidderProfile> findBidder(String bidderId);

    Optional<DomainStat> findDomain(String domain);

    static MarketIntelligenceSource empty() {
        return TableMarketIntelligenceSource.EMPTY;
    }

    static MarketIntelligenceSource of(List<BidderProfile> bidders, List<DomainStat> domains,
                                       List<ArchetypeStat> archetypes) {
        return new TableMarketIntelligenceSource(bidders, domains, archetypes);
    }
}
