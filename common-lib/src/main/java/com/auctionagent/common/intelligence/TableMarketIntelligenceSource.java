package com.auctionagent.common.intelligence;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable in-memory tables indexed by bidder id and domain name.
 * First occurrence wins when a key repeats.
 */
final class TableMarketIntelligenceSource implements MarketIntelligenceSource {

    static final TableMarketIntelligenceSource EMPTY =
        new TableMarketIntelligenceSource(List.of(), List.of(), List.of());

    private final List<BidderProfile> bidders;
    private final List<DomainStat> domains;
    private final List<ArchetypeStat> archetypes;
    private final Map<String, BidderProfile> bidderIndex;
    private final Map<String, DomainStat> domainIndex;

    TableMarketIntelligenceSource(List<BidderProfile> bidders, List<DomainStat> domains,
                                  List<ArchetypeStat> archetypes) {
        this.bidders    = bidders    == null ? List.of() : List.copyOf(bidders);
        this.domains    = domains    == null ? List.of() : List.copyOf(domains);
        this.archetypes = archetypes == null ? List.of() : List.copyOf(archetypes);

        Map<String, BidderProfile> byBidder = new HashMap<>();
        for (BidderProfile b : this.bidders) {
            if (b.bidderId() != null) byBidder.putIfAbsent(b.bidderId(), b);
        }
        Map<String, DomainStat> byDomain = new HashMap<>();
        for (DomainStat d : this.domains) {
            if (d.domain() != null) byDomain.putIfAbsent(d.domain().toLowerCase(), d);
        }
        this.bidderIndex = Collections.unmodifiableMap(byBidder);
        this.domainIndex = Collections.unmodifiableMap(byDomain);
    }

    @Override
    public List<BidderProfile> bidderProfiles() {
        return bidders;
    }

    @Override
    public List<DomainStat> domainStats() {
        return domains;
    }

    @Override
    public List<ArchetypeStat> auctionArchetypes() {
        return archetypes;
    }

    @Override
    public Optional<BidderProfile> findBidder(String bidderId) {
        if (bidderId == null) return Optional.empty();
        return Optional.ofNullable(bidderIndex.get(bidderId));
    }

    @Override
    public Optional<DomainStat> findDomain(String domain) {
        if (domain == null) return Optional.empty();
        return Optional.ofNullable(domainIndex.get(domain.toLowerCase()));
    }
}
