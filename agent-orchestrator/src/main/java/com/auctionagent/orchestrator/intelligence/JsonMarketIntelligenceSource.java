package com.auctionagent.orchestrator.intelligence;

import com.auctionagent.common.intelligence.ArchetypeStat;
import com.auctionagent.common.intelligence.BidderProfile;
import com.auctionagent.common.intelligence.DomainStat;
import com.auctionagent.common.intelligence.MarketIntelligenceSource;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Optional;

/**
 * Market-intelligence tables read from three JSON array files under
 * {@code market-intelligence.data-dir} (any Spring resource location, e.g. {@code classpath:}
 * or {@code file:}).
 *
 * <p>Files are read once at construction. A missing or unreadable file yields an empty table
 * and a WARN line; the resolver then reports "not found" for that lookup.
 */
@Component
public class JsonMarketIntelligenceSource implements MarketIntelligenceSource {

    private static final Logger log = LoggerFactory.getLogger(JsonMarketIntelligenceSource.class);

    static final String BIDDER_PROFILES_FILE    = "bidder_profiles.json";
    static final String DOMAIN_STATS_FILE       = "domain_stats.json";
    static final String AUCTION_ARCHETYPES_FILE = "auction_archetypes.json";

    private final MarketIntelligenceSource tables;

    public JsonMarketIntelligenceSource(ResourceLoader resourceLoader,
                                        ObjectMapper objectMapper,
                                        @Value("${market-intelligence.data-dir:classpath:market-intelligence}")
                                        String dataDir) {
        String base = dataDir.endsWith("/") ? dataDir : dataDir + "/";
        List<BidderProfile> bidders = load(resourceLoader, objectMapper, base + BIDDER_PROFILES_FILE,
            new TypeReference<List<BidderProfile>>() {});
        List<DomainStat> domains = load(resourceLoader, objectMapper, base + DOMAIN_STATS_FILE,
            new TypeReference<List<DomainStat>>() {});
        List<ArchetypeStat> archetypes = load(resourceLoader, objectMapper, base + AUCTION_ARCHETYPES_FILE,
            new TypeReference<List<ArchetypeStat>>() {});

        this.tables = MarketIntelligenceSource.of(bidders, domains, archetypes);
        log.info("[MarketIntelligence] Tables loaded. bidders={} domains={} archetypes={} dataDir={}",
            bidders.size(), domains.size(), archetypes.size(), dataDir);
    }

    private static <T> List<T> load(ResourceLoader loader, ObjectMapper mapper,
                                    String location, TypeReference<List<T>> type) {
        Resource resource = loader.getResource(location);
        if (!resource.exists()) {
            log.warn("[MarketIntelligence] Table missing, using empty table. location={}", location);
            return List.of();
        }
        try (InputStream in = resource.getInputStream()) {
            List<T> rows = mapper.readValue(in, type);
            return rows == null ? List.of() : rows;
        } catch (IOException e) {
            log.warn("[MarketIntelligence] Table unreadable, using empty table. location={} reason={}",
                location, e.getMessage());
            return List.of();
        }
    }

    @Override
    public List<BidderProfile> bidderProfiles() {
        return tables.bidderProfiles();
    }

    @Override
    public List<DomainStat> domainStats() {
        return tables.domainStats();
    }

    @Override
    public List<ArchetypeStat> auctionArchetypes() {
        return tables.auctionArchetypes();
    }

    @Override
    public Optional<BidderProfile> findBidder(String bidderId) {
        return tables.findBidder(bidderId);
    }

    @Override
    public Optional<DomainStat> findDomain(String domain) {
        return tables.findDomain(domain);
    }
}
