package com.contractlink.harvester.harvest.source;

import com.contractlink.harvester.harvest.model.FetchResult;
import com.contractlink.harvester.harvest.model.NormalizeResult;
import com.contractlink.harvester.harvest.model.ParseResult;
import com.contractlink.harvester.harvest.model.RawListing;
import com.contractlink.harvester.harvest.model.ScrapeFilters;
import com.contractlink.harvester.harvest.model.ScraperResult;
import com.contractlink.harvester.harvest.model.SourceId;

/**
 * One procurement source. Every stage reports problems through its result type; only programming
 * errors escape as exceptions.
 */
public interface Scraper {
    SourceId source();

    FetchResult fetchRaw(ScrapeFilters filters);

    ParseResult parse(FetchResult raw);

    NormalizeResult normalize(RawListing listing);

    ScraperResult run(ScrapeFilters filters);
}
