package com.talent.sourcing.discovery;

import com.talent.sourcing.core.model.Requirements;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Generates prioritized web search queries from requirements.
 * <ol>
 *   <li>domain alternatives and directory listings on review and database sites</li>
 *   <li>"companies like" queries for the first seeds</li>
 *   <li>secondary domain keywords and must-have terms</li>
 *   <li>a role-based fallback when nothing else could be generated</li>
 * </ol>
 * Queries with equal priority keep generation order.
 */
public class SearchQueryPlanner {

    static final String REVIEW_SITES = "(site:g2.com OR site:capterra.com OR site:producthunt.com)";
    static final String DIRECTORY_SITES = "(site:gartner.com OR site:crunchbase.com)";

    private final int maxSeeds;
    private final int maxKeywordTerms;

    public SearchQueryPlanner(int maxSeeds, int maxKeywordTerms) {
        this.maxSeeds = maxSeeds;
        this.maxKeywordTerms = maxKeywordTerms;
    }

    /**
     * Plans queries for the requirements. Excluded seeds are not expanded.
     */
    public List<PlannedQuery> plan(Requirements requirements, ExclusionFilter exclusions) {
        List<PlannedQuery> queries = new ArrayList<>();
        List<String> domains = requirements.getDomainKeywords();

        if (!domains.isEmpty()) {
            String domain = domains.get(0);
            queries.add(new PlannedQuery(REVIEW_SITES + " \"" + domain + "\" alternatives competitors", 1));
            queries.add(new PlannedQuery(DIRECTORY_SITES + " \"" + domain + "\" companies directory", 1));
        }

        List<String> seeds = new ArrayList<>();
        for (String seed : requirements.getSeedEntities()) {
            if (!exclusions.isExcluded(seed)) {
                seeds.add(seed);
            }
        }
        for (int i = 0; i < Math.min(maxSeeds, seeds.size()); i++) {
            queries.add(new PlannedQuery(REVIEW_SITES + " \"companies like " + seeds.get(i) + "\" alternatives", 2));
        }

        List<String> terms = new ArrayList<>();
        if (domains.size() > 1) {
            terms.addAll(domains.subList(1, domains.size()));
        }
        terms.addAll(requirements.getMustHave());
        for (int i = 0; i < Math.min(maxKeywordTerms, terms.size()); i++) {
            queries.add(new PlannedQuery("\"" + terms.get(i) + "\" companies", 3));
        }

        if (queries.isEmpty()) {
            queries.add(new PlannedQuery("\"" + requirements.getRoleTitle() + "\" companies directory", 4));
        }

        // List.sort is stable
        queries.sort(Comparator.comparingInt(PlannedQuery::priority));
        return queries;
    }
}
