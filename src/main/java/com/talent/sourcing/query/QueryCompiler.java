package com.talent.sourcing.query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiles a {@link FilterRequest} into the nested boolean query sent to the person index.
 *
 * <p>Layout of the compiled tree:</p>
 * <pre>
 * bool
 *   must:   nested(experience, bool(must: [membership, keyword if required]))
 *           location term, if required
 *   should: nested(experience, keyword), if optional
 *           location term, if optional
 *   minimum_should_match: 0 (only when there are should clauses)
 * </pre>
 * <p>Membership is a should-group with {@code minimum_should_match = 1} over the organization ids.
 * An optional filter is never placed under a must: a misplaced optional clause makes the
 * backend return zero results without any error.</p>
 *
 * <p>Compilation is pure: equal requests give equal trees.</p>
 */
public class QueryCompiler {
    private static final Logger log = LoggerFactory.getLogger(QueryCompiler.class);

    private final CompilerOptions options;

    public QueryCompiler() {
        this(CompilerOptions.defaults());
    }

    public QueryCompiler(CompilerOptions options) {
        this.options = options;
    }

    public CompilerOptions getOptions() {
        return options;
    }

    /**
     * @throws InvalidFilterException if the request names no organizations
     */
    public QueryTree compile(FilterRequest request) {
        if (request == null || request.requiredEntityIds().isEmpty()) {
            throw new InvalidFilterException("At least one required entity id is needed to build a person search");
        }

        List<QueryNode> experienceMust = new ArrayList<>();
        experienceMust.add(membership(request.requiredEntityIds()));

        List<QueryNode> outerMust = new ArrayList<>();
        List<QueryNode> outerShould = new ArrayList<>();

        if (request.hasKeyword()) {
            QueryStringQuery keyword = new QueryStringQuery(request.keywordExpression(), options.titleField(), "OR");
            if (request.keywordRequired()) {
                // Same nested scope as membership: the title must belong to a job at one of the organizations.
                experienceMust.add(keyword);
            } else {
                outerShould.add(new NestedQuery(options.experiencePath(), keyword));
            }
        }

        outerMust.add(new NestedQuery(options.experiencePath(), new BoolQuery(experienceMust, List.of(), null)));

        if (request.hasLocation()) {
            TermQuery location = new TermQuery(options.locationField(), request.location());
            if (request.locationRequired()) {
                outerMust.add(location);
            } else {
                outerShould.add(location);
            }
        }

        BoolQuery root = new BoolQuery(outerMust, outerShould, outerShould.isEmpty() ? null : 0);
        log.debug("query.compiled entities={} keyword={} keywordRequired={} location={} locationRequired={}",
                request.requiredEntityIds().size(), request.hasKeyword(), request.keywordRequired(),
                request.hasLocation(), request.locationRequired());
        return new QueryTree(root);
    }

    /**
     * One term per id while the list fits in a group; beyond that, grouped terms blocks.
     * Either way the result matches when any id matches.
     */
    private QueryNode membership(List<String> ids) {
        int groupSize = options.maxTermsPerGroup();
        List<QueryNode> clauses = new ArrayList<>();
        if (ids.size() <= groupSize) {
            for (String id : ids) {
                clauses.add(new TermQuery(options.entityIdField(), id));
            }
        } else {
            for (int start = 0; start < ids.size(); start += groupSize) {
                List<String> group = ids.subList(start, Math.min(ids.size(), start + groupSize));
                clauses.add(new TermsQuery(options.entityIdField(), group));
            }
            log.debug("query.membershipSplit ids={} groups={}", ids.size(), clauses.size());
        }
        return BoolQuery.anyOf(clauses);
    }
}
