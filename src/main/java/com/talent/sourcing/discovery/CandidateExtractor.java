package com.talent.sourcing.discovery;

import com.talent.sourcing.core.model.DiscoverySource;
import com.talent.sourcing.core.model.Provenance;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls organization names out of web search results with lightweight heuristics:
 * capitalized phrases, "like / including / such as" lists and product domains,
 * then drops common words and implausible names.
 */
public class CandidateExtractor {

    private static final Pattern CAPITALIZED = Pattern.compile(
            "\\b([A-Z][A-Za-z]*(?:\\s+[A-Z][A-Za-z]*)*(?:\\.ai|\\.com|\\.io)?)\\b");
    private static final Pattern LISTED = Pattern.compile(
            "(?:like|including|such as)\\s+([A-Z][a-zA-Z\\s,&]+?)(?:\\.|\\s+and\\s+[A-Z]|$)");
    private static final Pattern DOMAIN_NAME = Pattern.compile(
            "([A-Z][a-zA-Z]+?)(?:\\.com|\\.ai|\\.io)");
    private static final Pattern CRUNCHBASE_SLUG = Pattern.compile("/organization/([^/?#]+)");

    private static final Set<String> COMMON_WORDS = Set.of(
            "The", "A", "An", "And", "Or", "But", "For", "At", "By", "In", "On", "To", "Of",
            "We", "Our", "They", "This", "That", "These", "Those", "As", "Is", "Are", "Was", "Were",
            "Experience", "Candidates", "Companies", "Engineers", "Work", "Team", "Role", "Position",
            "Looking", "Seeking", "Need", "Want", "Must", "Should", "Will", "Can", "May",
            "About", "What", "Who", "When", "Where", "Why", "How", "Which", "While", "Since",
            "All", "Both", "Each", "Every", "Some", "Any", "Many", "Much", "Few", "Several",
            "Have", "Has", "Had", "Do", "Does", "Did", "With", "From", "Into", "During", "Before",
            "After", "Above", "Below", "Between", "Through",
            "API", "APIs", "AI", "ML", "NLP", "Tech", "Platform", "Service", "Services",
            "Software", "Hardware", "Cloud", "Enterprise", "Solutions", "System", "Systems", "Tool", "Tools",
            "Data", "Analytics", "Intelligence",
            "Find", "Search", "Get", "Make", "Build", "Create", "Use", "Try", "Start", "Stop",
            "Top", "Best", "New", "Old", "Good", "Bad", "High", "Low", "Fast", "Slow",
            "Alternatives", "Competitors", "Similar", "Like", "Its", "Reddit");

    private static final List<String> NON_COMPANY_DOMAINS = List.of(
            "linkedin.com", "crunchbase.com", "techcrunch.com", "forbes.com",
            "bloomberg.com", "reuters.com", "wsj.com", "nytimes.com",
            "twitter.com", "x.com", "facebook.com", "youtube.com", "reddit.com",
            "indeed.com", "glassdoor.com", "angel.co", "wellfound.com",
            "g2.com", "capterra.com", "ycombinator.com", "gartner.com",
            "wikipedia.org", "google.com", "bing.com", "medium.com");

    private final int maxPerResultSet;

    public CandidateExtractor(int maxPerResultSet) {
        if (maxPerResultSet < 1) {
            throw new IllegalArgumentException("maxPerResultSet must be >= 1");
        }
        this.maxPerResultSet = maxPerResultSet;
    }

    /**
     * Extracts candidates from the results of one query, deduplicated by exact name and
     * capped at {@code maxPerResultSet}.
     */
    public List<DiscoveryCandidate> extract(List<WebSearchHit> hits, DiscoverySource source, String query) {
        Map<String, DiscoveryCandidate> byName = new LinkedHashMap<>();
        for (WebSearchHit hit : hits) {
            String website = websiteFromUrl(hit.url());
            for (String name : extractNames(hit.content() + " " + hit.title())) {
                if (byName.containsKey(name) || !isLikelyOrganizationName(name)) {
                    continue;
                }
                String hint = website != null && mentionsName(hit, name) ? website : null;
                byName.put(name, new DiscoveryCandidate(name, hint,
                        new Provenance(source, query, hit.url(), hit.rank())));
            }
        }
        List<DiscoveryCandidate> candidates = new ArrayList<>(byName.values());
        return candidates.size() > maxPerResultSet ? candidates.subList(0, maxPerResultSet) : candidates;
    }

    List<String> extractNames(String text) {
        List<String> names = new ArrayList<>();
        Matcher capitalized = CAPITALIZED.matcher(text);
        while (capitalized.find()) {
            names.add(capitalized.group(1));
        }
        Matcher listed = LISTED.matcher(text);
        while (listed.find()) {
            for (String part : listed.group(1).split(",")) {
                String cleaned = part.strip();
                if (cleaned.length() > 2 && !cleaned.equals("and") && !cleaned.equals("or") && !cleaned.equals("the")) {
                    names.add(cleaned);
                }
            }
        }
        Matcher domains = DOMAIN_NAME.matcher(text);
        while (domains.find()) {
            names.add(domains.group(1));
        }

        List<String> result = new ArrayList<>();
        for (String name : names) {
            String cleaned = name.strip();
            if (!cleaned.isEmpty() && !COMMON_WORDS.contains(cleaned)) {
                result.add(cleaned);
            }
        }
        return result;
    }

    /**
     * Multi-word names pass; single words must be capitalized and either long enough,
     * contain a digit, or carry a domain suffix.
     */
    static boolean isLikelyOrganizationName(String name) {
        if (name == null || name.length() <= 2 || name.length() >= 50) {
            return false;
        }
        if (name.chars().noneMatch(Character::isLetter)) {
            return false;
        }
        if (name.split("\\s+").length >= 2) {
            return true;
        }
        if (!Character.isUpperCase(name.charAt(0))) {
            return false;
        }
        boolean hasDigit = name.chars().anyMatch(Character::isDigit);
        boolean hasDomainSuffix = name.endsWith(".ai") || name.endsWith(".com")
                || name.endsWith(".io") || name.endsWith(".co");
        return hasDigit || hasDomainSuffix || name.length() >= 4;
    }

    /**
     * Company website for a result URL: the root domain for company sites, a guessed
     * .com for Crunchbase organization pages, null for news, social and review sites.
     */
    static String websiteFromUrl(String url) {
        if (url == null) {
            return null;
        }
        String host;
        try {
            host = URI.create(url).getHost();
        } catch (IllegalArgumentException e) {
            return null;
        }
        if (host == null) {
            return null;
        }
        host = host.toLowerCase(Locale.ROOT);
        for (String excluded : NON_COMPANY_DOMAINS) {
            if (host.equals(excluded) || host.endsWith("." + excluded)) {
                if (excluded.equals("crunchbase.com")) {
                    Matcher slug = CRUNCHBASE_SLUG.matcher(url);
                    if (slug.find()) {
                        return "https://" + slug.group(1) + ".com";
                    }
                }
                return null;
            }
        }
        String[] parts = host.replaceFirst("^www\\.", "").split("\\.");
        String root = parts.length > 2
                ? parts[parts.length - 2] + "." + parts[parts.length - 1]
                : String.join(".", parts);
        return "https://" + root;
    }

    private static boolean mentionsName(WebSearchHit hit, String name) {
        String compactName = name.toLowerCase(Locale.ROOT).replace(" ", "").replace(".", "");
        String compactUrl = hit.url() == null ? "" : hit.url().toLowerCase(Locale.ROOT).replace(".", "");
        return compactUrl.contains(compactName)
                || hit.title().toLowerCase(Locale.ROOT).contains(name.toLowerCase(Locale.ROOT));
    }
}
