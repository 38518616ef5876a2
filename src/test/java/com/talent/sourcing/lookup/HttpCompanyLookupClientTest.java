package com.talent.sourcing.lookup;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.talent.sourcing.core.model.EntityMetadata;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("HttpCompanyLookupClient Tests")
class HttpCompanyLookupClientTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpCompanyLookupClient client = HttpCompanyLookupClient.builder()
            .baseUrl("https://api.example-data.com/")
            .apiKey("secret")
            .maxHits(3)
            .build();

    @Nested
    @DisplayName("Query building")
    class QueryBuilding {

        @Test
        @DisplayName("Should use a phrase match on the exact tier")
        void exactTierUsesPhraseMatch() {
            ObjectNode query = client.buildQuery(new LookupRequest(" Acme Corp ", null), LookupTier.EXACT_NAME);

            assertEquals(3, query.path("size").asInt());
            assertEquals("Acme Corp", query.path("query").path("match_phrase").path("name").asText());
        }

        @Test
        @DisplayName("Should match on domain on the website tier")
        void websiteTierMatchesOnDomain() {
            ObjectNode query = client.buildQuery(
                    new LookupRequest("Acme", "https://www.acme.com/about"), LookupTier.WEBSITE);

            assertEquals("acme.com", query.path("query").path("match").path("website").asText());
        }

        @Test
        @DisplayName("Should enable fuzziness on the fuzzy tier")
        void fuzzyTierEnablesFuzziness() {
            ObjectNode query = client.buildQuery(LookupRequest.of("Acme"), LookupTier.FUZZY_NAME);

            JsonNode name = query.path("query").path("match").path("name");
            assertEquals("Acme", name.path("query").asText());
            assertEquals("AUTO", name.path("fuzziness").asText());
        }

        @Test
        @DisplayName("Should skip the website tier without a hint")
        void websiteTierIsSkippedWithoutHint() {
            assertEquals(Optional.empty(), client.lookup(LookupRequest.of("Acme"), LookupTier.WEBSITE));
        }
    }

    @ParameterizedTest
    @CsvSource({
            "https://www.acme.com/about, acme.com",
            "HTTP://Acme.io, acme.io",
            "acme.de, acme.de",
            "www.acme.co.uk/, acme.co.uk"
    })
    void domainOfStripsSchemeAndPath(String website, String expected) {
        assertEquals(expected, HttpCompanyLookupClient.domainOf(website));
    }

    @Nested
    @DisplayName("Match selection")
    class Selection {

        @Test
        @DisplayName("Should pick the highest confidence above the threshold")
        void picksHighestConfidenceAboveThreshold() {
            List<CompanyRecordParser.CompanyHit> hits = List.of(
                    new CompanyRecordParser.CompanyHit("c-2", "Acme Widgets", 9.0, EntityMetadata.empty()),
                    new CompanyRecordParser.CompanyHit("c-1", "Acme Corporation", 5.0,
                            EntityMetadata.ofWebsite("acme.com")));

            Optional<LookupMatch> match = client.selectBest("Acme Corp", LookupTier.EXACT_NAME, hits);

            assertTrue(match.isPresent());
            assertEquals("c-1", match.get().stableId());
            assertEquals(0.85, match.get().confidence(), 1e-9);
            assertEquals(LookupTier.EXACT_NAME, match.get().tier());
            assertEquals("acme.com", match.get().metadata().website());
        }

        @Test
        @DisplayName("Should return no match when everything is below the threshold")
        void noMatchWhenEverythingBelowThreshold() {
            List<CompanyRecordParser.CompanyHit> hits = List.of(
                    new CompanyRecordParser.CompanyHit("c-9", "Globex", 10.0, EntityMetadata.empty()));

            assertTrue(client.selectBest("Acme", LookupTier.FUZZY_NAME, hits).isEmpty());
        }
    }

    @Nested
    @DisplayName("Record parsing")
    class Parsing {

        @Test
        @DisplayName("Should parse a search envelope")
        void parsesSearchEnvelope() throws Exception {
            JsonNode body = mapper.readTree("""
                    {"hits": {"hits": [
                      {"_id": "c-1", "_score": 7.5, "_source": {"name": "Acme Corp", "industry": "Software",
                        "size_range": "51-200", "hq_country": "Germany", "website": "acme.com"}},
                      {"_id": "c-2", "_source": {"industry": "no name"}}
                    ]}}
                    """);

            List<CompanyRecordParser.CompanyHit> hits = CompanyRecordParser.parseHits(body);

            assertEquals(1, hits.size());
            CompanyRecordParser.CompanyHit hit = hits.get(0);
            assertEquals("c-1", hit.id());
            assertEquals(7.5, hit.score());
            assertEquals(new EntityMetadata("Software", "51-200", "Germany", "acme.com"), hit.metadata());
        }

        @Test
        @DisplayName("Should parse a bare array with numeric ids")
        void parsesBareArrayWithNumericIds() throws Exception {
            JsonNode body = mapper.readTree("""
                    [{"id": 42, "company_name": "Globex", "employees_count": 120}]
                    """);

            List<CompanyRecordParser.CompanyHit> hits = CompanyRecordParser.parseHits(body);

            assertEquals(1, hits.size());
            assertEquals("42", hits.get(0).id());
            assertEquals("Globex", hits.get(0).name());
            assertEquals("120", hits.get(0).metadata().size());
            assertEquals(0.0, hits.get(0).score());
        }

        @Test
        @DisplayName("Should yield no hits for unexpected shapes")
        void unexpectedShapesYieldNoHits() throws Exception {
            assertTrue(CompanyRecordParser.parseHits(mapper.readTree("{\"status\": \"ok\"}")).isEmpty());
            assertTrue(CompanyRecordParser.parseHits(null).isEmpty());
        }

        @Test
        @DisplayName("Should read profile metadata from fallback fields")
        void profileMetadataUsesFallbackFields() throws Exception {
            ProfilePayload payload = new ProfilePayload("c-1", mapper.readTree("""
                    {"name": "Acme", "domain": "acme.com", "location": "  ", "hq_location": "Berlin"}
                    """));

            EntityMetadata metadata = payload.toMetadata();

            assertEquals("acme.com", metadata.website());
            assertEquals("Berlin", metadata.location());
            assertNull(metadata.industry());
        }
    }

    @Test
    @DisplayName("Should compare normalized keys for similarity")
    void similarityUsesNormalizedKeys() {
        NameSimilarity similarity = new NameSimilarity(com.talent.sourcing.rules.NameNormalizer.withDefaultRules());

        assertEquals(1.0, similarity.compute("Acme Corp", "ACME, Inc."));
        assertEquals(0.0, similarity.compute("Acme", "Inc."));
        assertEquals(0.75, NameSimilarity.ratio("abcd", "abce"), 1e-9);
    }

    @Test
    @DisplayName("Should weight name similarity over the backend score")
    void confidenceWeightsNameOverBackendScore() {
        assertEquals(1.0, MatchConfidence.combine(1.0, 25.0), 1e-9);
        assertEquals(0.7, MatchConfidence.combine(1.0, 0.0), 1e-9);
        assertEquals(0.3, MatchConfidence.combine(0.0, 10.0), 1e-9);
    }
}
