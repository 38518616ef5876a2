package com.talent.sourcing.query;

/**
 * Field names of the person index and backend limits used by {@link QueryCompiler}.
 *
 * @param experiencePath   nested path of work-history entries
 * @param entityIdField    organization id field inside a work-history entry
 * @param titleField       job title field inside a work-history entry
 * @param locationField    top-level location field of a person
 * @param maxTermsPerGroup ids per membership clause before splitting into grouped blocks
 */
public record CompilerOptions(String experiencePath, String entityIdField, String titleField,
                              String locationField, int maxTermsPerGroup) {

    public CompilerOptions {
        requireText(experiencePath, "experiencePath");
        requireText(entityIdField, "entityIdField");
        requireText(titleField, "titleField");
        requireText(locationField, "locationField");
        if (maxTermsPerGroup < 1) {
            throw new IllegalArgumentException("maxTermsPerGroup must be >= 1");
        }
    }

    public static CompilerOptions defaults() {
        return new CompilerOptions("experience", "experience.company_id", "experience.title", "location", 100);
    }

    public CompilerOptions withMaxTermsPerGroup(int maxTermsPerGroup) {
        return new CompilerOptions(experiencePath, entityIdField, titleField, locationField, maxTermsPerGroup);
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }
}
