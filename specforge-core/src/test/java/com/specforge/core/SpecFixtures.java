package com.specforge.core;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Specification documents shared by tests.
 *
 * <p>{@link #AGENT_READY_MODERATE} passes every gate that applies to MODERATE complexity at
 * maturity 3. The other fixtures each break one thing.
 *
 * @since 1.0.0
 */
public final class SpecFixtures {

    public static final String AGENT_READY_MODERATE = """
        ---
        specmas: v3
        kind: FeatureSpec
        id: feat-order-export
        name: Order Export
        complexity: MODERATE
        maturity: 3
        ---

        # Overview

        Lets administrators download completed orders as a CSV file.
        Success metric: an export of 10000 orders finishes within 5 seconds.

        ## Functional Requirements

        ### FR-1: Export orders
        Administrators download completed orders as a CSV file.

        Validation Criteria:
        - The CSV has one row per completed order
        - Columns appear in the documented order

        ### FR-2: Filter by date
        Exports can be limited to a date range.

        Validation Criteria:
        - Orders outside the range are excluded

        ## Non-Functional Requirements

        - An export of 10000 orders completes within 5 seconds

        ## Security

        Authentication is required for every export request.
        Authorization is limited to the admin role with the export permission.

        ## User Stories

        - As an administrator, I want to export orders so that finance can reconcile payments.

        ## Acceptance Criteria

        - AC-1: Given completed orders exist, when the administrator exports, then the CSV lists each order (FR-1)
        - AC-2: Given a date range, when the administrator exports, then only orders in the range appear (FR-2)
        """;

    /** HIGH complexity declared at maturity 3: below the HIGH minimum of 5. */
    public static final String HIGH_AT_MATURITY_THREE = AGENT_READY_MODERATE
        .replace("complexity: MODERATE", "complexity: HIGH");

    /** Front matter without a name and with an out-of-range maturity. */
    public static final String BROKEN_FRONT_MATTER = """
        ---
        specmas: v3
        kind: FeatureSpec
        id: feat-broken
        complexity: MODERATE
        maturity: 9
        ---

        # Overview

        A document whose front matter lacks a name and declares a maturity outside one to five.
        """;

    private SpecFixtures() {
        // Utility class
    }

    /**
     * Writes a fixture to a file.
     *
     * @param dir target directory
     * @param fileName file name
     * @param content document text
     * @return written file
     * @throws IOException if the file cannot be written
     */
    public static Path write(Path dir, String fileName, String content) throws IOException {
        Path file = dir.resolve(fileName);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }
}
