package dev.brainlift.api;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Body of {@code POST /api/research/sessions}.
 *
 * @param documentId document the research is for
 * @param purpose the document's purpose statement
 * @param categories category keys or names; empty or absent means all categories
 * @param requirements source requirements; absent means the defaults
 */
public record StartSessionRequest(
    String documentId,
    String purpose,
    @Nullable List<String> categories,
    @Nullable RequirementsRequest requirements) {}
