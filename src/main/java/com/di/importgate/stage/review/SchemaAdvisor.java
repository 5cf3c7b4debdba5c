package com.di.importgate.stage.review;

import java.util.List;

/**
 * Reviews a mapping file (and its data table and metadata) for problems the
 * deterministic checks cannot see.
 *
 * <p>Implementations throw {@link com.di.importgate.exception.AdvisorUnavailableException}
 * when they cannot produce a review; an empty list means the advisor found nothing.
 */
public interface SchemaAdvisor {

    /** Registry key, matched against {@code importgate.review.advisor.type}. */
    String type();

    List<AdvisorFinding> review(ReviewRequest request);
}
