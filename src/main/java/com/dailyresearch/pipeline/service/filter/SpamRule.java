package com.dailyresearch.pipeline.service.filter;

import com.dailyresearch.pipeline.model.ContentItem;

import java.util.Optional;

/**
 * One independently togglable spam pattern family.
 *
 * <p>Rules are stateless and must not modify the item. A rule votes by
 * returning a reason; an empty result means the rule found nothing.
 *
 * @see SpamFilter
 */
public interface SpamRule {

    /** Short identifier used in drop reasons and logs. */
    String name();

    /** Whether the family is switched on in the current configuration. */
    boolean isEnabled();

    /**
     * Checks the item against this family.
     *
     * @param item the candidate, not yet scored
     * @return a human-readable reason when the item looks like spam
     */
    Optional<String> check(ContentItem item);
}
