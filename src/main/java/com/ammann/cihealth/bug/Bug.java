/* (C)2026 */
package com.ammann.cihealth.bug;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Bug tracker entry associated with a test.
 *
 * @param id         tracker id
 * @param key        human readable key, if the tracker has one
 * @param summary    bug title
 * @param status     tracker status (e.g. NEW, ASSIGNED)
 * @param components tracker components; the first one owns the bug
 * @param url        link to the bug, used as its identity in summaries; never null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Bug(
        long id,
        String key,
        String summary,
        String status,
        List<String> components,
        String url
) {
    /** Component used when a bug carries no component. */
    public static final String UNKNOWN_COMPONENT = "Unknown";

    public Bug {
        components = components == null ? List.of() : List.copyOf(components);
        url = url == null ? "" : url;
    }

    /**
     * Returns the owning component of this bug.
     *
     * @return first component, or {@value #UNKNOWN_COMPONENT} if none is set
     */
    public String primaryComponent() {
        return components.isEmpty() ? UNKNOWN_COMPONENT : components.get(0);
    }
}
