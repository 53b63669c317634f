/* (C)2026 */
package com.ammann.cihealth.bug;

import java.util.List;

/**
 * Read access to bugs already fetched from the bug tracker.
 *
 * <p>Implementations must be safe to call once per test and release. An empty list means
 * no known bug; the report treats such failures as not yet attributed.
 */
public interface BugCache
{
    /**
     * Lists bugs for a test that apply to the given release.
     *
     * @param release  release the bugs must target
     * @param jobName  optional job name hint, empty for test lookups
     * @param testName test name, empty for job lookups
     * @return matching bugs, never {@code null}
     */
    List<Bug> listBugs(String release, String jobName, String testName);

    /**
     * Lists bugs that match the test or job but target a different release.
     */
    List<Bug> listAssociatedBugs(String release, String jobName, String testName);
}
