/* (C)2026 */
package com.ammann.cihealth.identification;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;
import org.jboss.logging.Logger;

/**
 * Classifies jobs by the infrastructure platform they run on.
 *
 * <p>Platform patterns require a trailing dash, so they are stricter than the variant
 * patterns. Never-stable decisions of the wrapped variant manager are honored in addition
 * to the platform's own list. Not a CDI bean; the report service creates one per report.
 */
public class PlatformVariantManager implements VariantManager
{
    private static final Logger LOG = Logger.getLogger(PlatformVariantManager.class);

    static final String UNKNOWN_PLATFORM = "unknown platform";

    private static final Pattern AWS = Pattern.compile("(?i)-aws-");
    private static final Pattern AZURE = Pattern.compile("(?i)-azure-");
    private static final Pattern FIPS = Pattern.compile("(?i)-fips-");
    private static final Pattern METAL = Pattern.compile("(?i)-metal-");
    private static final Pattern METAL_IPI = Pattern.compile("(?i)-metal-ipi");
    private static final Pattern GCP = Pattern.compile("(?i)-gcp-");
    private static final Pattern OPENSTACK = Pattern.compile("(?i)-openstack-");
    private static final Pattern OVIRT = Pattern.compile("(?i)-ovirt-");
    private static final Pattern OVN = Pattern.compile("(?i)-ovn-");
    private static final Pattern PROXY = Pattern.compile("(?i)-proxy");
    private static final Pattern PROMOTE_JOB = Pattern.compile("(?i)^promote-");
    private static final Pattern PPC64LE = Pattern.compile("(?i)-ppc64le-");
    private static final Pattern REALTIME = Pattern.compile("(?i)-rt-");
    private static final Pattern S390X = Pattern.compile("(?i)-s390x-");
    private static final Pattern SERIAL = Pattern.compile("(?i)-serial-");
    private static final Pattern UPGRADE = Pattern.compile("(?i)-upgrade-");
    private static final Pattern VSPHERE = Pattern.compile("(?i)-vsphere");
    private static final Pattern VSPHERE_UPI = Pattern.compile("(?i)-vsphere-upi");

    private static final SortedSet<String> ALL_PLATFORMS = Collections.unmodifiableSortedSet(new TreeSet<>(Set.of(
            "aws",
            "azure",
            "fips",
            "gcp",
            "metal-upi",
            "metal-ipi",
            NEVER_STABLE,
            "openstack",
            "ovirt",
            "ovn",
            "ppc64le",
            PROMOTE,
            "proxy",
            "realtime",
            "s390x",
            "serial",
            "upgrade",
            "vsphere-ipi",
            "vsphere-upi")));

    private static final Set<String> NEVER_STABLE_JOBS = Set.of(
            "release-openshift-ocp-installer-e2e-ovirt-upgrade-4.5-stable-to-4.6-ci",
            "release-openshift-origin-installer-e2e-aws-upgrade-rollback-4.5-to-4.6",
            "release-openshift-origin-installer-e2e-aws-disruptive-4.6");

    private final VariantManager delegate;

    public PlatformVariantManager(VariantManager delegate) {
        this.delegate = delegate;
    }

    @Override
    public SortedSet<String> allVariants() {
        return ALL_PLATFORMS;
    }

    @Override
    public boolean isJobNeverStable(String jobName) {
        return NEVER_STABLE_JOBS.contains(jobName)
                || (delegate != null && delegate.isJobNeverStable(jobName));
    }

    @Override
    public List<String> identifyVariants(String jobName) {
        if (isJobNeverStable(jobName)) {
            return List.of(NEVER_STABLE);
        }
        if (PROMOTE_JOB.matcher(jobName).find()) {
            return List.of(PROMOTE);
        }

        List<String> platforms = new ArrayList<>();
        OpenshiftVariantManager.addIfMatches(platforms, AWS, jobName, "aws");
        OpenshiftVariantManager.addIfMatches(platforms, AZURE, jobName, "azure");
        OpenshiftVariantManager.addIfMatches(platforms, GCP, jobName, "gcp");
        OpenshiftVariantManager.addIfMatches(platforms, OPENSTACK, jobName, "openstack");

        if (METAL_IPI.matcher(jobName).find()) {
            platforms.add("metal-ipi");
        } else if (METAL.matcher(jobName).find()) {
            platforms.add("metal-upi");
        }

        OpenshiftVariantManager.addIfMatches(platforms, OVIRT, jobName, "ovirt");
        if (VSPHERE_UPI.matcher(jobName).find()) {
            platforms.add("vsphere-upi");
        } else if (VSPHERE.matcher(jobName).find()) {
            platforms.add("vsphere-ipi");
        }

        OpenshiftVariantManager.addIfMatches(platforms, UPGRADE, jobName, "upgrade");
        OpenshiftVariantManager.addIfMatches(platforms, SERIAL, jobName, "serial");
        OpenshiftVariantManager.addIfMatches(platforms, OVN, jobName, "ovn");
        OpenshiftVariantManager.addIfMatches(platforms, FIPS, jobName, "fips");
        OpenshiftVariantManager.addIfMatches(platforms, PPC64LE, jobName, "ppc64le");
        OpenshiftVariantManager.addIfMatches(platforms, S390X, jobName, "s390x");
        OpenshiftVariantManager.addIfMatches(platforms, REALTIME, jobName, "realtime");
        OpenshiftVariantManager.addIfMatches(platforms, PROXY, jobName, "proxy");

        if (platforms.isEmpty()) {
            LOG.debugf("Unknown platform for job: %s", jobName);
            return List.of(UNKNOWN_PLATFORM);
        }
        return List.copyOf(platforms);
    }
}
