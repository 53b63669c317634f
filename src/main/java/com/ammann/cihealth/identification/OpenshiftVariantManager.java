/* (C)2026 */
package com.ammann.cihealth.identification;

import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;
import org.jboss.logging.Logger;

/**
 * Variant classification of OpenShift release jobs based on job name patterns.
 *
 * <p>Never-stable, tech preview and promotion jobs are classified exclusively and never
 * contribute to any other variant.
 */
@ApplicationScoped
public class OpenshiftVariantManager implements VariantManager
{
    private static final Logger LOG = Logger.getLogger(OpenshiftVariantManager.class);

    static final String UNKNOWN_VARIANT = "unknown variant";

    private static final Pattern ARM64 = Pattern.compile("(?i)-arm64");
    private static final Pattern ASSISTED = Pattern.compile("(?i)-assisted");
    private static final Pattern AWS = Pattern.compile("(?i)-aws");
    private static final Pattern AZURE = Pattern.compile("(?i)-azure");
    private static final Pattern COMPACT = Pattern.compile("(?i)-compact");
    private static final Pattern FIPS = Pattern.compile("(?i)-fips");
    private static final Pattern METAL = Pattern.compile("(?i)-metal");
    // metal-assisted and metal-ipi jobs do not carry a trailing version segment
    private static final Pattern METAL_ASSISTED = Pattern.compile("(?i)-metal-assisted");
    private static final Pattern METAL_IPI = Pattern.compile("(?i)-metal-ipi");
    private static final Pattern GCP = Pattern.compile("(?i)-gcp");
    private static final Pattern OPENSTACK = Pattern.compile("(?i)-openstack");
    private static final Pattern OSD = Pattern.compile("(?i)-osd");
    private static final Pattern OVIRT = Pattern.compile("(?i)-ovirt");
    private static final Pattern OVN = Pattern.compile("(?i)-ovn");
    private static final Pattern PROXY = Pattern.compile("(?i)-proxy");
    private static final Pattern PROMOTE_JOB = Pattern.compile("(?i)^promote-");
    private static final Pattern PPC64LE = Pattern.compile("(?i)-ppc64le");
    private static final Pattern REALTIME = Pattern.compile("(?i)-rt");
    private static final Pattern S390X = Pattern.compile("(?i)-s390x");
    private static final Pattern SERIAL = Pattern.compile("(?i)-serial");
    private static final Pattern TECH_PREVIEW_JOB = Pattern.compile("(?i)-techpreview");
    private static final Pattern UPGRADE = Pattern.compile("(?i)-upgrade");
    private static final Pattern VSPHERE = Pattern.compile("(?i)-vsphere");
    private static final Pattern VSPHERE_UPI = Pattern.compile("(?i)-vsphere-upi");
    private static final Pattern SINGLE_NODE = Pattern.compile("(?i)-single-node");

    private static final SortedSet<String> ALL_VARIANTS = Collections.unmodifiableSortedSet(new TreeSet<>(Set.of(
            "arm64",
            "assisted",
            "aws",
            "azure",
            "compact",
            "fips",
            "gcp",
            "metal-assisted",
            "metal-upi",
            "metal-ipi",
            NEVER_STABLE,
            "openstack",
            "osd",
            "ovirt",
            "ovn",
            "ppc64le",
            PROMOTE,
            "proxy",
            "realtime",
            "s390x",
            "serial",
            TECH_PREVIEW,
            "upgrade",
            "vsphere-ipi",
            "vsphere-upi",
            "single-node")));

    /**
     * Unproven new jobs and jobs that are near permafail for an extended period. They stay in
     * the job and test lists but are excluded from the regular variants.
     */
    private static final Set<String> NEVER_STABLE_JOBS = Set.of(
            "periodic-ci-openshift-release-master-nightly-4.10-e2e-azurestack-csi",
            "periodic-ci-openshift-release-master-nightly-4.11-e2e-azurestack-csi",
            "periodic-ci-openshift-release-master-ci-4.11-upgrade-from-stable-4.10-e2e-aws-upgrade-infra",
            "periodic-ci-openshift-release-master-ci-4.11-upgrade-from-stable-4.10-e2e-azure-ovn-upgrade",
            "periodic-ci-openshift-release-master-nightly-4.10-e2e-telco5g",
            "periodic-ci-openshift-release-master-nightly-4.11-e2e-telco5g",
            "periodic-ci-openshift-release-master-ci-4.10-e2e-aws-upgrade-single-node",
            "periodic-ci-openshift-release-master-ci-4.10-e2e-azure-upgrade-single-node",
            "periodic-ci-openshift-release-master-nightly-4.10-e2e-aws-single-node",
            "periodic-ci-openshift-release-master-nightly-4.10-e2e-aws-single-node-serial",
            "periodic-ci-openshift-release-master-nightly-4.9-e2e-aws-fips-serial",
            "periodic-ci-openshift-release-master-nightly-4.9-e2e-metal-ipi-compact",
            "periodic-ci-openshift-release-master-nightly-4.9-e2e-openstack-proxy",
            "periodic-ci-openshift-release-master-nightly-4.9-e2e-aws-workers-rhel7",
            "periodic-ci-openshift-release-master-ci-4.9-e2e-aws-calico",
            "periodic-ci-openshift-release-master-ci-4.9-e2e-azure-cilium",
            "periodic-ci-openshift-release-master-ci-4.9-e2e-gcp-cilium",
            "periodic-ci-openshift-release-master-ci-4.9-e2e-aws-network-stress",
            "periodic-ci-openshift-release-master-ci-4.9-e2e-aws-ovn-network-stress",
            "release-openshift-origin-installer-e2e-aws-disruptive-4.9",
            "release-openshift-origin-installer-e2e-aws-disruptive-4.10",
            "release-openshift-ocp-installer-e2e-ovirt-upgrade-4.5-stable-to-4.6-ci",
            "release-openshift-origin-installer-e2e-aws-upgrade-rollback-4.5-to-4.6",
            "release-openshift-origin-installer-e2e-aws-disruptive-4.6");

    @Override
    public SortedSet<String> allVariants() {
        return ALL_VARIANTS;
    }

    @Override
    public boolean isJobNeverStable(String jobName) {
        return NEVER_STABLE_JOBS.contains(jobName);
    }

    @Override
    public List<String> identifyVariants(String jobName) {
        if (isJobNeverStable(jobName)) {
            return List.of(NEVER_STABLE);
        }
        if (TECH_PREVIEW_JOB.matcher(jobName).find()) {
            return List.of(TECH_PREVIEW);
        }
        if (PROMOTE_JOB.matcher(jobName).find()) {
            return List.of(PROMOTE);
        }

        List<String> variants = new ArrayList<>();
        addIfMatches(variants, ARM64, jobName, "arm64");
        addIfMatches(variants, ASSISTED, jobName, "assisted");
        addIfMatches(variants, AWS, jobName, "aws");
        addIfMatches(variants, AZURE, jobName, "azure");
        addIfMatches(variants, COMPACT, jobName, "compact");
        addIfMatches(variants, GCP, jobName, "gcp");
        addIfMatches(variants, OPENSTACK, jobName, "openstack");
        addIfMatches(variants, OSD, jobName, "osd");

        if (METAL_ASSISTED.matcher(jobName).find()) {
            variants.add("metal-assisted");
        } else if (METAL_IPI.matcher(jobName).find()) {
            variants.add("metal-ipi");
        } else if (METAL.matcher(jobName).find()) {
            variants.add("metal-upi");
        }

        addIfMatches(variants, OVIRT, jobName, "ovirt");
        if (VSPHERE_UPI.matcher(jobName).find()) {
            variants.add("vsphere-upi");
        } else if (VSPHERE.matcher(jobName).find()) {
            variants.add("vsphere-ipi");
        }

        addIfMatches(variants, UPGRADE, jobName, "upgrade");
        addIfMatches(variants, SERIAL, jobName, "serial");
        addIfMatches(variants, OVN, jobName, "ovn");
        addIfMatches(variants, FIPS, jobName, "fips");
        addIfMatches(variants, PPC64LE, jobName, "ppc64le");
        addIfMatches(variants, S390X, jobName, "s390x");
        addIfMatches(variants, REALTIME, jobName, "realtime");
        addIfMatches(variants, PROXY, jobName, "proxy");
        addIfMatches(variants, SINGLE_NODE, jobName, "single-node");

        if (variants.isEmpty()) {
            LOG.debugf("Unknown variant for job: %s", jobName);
            return List.of(UNKNOWN_VARIANT);
        }
        return List.copyOf(variants);
    }

    static void addIfMatches(List<String> target, Pattern pattern, String jobName, String variant) {
        if (pattern.matcher(jobName).find()) {
            target.add(variant);
        }
    }
}
