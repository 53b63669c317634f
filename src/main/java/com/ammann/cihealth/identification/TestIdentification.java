/* (C)2026 */
package com.ammann.cihealth.identification;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Name-based classification of tests: setup containers, operator install and upgrade
 * tests, curated tests and the synthetic tests injected by the raw data loader.
 */
public final class TestIdentification
{
    private TestIdentification() {}

    /** Synthetic test recording whether a run got past infrastructure setup. */
    public static final String INFRASTRUCTURE_TEST_NAME = "[sig-sippy] infrastructure should work";

    /** Synthetic test recording whether the cluster install succeeded. */
    public static final String INSTALL_TEST_NAME = "[sig-sippy] install should work";

    /** Synthetic test recording whether the cluster upgrade succeeded. */
    public static final String UPGRADE_TEST_NAME = "[sig-sippy] upgrade should work";

    /** Synthetic test recording whether the conformance suite passed. */
    public static final String OPENSHIFT_TESTS_NAME = "[sig-sippy] openshift-tests should work";

    /** Synthetic test recording whether every operator was healthy at the end of the run. */
    public static final String FINAL_OPERATOR_HEALTH_TEST_NAME =
            "[sig-sippy] tests should finish with healthy operators";

    /** Whole-job pseudo test reported by the test grid. */
    public static final String OVERALL_TEST_NAME = "Overall";

    public static final String OPERATOR_UPGRADE_PREFIX = "Cluster upgrade.Operator upgrade ";

    private static final Pattern OPERATOR_CONDITIONS_TEST =
            Pattern.compile("Operator results.*operator install (?<operator>.*)");

    private static final Set<String> CUSTOM_JOB_SETUP_CONTAINERS = Set.of(
            "e2e-44-stable-to-45-ci-ipi-install-install-stableinitial",
            "e2e-aws-hypershift-ipi-install",
            "e2e-aws-proxy-ipi-install-install",
            "e2e-aws-upgrade-ipi-install-install-stableinitial",
            "e2e-aws-upgrade-rollback-ipi-install-install-stableinitial",
            "e2e-aws-workers-rhel7-ipi-install-install",
            "e2e-azure-upgrade-ipi-conf-azure",
            "e2e-gcp-libvirt-cert-rotation-openshift-e2e-gcp-libvirt-cert-rotation-setup",
            "e2e-gcp-upgrade-ipi-install-install-stableinitial",
            "e2e-metal-assisted-baremetalds-assisted-setup",
            "e2e-metal-ipi-baremetalds-devscripts-setup",
            "e2e-metal-ipi-ovn-ipv6-baremetalds-devscripts-setup",
            "e2e-openstack-upgrade-ipi-install",
            "e2e-ovirt-ipi-install-install container test",
            "e2e-vsphere-ipi-install-vsphere",
            "e2e-vsphere-upi-upi-install-vsphere",
            "hypershift-launch-wait-for-nodes",
            "install-install container test",
            "install-stableinitial container test",
            "ipi-install-libvirt-install");

    // Tests worth watching individually, keyed by release.
    private static final Map<String, List<String>> CURATED_TEST_SUBSTRINGS = Map.of(
            "4.9", List.of(
                    "Kubernetes APIs remain available",
                    "OAuth APIs remain available",
                    "OpenShift APIs remain available",
                    "Cluster frontend ingress remain available"));

    /**
     * Whether the test only reports that the job's environment came up, rather than testing
     * the product.
     */
    public static boolean isSetupContainerEquivalent(String testName) {
        for (String setup : CUSTOM_JOB_SETUP_CONTAINERS) {
            if (testName.contains(setup)) {
                return true;
            }
        }
        // kube uses "Up" to mean the installation worked
        return testName.endsWith("container setup")
                || testName.equals("Up")
                || testName.endsWith("create-cluster");
    }

    public static boolean isCuratedTest(String release, String testName) {
        for (String substring : CURATED_TEST_SUBSTRINGS.getOrDefault(release, List.of())) {
            if (testName.contains(substring)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Extracts the operator from an operator install test.
     *
     * @return the operator name, or {@code null} if the test is not an operator install test
     */
    public static String operatorFromInstallTest(String testName) {
        Matcher matcher = OPERATOR_CONDITIONS_TEST.matcher(testName);
        return matcher.find() ? matcher.group("operator") : null;
    }

    /**
     * Extracts the operator from an operator upgrade test.
     *
     * @return the operator name, or {@code null} if the test is not an operator upgrade test
     */
    public static String operatorFromUpgradeTest(String testName) {
        return testName.startsWith(OPERATOR_UPGRADE_PREFIX)
                ? testName.substring(OPERATOR_UPGRADE_PREFIX.length())
                : null;
    }
}
