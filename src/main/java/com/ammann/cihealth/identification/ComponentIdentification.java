/* (C)2026 */
package com.ammann.cihealth.identification;

import com.ammann.cihealth.bug.Bug;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heuristic mapping of tests to bug tracker components for tests without a bug.
 *
 * <p>Operator health tests map through the operator table; every other test maps through
 * the {@code [sig-xxx]} tag in its name.
 */
public final class ComponentIdentification
{
    private ComponentIdentification() {}

    public static final String SIG_UNKNOWN = "sig-unknown";

    private static final Pattern SIG = Pattern.compile("\\[(sig-.*?)\\]");

    private static final Map<String, String> OPERATOR_TO_COMPONENT = Map.ofEntries(
            Map.entry("authentication", "apiserver-auth"),
            Map.entry("cloud-credential", "Cloud Credential Operator"),
            Map.entry("cluster-autoscaler", "Cloud Compute"),
            Map.entry("config-operator", "config-operator"),
            Map.entry("console", "Management Console"),
            Map.entry("csi-snapshot-controller", "Storage"),
            Map.entry("dns", "DNS"),
            Map.entry("etcd", "Etcd"),
            Map.entry("ingress", "Routing"),
            Map.entry("image-registry", "Image Registry"),
            Map.entry("insights", "Insights Operator"),
            Map.entry("kube-apiserver", "kube-apiserver"),
            Map.entry("kube-controller-manager", "kube-controller-manager"),
            Map.entry("kube-scheduler", "kube-scheduler"),
            Map.entry("kube-storage-version-migrator", "kube-storage-version-migrator"),
            Map.entry("machine-api", "Cloud Compute"),
            Map.entry("machine-approver", "Cloud Compute"),
            Map.entry("machine-config", "Machine Config Operator"),
            Map.entry("marketplace", "OLM"),
            Map.entry("monitoring", "Monitoring"),
            Map.entry("network", "Networking"),
            Map.entry("node-tuning", "Node Tuning Operator"),
            Map.entry("openshift-apiserver", "openshift-apiserver"),
            Map.entry("openshift-controller-manager", "openshift-controller-manager"),
            Map.entry("openshift-samples", "Samples"),
            Map.entry("operator-lifecycle-manager", "OLM"),
            Map.entry("operator-lifecycle-manager-catalog", "OLM"),
            Map.entry("operator-lifecycle-manager-packageserver", "OLM"),
            Map.entry("service-ca", "service-ca"),
            Map.entry("storage", "Storage"));

    private static final Map<String, String> SIG_TO_COMPONENT = Map.ofEntries(
            Map.entry("sig-cli", "oc"),
            Map.entry("sig-api-machinery", "kube-apiserver"),
            Map.entry("sig-apps", "kube-controller-manager"),
            Map.entry("sig-arch", Bug.UNKNOWN_COMPONENT),
            Map.entry("sig-auth", "apiserver-auth"),
            Map.entry("sig-builds", "Build"),
            Map.entry("sig-cluster-lifecycle", Bug.UNKNOWN_COMPONENT),
            Map.entry("sig-devex", "Build"),
            Map.entry("sig-imageregistry", "Image Registry"),
            Map.entry("sig-network", "Networking"),
            Map.entry("sig-node", "Node"),
            Map.entry("sig-operator", "OLM"),
            Map.entry("sig-storage", "Storage"),
            Map.entry(SIG_UNKNOWN, Bug.UNKNOWN_COMPONENT));

    public static String componentForOperator(String operator) {
        return OPERATOR_TO_COMPONENT.getOrDefault(operator, Bug.UNKNOWN_COMPONENT);
    }

    public static String componentForSig(String sig) {
        return SIG_TO_COMPONENT.getOrDefault(sig, Bug.UNKNOWN_COMPONENT);
    }

    /**
     * Returns the sig tag of a test name, e.g. {@code sig-network} for
     * {@code "[sig-network] pods should ..."}, or {@value #SIG_UNKNOWN} if there is none.
     */
    public static String findSig(String testName) {
        Matcher matcher = SIG.matcher(testName);
        return matcher.find() ? matcher.group(1) : SIG_UNKNOWN;
    }

    /**
     * Resolves the component of a test that has no bug.
     */
    public static String componentForTest(String testName) {
        String operator = TestIdentification.operatorFromInstallTest(testName);
        if (operator != null) {
            return componentForOperator(operator);
        }
        operator = TestIdentification.operatorFromUpgradeTest(testName);
        if (operator != null) {
            return componentForOperator(operator);
        }
        return componentForSig(findSig(testName));
    }
}
