package io.dataproc.client;

import io.dataproc.internal.client.PathTemplate;
import java.util.Map;

/**
 * Builds and parses Dataproc resource names. The {@code parse} methods return the path variables
 * keyed by name, or an empty map if the path doesn't have the expected shape.
 */
public final class ResourceNames {
  private static final PathTemplate CLUSTER =
      PathTemplate.of("projects/{project}/locations/{location}/clusters/{cluster}");
  private static final PathTemplate WORKFLOW_TEMPLATE =
      PathTemplate.of("projects/{project}/regions/{region}/workflowTemplates/{workflow_template}");
  private static final PathTemplate REGION = PathTemplate.of("projects/{project}/regions/{region}");
  private static final PathTemplate BILLING_ACCOUNT =
      PathTemplate.of("billingAccounts/{billing_account}");
  private static final PathTemplate FOLDER = PathTemplate.of("folders/{folder}");
  private static final PathTemplate ORGANIZATION = PathTemplate.of("organizations/{organization}");
  private static final PathTemplate PROJECT = PathTemplate.of("projects/{project}");
  private static final PathTemplate LOCATION =
      PathTemplate.of("projects/{project}/locations/{location}");

  private ResourceNames() {}

  public static String clusterPath(String project, String location, String cluster) {
    return CLUSTER.instantiate(project, location, cluster);
  }

  /** @return {@code project}, {@code location} and {@code cluster} */
  public static Map<String, String> parseClusterPath(String path) {
    return CLUSTER.match(path);
  }

  public static String workflowTemplatePath(
      String project, String region, String workflowTemplate) {
    return WORKFLOW_TEMPLATE.instantiate(project, region, workflowTemplate);
  }

  /** @return {@code project}, {@code region} and {@code workflow_template} */
  public static Map<String, String> parseWorkflowTemplatePath(String path) {
    return WORKFLOW_TEMPLATE.match(path);
  }

  /** Parent of the workflow templates of a region, as taken by {@code ListWorkflowTemplates}. */
  public static String regionPath(String project, String region) {
    return REGION.instantiate(project, region);
  }

  public static Map<String, String> parseRegionPath(String path) {
    return REGION.match(path);
  }

  public static String commonBillingAccountPath(String billingAccount) {
    return BILLING_ACCOUNT.instantiate(billingAccount);
  }

  public static Map<String, String> parseCommonBillingAccountPath(String path) {
    return BILLING_ACCOUNT.match(path);
  }

  public static String commonFolderPath(String folder) {
    return FOLDER.instantiate(folder);
  }

  public static Map<String, String> parseCommonFolderPath(String path) {
    return FOLDER.match(path);
  }

  public static String commonOrganizationPath(String organization) {
    return ORGANIZATION.instantiate(organization);
  }

  public static Map<String, String> parseCommonOrganizationPath(String path) {
    return ORGANIZATION.match(path);
  }

  public static String commonProjectPath(String project) {
    return PROJECT.instantiate(project);
  }

  public static Map<String, String> parseCommonProjectPath(String path) {
    return PROJECT.match(path);
  }

  public static String commonLocationPath(String project, String location) {
    return LOCATION.instantiate(project, location);
  }

  public static Map<String, String> parseCommonLocationPath(String path) {
    return LOCATION.match(path);
  }
}
