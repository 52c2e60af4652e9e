package io.dataproc.client;

import io.dataproc.api.v1.DeleteWorkflowTemplateRequest;
import io.dataproc.api.v1.GetWorkflowTemplateRequest;
import io.dataproc.api.v1.ListWorkflowTemplatesRequest;
import io.dataproc.api.v1.WorkflowTemplate;
import io.dataproc.client.paging.ListWorkflowTemplatesAsyncPager;
import io.dataproc.client.paging.ListWorkflowTemplatesPager;
import io.dataproc.serviceclient.WorkflowTemplateServiceStubs;
import java.util.concurrent.CompletableFuture;

/**
 * Client of the {@code WorkflowTemplateService}. Template names have the shape built by {@link
 * ResourceNames#workflowTemplatePath}, list parents the shape built by {@link
 * ResourceNames#regionPath}.
 */
public interface WorkflowTemplateServiceClient {

  static WorkflowTemplateServiceClient newInstance(WorkflowTemplateServiceStubs stubs) {
    return newInstance(stubs, DataprocClientOptions.getDefaultInstance());
  }

  static WorkflowTemplateServiceClient newInstance(
      WorkflowTemplateServiceStubs stubs, DataprocClientOptions options) {
    return new WorkflowTemplateServiceClientImpl(stubs, options);
  }

  WorkflowTemplateServiceStubs getServiceStubs();

  DataprocClientOptions getOptions();

  WorkflowTemplate getWorkflowTemplate(GetWorkflowTemplateRequest request);

  /** Latest version of the template. */
  WorkflowTemplate getWorkflowTemplate(String name);

  ListWorkflowTemplatesPager listWorkflowTemplates(ListWorkflowTemplatesRequest request);

  ListWorkflowTemplatesPager listWorkflowTemplates(String parent);

  void deleteWorkflowTemplate(DeleteWorkflowTemplateRequest request);

  void deleteWorkflowTemplate(String name);

  CompletableFuture<WorkflowTemplate> getWorkflowTemplateAsync(GetWorkflowTemplateRequest request);

  CompletableFuture<ListWorkflowTemplatesAsyncPager> listWorkflowTemplatesAsync(
      ListWorkflowTemplatesRequest request);

  CompletableFuture<Void> deleteWorkflowTemplateAsync(DeleteWorkflowTemplateRequest request);
}
