package io.dataproc.serviceclient;

/** Names and tag keys of the metrics the service stubs report. */
public final class DataprocMetrics {

  /** Counter, one per call attempt. */
  public static final String REQUEST = "dataproc_request";

  /** Counter, one per attempt that closed with a non OK status, tagged by {@link #STATUS_CODE}. */
  public static final String REQUEST_FAILURE = "dataproc_request_failure";

  /** Timer, from the start of an attempt until its status is received. */
  public static final String REQUEST_LATENCY = "dataproc_request_latency";

  /** gRPC service, for example {@code dataproc.v1.ClusterController}. */
  public static final String SERVICE = "service";

  /** gRPC method without the service, for example {@code ListClusters}. */
  public static final String OPERATION = "operation";

  public static final String STATUS_CODE = "status_code";

  private DataprocMetrics() {}
}
