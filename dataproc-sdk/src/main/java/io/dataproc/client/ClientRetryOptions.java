package io.dataproc.client;

import io.dataproc.serviceclient.RpcRetryOptions;
import io.dataproc.serviceclient.ServiceStubs;

final class ClientRetryOptions {
  private ClientRetryOptions() {}

  /** Retry options of the client if set, otherwise those of the stubs. */
  static RpcRetryOptions resolve(DataprocClientOptions options, ServiceStubs<?, ?> stubs) {
    RpcRetryOptions rpcRetryOptions = options.getRpcRetryOptions();
    return rpcRetryOptions != null ? rpcRetryOptions : stubs.getOptions().getRpcRetryOptions();
  }
}
