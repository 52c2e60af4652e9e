package io.dataproc.client;

import static org.junit.Assert.*;

import io.dataproc.serviceclient.RpcRetryOptions;
import java.time.Duration;
import org.junit.Test;

public class DataprocClientOptionsTest {

  @Test
  public void testDefaults() {
    DataprocClientOptions options = DataprocClientOptions.getDefaultInstance();

    assertNull(options.getQuotaProjectId());
    assertNull(options.getRpcRetryOptions());
    assertNotNull(options.getIdentity());
    assertFalse(options.getIdentity().isEmpty());
  }

  @Test
  public void testUnsetRetryFieldsKeepDefaults() {
    DataprocClientOptions options =
        DataprocClientOptions.newBuilder()
            .setRpcRetryOptions(RpcRetryOptions.newBuilder().setMaxAttempts(3).build())
            .validateAndBuildWithDefaults();

    RpcRetryOptions retry = options.getRpcRetryOptions();
    assertEquals(3, retry.getMaxAttempts());
    assertEquals(RpcRetryOptions.DEFAULT_INITIAL_RETRY_DELAY, retry.getInitialRetryDelay());
  }

  @Test
  public void testToBuilderCopies() {
    DataprocClientOptions options =
        DataprocClientOptions.newBuilder()
            .setQuotaProjectId("billing")
            .setIdentity("me")
            .setRpcRetryOptions(
                RpcRetryOptions.newBuilder().setTotalTimeout(Duration.ofSeconds(5)).build())
            .validateAndBuildWithDefaults();

    assertEquals(options, options.toBuilder().validateAndBuildWithDefaults());
    assertEquals("me", options.getIdentity());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEmptyQuotaProjectIsRejected() {
    DataprocClientOptions.newBuilder().setQuotaProjectId("").validateAndBuildWithDefaults();
  }
}
