package io.dataproc.internal.client;

import static org.junit.Assert.*;

import com.google.common.collect.ImmutableMap;
import io.grpc.Metadata;
import org.junit.Test;

public class CallMetadataTest {

  @Test
  public void testRoutingParamsAreEncodedInOrder() {
    Metadata metadata =
        CallMetadata.of(null, ImmutableMap.of("project_id", "my project", "region", "us/east1"));

    assertEquals(
        "project_id=my+project&region=us%2Feast1",
        metadata.get(CallMetadata.REQUEST_PARAMS_HEADER_KEY));
    assertNull(metadata.get(CallMetadata.USER_PROJECT_HEADER_KEY));
  }

  @Test
  public void testEmptyValuesAreSkipped() {
    Metadata metadata =
        CallMetadata.of("billing", ImmutableMap.of("project_id", "", "region", "r"));

    assertEquals("region=r", metadata.get(CallMetadata.REQUEST_PARAMS_HEADER_KEY));
    assertEquals("billing", metadata.get(CallMetadata.USER_PROJECT_HEADER_KEY));
  }

  @Test
  public void testNoRoutingHeaderWithoutValues() {
    Metadata metadata = CallMetadata.of(null, ImmutableMap.of("name", ""));

    assertFalse(metadata.containsKey(CallMetadata.REQUEST_PARAMS_HEADER_KEY));
  }
}
