package io.dataproc.serviceclient;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/** Library version, filled in from the build at packaging time. */
public final class Version {

  private static final String VERSION_RESOURCE = "/io/dataproc/version.properties";

  /** Value of the {@code client-version} header sent with every request. */
  public static final String LIBRARY_VERSION;

  static {
    Properties properties = new Properties();
    try (InputStream in = Version.class.getResourceAsStream(VERSION_RESOURCE)) {
      if (in != null) {
        properties.load(in);
      }
    } catch (IOException e) {
      throw new ExceptionInInitializerError(e);
    }
    LIBRARY_VERSION = properties.getProperty("dataproc-sdk-version", "unknown");
  }

  private Version() {}
}
