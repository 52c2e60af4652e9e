package io.dataproc.serviceclient;

import io.grpc.netty.shaded.io.netty.handler.ssl.ApplicationProtocolConfig;
import io.grpc.netty.shaded.io.netty.handler.ssl.ApplicationProtocolNames;
import io.grpc.netty.shaded.io.netty.handler.ssl.SslContext;
import io.grpc.netty.shaded.io.netty.handler.ssl.SslContextBuilder;
import io.grpc.netty.shaded.io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import java.io.IOException;
import java.io.InputStream;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.KeyStoreException;
import java.security.NoSuchAlgorithmException;
import javax.annotation.Nullable;
import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLException;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509TrustManager;

/**
 * Builds a client {@link SslContext} for the Dataproc endpoint, optionally carrying a client
 * certificate for mutual TLS.
 *
 * <pre>{@code
 * SslContext ctx =
 *     SimpleSslContextBuilder.forPKCS8(certChainStream, keyStream).build();
 * DataprocServiceStubsOptions.newBuilder()
 *     .setClientCertificateSource(() -> ctx)
 *     .validateAndBuildWithDefaults();
 * }</pre>
 */
public class SimpleSslContextBuilder {

  // gRPC runs on HTTP/2 which has to be negotiated through ALPN
  private static final ApplicationProtocolConfig H2_ALPN_CONFIG =
      new ApplicationProtocolConfig(
          ApplicationProtocolConfig.Protocol.ALPN,
          ApplicationProtocolConfig.SelectorFailureBehavior.NO_ADVERTISE,
          ApplicationProtocolConfig.SelectedListenerFailureBehavior.ACCEPT,
          ApplicationProtocolNames.HTTP_2);

  private enum KeyFormat {
    NONE,
    PKCS_8,
    PKCS_12
  }

  private final KeyFormat keyFormat;
  private final @Nullable InputStream keyCertChain;
  private final @Nullable InputStream key;
  private TrustManager trustManager;
  private InputStream trustedCertificates;
  private boolean useInsecureTrustManager;
  private String keyPassword;

  /**
   * @param keyCertChain X.509 client certificate chain in PEM format
   * @param key PKCS#8 client private key in PEM format
   */
  public static SimpleSslContextBuilder forPKCS8(InputStream keyCertChain, InputStream key) {
    return new SimpleSslContextBuilder(KeyFormat.PKCS_8, keyCertChain, key);
  }

  /** @param pfxKeyArchive .pfx or .p12 archive holding the client key and certificate chain */
  public static SimpleSslContextBuilder forPKCS12(InputStream pfxKeyArchive) {
    return new SimpleSslContextBuilder(KeyFormat.PKCS_12, null, pfxKeyArchive);
  }

  /** Server authentication only, no client certificate. */
  public static SimpleSslContextBuilder noKeyOrCertChain() {
    return new SimpleSslContextBuilder(KeyFormat.NONE, null, null);
  }

  private SimpleSslContextBuilder(
      KeyFormat keyFormat, @Nullable InputStream keyCertChain, @Nullable InputStream key) {
    this.keyFormat = keyFormat;
    this.keyCertChain = keyCertChain;
    this.key = key;
  }

  /**
   * Server certificates are verified with, in order of precedence: the trust manager, the trusted
   * certificates, the insecure trust manager, or the JVM default trust store.
   *
   * @throws SSLException if the key material or the trusted certificates can't be parsed
   * @throws IllegalArgumentException if more than one server verification option is set
   */
  public SslContext build() throws SSLException {
    int verificationOptions =
        (trustManager != null ? 1 : 0)
            + (trustedCertificates != null ? 1 : 0)
            + (useInsecureTrustManager ? 1 : 0);
    if (verificationOptions > 1) {
      throw new IllegalArgumentException(
          "Only one of trustManager, trustedCertificates or useInsecureTrustManager can be set");
    }

    SslContextBuilder builder =
        SslContextBuilder.forClient().applicationProtocolConfig(H2_ALPN_CONFIG);
    if (trustManager != null) {
      builder.trustManager(trustManager);
    } else if (trustedCertificates != null) {
      builder.trustManager(trustedCertificates);
    } else if (useInsecureTrustManager) {
      builder.trustManager(InsecureTrustManagerFactory.INSTANCE.getTrustManagers()[0]);
    } else {
      builder.trustManager(getDefaultTrustManager());
    }

    switch (keyFormat) {
      case PKCS_8:
        builder.keyManager(keyCertChain, key, keyPassword);
        break;
      case PKCS_12:
        builder.keyManager(createPKCS12KeyManager());
        break;
      case NONE:
        break;
      default:
        throw new IllegalArgumentException("Unsupported key format " + keyFormat);
    }
    return builder.build();
  }

  /** Trust manager verifying the server certificate. */
  public SimpleSslContextBuilder setTrustManager(TrustManager trustManager) {
    this.trustManager = trustManager;
    return this;
  }

  /** X.509 CA certificates in PEM format that the server certificate has to chain to. */
  public SimpleSslContextBuilder setTrustedCertificates(InputStream trustedCertificates) {
    this.trustedCertificates = trustedCertificates;
    return this;
  }

  /** Accepts any server certificate. Only for tests against self-signed servers. */
  public SimpleSslContextBuilder setUseInsecureTrustManager(boolean useInsecureTrustManager) {
    this.useInsecureTrustManager = useInsecureTrustManager;
    return this;
  }

  /** @param keyPassword password of the key or the PKCS#12 archive, null if unprotected */
  public SimpleSslContextBuilder setKeyPassword(String keyPassword) {
    this.keyPassword = keyPassword;
    return this;
  }

  private KeyManagerFactory createPKCS12KeyManager() throws SSLException {
    char[] password = keyPassword != null ? keyPassword.toCharArray() : new char[0];
    try {
      KeyStore keyStore = KeyStore.getInstance("PKCS12");
      keyStore.load(key, password);
      KeyManagerFactory kmf =
          KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
      kmf.init(keyStore, password);
      return kmf;
    } catch (GeneralSecurityException | IOException e) {
      throw new SSLException("Input stream does not contain a valid PKCS12 archive", e);
    }
  }

  private static X509TrustManager getDefaultTrustManager() {
    TrustManagerFactory tmf;
    try {
      tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
      tmf.init((KeyStore) null);
    } catch (KeyStoreException | NoSuchAlgorithmException e) {
      throw new UnknownDefaultTrustManagerException(e);
    }
    for (TrustManager tm : tmf.getTrustManagers()) {
      if (tm instanceof X509TrustManager) {
        return (X509TrustManager) tm;
      }
    }
    throw new UnknownDefaultTrustManagerException(
        "No X509TrustManager among the default trust managers");
  }

  /** The JVM default trust store could not be loaded. */
  public static final class UnknownDefaultTrustManagerException extends RuntimeException {
    public UnknownDefaultTrustManagerException(Throwable cause) {
      super(cause);
    }

    public UnknownDefaultTrustManagerException(String message) {
      super(message);
    }
  }
}
