package io.dataproc.serviceclient;

import io.grpc.netty.shaded.io.netty.handler.ssl.SslContext;
import javax.net.ssl.SSLException;

/**
 * Supplies the client certificate for mutual TLS. Only invoked when client certificates are
 * enabled through {@code GOOGLE_API_USE_CLIENT_CERTIFICATE}.
 *
 * @see SimpleSslContextBuilder
 */
@FunctionalInterface
public interface ClientCertificateSource {
  SslContext createSslContext() throws SSLException;
}
