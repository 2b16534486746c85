package cafe.woden.ircbot.irc;

import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.util.concurrent.atomic.AtomicReference;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Socket factories for TLS connections.
 *
 * <p><b>WARNING:</b> the trust-all factory disables certificate validation. Only use it against
 * servers with self-signed certificates you control.
 */
final class TlsSocketFactories {
  private static final Logger log = LoggerFactory.getLogger(TlsSocketFactories.class);

  private static final SSLSocketFactory DEFAULT_SSL =
      (SSLSocketFactory) SSLSocketFactory.getDefault();

  private static final AtomicReference<SSLSocketFactory> TRUST_ALL_SSL = new AtomicReference<>();

  private TlsSocketFactories() {}

  static SSLSocketFactory sslSocketFactory(boolean trustAllCertificates) {
    if (!trustAllCertificates) return DEFAULT_SSL;

    SSLSocketFactory existing = TRUST_ALL_SSL.get();
    if (existing != null) return existing;

    SSLSocketFactory created = buildTrustAllSslFactory();
    TRUST_ALL_SSL.compareAndSet(null, created);
    return TRUST_ALL_SSL.get();
  }

  private static SSLSocketFactory buildTrustAllSslFactory() {
    TrustManager[] trustAll =
        new TrustManager[] {
          new X509TrustManager() {
            @Override
            public void checkClientTrusted(X509Certificate[] chain, String authType) {
              // trust all
            }

            @Override
            public void checkServerTrusted(X509Certificate[] chain, String authType) {
              // trust all
            }

            @Override
            public X509Certificate[] getAcceptedIssuers() {
              return new X509Certificate[0];
            }
          }
        };

    try {
      SSLContext ctx = SSLContext.getInstance("TLS");
      ctx.init(null, trustAll, new SecureRandom());
      log.warn("[ircbot] TLS certificate validation is disabled");
      return ctx.getSocketFactory();
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Cannot build trust-all TLS context", e);
    }
  }
}
