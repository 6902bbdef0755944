package com.codeheadsystems.pow.client.manager;

import com.codeheadsystems.pow.client.accessor.PowServiceAccessor;
import com.codeheadsystems.pow.client.config.PowServiceConfig;
import com.codeheadsystems.pow.client.config.PowServiceSettings;
import com.codeheadsystems.pow.client.exceptions.PowEnvelopeException;
import com.codeheadsystems.pow.client.exceptions.PowUpstreamException;
import com.codeheadsystems.pow.client.logging.DiagnosticLogger;
import com.codeheadsystems.pow.client.logging.TokenDiagnostics;
import com.codeheadsystems.pow.client.model.PowFailureKind;
import com.codeheadsystems.pow.client.model.PowToken;
import com.codeheadsystems.pow.client.model.PowTokenReply;
import com.codeheadsystems.pow.client.model.TokenPayload;
import com.codeheadsystems.pow.model.PowTokenResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Obtains a proof-of-work token from the issuing service.
 * <p>
 * Each call is a single attempt: the configuration is read afresh, one request is sent, and the
 * outcome is either a {@link PowToken} or an empty result with the reason written to the
 * {@link DiagnosticLogger}. Failures never reach the caller as exceptions; the returned future
 * always completes normally.
 * <p>
 * The HTTP exchange blocks, so it runs on the supplied worker {@link Executor} rather than on the
 * caller's thread. Calls share no state and may be issued concurrently.
 */
@Singleton
public class PowTokenFetcher {

  /**
   * Source name reported with every diagnostic error.
   */
  public static final String SOURCE = "PowTokenFetcher";

  private static final Logger log = LoggerFactory.getLogger(PowTokenFetcher.class);

  private final PowServiceConfig powServiceConfig;
  private final PowServiceAccessor powServiceAccessor;
  private final DiagnosticLogger diagnosticLogger;
  private final TokenDiagnostics tokenDiagnostics;
  private final ObjectMapper objectMapper;
  private final Executor executor;

  /**
   * Instantiates a new Pow token fetcher.
   *
   * @param powServiceConfig   live configuration, read on every call
   * @param powServiceAccessor the pow service accessor
   * @param diagnosticLogger   the diagnostic logger
   * @param objectMapper       the object mapper used to inspect token payloads
   * @param executor           the worker executor for the blocking HTTP exchange
   */
  @Inject
  public PowTokenFetcher(final PowServiceConfig powServiceConfig,
                         final PowServiceAccessor powServiceAccessor,
                         final DiagnosticLogger diagnosticLogger,
                         final ObjectMapper objectMapper,
                         final Executor executor) {
    log.info("PowTokenFetcher({}, {})", powServiceConfig, powServiceAccessor);
    this.powServiceConfig = powServiceConfig;
    this.powServiceAccessor = powServiceAccessor;
    this.diagnosticLogger = diagnosticLogger;
    this.tokenDiagnostics = new TokenDiagnostics(diagnosticLogger);
    this.objectMapper = objectMapper;
    this.executor = executor;
  }

  /**
   * Requests a token from the issuing service.
   *
   * @return a future holding the token, or empty when none could be obtained. Never completes exceptionally.
   */
  public CompletableFuture<Optional<PowToken>> fetchToken() {
    final PowServiceSettings settings = powServiceConfig.snapshot();
    if (!settings.isConfigured()) {
      diagnosticLogger.logError(
          PowFailureKind.CONFIG_MISSING.describe("POW service not configured: missing server_url or api_key"),
          0, "Configuration error", SOURCE);
      return CompletableFuture.completedFuture(Optional.empty());
    }

    try {
      return CompletableFuture.supplyAsync(() -> attempt(settings), executor);
    } catch (RejectedExecutionException e) {
      return CompletableFuture.completedFuture(requestException(e));
    }
  }

  private Optional<PowToken> attempt(final PowServiceSettings settings) {
    try {
      diagnosticLogger.logInfo("[POW Service] Requesting token from " + settings.tokenEndpoint());
      final PowTokenReply reply = powServiceAccessor.requestToken(settings);
      return extract(reply);
    } catch (PowUpstreamException e) {
      diagnosticLogger.logError(
          PowFailureKind.UPSTREAM_ERROR.describe("POW service request failed: " + e.getStatusCode()),
          e.getStatusCode(), e.getResponseBody(), SOURCE);
      return Optional.empty();
    } catch (PowEnvelopeException e) {
      diagnosticLogger.logError(
          PowFailureKind.INVALID_ENVELOPE.describe("POW service returned an invalid response: " + e.getMessage()),
          e.getStatusCode(), e.getResponseBody(), SOURCE);
      return Optional.empty();
    } catch (RuntimeException e) {
      return requestException(e);
    }
  }

  private Optional<PowToken> extract(final PowTokenReply reply) {
    final PowTokenResponse envelope = reply.envelope();
    if (!envelope.isSuccess()) {
      diagnosticLogger.logError(
          PowFailureKind.UPSTREAM_REJECTED.describe("POW service returned success=false"),
          reply.statusCode(), reply.body(), SOURCE);
      return Optional.empty();
    }

    final Optional<String> token = envelope.tokenValue();
    if (token.isEmpty()) {
      diagnosticLogger.logError(
          PowFailureKind.EMPTY_TOKEN.describe("POW service returned empty token"),
          reply.statusCode(), reply.body(), SOURCE);
      return Optional.empty();
    }

    final TokenPayload payload = TokenPayload.parse(objectMapper, token.get());
    final String deviceId = envelope.deviceIdValue()
        .or(payload::deviceId)
        .orElse(null);
    final PowToken powToken = new PowToken(token.get(), deviceId, envelope.userAgent());
    tokenDiagnostics.report(powToken, envelope.isCached(), payload);
    return Optional.of(powToken);
  }

  private Optional<PowToken> requestException(final Exception e) {
    log.debug("requestException()", e);
    final String text = e.getMessage() == null ? e.toString() : e.getMessage();
    diagnosticLogger.logError(
        PowFailureKind.REQUEST_EXCEPTION.describe("POW service request exception: " + text),
        0, text, SOURCE);
    return Optional.empty();
  }
}
