package com.codeheadsystems.pow.client.accessor;

import com.codeheadsystems.pow.client.config.PowServiceSettings;
import com.codeheadsystems.pow.client.config.ProxyAddress;
import com.codeheadsystems.pow.client.exceptions.PowAccessorException;
import com.codeheadsystems.pow.client.exceptions.PowEnvelopeException;
import com.codeheadsystems.pow.client.exceptions.PowUpstreamException;
import com.codeheadsystems.pow.client.model.PowTokenReply;
import com.codeheadsystems.pow.model.PowTokenResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the issuing service's {@code GET /api/pow/token} endpoint.
 * <p>
 * Handles request construction, proxy selection, HTTP dispatch, status-code checking and envelope
 * deserialization. This call blocks for up to {@link PowServiceSettings#REQUEST_TIMEOUT}; callers
 * are expected to run it off their own thread.
 * <p>
 * A non-200 status is surfaced as {@link PowUpstreamException}, an undecodable body as
 * {@link PowEnvelopeException}. I/O errors and interruptions are wrapped in {@link PowAccessorException}.
 */
@Singleton
public class PowServiceAccessor {

  private static final Logger log = LoggerFactory.getLogger(PowServiceAccessor.class);

  private final HttpClientFactory httpClientFactory;
  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Pow service accessor.
   *
   * @param httpClientFactory the http client factory
   * @param objectMapper      the object mapper
   */
  @Inject
  public PowServiceAccessor(final HttpClientFactory httpClientFactory,
                            final ObjectMapper objectMapper) {
    log.info("PowServiceAccessor()");
    this.httpClientFactory = httpClientFactory;
    this.objectMapper = objectMapper;
  }

  /**
   * Requests a token from the issuing service described by the settings.
   *
   * @param settings a configured settings snapshot
   * @return the decoded reply
   * @throws IllegalArgumentException if the server or proxy URL is malformed
   */
  public PowTokenReply requestToken(final PowServiceSettings settings) {
    final String endpoint = settings.tokenEndpoint();
    final Optional<ProxyAddress> proxy = settings.activeProxyUrl().map(ProxyAddress::parse);
    log.trace("requestToken(endpoint={}, proxy={})", endpoint, proxy);

    final HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create(endpoint))
        .header("Authorization", "Bearer " + settings.apiKey())
        .header("Accept", "application/json")
        .timeout(PowServiceSettings.REQUEST_TIMEOUT)
        .GET()
        .build();
    final HttpClient httpClient = httpClientFactory.create(proxy);

    final HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new PowAccessorException("HTTP request failed for " + endpoint + ": " + describe(e), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new PowAccessorException("HTTP request interrupted for " + endpoint, e);
    }

    final int statusCode = response.statusCode();
    final String body = response.body();
    checkStatus(statusCode, body);
    return new PowTokenReply(statusCode, body, decode(statusCode, body));
  }

  private PowTokenResponse decode(final int statusCode, final String body) {
    final PowTokenResponse envelope;
    try {
      envelope = objectMapper.readValue(body == null ? "" : body, PowTokenResponse.class);
    } catch (JsonProcessingException e) {
      throw new PowEnvelopeException("Response is not a token envelope: " + e.getOriginalMessage(),
          statusCode, body, e);
    }
    if (envelope == null) {
      throw new PowEnvelopeException("Response is not a token envelope: null", statusCode, body, null);
    }
    return envelope;
  }

  private void checkStatus(final int statusCode, final String body) {
    if (statusCode != 200) {
      log.debug("checkStatus(statusCode={})", statusCode);
      throw new PowUpstreamException(statusCode, body);
    }
  }

  private static String describe(final Throwable e) {
    return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
  }
}
