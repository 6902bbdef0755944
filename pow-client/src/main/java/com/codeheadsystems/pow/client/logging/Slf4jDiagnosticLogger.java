package com.codeheadsystems.pow.client.logging;

import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DiagnosticLogger} that writes to the SLF4J logger {@code pow.diagnostics}.
 */
@Singleton
public class Slf4jDiagnosticLogger implements DiagnosticLogger {

  /**
   * The constant LOGGER_NAME.
   */
  public static final String LOGGER_NAME = "pow.diagnostics";

  private final Logger log;

  /**
   * Instantiates a new Slf4j diagnostic logger.
   */
  @Inject
  public Slf4jDiagnosticLogger() {
    this(LoggerFactory.getLogger(LOGGER_NAME));
  }

  /**
   * Instantiates a new Slf4j diagnostic logger writing to the given logger.
   *
   * @param log the log
   */
  public Slf4jDiagnosticLogger(final Logger log) {
    this.log = log;
  }

  @Override
  public void logInfo(final String message) {
    log.info("{}", message);
  }

  @Override
  public void logError(final String errorMessage,
                       final int statusCode,
                       final String responseText,
                       final String source) {
    log.error("{} (source={}, status={}, response={})", errorMessage, source, statusCode, responseText);
  }
}
