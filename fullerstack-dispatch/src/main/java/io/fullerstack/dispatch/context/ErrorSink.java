package io.fullerstack.dispatch.context;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Receives failures raised by continuations so the loop can keep going.
 */
@FunctionalInterface
public interface ErrorSink {

  /**
   * Reports a failure.
   *
   * @param context the context whose continuation failed
   * @param error   what the continuation threw
   */
  void report ( ExecutionContext context, Throwable error );

  /**
   * @return a sink that logs through SLF4J at error level
   */
  static ErrorSink logging () {
    Logger logger = LoggerFactory.getLogger ( ErrorSink.class );
    return ( context, error ) ->
      logger.error ( "Continuation failed on context '{}'", context.name (), error );
  }
}
