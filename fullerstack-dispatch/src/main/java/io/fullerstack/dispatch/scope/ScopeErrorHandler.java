package io.fullerstack.dispatch.scope;

import io.fullerstack.dispatch.job.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Receives failures of launched jobs, and of deferred jobs nobody awaited before teardown.
 * <p>
 * Launch failures are handed over on the job's return context.
 */
@FunctionalInterface
public interface ScopeErrorHandler {

  void handle ( JobScope scope, Job < ? > job, Throwable error );

  /**
   * Default policy: log, then cancel the failed job's siblings in the same scope.
   *
   * @return the default handler
   */
  static ScopeErrorHandler cancelSiblings () {
    Logger logger = LoggerFactory.getLogger ( ScopeErrorHandler.class );
    return ( scope, job, error ) -> {
      logger.error ( "Job {} failed in scope '{}'", job.id (), scope.path (), error );
      int cancelled = scope.cancelSiblings ( job );
      if ( cancelled > 0 ) {
        logger.debug ( "Cancelled {} sibling job(s) in scope '{}'", cancelled, scope.path () );
      }
    };
  }

  /**
   * @return a handler that only logs
   */
  static ScopeErrorHandler logging () {
    Logger logger = LoggerFactory.getLogger ( ScopeErrorHandler.class );
    return ( scope, job, error ) ->
      logger.error ( "Job {} failed in scope '{}'", job.id (), scope.path (), error );
  }
}
