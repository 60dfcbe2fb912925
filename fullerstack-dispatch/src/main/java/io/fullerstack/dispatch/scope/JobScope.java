package io.fullerstack.dispatch.scope;

import io.fullerstack.dispatch.context.ExecutionContext;
import io.fullerstack.dispatch.error.JobTimeoutException;
import io.fullerstack.dispatch.error.RejectedSubmissionException;
import io.fullerstack.dispatch.job.BackgroundWork;
import io.fullerstack.dispatch.job.DispatchJob;
import io.fullerstack.dispatch.job.Job;
import io.fullerstack.dispatch.job.JobId;
import io.fullerstack.dispatch.job.Outcome;
import io.fullerstack.dispatch.pool.DispatcherPool;
import io.fullerstack.dispatch.valve.Posted;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Structured-concurrency boundary owning a group of jobs.
 * <p>
 * < p >Scopes nest: cancelling a scope cancels every job it owns and every child
 * scope, transitively, exactly once each. A cancelled or closed scope rejects new
 * work with {@link RejectedSubmissionException}; rejected work never runs.
 * <p>
 * < p >< b >Error policy:</b >
 * < ul >
 * < li >{@link #launch} failures go to the {@link ScopeErrorHandler} on the return context</li >
 * < li >{@link #async} failures are kept until {@link Deferred#await()}, or reported at teardown if never awaited</li >
 * </ul >
 * <p>
 * < p >< b >Usage:</b >
 * < pre >
 * JobScope screen = new JobScope ( "screen", pool );
 * screen.launch ( signal -> repository.load (), main, view::show );
 * ...
 * screen.close (); // waits for quiescence, then force-cancels the rest
 * </pre >
 */
public class JobScope implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger ( JobScope.class );

  private final String            name;
  private final JobScope          parent;
  private final DispatcherPool    pool;
  private final ScopeErrorHandler errorHandler;
  private final Duration          teardownTimeout;

  private final Map < String, JobScope > children = new ConcurrentHashMap <> ();

  // Guarded by jobs; also the monitor quiescence waiters park on
  private final Set < Job < ? > >        jobs      = new LinkedHashSet <> ();
  // Only deferreds that may still need a teardown report: pending, or failed and never awaited
  private final Set < Deferred < ? > >  deferreds = new LinkedHashSet <> ();

  private volatile boolean cancelled = false;
  private volatile boolean closed    = false;

  /**
   * Creates a root scope with the default error handler and a five second teardown grace period.
   *
   * @param name scope name
   * @param pool pool the scope's jobs run on
   */
  public JobScope ( String name, DispatcherPool pool ) {
    this ( name, pool, ScopeErrorHandler.cancelSiblings (), Duration.ofSeconds ( 5 ) );
  }

  /**
   * Creates a root scope.
   *
   * @param name            scope name
   * @param pool            pool the scope's jobs run on
   * @param errorHandler    receives launch failures and unobserved deferred failures
   * @param teardownTimeout how long {@link #close()} waits for quiescence before cancelling
   */
  public JobScope ( String name, DispatcherPool pool, ScopeErrorHandler errorHandler, Duration teardownTimeout ) {
    this ( name, null, pool, errorHandler, teardownTimeout );
  }

  private JobScope ( String name, JobScope parent, DispatcherPool pool,
                     ScopeErrorHandler errorHandler, Duration teardownTimeout ) {
    this.name = Objects.requireNonNull ( name, "Scope name cannot be null" );
    this.parent = parent;
    this.pool = Objects.requireNonNull ( pool, "Pool cannot be null" );
    this.errorHandler = Objects.requireNonNull ( errorHandler, "Error handler cannot be null" );
    this.teardownTimeout = Objects.requireNonNull ( teardownTimeout, "Teardown timeout cannot be null" );
  }

  // ========== Scheduling ==========

  /**
   * Launches fire-and-forget work; the result is dropped, failures go to the error handler.
   *
   * @param work          the body
   * @param returnContext where failures are handled
   * @param <T>           result type
   * @return the job handle
   * @throws RejectedSubmissionException if the scope is cancelled or closed, or the pool refuses
   */
  public < T > Job < T > launch ( BackgroundWork < T > work, ExecutionContext returnContext ) {
    return launch ( work, returnContext, value -> {
    } );
  }

  /**
   * Launches work whose result is handed to {@code onResult} on {@code returnContext}.
   *
   * @param work          the body
   * @param returnContext where the result and failures are delivered
   * @param onResult      receives the value on {@code returnContext}
   * @param <T>           result type
   * @return the job handle
   * @throws RejectedSubmissionException if the scope is cancelled or closed, or the pool refuses
   */
  public < T > Job < T > launch ( BackgroundWork < T > work, ExecutionContext returnContext, Consumer < ? super T > onResult ) {
    Objects.requireNonNull ( returnContext, "Return context cannot be null" );
    Objects.requireNonNull ( onResult, "Result consumer cannot be null" );
    DispatchJob < T > job = new DispatchJob <> ( work, this );
    job.returnTo ( returnContext, outcome -> {
      if ( outcome.isSuccess () ) {
        onResult.accept ( outcome.value () );
      } else if ( outcome.isFailure () ) {
        errorHandler.handle ( this, job, outcome.error () );
      }
    } );
    return register ( job );
  }

  /**
   * Starts work whose result is retrieved later with {@link Deferred#await()}.
   *
   * @param work the body
   * @param <T>  result type
   * @return the deferred handle
   * @throws RejectedSubmissionException if the scope is cancelled or closed, or the pool refuses
   */
  public < T > Deferred < T > async ( BackgroundWork < T > work ) {
    DispatchJob < T > job = new DispatchJob <> ( work, this );
    Deferred < T > deferred = new Deferred <> ( job );
    synchronized ( jobs ) {
      deferreds.add ( deferred );
    }
    // Installed before submission so it runs ahead of the quiescence bookkeeping
    job.whenTerminal ( outcome -> {
      if ( !outcome.isFailure () || deferred.isObserved () ) {
        forget ( deferred );
      }
    } );
    try {
      register ( job );
    } catch ( RejectedSubmissionException e ) {
      forget ( deferred );
      throw e;
    }
    return deferred;
  }

  void forget ( Deferred < ? > deferred ) {
    synchronized ( jobs ) {
      deferreds.remove ( deferred );
    }
  }

  /**
   * @return number of deferreds still held for the teardown report
   */
  int trackedDeferredCount () {
    synchronized ( jobs ) {
      return deferreds.size ();
    }
  }

  /**
   * Races the job's completion against a deadline on {@code context}.
   * <p>
   * < p >Both contenders are continuations on the same context; whichever runs first
   * hands its outcome to {@code onOutcome} and the other becomes a no-op. When the
   * deadline wins, the job is cancelled and the outcome is FAILED with a
   * {@link JobTimeoutException}.
   *
   * @param work      the body
   * @param timeout   the deadline
   * @param context   where the race is decided and {@code onOutcome} runs
   * @param onOutcome receives exactly one outcome
   * @param <T>       result type
   * @return the job handle
   * @throws RejectedSubmissionException if the scope is cancelled or closed, or the pool refuses
   */
  public < T > Job < T > withTimeout ( BackgroundWork < T > work, Duration timeout,
                                       ExecutionContext context, Consumer < Outcome < T > > onOutcome ) {
    Objects.requireNonNull ( timeout, "Timeout cannot be null" );
    Objects.requireNonNull ( context, "Context cannot be null" );
    Objects.requireNonNull ( onOutcome, "Outcome consumer cannot be null" );
    DispatchJob < T > job = new DispatchJob <> ( work, this );
    AtomicBoolean settled = new AtomicBoolean ();
    Posted timer = context.postDelayed ( () -> {
      if ( settled.compareAndSet ( false, true ) ) {
        job.cancel ();
        onOutcome.accept ( Outcome.failed (
          new JobTimeoutException ( "Job " + job.id () + " timed out after " + timeout, timeout )
        ) );
      }
    }, timeout );
    try {
      register ( job );
    } catch ( RejectedSubmissionException e ) {
      timer.cancel ();
      throw e;
    }
    job.whenTerminal ( outcome -> context.post ( () -> {
      if ( settled.compareAndSet ( false, true ) ) {
        timer.cancel ();
        onOutcome.accept ( outcome );
      } else {
        logger.trace ( "Job {} settled after its deadline, outcome {} ignored", job.id (), outcome.state () );
      }
    } ) );
    return job;
  }

  private < T > DispatchJob < T > register ( DispatchJob < T > job ) {
    synchronized ( jobs ) {
      if ( closed ) {
        throw new RejectedSubmissionException ( "Scope '" + path () + "' is closed" );
      }
      if ( cancelled ) {
        throw new RejectedSubmissionException ( "Scope '" + path () + "' is cancelled" );
      }
      jobs.add ( job );
    }
    job.whenTerminal ( outcome -> release ( job ) );
    try {
      pool.submit ( job );
    } catch ( RejectedSubmissionException e ) {
      job.cancel ();
      throw e;
    }
    return job;
  }

  private void release ( Job < ? > job ) {
    synchronized ( jobs ) {
      jobs.remove ( job );
      if ( jobs.isEmpty () ) {
        jobs.notifyAll ();
      }
    }
  }

  // ========== Cancellation ==========

  /**
   * Cancels every owned job and, recursively, every child scope. Later submissions are rejected.
   *
   * @return true if this call performed the cancellation
   */
  public boolean cancel () {
    List < Job < ? > > snapshot;
    synchronized ( jobs ) {
      if ( cancelled ) {
        return false;
      }
      cancelled = true;
      snapshot = new ArrayList <> ( jobs );
    }
    snapshot.forEach ( Job::cancel );
    children.values ().forEach ( JobScope::cancel );
    logger.debug ( "Scope '{}' cancelled with {} active job(s)", path (), snapshot.size () );
    return true;
  }

  /**
   * Cancels every active job of this scope except {@code failed}. The scope stays open.
   *
   * @param failed the job to spare
   * @return number of jobs this call cancelled
   */
  public int cancelSiblings ( Job < ? > failed ) {
    JobId spared = failed.id ();
    int count = 0;
    for ( Job < ? > job : activeJobs () ) {
      if ( !job.id ().equals ( spared ) && job.cancel () ) {
        count++;
      }
    }
    return count;
  }

  // ========== Quiescence & teardown ==========

  /**
   * @return true when every owned job, here and in child scopes, is terminal
   */
  public boolean isQuiescent () {
    synchronized ( jobs ) {
      if ( !jobs.isEmpty () ) {
        return false;
      }
    }
    return children.values ().stream ().allMatch ( JobScope::isQuiescent );
  }

  /**
   * Waits until the scope and its children are quiescent.
   *
   * @param timeout maximum time to wait
   * @return true if quiescent within the timeout
   */
  public boolean awaitQuiescence ( Duration timeout ) {
    long deadline = System.nanoTime () + timeout.toNanos ();
    try {
      synchronized ( jobs ) {
        while ( !jobs.isEmpty () ) {
          long remaining = deadline - System.nanoTime ();
          if ( remaining <= 0L ) {
            return false;
          }
          TimeUnit.NANOSECONDS.timedWait ( jobs, remaining );
        }
      }
    } catch ( InterruptedException e ) {
      Thread.currentThread ().interrupt ();
      return false;
    }
    for ( JobScope child : List.copyOf ( children.values () ) ) {
      long remaining = Math.max ( 0L, deadline - System.nanoTime () );
      if ( !child.awaitQuiescence ( Duration.ofNanos ( remaining ) ) ) {
        return false;
      }
    }
    return true;
  }

  /**
   * Tears the scope down with the configured grace period.
   *
   * @see #teardown(Duration)
   */
  @Override
  public void close () {
    teardown ( teardownTimeout );
  }

  /**
   * Rejects new work, closes child scopes, waits up to {@code timeout} for quiescence,
   * force-cancels whatever is still active, and reports failed deferreds nobody awaited.
   *
   * @param timeout grace period; {@link Duration#ZERO} cancels immediately
   */
  public void teardown ( Duration timeout ) {
    synchronized ( jobs ) {
      if ( closed ) {
        return;
      }
      closed = true;
    }
    long deadline = System.nanoTime () + timeout.toNanos ();
    for ( JobScope child : List.copyOf ( children.values () ) ) {
      child.teardown ( Duration.ofNanos ( Math.max ( 0L, deadline - System.nanoTime () ) ) );
    }
    if ( !awaitQuiescence ( Duration.ofNanos ( Math.max ( 0L, deadline - System.nanoTime () ) ) ) ) {
      logger.warn ( "Scope '{}' not quiescent after {}, cancelling {} job(s)", path (), timeout, activeJobs ().size () );
      cancel ();
    }
    reportUnobserved ();
    children.clear ();
    if ( parent != null ) {
      parent.children.remove ( name, this );
    }
    logger.debug ( "Scope '{}' torn down", path () );
  }

  private void reportUnobserved () {
    List < Deferred < ? > > snapshot;
    synchronized ( jobs ) {
      snapshot = new ArrayList <> ( deferreds );
      deferreds.clear ();
    }
    for ( Deferred < ? > deferred : snapshot ) {
      if ( deferred.isObserved () ) {
        continue;
      }
      deferred.outcome ()
        .filter ( Outcome::isFailure )
        .ifPresent ( outcome -> {
          try {
            errorHandler.handle ( this, deferred, outcome.error () );
          } catch ( RuntimeException e ) {
            logger.error ( "Error handler of scope '{}' failed", path (), e );
          }
        } );
    }
  }

  // ========== Hierarchy ==========

  /**
   * Returns the named child scope, creating it on first use. A child created under a
   * cancelled scope starts cancelled.
   *
   * @param childName child name
   * @return the child scope
   * @throws IllegalStateException if this scope is closed
   */
  public JobScope scope ( String childName ) {
    Objects.requireNonNull ( childName, "Scope name cannot be null" );
    checkClosed ();
    JobScope child = children.computeIfAbsent ( childName,
      n -> new JobScope ( n, this, pool, errorHandler, teardownTimeout ) );
    if ( cancelled ) {
      child.cancel ();
    }
    return child;
  }

  /**
   * Creates an anonymous child scope.
   *
   * @return the new child scope
   * @throws IllegalStateException if this scope is closed
   */
  public JobScope scope () {
    return scope ( "scope-" + UUID.randomUUID () );
  }

  public String name () {
    return name;
  }

  /**
   * @return slash-separated names from the root scope to this one
   */
  public String path () {
    return parent == null ? name : parent.path () + "/" + name;
  }

  public Optional < JobScope > parent () {
    return Optional.ofNullable ( parent );
  }

  public DispatcherPool pool () {
    return pool;
  }

  public boolean isCancelled () {
    return cancelled;
  }

  public boolean isClosed () {
    return closed;
  }

  /**
   * @return snapshot of the owned jobs that are not terminal yet, in launch order
   */
  public List < Job < ? > > activeJobs () {
    synchronized ( jobs ) {
      return List.copyOf ( jobs );
    }
  }

  private void checkClosed () {
    if ( closed ) {
      throw new IllegalStateException ( "Scope '" + path () + "' is closed" );
    }
  }

  @Override
  public String toString () {
    return "JobScope[" + path () + "]";
  }
}
