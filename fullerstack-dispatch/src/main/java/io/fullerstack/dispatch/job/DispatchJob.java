package io.fullerstack.dispatch.job;

import io.fullerstack.dispatch.context.ExecutionContext;
import io.fullerstack.dispatch.error.JobCancelledException;
import io.fullerstack.dispatch.scope.JobScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * The runtime's {@link Job}: a state machine around one {@link BackgroundWork}.
 * <p>
 * < p >< b >Ownership:</b >
 * < ul >
 * < li >A pool worker moves the job CREATED → RUNNING → terminal via {@link #run()}</li >
 * < li >Any thread may {@link #cancel()}; exactly one terminal transition wins</li >
 * < li >When a return context is set, the worker posts the delivery there unless the job ended CANCELLED</li >
 * </ul >
 * <p>
 * < p >Transitions happen under the job's monitor; listeners and delivery run outside it.
 *
 * @param <T> result type
 */
public class DispatchJob < T > implements Job < T >, CancellationSignal, Runnable {

  private static final Logger logger = LoggerFactory.getLogger ( DispatchJob.class );

  private final JobId               id;
  private final BackgroundWork < T > work;
  private final JobScope            scope;

  private final CountDownLatch                          terminal  = new CountDownLatch ( 1 );
  private final List < Consumer < ? super Outcome < T > > > listeners = new ArrayList <> ();

  private volatile JobState      state = JobState.CREATED;
  private volatile Outcome < T > outcome;

  private ExecutionContext          returnContext;
  private Consumer < Outcome < T > > delivery;
  private Runnable                  withdraw;

  /**
   * Creates a job that belongs to no scope.
   *
   * @param work the body to execute
   */
  public DispatchJob ( BackgroundWork < T > work ) {
    this ( work, null );
  }

  /**
   * Creates a job owned by a scope.
   *
   * @param work  the body to execute
   * @param scope owning scope, nullable
   */
  public DispatchJob ( BackgroundWork < T > work, JobScope scope ) {
    this.id = JobId.generate ();
    this.work = Objects.requireNonNull ( work, "Work cannot be null" );
    this.scope = scope;
  }

  /**
   * Sets where the terminal outcome is delivered. Must be called before submission.
   *
   * @param context  context the delivery is posted to
   * @param delivery receives COMPLETED and FAILED outcomes on {@code context}
   * @return this job
   * @throws IllegalStateException if the job already left CREATED
   */
  public synchronized DispatchJob < T > returnTo ( ExecutionContext context, Consumer < Outcome < T > > delivery ) {
    if ( state != JobState.CREATED ) {
      throw new IllegalStateException ( "Job " + id + " is already " + state );
    }
    this.returnContext = Objects.requireNonNull ( context, "Return context cannot be null" );
    this.delivery = Objects.requireNonNull ( delivery, "Delivery cannot be null" );
    return this;
  }

  /**
   * Installs the hook that removes this job from a pool queue when it is cancelled
   * before a worker picked it up.
   *
   * @param withdraw removal hook
   */
  public synchronized void onWithdraw ( Runnable withdraw ) {
    this.withdraw = withdraw;
  }

  /**
   * Moves CREATED → RUNNING. Called by the worker that picked the job.
   *
   * @return false if the job was cancelled first and must be skipped
   */
  public synchronized boolean markRunning () {
    if ( state != JobState.CREATED ) {
      return false;
    }
    state = JobState.RUNNING;
    return true;
  }

  /**
   * Executes the work on the calling worker thread and settles the job.
   * The job must be RUNNING (see {@link #markRunning()}).
   */
  @Override
  public void run () {
    if ( state != JobState.RUNNING ) {
      throw new IllegalStateException ( "Job " + id + " is " + state + ", expected RUNNING" );
    }
    Outcome < T > result;
    try {
      result = Outcome.completed ( work.execute ( this ) );
    } catch ( JobCancelledException e ) {
      result = Outcome.cancelled ();
    } catch ( Throwable error ) {
      // Includes errors such as StackOverflowError; the worker outlives its job
      result = Outcome.failed ( error );
    }
    if ( !settle ( result ) ) {
      logger.trace ( "Job {} was cancelled while running, result discarded", id );
    }
  }

  @Override
  public boolean cancel () {
    Runnable hook;
    boolean queued;
    synchronized ( this ) {
      if ( state.isTerminal () ) {
        return false;
      }
      queued = state == JobState.CREATED;
      hook = withdraw;
    }
    if ( !settle ( Outcome.cancelled () ) ) {
      return false;
    }
    if ( queued && hook != null ) {
      hook.run ();
    }
    return true;
  }

  @Override
  public boolean isCancelled () {
    return state == JobState.CANCELLED;
  }

  @Override
  public JobId id () {
    return id;
  }

  @Override
  public JobState state () {
    return state;
  }

  @Override
  public Optional < JobScope > scope () {
    return Optional.ofNullable ( scope );
  }

  @Override
  public Optional < Outcome < T > > outcome () {
    return Optional.ofNullable ( outcome );
  }

  @Override
  public void whenTerminal ( Consumer < ? super Outcome < T > > listener ) {
    Objects.requireNonNull ( listener, "Listener cannot be null" );
    synchronized ( this ) {
      if ( !state.isTerminal () ) {
        listeners.add ( listener );
        return;
      }
    }
    listener.accept ( outcome );
  }

  /**
   * Blocks until the job is terminal.
   *
   * @return the terminal outcome
   * @throws InterruptedException if interrupted while waiting
   */
  public Outcome < T > awaitOutcome () throws InterruptedException {
    terminal.await ();
    return outcome;
  }

  /**
   * Blocks until the job is terminal or the timeout elapses.
   *
   * @param timeout maximum time to wait
   * @return the terminal outcome, or empty on timeout
   * @throws InterruptedException if interrupted while waiting
   */
  public Optional < Outcome < T > > awaitOutcome ( Duration timeout ) throws InterruptedException {
    if ( terminal.await ( timeout.toNanos (), TimeUnit.NANOSECONDS ) ) {
      return Optional.of ( outcome );
    }
    return Optional.empty ();
  }

  /**
   * @return the context outcomes are delivered to, if any
   */
  public Optional < ExecutionContext > returnContext () {
    return Optional.ofNullable ( returnContext );
  }

  private boolean settle ( Outcome < T > result ) {
    List < Consumer < ? super Outcome < T > > > notify;
    ExecutionContext target;
    Consumer < Outcome < T > > deliver;
    synchronized ( this ) {
      if ( !state.canTransitionTo ( result.state () ) ) {
        return false;
      }
      outcome = result;
      state = result.state ();
      notify = new ArrayList <> ( listeners );
      listeners.clear ();
      target = returnContext;
      deliver = delivery;
    }
    for ( Consumer < ? super Outcome < T > > listener : notify ) {
      try {
        listener.accept ( result );
      } catch ( RuntimeException e ) {
        logger.error ( "Terminal listener of job {} failed", id, e );
      }
    }
    if ( target != null && !result.isCancelled () ) {
      if ( !target.post ( () -> deliver.accept ( result ) ) ) {
        if ( result.isFailure () ) {
          logger.warn ( "Return context '{}' refused delivery of failed job {}",
            target.name (), id, result.error () );
        } else {
          logger.debug ( "Return context '{}' refused delivery of job {}", target.name (), id );
        }
      }
    }
    // Waiters wake only after listeners ran and the delivery is queued
    terminal.countDown ();
    return true;
  }

  @Override
  public String toString () {
    return "DispatchJob[" + id + ", " + state + "]";
  }
}
