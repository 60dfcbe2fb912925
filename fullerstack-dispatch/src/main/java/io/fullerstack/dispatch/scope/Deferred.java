package io.fullerstack.dispatch.scope;

import io.fullerstack.dispatch.context.ExecutionContext;
import io.fullerstack.dispatch.current.CurrentContext;
import io.fullerstack.dispatch.error.ClosureException;
import io.fullerstack.dispatch.error.DispatchException;
import io.fullerstack.dispatch.error.JobCancelledException;
import io.fullerstack.dispatch.error.JobTimeoutException;
import io.fullerstack.dispatch.job.DispatchJob;
import io.fullerstack.dispatch.job.Job;
import io.fullerstack.dispatch.job.JobId;
import io.fullerstack.dispatch.job.JobState;
import io.fullerstack.dispatch.job.Outcome;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * A job whose result is retrieved later with {@code await}.
 * <p>
 * < p >Errors are not reported when they happen; they surface where the result is
 * observed. Every {@code await} yields the same cached terminal outcome, and the work
 * never runs twice. A deferred that failed and was never awaited is reported when its
 * scope is torn down.
 *
 * @param <T> result type
 * @see JobScope#async(io.fullerstack.dispatch.job.BackgroundWork)
 */
public class Deferred < T > implements Job < T > {

  private final DispatchJob < T > job;
  private final AtomicBoolean     observed = new AtomicBoolean ();

  Deferred ( DispatchJob < T > job ) {
    this.job = job;
  }

  /**
   * Blocks the calling thread until the job is terminal.
   *
   * @return the value
   * @throws ClosureException      if the work threw (the cause is the original error)
   * @throws JobCancelledException if the job was cancelled
   */
  public T await () {
    observe ();
    try {
      return job.awaitOutcome ().getOrThrow ();
    } catch ( InterruptedException e ) {
      Thread.currentThread ().interrupt ();
      throw new DispatchException ( "Interrupted while awaiting job " + job.id (), e );
    }
  }

  /**
   * Blocks the calling thread until the job is terminal or the timeout elapses.
   * The job keeps running after a timeout.
   *
   * @param timeout maximum time to wait
   * @return the value
   * @throws JobTimeoutException   if the timeout elapsed first
   * @throws ClosureException      if the work threw
   * @throws JobCancelledException if the job was cancelled
   */
  public T await ( Duration timeout ) {
    Objects.requireNonNull ( timeout, "Timeout cannot be null" );
    observe ();
    try {
      return job.awaitOutcome ( timeout )
        .orElseThrow ( () -> new JobTimeoutException ( "Job " + job.id () + " did not finish within " + timeout, timeout ) )
        .getOrThrow ();
    } catch ( InterruptedException e ) {
      Thread.currentThread ().interrupt ();
      throw new DispatchException ( "Interrupted while awaiting job " + job.id (), e );
    }
  }

  /**
   * Suspends without blocking: {@code continuation} is posted to {@code context}
   * once the job is terminal.
   *
   * @param context      where the continuation runs
   * @param continuation receives the terminal outcome
   */
  public void await ( ExecutionContext context, Consumer < Outcome < T > > continuation ) {
    Objects.requireNonNull ( context, "Context cannot be null" );
    Objects.requireNonNull ( continuation, "Continuation cannot be null" );
    observe ();
    job.whenTerminal ( outcome -> context.post ( () -> continuation.accept ( outcome ) ) );
  }

  /**
   * Like {@link #await(ExecutionContext, Consumer)} on the context running the caller.
   *
   * @param continuation receives the terminal outcome
   * @throws IllegalStateException if the caller is not on an execution context
   */
  public void await ( Consumer < Outcome < T > > continuation ) {
    await ( CurrentContext.require (), continuation );
  }

  /**
   * @return true once any form of {@code await} was called
   */
  public boolean isObserved () {
    return observed.get ();
  }

  private void observe () {
    if ( observed.compareAndSet ( false, true ) ) {
      job.scope ().ifPresent ( scope -> scope.forget ( this ) );
    }
  }

  @Override
  public JobId id () {
    return job.id ();
  }

  @Override
  public JobState state () {
    return job.state ();
  }

  @Override
  public boolean cancel () {
    return job.cancel ();
  }

  @Override
  public Optional < JobScope > scope () {
    return job.scope ();
  }

  @Override
  public Optional < Outcome < T > > outcome () {
    return job.outcome ();
  }

  @Override
  public void whenTerminal ( Consumer < ? super Outcome < T > > listener ) {
    job.whenTerminal ( listener );
  }

  @Override
  public String toString () {
    return "Deferred[" + job.id () + ", " + job.state () + "]";
  }
}
