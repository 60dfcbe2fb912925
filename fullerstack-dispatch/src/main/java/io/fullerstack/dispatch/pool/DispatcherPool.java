package io.fullerstack.dispatch.pool;

import io.fullerstack.dispatch.context.ExecutionContext;
import io.fullerstack.dispatch.error.RejectedSubmissionException;
import io.fullerstack.dispatch.job.BackgroundWork;
import io.fullerstack.dispatch.job.DispatchJob;
import io.fullerstack.dispatch.job.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Bounded set of persistent workers executing background jobs.
 * <p>
 * < p >< b >Design Pattern:</b >
 * < ul >
 * < li >One lock-guarded FIFO of pending jobs, N platform worker threads parked on it</li >
 * < li >A worker pops the oldest job, moves it to RUNNING, runs it to a terminal state</li >
 * < li >At most N jobs run at once; everything else waits in the queue, never dropped</li >
 * < li >Completion order across workers is not guaranteed</li >
 * </ul >
 * <p>
 * < p >< b >Cancellation:</b > a job cancelled while queued is withdrawn from the queue;
 * a running job only sees its cooperative flag. Workers are never interrupted.
 * <p>
 * < p >< b >Usage:</b >
 * < pre >
 * DispatcherPool pool = DispatcherPool.builder ( "io" ).workers ( 4 ).build ();
 * DispatchJob&lt;String&gt; job = pool.submit ( signal -> fetch () );
 * pool.shutdown ();
 * pool.awaitTermination ( Duration.ofSeconds ( 5 ) );
 * </pre >
 */
public class DispatcherPool implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger ( DispatcherPool.class );

  private final String name;
  private final int    workerCount;
  private final int    queueCapacity;

  private final Deque < DispatchJob < ? > > pending  = new ArrayDeque <> ();
  private final ReentrantLock               lock     = new ReentrantLock ();
  private final Condition                   nonEmpty = lock.newCondition ();
  private       boolean                     shutdown = false;

  private final Set < DispatchJob < ? > > running    = ConcurrentHashMap.newKeySet ();
  private final AtomicInteger            active     = new AtomicInteger ();
  private final AtomicLong               completed  = new AtomicLong ();
  private final List < Thread >          workers;
  private final CountDownLatch           terminated;

  private DispatcherPool ( Builder builder ) {
    this.name = builder.name;
    this.workerCount = builder.workers;
    this.queueCapacity = builder.queueCapacity;
    this.terminated = new CountDownLatch ( workerCount );
    List < Thread > threads = new ArrayList <> ( workerCount );
    for ( int i = 0; i < workerCount; i++ ) {
      Thread worker = new Thread ( this::work, name + "-worker-" + i );
      worker.setDaemon ( true );
      threads.add ( worker );
    }
    this.workers = List.copyOf ( threads );
    workers.forEach ( Thread::start );
    logger.debug ( "Pool '{}' started with {} worker(s), queue capacity {}",
      name, workerCount, queueCapacity > 0 ? queueCapacity : "unbounded" );
  }

  /**
   * Creates a pool with one worker per available processor and an unbounded queue.
   *
   * @param name pool name (used for worker thread names)
   * @return the started pool
   */
  public static DispatcherPool create ( String name ) {
    return builder ( name ).build ();
  }

  /**
   * @param name pool name (used for worker thread names)
   * @return a builder
   */
  public static Builder builder ( String name ) {
    return new Builder ( name );
  }

  /**
   * Schedules work without a return context.
   *
   * @param work the body
   * @param <T>  result type
   * @return the job handle, returned immediately
   * @throws RejectedSubmissionException if shut down or the queue is full
   */
  public < T > DispatchJob < T > submit ( BackgroundWork < T > work ) {
    return submit ( new DispatchJob <> ( work ) );
  }

  /**
   * Schedules work whose outcome is delivered on {@code returnContext}.
   *
   * @param work          the body
   * @param returnContext context the delivery is posted to
   * @param delivery      receives COMPLETED and FAILED outcomes
   * @param <T>           result type
   * @return the job handle, returned immediately
   * @throws RejectedSubmissionException if shut down or the queue is full
   */
  public < T > DispatchJob < T > submit ( BackgroundWork < T > work,
                                          ExecutionContext returnContext,
                                          Consumer < Outcome < T > > delivery ) {
    return submit ( new DispatchJob <> ( work ).returnTo ( returnContext, delivery ) );
  }

  /**
   * Queues a prepared job. A job that is already cancelled is returned untouched.
   *
   * @param job the job, in CREATED state
   * @param <T> result type
   * @return the same job
   * @throws RejectedSubmissionException if shut down or the queue is full
   */
  public < T > DispatchJob < T > submit ( DispatchJob < T > job ) {
    Objects.requireNonNull ( job, "Job cannot be null" );
    lock.lock ();
    try {
      if ( shutdown ) {
        throw new RejectedSubmissionException ( "Pool '" + name + "' is shut down" );
      }
      if ( queueCapacity > 0 && pending.size () >= queueCapacity ) {
        throw new RejectedSubmissionException (
          "Pool '" + name + "' queue is full (" + queueCapacity + " pending)"
        );
      }
      if ( job.isDone () ) {
        return job;
      }
      job.onWithdraw ( () -> withdraw ( job ) );
      pending.addLast ( job );
      nonEmpty.signal ();
    } finally {
      lock.unlock ();
    }
    // Cancelled between the check and the hook installation
    if ( job.isCancelled () ) {
      withdraw ( job );
    }
    return job;
  }

  /**
   * Stops accepting work. Queued and running jobs still finish; workers exit once
   * the queue is empty.
   */
  public void shutdown () {
    lock.lock ();
    try {
      if ( shutdown ) {
        return;
      }
      shutdown = true;
      nonEmpty.signalAll ();
    } finally {
      lock.unlock ();
    }
    logger.debug ( "Pool '{}' shutting down, {} job(s) still queued", name, queuedCount () );
  }

  /**
   * Stops accepting work, cancels every queued job and flags every running one.
   *
   * @return the jobs that were withdrawn from the queue
   */
  public List < DispatchJob < ? > > shutdownNow () {
    List < DispatchJob < ? > > withdrawn;
    lock.lock ();
    try {
      shutdown = true;
      withdrawn = new ArrayList <> ( pending );
      pending.clear ();
      nonEmpty.signalAll ();
    } finally {
      lock.unlock ();
    }
    withdrawn.forEach ( DispatchJob::cancel );
    running.forEach ( DispatchJob::cancel );
    logger.info ( "Pool '{}' shut down now: {} queued job(s) cancelled, {} running job(s) flagged",
      name, withdrawn.size (), running.size () );
    return withdrawn;
  }

  /**
   * Waits for every worker to exit after a shutdown.
   *
   * @param timeout maximum time to wait
   * @return true if all workers exited within the timeout
   */
  public boolean awaitTermination ( Duration timeout ) {
    try {
      return terminated.await ( timeout.toNanos (), TimeUnit.NANOSECONDS );
    } catch ( InterruptedException e ) {
      Thread.currentThread ().interrupt ();
      return false;
    }
  }

  /**
   * Shuts down, waits up to {@code timeout} and cancels whatever is left.
   *
   * @param timeout grace period for queued and running jobs
   * @return true if the pool terminated within the grace period
   */
  public boolean shutdownGracefully ( Duration timeout ) {
    shutdown ();
    if ( awaitTermination ( timeout ) ) {
      return true;
    }
    logger.warn ( "Pool '{}' did not drain within {}, cancelling remaining jobs", name, timeout );
    shutdownNow ();
    return false;
  }

  @Override
  public void close () {
    shutdownGracefully ( Duration.ofSeconds ( 5 ) );
  }

  public String name () {
    return name;
  }

  public int workerCount () {
    return workerCount;
  }

  /**
   * @return number of jobs executing right now
   */
  public int activeCount () {
    return active.get ();
  }

  /**
   * @return number of jobs waiting for a worker
   */
  public int queuedCount () {
    lock.lock ();
    try {
      return pending.size ();
    } finally {
      lock.unlock ();
    }
  }

  /**
   * @return number of jobs workers have finished executing
   */
  public long completedCount () {
    return completed.get ();
  }

  public boolean isShutdown () {
    lock.lock ();
    try {
      return shutdown;
    } finally {
      lock.unlock ();
    }
  }

  /**
   * @return true once shut down and every worker has exited
   */
  public boolean isTerminated () {
    return terminated.getCount () == 0L;
  }

  private void withdraw ( DispatchJob < ? > job ) {
    lock.lock ();
    try {
      pending.remove ( job );
    } finally {
      lock.unlock ();
    }
  }

  private DispatchJob < ? > take () throws InterruptedException {
    lock.lock ();
    try {
      while ( pending.isEmpty () ) {
        if ( shutdown ) {
          return null;
        }
        nonEmpty.await ();
      }
      return pending.pollFirst ();
    } finally {
      lock.unlock ();
    }
  }

  private void work () {
    try {
      while ( true ) {
        DispatchJob < ? > job = take ();
        if ( job == null ) {
          break;
        }
        if ( !job.markRunning () ) {
          continue;
        }
        running.add ( job );
        active.incrementAndGet ();
        try {
          job.run ();
        } catch ( Throwable e ) {
          logger.error ( "Pool '{}' failed to settle job {}", name, job.id (), e );
        } finally {
          active.decrementAndGet ();
          running.remove ( job );
          completed.incrementAndGet ();
        }
      }
    } catch ( InterruptedException e ) {
      Thread.currentThread ().interrupt ();
      logger.warn ( "Worker '{}' interrupted, exiting", Thread.currentThread ().getName () );
    } finally {
      terminated.countDown ();
    }
  }

  @Override
  public String toString () {
    return "DispatcherPool[" + name + ", workers=" + workerCount + ", active=" + active.get () + "]";
  }

  /**
   * Builder for {@link DispatcherPool}.
   */
  public static final class Builder {
    private final String name;
    private       int    workers       = Runtime.getRuntime ().availableProcessors ();
    private       int    queueCapacity = 0;

    private Builder ( String name ) {
      Objects.requireNonNull ( name, "Pool name cannot be null" );
      if ( name.isBlank () ) {
        throw new IllegalArgumentException ( "Pool name cannot be blank" );
      }
      this.name = name;
    }

    /**
     * @param workers worker count; 0 means one per available processor
     */
    public Builder workers ( int workers ) {
      if ( workers < 0 ) {
        throw new IllegalArgumentException ( "Worker count cannot be negative: " + workers );
      }
      this.workers = workers == 0 ? Runtime.getRuntime ().availableProcessors () : workers;
      return this;
    }

    /**
     * @param queueCapacity maximum queued jobs; 0 means unbounded
     */
    public Builder queueCapacity ( int queueCapacity ) {
      if ( queueCapacity < 0 ) {
        throw new IllegalArgumentException ( "Queue capacity cannot be negative: " + queueCapacity );
      }
      this.queueCapacity = queueCapacity;
      return this;
    }

    public DispatcherPool build () {
      return new DispatcherPool ( this );
    }
  }
}
