package io.fullerstack.dispatch.context;

import io.fullerstack.dispatch.clock.Ticker;
import io.fullerstack.dispatch.current.CurrentContext;
import io.fullerstack.dispatch.valve.Posted;
import io.fullerstack.dispatch.valve.Valve;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative loop that owns a {@link Valve} and drains it in order.
 * <p>
 * < p >This is the Looper/Handler pair of the runtime: producers on any thread
 * {@link #post(Runnable)} continuations, and exactly one thread at a time runs
 * them, either by calling {@link #run()} itself or through {@link #start()}.
 * <p>
 * < p >< b >Guarantees:</b >
 * < ul >
 * < li >FIFO per context; re-entrant posts go to the back of the mailbox</li >
 * < li >A continuation always runs to completion before the next one is taken</li >
 * < li >A throwing continuation is reported to the {@link ErrorSink}; the loop keeps going</li >
 * < li >The running thread is bound in {@link CurrentContext} while the loop runs</li >
 * </ul >
 * <p>
 * < p >< b >Usage:</b >
 * < pre >
 * LoopingContext main = LoopingContext.builder ( "main" ).build ();
 * main.post ( () -> render ( model ) );
 * main.run (); // blocks until main.stop ()
 * </pre >
 */
public class LoopingContext implements ExecutionContext, AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger ( LoopingContext.class );

  private final String    name;
  private final Valve     valve;
  private final ErrorSink errorSink;
  private final Duration  stopTimeout;

  private final    AtomicReference < Thread > owner = new AtomicReference <> ();
  private volatile Thread                     thread;
  private volatile boolean                    stopped;

  private LoopingContext ( Builder builder ) {
    this.name = builder.name;
    this.valve = new Valve ( builder.name, builder.ticker );
    this.errorSink = builder.errorSink;
    this.stopTimeout = builder.stopTimeout;
  }

  /**
   * Creates a context with the default ticker and a logging error sink.
   *
   * @param name context label
   * @return the new, not yet running, context
   */
  public static LoopingContext create ( String name ) {
    return builder ( name ).build ();
  }

  /**
   * @param name context label
   * @return a builder for a context with that label
   */
  public static Builder builder ( String name ) {
    return new Builder ( name );
  }

  @Override
  public String name () {
    return name;
  }

  @Override
  public boolean post ( Runnable continuation ) {
    Objects.requireNonNull ( continuation, "Continuation cannot be null" );
    boolean accepted = valve.submit ( continuation );
    if ( !accepted ) {
      logger.debug ( "Context '{}' is stopped, continuation refused", name );
    }
    return accepted;
  }

  @Override
  public Posted postDelayed ( Runnable continuation, Duration delay ) {
    Objects.requireNonNull ( continuation, "Continuation cannot be null" );
    Posted posted = valve.schedule ( continuation, delay );
    if ( !posted.isPending () ) {
      logger.debug ( "Context '{}' is stopped, delayed continuation refused", name );
    }
    return posted;
  }

  @Override
  public void run () {
    Thread current = Thread.currentThread ();
    if ( !owner.compareAndSet ( null, current ) ) {
      throw new IllegalStateException (
        "Context '" + name + "' is already running on thread '" + owner.get ().getName () + "'"
      );
    }
    ExecutionContext previous = CurrentContext.bind ( this );
    logger.debug ( "Context '{}' loop started on thread '{}'", name, current.getName () );
    try {
      while ( !stopped ) {
        Runnable continuation = valve.next ( true );
        if ( continuation == null ) {
          break;
        }
        execute ( continuation );
      }
    } catch ( InterruptedException e ) {
      Thread.currentThread ().interrupt ();
      logger.warn ( "Context '{}' loop interrupted, stopping", name );
      stop ();
    } finally {
      CurrentContext.restore ( previous );
      owner.set ( null );
      logger.debug ( "Context '{}' loop exited", name );
    }
  }

  /**
   * Runs the loop on a dedicated platform thread named after this context.
   *
   * @return this context
   * @throws IllegalStateException if already started or stopped
   */
  public synchronized LoopingContext start () {
    if ( stopped ) {
      throw new IllegalStateException ( "Context '" + name + "' is stopped" );
    }
    if ( thread != null ) {
      throw new IllegalStateException ( "Context '" + name + "' is already started" );
    }
    Thread loop = new Thread ( this::run, name );
    thread = loop;
    loop.start ();
    return this;
  }

  /**
   * Runs every continuation that is due right now on the calling thread, without blocking.
   * Continuations posted while draining are left for the next drain.
   *
   * @return number of continuations executed
   * @throws IllegalStateException if another thread is running this context
   */
  public int drain () {
    Thread current = Thread.currentThread ();
    boolean acquired = owner.compareAndSet ( null, current );
    if ( !acquired && owner.get () != current ) {
      throw new IllegalStateException ( "Context '" + name + "' is running on another thread" );
    }
    ExecutionContext previous = CurrentContext.bind ( this );
    int executed = 0;
    try {
      int due = valve.dueCount ();
      while ( executed < due && !stopped ) {
        Runnable continuation = valve.next ( false );
        if ( continuation == null ) {
          break;
        }
        execute ( continuation );
        executed++;
      }
    } catch ( InterruptedException e ) {
      // next(false) never parks
      Thread.currentThread ().interrupt ();
    } finally {
      CurrentContext.restore ( previous );
      if ( acquired ) {
        owner.set ( null );
      }
    }
    return executed;
  }

  /**
   * Blocks until this context has nothing due and nothing executing.
   *
   * @param timeout maximum time to wait
   * @return true if idle within the timeout
   * @throws IllegalStateException if called from the context's own thread
   */
  public boolean awaitIdle ( Duration timeout ) {
    if ( isCurrent () ) {
      throw new IllegalStateException (
        "Cannot call Context::awaitIdle from within context '" + name + "'s thread"
      );
    }
    try {
      return valve.awaitIdle ( timeout );
    } catch ( InterruptedException e ) {
      Thread.currentThread ().interrupt ();
      throw new IllegalStateException ( "Context '" + name + "' awaitIdle interrupted", e );
    }
  }

  @Override
  public void stop () {
    if ( stopped ) {
      return;
    }
    stopped = true;
    int dropped = valve.discard ();
    logger.debug ( "Context '{}' stopped, {} pending continuation(s) dropped", name, dropped );
  }

  /**
   * Stops the loop and, if it was {@link #start() started}, joins its thread.
   */
  @Override
  public void close () {
    stop ();
    Thread loop = thread;
    if ( loop != null && loop != Thread.currentThread () ) {
      try {
        loop.join ( stopTimeout.toMillis () );
        if ( loop.isAlive () ) {
          logger.warn ( "Context '{}' thread still running after {}", name, stopTimeout );
        }
      } catch ( InterruptedException e ) {
        Thread.currentThread ().interrupt ();
      }
    }
  }

  @Override
  public boolean isCurrent () {
    return owner.get () == Thread.currentThread ();
  }

  /**
   * @return true once {@link #stop()} was called
   */
  public boolean isStopped () {
    return stopped;
  }

  /**
   * @return number of queued continuations, due or not
   */
  public int pendingCount () {
    return valve.size ();
  }

  /**
   * @return the time source for delayed posts
   */
  public Ticker ticker () {
    return valve.ticker ();
  }

  private void execute ( Runnable continuation ) {
    try {
      continuation.run ();
    } catch ( Throwable error ) {
      if ( error instanceof OutOfMemoryError ) {
        throw (OutOfMemoryError) error;
      }
      try {
        errorSink.report ( this, error );
      } catch ( RuntimeException sinkFailure ) {
        logger.error ( "Error sink of context '{}' failed", name, sinkFailure );
      }
    } finally {
      valve.finished ();
    }
  }

  @Override
  public String toString () {
    return "LoopingContext[" + name + "]";
  }

  /**
   * Builder for {@link LoopingContext}.
   */
  public static final class Builder {
    private final String    name;
    private       Ticker    ticker      = Ticker.system ();
    private       ErrorSink errorSink   = ErrorSink.logging ();
    private       Duration  stopTimeout = Duration.ofSeconds ( 1 );

    private Builder ( String name ) {
      Objects.requireNonNull ( name, "Context name cannot be null" );
      if ( name.isBlank () ) {
        throw new IllegalArgumentException ( "Context name cannot be blank" );
      }
      this.name = name;
    }

    public Builder ticker ( Ticker ticker ) {
      this.ticker = Objects.requireNonNull ( ticker, "Ticker cannot be null" );
      return this;
    }

    public Builder errorSink ( ErrorSink errorSink ) {
      this.errorSink = Objects.requireNonNull ( errorSink, "Error sink cannot be null" );
      return this;
    }

    public Builder stopTimeout ( Duration stopTimeout ) {
      this.stopTimeout = Objects.requireNonNull ( stopTimeout, "Stop timeout cannot be null" );
      return this;
    }

    public LoopingContext build () {
      return new LoopingContext ( this );
    }
  }
}
