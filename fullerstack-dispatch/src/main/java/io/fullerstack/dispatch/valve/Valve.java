package io.fullerstack.dispatch.valve;

import io.fullerstack.dispatch.clock.ManualTicker;
import io.fullerstack.dispatch.clock.Ticker;

import java.time.Duration;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Valve - the ordered mailbox of one execution context.
 * <p>
 * < p >< b >Ordering:</b >
 * < ul >
 * < li >Every entry carries a due time (read from the {@link Ticker}) and a sequence number</li >
 * < li >Entries are released in (due time, sequence) order</li >
 * < li >Immediate entries are due at the instant they are posted, so they come out strictly FIFO</li >
 * < li >An entry posted by the consuming thread itself goes to the back, never runs inline</li >
 * </ul >
 * <p>
 * < p >< b >Design Pattern:</b >
 * < ul >
 * < li >Valve = lock-guarded priority queue + one consuming thread</li >
 * < li >Producers {@link #submit(Runnable)} from any thread and never block</li >
 * < li >The consumer parks in {@link #next(boolean)} until the head entry is due</li >
 * < li >The consumer reports {@link #finished()} so {@link #awaitIdle(Duration)} can wake</li >
 * </ul >
 * <p>
 * < p >< b >Usage:</b >
 * < pre >
 * Valve valve = new Valve ( "main", Ticker.system () );
 * valve.submit ( () -> System.out.println ( "Task 1" ) ); // any thread
 * Runnable task = valve.next ( true );                   // consumer thread
 * try { task.run (); } finally { valve.finished (); }
 * valve.close ();
 * </pre >
 */
public class Valve implements AutoCloseable {

  private final String name;
  private final Ticker ticker;

  private final PriorityQueue < Entry > entries = new PriorityQueue <> ();
  private final ReentrantLock           lock    = new ReentrantLock ();
  private final Condition               ready   = lock.newCondition ();
  private final Condition               idle    = lock.newCondition ();

  private long    sequence  = 0L;
  private boolean executing = false;
  private boolean closed    = false;

  /**
   * Creates a Valve ordered by the given ticker.
   *
   * @param name   descriptive name (used in diagnostics)
   * @param ticker time source for due times
   */
  public Valve ( String name, Ticker ticker ) {
    this.name = Objects.requireNonNull ( name, "Valve name cannot be null" );
    this.ticker = Objects.requireNonNull ( ticker, "Ticker cannot be null" );
    if ( ticker instanceof ManualTicker ) {
      ( (ManualTicker) ticker ).onAdvance ( this::wake );
    }
  }

  /**
   * Appends a task due immediately.
   *
   * @param task the task to execute
   * @return true if the task was accepted, false if the valve is closed
   */
  public boolean submit ( Runnable task ) {
    return schedule ( task, Duration.ZERO ).isPending ();
  }

  /**
   * Enqueues a task that becomes due after {@code delay}.
   *
   * @param task  the task to execute
   * @param delay non-negative delay, {@link Duration#ZERO} for immediate
   * @return handle to the entry; not pending if the valve is closed
   */
  public Posted schedule ( Runnable task, Duration delay ) {
    Objects.requireNonNull ( task, "Task cannot be null" );
    Objects.requireNonNull ( delay, "Delay cannot be null" );
    if ( delay.isNegative () ) {
      throw new IllegalArgumentException ( "Delay cannot be negative: " + delay );
    }
    lock.lock ();
    try {
      // Due time is read under the lock so immediate entries stay in posting order
      Entry entry = new Entry ( task, ticker.deadline ( delay ), sequence++ );
      if ( closed ) {
        entry.pending = false;
        return entry;
      }
      entries.add ( entry );
      ready.signalAll ();
      return entry;
    } finally {
      lock.unlock ();
    }
  }

  /**
   * Removes the oldest due task and marks the valve as executing.
   * <p>
   * < p >The caller must invoke {@link #finished()} once the task has run.
   *
   * @param block whether to park until a task becomes due
   * @return the next task, or null if the valve is closed (or, when not blocking, nothing is due)
   * @throws InterruptedException if interrupted while parked
   */
  public Runnable next ( boolean block ) throws InterruptedException {
    lock.lock ();
    try {
      while ( true ) {
        if ( closed ) {
          return null;
        }
        Entry head = entries.peek ();
        long now = ticker.nanos ();
        if ( head != null && head.due - now <= 0 ) {
          entries.poll ();
          head.pending = false;
          executing = true;
          return head.task;
        }
        if ( !block ) {
          return null;
        }
        if ( head == null ) {
          ready.await ();
        } else {
          ready.awaitNanos ( head.due - now );
        }
      }
    } finally {
      lock.unlock ();
    }
  }

  /**
   * Marks the task handed out by {@link #next(boolean)} as done and wakes idle waiters.
   */
  public void finished () {
    lock.lock ();
    try {
      executing = false;
      if ( !hasDueLocked () ) {
        idle.signalAll ();
      }
    } finally {
      lock.unlock ();
    }
  }

  /**
   * Blocks until no task is executing and none is due, or the valve closes.
   * Tasks scheduled for the future do not count.
   *
   * @param timeout maximum time to wait
   * @return true if the valve became idle (or closed) within the timeout
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitIdle ( Duration timeout ) throws InterruptedException {
    long remaining = timeout.toNanos ();
    lock.lock ();
    try {
      while ( !closed && ( executing || hasDueLocked () ) ) {
        if ( remaining <= 0L ) {
          return false;
        }
        remaining = idle.awaitNanos ( remaining );
      }
      return true;
    } finally {
      lock.unlock ();
    }
  }

  /**
   * @return true if nothing executes and no entry is due
   */
  public boolean isIdle () {
    lock.lock ();
    try {
      return !executing && !hasDueLocked ();
    } finally {
      lock.unlock ();
    }
  }

  /**
   * @return number of entries that are due now
   */
  public int dueCount () {
    lock.lock ();
    try {
      long now = ticker.nanos ();
      int count = 0;
      for ( Entry entry : entries ) {
        if ( entry.due - now <= 0 ) {
          count++;
        }
      }
      return count;
    } finally {
      lock.unlock ();
    }
  }

  /**
   * @return number of queued entries, due or not
   */
  public int size () {
    lock.lock ();
    try {
      return entries.size ();
    } finally {
      lock.unlock ();
    }
  }

  /**
   * Closes the valve: pending entries are discarded, later submissions are refused
   * and a parked consumer returns null.
   *
   * @return number of entries discarded
   */
  public int discard () {
    lock.lock ();
    try {
      if ( closed ) {
        return 0;
      }
      closed = true;
      int dropped = entries.size ();
      entries.forEach ( entry -> entry.pending = false );
      entries.clear ();
      ready.signalAll ();
      idle.signalAll ();
      return dropped;
    } finally {
      lock.unlock ();
    }
  }

  @Override
  public void close () {
    discard ();
  }

  /**
   * @return true once {@link #close()} was called
   */
  public boolean isClosed () {
    lock.lock ();
    try {
      return closed;
    } finally {
      lock.unlock ();
    }
  }

  /**
   * @return the ticker due times are read from
   */
  public Ticker ticker () {
    return ticker;
  }

  /**
   * @return the valve name
   */
  public String getName () {
    return name;
  }

  private boolean hasDueLocked () {
    Entry head = entries.peek ();
    return head != null && head.due - ticker.nanos () <= 0;
  }

  private void wake () {
    lock.lock ();
    try {
      ready.signalAll ();
    } finally {
      lock.unlock ();
    }
  }

  private boolean remove ( Entry entry ) {
    lock.lock ();
    try {
      if ( !entry.pending ) {
        return false;
      }
      entry.pending = false;
      entries.remove ( entry );
      if ( !executing && !hasDueLocked () ) {
        idle.signalAll ();
      }
      return true;
    } finally {
      lock.unlock ();
    }
  }

  @Override
  public String toString () {
    return "Valve[" + name + "]";
  }

  /**
   * Queue entry; guarded by the valve lock.
   */
  private final class Entry implements Posted, Comparable < Entry > {
    final Runnable task;
    final long     due;
    final long     seq;
    boolean pending = true;

    Entry ( Runnable task, long due, long seq ) {
      this.task = task;
      this.due = due;
      this.seq = seq;
    }

    @Override
    public int compareTo ( Entry other ) {
      int byDue = Long.compare ( due - other.due, 0L );
      return byDue != 0 ? byDue : Long.compare ( seq, other.seq );
    }

    @Override
    public boolean cancel () {
      return remove ( this );
    }

    @Override
    public boolean isPending () {
      lock.lock ();
      try {
        return pending;
      } finally {
        lock.unlock ();
      }
    }
  }
}
