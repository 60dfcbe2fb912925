package io.fullerstack.dispatch.sink;

import io.fullerstack.dispatch.context.ExecutionContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Value sink confined to one {@link ExecutionContext}.
 * <p>
 * < p >Stands in for presentation state: values are only accepted on the thread running
 * the bound context, and are forwarded to a downstream consumer and kept in a buffer
 * until {@link #drain()}.
 * <p>
 * < p >The buffer is guarded by the sink's monitor so other threads can inspect it.
 *
 * @param < T > the value type
 */
public class ContextSink < T > implements Consumer < T > {

  private final ExecutionContext context;
  private final Consumer < ? super T > downstream;
  private final List < T >             buffer = new ArrayList <> ();

  /**
   * Creates a sink that only buffers.
   *
   * @param context the only context allowed to feed this sink
   */
  public ContextSink ( ExecutionContext context ) {
    this ( context, value -> {
    } );
  }

  /**
   * Creates a sink that buffers and forwards.
   *
   * @param context    the only context allowed to feed this sink
   * @param downstream receives each accepted value
   */
  public ContextSink ( ExecutionContext context, Consumer < ? super T > downstream ) {
    this.context = Objects.requireNonNull ( context, "Context cannot be null" );
    this.downstream = Objects.requireNonNull ( downstream, "Downstream cannot be null" );
  }

  /**
   * Accepts a value.
   *
   * @param value the value
   * @throws IllegalStateException if the caller is not running the bound context
   */
  @Override
  public void accept ( T value ) {
    if ( !context.isCurrent () ) {
      throw new IllegalStateException (
        "Sink bound to context '" + context.name () + "' invoked from thread '" + Thread.currentThread ().getName () + "'"
      );
    }
    synchronized ( this ) {
      buffer.add ( value );
    }
    downstream.accept ( value );
  }

  /**
   * @return values accepted since the last drain; the buffer is cleared
   */
  public synchronized List < T > drain () {
    List < T > captured = Collections.unmodifiableList ( new ArrayList <> ( buffer ) );
    buffer.clear ();
    return captured;
  }

  /**
   * @return values accepted since the last drain, without clearing
   */
  public synchronized List < T > values () {
    return Collections.unmodifiableList ( new ArrayList <> ( buffer ) );
  }

  public ExecutionContext context () {
    return context;
  }
}
