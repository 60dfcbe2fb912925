package io.fullerstack.dispatch.job;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;

import java.util.UUID;

/**
 * UUID-based identity of a {@link Job}.
 * <p>
 * < p >Use {@link #generate()} for new jobs or {@link #of(UUID)} to wrap an existing UUID.
 */
@Getter
@EqualsAndHashCode
public final class JobId {

  private final UUID uuid;

  private JobId ( @NonNull UUID uuid ) {
    this.uuid = uuid;
  }

  /**
   * @return a new random id
   */
  public static JobId generate () {
    return new JobId ( UUID.randomUUID () );
  }

  /**
   * @param uuid the UUID to wrap
   * @return id wrapping the UUID
   * @throws NullPointerException if uuid is null
   */
  public static JobId of ( UUID uuid ) {
    return new JobId ( uuid );
  }

  @Override
  public String toString () {
    return uuid.toString ();
  }
}
