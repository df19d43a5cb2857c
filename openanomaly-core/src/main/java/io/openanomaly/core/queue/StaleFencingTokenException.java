package io.openanomaly.core.queue;

/** Thrown when a job carries a fencing token lower than the highest the queue has seen. */
public class StaleFencingTokenException extends Exception {
  private final long token;
  private final long highestSeen;

  public StaleFencingTokenException(long token, long highestSeen) {
    super("fencing token " + token + " is lower than " + highestSeen);
    this.token = token;
    this.highestSeen = highestSeen;
  }

  public long getToken() {
    return token;
  }

  public long getHighestSeen() {
    return highestSeen;
  }
}
