package io.openanomaly.core.queue;

/** A job handed to a consumer, with the number of times it has been delivered so far. */
public final class Delivery {
  private final Job job;
  private final int deliveryCount;

  public Delivery(Job job, int deliveryCount) {
    this.job = job;
    this.deliveryCount = deliveryCount;
  }

  public Job getJob() {
    return job;
  }

  /** 1 on the first delivery. */
  public int getDeliveryCount() {
    return deliveryCount;
  }

  public boolean isRedelivery() {
    return deliveryCount > 1;
  }
}
