package com.securebeacon.client.lockout;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link LockoutChannel} delivering changes synchronously on the publishing thread to
 * subscribers in the same process. A failing subscriber is logged and does not stop delivery to
 * the others.
 */
public class InProcessLockoutChannel implements LockoutChannel {

  private static final Logger log = LoggerFactory.getLogger(InProcessLockoutChannel.class);

  private final List<Consumer<LockoutChange>> subscribers = new CopyOnWriteArrayList<>();

  @Override
  public void publish(LockoutChange change) {
    for (Consumer<LockoutChange> subscriber : subscribers) {
      try {
        subscriber.accept(change);
      } catch (RuntimeException e) {
        log.warn("Lockout subscriber failed for change from {}", change.sourceId(), e);
      }
    }
  }

  @Override
  public Subscription subscribe(Consumer<LockoutChange> subscriber) {
    subscribers.add(subscriber);
    return () -> subscribers.remove(subscriber);
  }
}
