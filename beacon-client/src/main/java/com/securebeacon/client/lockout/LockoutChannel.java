package com.securebeacon.client.lockout;

import java.util.function.Consumer;

/**
 * Publish/subscribe channel that tells sibling trackers a cached lockout entry changed, so they
 * re-read the cache instead of polling the backend.
 */
public interface LockoutChannel {

  /**
   * Delivers the change to every current subscriber, including the publisher's own.
   *
   * @param change the change
   */
  void publish(LockoutChange change);

  /**
   * Registers a subscriber.
   *
   * @param subscriber receives each published change
   * @return a handle that unsubscribes when closed
   */
  Subscription subscribe(Consumer<LockoutChange> subscriber);

  /**
   * Subscription handle.
   */
  interface Subscription extends AutoCloseable {

    @Override
    void close();
  }
}
