/*
 * Copyright (C) 2015 Brett Wooldridge
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.zaxxer.nupipe.internal;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A mutual exclusion lock whose waiters are futures rather than parked
 * threads.  {@link #acquire()} returns a future that completes with a
 * {@link Permit} once the lock is held; waiters are granted the lock in
 * FIFO order.  The holder must call {@link Permit#release()} exactly once;
 * additional calls on the same permit are ignored.
 * <p>
 * The next waiter's continuations run on the thread that releases the lock.
 *
 * @author Brett Wooldridge
 */
public final class AsyncLock
{
   private final Deque<CompletableFuture<Permit>> waiters;
   private boolean locked;

   public AsyncLock()
   {
      this.waiters = new ArrayDeque<>();
   }

   /**
    * Request the lock.
    *
    * @return a future completing with the permit once the lock is held
    */
   public CompletableFuture<Permit> acquire()
   {
      synchronized (this) {
         if (!locked) {
            locked = true;
            return CompletableFuture.completedFuture(new Permit());
         }

         final CompletableFuture<Permit> waiter = new CompletableFuture<>();
         waiters.add(waiter);
         return waiter;
      }
   }

   /**
    * @return true if some party currently holds the lock
    */
   public synchronized boolean isLocked()
   {
      return locked;
   }

   /**
    * @return the number of parties waiting for the lock
    */
   public synchronized int getQueueLength()
   {
      return waiters.size();
   }

   private void release()
   {
      final CompletableFuture<Permit> next;
      synchronized (this) {
         next = waiters.poll();
         if (next == null) {
            locked = false;
            return;
         }
      }

      // ownership passes directly to the next waiter, the lock stays held
      next.complete(new Permit());
   }

   /**
    * Proof of ownership of an {@link AsyncLock}.
    */
   public final class Permit implements AutoCloseable
   {
      private final AtomicBoolean released = new AtomicBoolean();

      private Permit()
      {
      }

      public void release()
      {
         if (released.compareAndSet(false, true)) {
            AsyncLock.this.release();
         }
      }

      @Override
      public void close()
      {
         release();
      }
   }
}
