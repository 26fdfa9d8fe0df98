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

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The shared pool on which blocking pipe reads are performed when a handler
 * is not given an executor of its own.  Threads are daemons, so an
 * abandoned handler never keeps the JVM alive.
 */
public final class DrainExecutor
{
   private static final ExecutorService INSTANCE = Executors.newCachedThreadPool(new DrainThreadFactory());

   private DrainExecutor()
   {
   }

   public static ExecutorService get()
   {
      return INSTANCE;
   }

   private static final class DrainThreadFactory implements ThreadFactory
   {
      private final AtomicInteger count = new AtomicInteger();

      @Override
      public Thread newThread(final Runnable r)
      {
         final Thread thread = new Thread(r, "NuPipe Drain Thread-" + count.incrementAndGet());
         thread.setDaemon(true);
         return thread;
      }
   }
}
