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

import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Drives a repeated asynchronous step until it reports that it is finished.
 * Steps that complete synchronously are iterated in place instead of being
 * chained, so the depth of the call stack does not grow with the number of
 * iterations.
 *
 * @author Brett Wooldridge
 */
public final class AsyncLoop
{
   private AsyncLoop()
   {
   }

   /**
    * Run {@code step} repeatedly.  Each invocation returns a future that
    * completes with {@code true} to continue or {@code false} to stop.
    *
    * @param step the loop body
    * @return a future that completes normally when a step returns {@code false},
    *         or exceptionally with the first failure of a step
    */
   public static CompletableFuture<Void> run(final Supplier<CompletableFuture<Boolean>> step)
   {
      final CompletableFuture<Void> result = new CompletableFuture<>();
      iterate(step, result);
      return result;
   }

   private static void iterate(final Supplier<CompletableFuture<Boolean>> step, final CompletableFuture<Void> result)
   {
      while (true) {
         final CompletableFuture<Boolean> next;
         try {
            next = step.get();
         }
         catch (Throwable t) {
            result.completeExceptionally(t);
            return;
         }

         if (next.isDone() && !next.isCompletedExceptionally()) {
            if (!next.join()) {
               result.complete(null);
               return;
            }
            continue;
         }

         next.whenComplete((more, error) -> {
            if (error != null) {
               result.completeExceptionally(Futures.unwrap(error));
            }
            else if (more) {
               iterate(step, result);
            }
            else {
               result.complete(null);
            }
         });
         return;
      }
   }
}
