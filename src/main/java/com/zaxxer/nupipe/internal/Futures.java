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

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Helpers for bridging the asynchronous read core to blocking callers.
 */
public final class Futures
{
   private Futures()
   {
   }

   /**
    * Block until {@code future} completes and return its value, rethrowing
    * the cause of a failure as it was originally thrown.
    *
    * @param future the future to wait on
    * @param <T> the value type
    * @return the value of the future
    * @throws IOException if the future failed with an {@code IOException}, or
    *         the waiting thread was interrupted
    */
   public static <T> T await(final CompletableFuture<T> future) throws IOException
   {
      try {
         return future.get();
      }
      catch (InterruptedException e) {
         Thread.currentThread().interrupt();
         final InterruptedIOException interrupted = new InterruptedIOException("Interrupted while waiting for process output");
         interrupted.initCause(e);
         throw interrupted;
      }
      catch (ExecutionException e) {
         throw rethrow(e.getCause());
      }
      catch (CancellationException e) {
         throw new IOException("Process output read was cancelled", e);
      }
   }

   /**
    * Strip the {@link CompletionException} and {@link ExecutionException}
    * wrappers that {@link CompletableFuture} adds around a failure.
    *
    * @param t a failure reported by a future
    * @return the underlying cause
    */
   public static Throwable unwrap(Throwable t)
   {
      while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
         t = t.getCause();
      }
      return t;
   }

   /**
    * Wrap a checked {@code IOException} so that it can leave a lambda passed
    * to a {@link CompletableFuture} stage.
    *
    * @param e the exception
    * @return an unchecked wrapper for {@code e}
    */
   public static CompletionException wrap(final IOException e)
   {
      return new CompletionException(e);
   }

   private static IOException rethrow(final Throwable cause) throws IOException
   {
      final Throwable t = unwrap(cause);
      if (t instanceof IOException) {
         return (IOException) t;
      }
      if (t instanceof RuntimeException) {
         throw (RuntimeException) t;
      }
      if (t instanceof Error) {
         throw (Error) t;
      }
      return new IOException(t);
   }
}
