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

package com.zaxxer.nupipe;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zaxxer.nupipe.internal.AsyncLock;
import com.zaxxer.nupipe.internal.AsyncLoop;
import com.zaxxer.nupipe.internal.BufferChunk;
import com.zaxxer.nupipe.internal.Constants;
import com.zaxxer.nupipe.internal.DrainExecutor;
import com.zaxxer.nupipe.internal.Futures;

/**
 * Mediates between the output pipe of a child process and the code that
 * consumes that output.
 * <p>
 * A {@code ProcessStreamHandler} takes ownership of the pipe and immediately
 * starts draining it in the background, so the child process never blocks
 * writing into a full pipe.  The consumer chooses how the output is accessed
 * through the {@link StreamMode} of the handler:
 * <ul>
 * <li>{@link StreamMode#BUFFERING}: everything is captured in memory as it
 * arrives.  The {@link ProcessStreamReader} text operations simply read
 * whatever has been captured.</li>
 * <li>{@link StreamMode#MANUAL_READ}: nothing is captured, the consumer pulls
 * bytes directly from the pipe through the {@link ProcessInputStream}.  A
 * producer that outpaces the consumer will block.</li>
 * <li>{@link StreamMode#BUFFERED_MANUAL_READ}: the consumer pulls bytes while
 * the background drain keeps capturing periodically.</li>
 * <li>{@link StreamMode#DISCARD}: the output is dropped and the pipe is
 * closed.</li>
 * </ul>
 * The first read through the {@link ProcessInputStream} switches a buffering
 * handler to {@link StreamMode#BUFFERED_MANUAL_READ}, so nothing captured so
 * far is lost.
 * <p>
 * The outcome of draining is reported once by {@link #getCompletion()}.
 *
 * @author Brett Wooldridge
 */
public class ProcessStreamHandler
{
   private static final Logger LOGGER = LoggerFactory.getLogger(ProcessStreamHandler.class);

   final AsyncLock ioLock;

   private final Object modeLock;
   private StreamMode mode;

   private volatile InputStream source;
   private volatile BufferChunk buffer;
   private volatile boolean endOfStream;

   private final byte[] scratch;
   private final Executor executor;
   private final Executor pollExecutor;

   private final CompletableFuture<Void> completion;
   private final ProcessStreamReader reader;
   private final CompletableFuture<Void> drainTask;

   /**
    * Create a handler decoding the pipe contents as UTF-8.
    *
    * @param source the output pipe of the process
    */
   public ProcessStreamHandler(final InputStream source)
   {
      this(source, StandardCharsets.UTF_8);
   }

   /**
    * Create a handler using the shared drain executor and the configured poll
    * interval.
    *
    * @param source the output pipe of the process
    * @param charset the charset used by the {@link ProcessStreamReader}
    */
   public ProcessStreamHandler(final InputStream source, final Charset charset)
   {
      this(source, charset, DrainExecutor.get(), Constants.getPollIntervalMillis(), TimeUnit.MILLISECONDS);
   }

   /**
    * Create a handler and start draining {@code source}.
    *
    * @param source the output pipe of the process, owned by the handler from now on
    * @param charset the charset used by the {@link ProcessStreamReader}
    * @param executor the executor on which blocking pipe reads are performed
    * @param pollInterval how long the drain sleeps between mode checks while
    *        a manual consumer is attached
    * @param unit the unit of {@code pollInterval}
    */
   public ProcessStreamHandler(final InputStream source, final Charset charset, final Executor executor, final long pollInterval, final TimeUnit unit)
   {
      if (pollInterval <= 0) {
         throw new IllegalArgumentException("pollInterval must be positive");
      }

      this.source = Objects.requireNonNull(source, "source");
      Objects.requireNonNull(charset, "charset");
      this.executor = Objects.requireNonNull(executor, "executor");
      this.pollExecutor = CompletableFuture.delayedExecutor(pollInterval, unit, executor);
      this.ioLock = new AsyncLock();
      this.modeLock = new Object();
      this.mode = StreamMode.BUFFERING;
      this.scratch = new byte[Constants.getBufferCapacity()];
      this.completion = new CompletableFuture<>();

      final ProcessInputStream stream = new ProcessInputStream(this);
      this.reader = new ProcessStreamReaderImpl(this, stream, charset, Constants.getBufferCapacity());

      this.drainTask = AsyncLoop.run(this::drainStep);
      drainTask.whenComplete(this::onDrainComplete);
      completion.whenComplete((v, error) -> {
         if (error != null) {
            scheduleRelease();
         }
      });
   }

   /**
    * @return the text reader over the output of the process
    */
   public ProcessStreamReader getReader()
   {
      return reader;
   }

   /**
    * Returns a future that completes normally once the output has been
    * drained to its end (or discarded), or exceptionally with the first
    * failure reading the pipe.  Completing or cancelling the returned future
    * has no effect on the handler.
    *
    * @return the completion signal of this handler
    */
   public CompletableFuture<Void> getCompletion()
   {
      return completion.copy();
   }

   public StreamMode getMode()
   {
      synchronized (modeLock) {
         return mode;
      }
   }

   /**
    * @return true once the handler has been set to {@link StreamMode#DISCARD}
    */
   public boolean isDiscarded()
   {
      return getMode() == StreamMode.DISCARD;
   }

   /**
    * Switch the handler to another mode.
    *
    * @param requested the new mode
    * @throws StreamDisposedException if the handler has already been set to
    *         {@link StreamMode#DISCARD}
    * @throws IllegalStateException if a manual consumer is attached and
    *         {@code requested} is {@link StreamMode#BUFFERING}
    */
   void setMode(final StreamMode requested)
   {
      Objects.requireNonNull(requested, "mode");
      synchronized (modeLock) {
         if (mode == requested) {
            return;
         }

         if (!mode.canTransitionTo(requested)) {
            if (mode == StreamMode.DISCARD) {
               throw new StreamDisposedException("The stream has been set to discard its contents, so it cannot be used in another mode");
            }
            throw new IllegalStateException("The stream is already being read from, so it cannot be used in another mode");
         }

         LOGGER.debug("Switching process stream from {} to {}", mode, requested);
         mode = requested;

         if (requested == StreamMode.DISCARD) {
            // never take the I/O lock while holding the mode lock, and let the
            // drain loop finish with the pipe first
            scheduleRelease();
         }
      }
   }

   /**
    * Used by the first read of the {@link ProcessInputStream}: switch to
    * {@link StreamMode#BUFFERED_MANUAL_READ} unless a manual mode is already
    * active.
    */
   void ensureManualReadMode()
   {
      synchronized (modeLock) {
         if (!mode.isManual()) {
            setMode(StreamMode.BUFFERED_MANUAL_READ);
         }
      }
   }

   /**
    * Transfer ownership of the current buffer chunk to the caller, provided
    * it holds any bytes.  The handler forgets the chunk, and starts a new one
    * on its next drain.  Must be called while holding {@link #ioLock}.
    *
    * @return the rewound chunk, or {@code null} if there is nothing buffered
    */
   BufferChunk claimBuffer()
   {
      final BufferChunk chunk = buffer;
      if (chunk == null || chunk.size() == 0) {
         return null;
      }

      buffer = null;
      chunk.rewind();
      return chunk;
   }

   /**
    * Perform one read from the pipe on the handler's executor.  Must be
    * called while holding {@link #ioLock}; the lock must stay held until the
    * returned future completes.
    *
    * @return a future completing with the number of bytes read, or -1 at the
    *         end of the stream
    */
   CompletableFuture<Integer> readSource(final byte[] bytes, final int offset, final int length)
   {
      if (endOfStream) {
         return CompletableFuture.completedFuture(-1);
      }

      final InputStream in = source;
      if (in == null) {
         return CompletableFuture.failedFuture(new IOException("Stream closed"));
      }

      return CompletableFuture.supplyAsync(() -> {
         try {
            final int read = in.read(bytes, offset, length);
            if (read < 0) {
               LOGGER.debug("End of process stream reached");
               endOfStream = true;
               closeSource();
            }
            return read;
         }
         catch (IOException e) {
            throw Futures.wrap(e);
         }
      }, executor);
   }

   /**
    * Must be called while holding {@link #ioLock}.
    *
    * @return an estimate of the bytes the pipe can deliver without blocking
    */
   int availableFromSource()
   {
      final InputStream in = source;
      if (in == null || endOfStream) {
         return 0;
      }

      try {
         return in.available();
      }
      catch (IOException e) {
         // the next read of the pipe reports the failure
         LOGGER.debug("Unable to query process stream for available bytes", e);
         return 0;
      }
   }

   /**
    * @return the failure recorded by the Completion Signal, or {@code null}
    *         if reading has not failed
    */
   Throwable getFailure()
   {
      if (!completion.isCompletedExceptionally()) {
         return null;
      }

      try {
         completion.join();
         return null;
      }
      catch (CompletionException e) {
         return Futures.unwrap(e);
      }
   }

   void recordEndOfStream()
   {
      completion.complete(null);
   }

   void recordFailure(final Throwable cause)
   {
      if (completion.completeExceptionally(cause)) {
         LOGGER.warn("Reading process stream failed", cause);
      }
   }

   private CompletableFuture<Boolean> drainStep()
   {
      if (completion.isDone()) {
         return CompletableFuture.completedFuture(false);
      }

      switch (getMode()) {
      case MANUAL_READ:
         // the consumer has the pipe to itself, just check back later
         return pause();
      case BUFFERED_MANUAL_READ:
         return pause().thenCompose(more -> getMode() == StreamMode.BUFFERED_MANUAL_READ ? bufferStep() : CompletableFuture.completedFuture(true));
      case BUFFERING:
         return bufferStep();
      case DISCARD:
      default:
         // cleanup happens in discardContent(), once this loop is done with the pipe
         return CompletableFuture.completedFuture(false);
      }
   }

   private CompletableFuture<Boolean> pause()
   {
      return CompletableFuture.supplyAsync(() -> true, pollExecutor);
   }

   private CompletableFuture<Boolean> bufferStep()
   {
      return ioLock.acquire().thenCompose(permit -> {
         final CompletableFuture<Boolean> step;
         try {
            if (getMode() == StreamMode.DISCARD) {
               step = CompletableFuture.completedFuture(false);
            }
            else {
               // a new chunk is needed whenever the consumer stream has claimed the previous one
               if (buffer == null) {
                  buffer = new BufferChunk();
               }

               step = readSource(scratch, 0, scratch.length).thenApply(read -> {
                  if (read < 0) {
                     return false;
                  }
                  buffer.append(scratch, 0, read);
                  return true;
               });
            }
         }
         catch (RuntimeException e) {
            permit.release();
            throw e;
         }

         return step.whenComplete((more, error) -> permit.release());
      });
   }

   private void onDrainComplete(final Void result, final Throwable error)
   {
      if (error == null) {
         completion.complete(null);
         return;
      }

      final Throwable cause = Futures.unwrap(error);
      if (isDiscarded()) {
         // closing the pipe is how a discard stops things, a failing read is expected
         LOGGER.debug("Ignoring failure of discarded process stream", cause);
         completion.complete(null);
      }
      else {
         recordFailure(cause);
      }
   }

   private void scheduleRelease()
   {
      drainTask.whenCompleteAsync((v, e) -> discardContent(), executor);
   }

   private void discardContent()
   {
      LOGGER.debug("Discarding process stream content");

      ioLock.acquire().thenAccept(permit -> {
         try (permit) {
            final BufferChunk chunk = buffer;
            if (chunk != null) {
               buffer = null;
               chunk.dispose();
            }

            closeSource();
         }

         LOGGER.debug("Finished discarding process stream content");
      });
   }

   private void closeSource()
   {
      final InputStream in = source;
      if (in != null) {
         source = null;
         try {
            in.close();
         }
         catch (IOException e) {
            LOGGER.warn("Failed to close process stream", e);
         }
      }
   }
}
