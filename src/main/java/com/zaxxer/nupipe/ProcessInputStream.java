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
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

import com.zaxxer.nupipe.internal.BufferChunk;
import com.zaxxer.nupipe.internal.Futures;

/**
 * The consumer's view of the raw bytes written by a process.
 * <p>
 * Reads first return whatever the {@link ProcessStreamHandler} has buffered,
 * then read directly from the pipe.  The first read switches a buffering
 * handler to {@link StreamMode#BUFFERED_MANUAL_READ}.  Closing this stream
 * discards the remaining output.
 * <p>
 * This stream cannot be marked, reset or written.
 *
 * @author Brett Wooldridge
 */
public final class ProcessInputStream extends InputStream
{
   private static final int UNCHECKED = 0;
   private static final int MODE_CHECKED = 1;
   private static final int CLOSED = -1;

   private final ProcessStreamHandler handler;
   private final AtomicInteger state;

   // written only while holding handler.ioLock
   private volatile BufferChunk buffer;

   ProcessInputStream(final ProcessStreamHandler handler)
   {
      this.handler = handler;
      this.state = new AtomicInteger(UNCHECKED);
   }

   @Override
   public int read() throws IOException
   {
      final byte[] single = new byte[1];
      int read;
      do {
         read = read(single, 0, 1);
      }
      while (read == 0);

      return read < 0 ? -1 : single[0] & 0xff;
   }

   @Override
   public int read(final byte[] bytes, final int offset, final int length) throws IOException
   {
      return Futures.await(readAsync(bytes, offset, length));
   }

   /**
    * Read up to {@code length} bytes without blocking the calling thread.
    * Buffered bytes are copied first; if they do not satisfy the request, one
    * direct read from the pipe supplies the rest.
    *
    * @param bytes the destination array
    * @param offset the offset into {@code bytes}
    * @param length the maximum number of bytes to read
    * @return a future completing with the number of bytes read, or -1 at the
    *         end of the stream
    */
   public CompletableFuture<Integer> readAsync(final byte[] bytes, final int offset, final int length)
   {
      Objects.requireNonNull(bytes, "bytes");
      Objects.checkFromIndexSize(offset, length, bytes.length);

      try {
         ensureManualReadMode();
      }
      catch (IOException e) {
         return CompletableFuture.failedFuture(e);
      }

      if (length == 0) {
         return CompletableFuture.completedFuture(0);
      }

      return handler.ioLock.acquire().thenCompose(permit -> {
         CompletableFuture<Integer> read;
         try {
            read = readLocked(bytes, offset, length);
         }
         catch (IOException | RuntimeException e) {
            read = CompletableFuture.failedFuture(e);
         }

         return read.whenComplete((n, error) -> permit.release());
      });
   }

   /**
    * @return the number of unread bytes already claimed from the handler's
    *         buffer, an estimate while a read is in progress
    */
   @Override
   public int available() throws IOException
   {
      if (state.get() == CLOSED) {
         throw new IOException("Stream closed");
      }

      final BufferChunk chunk = buffer;
      return chunk == null ? 0 : Math.max(0, chunk.remaining());
   }

   @Override
   public boolean markSupported()
   {
      return false;
   }

   /**
    * Close this stream, setting the handler to {@link StreamMode#DISCARD}.
    */
   @Override
   public void close()
   {
      if (state.getAndSet(CLOSED) != CLOSED) {
         handler.setMode(StreamMode.DISCARD);

         handler.ioLock.acquire().thenAccept(permit -> {
            try (permit) {
               if (buffer != null) {
                  buffer.dispose();
                  buffer = null;
               }
            }
         });
      }
   }

   private CompletableFuture<Integer> readLocked(final byte[] bytes, final int offset, final int length) throws IOException
   {
      if (state.get() == CLOSED || handler.isDiscarded()) {
         throw new IOException("Stream closed");
      }

      final Throwable failure = handler.getFailure();
      if (failure != null) {
         // the teardown has released the pipe, report why
         throw failure instanceof IOException ? (IOException) failure : new IOException(failure);
      }

      final int fromBuffers = readFromBuffers(bytes, offset, length);
      if (fromBuffers == length || (fromBuffers > 0 && handler.availableFromSource() <= 0)) {
         // never make a caller that already has bytes wait on the pipe
         return CompletableFuture.completedFuture(fromBuffers);
      }

      return handler.readSource(bytes, offset + fromBuffers, length - fromBuffers).handle((read, error) -> {
         if (error != null) {
            final Throwable cause = Futures.unwrap(error);
            if (handler.isDiscarded()) {
               throw new CompletionException(new IOException("Stream closed", cause));
            }
            handler.recordFailure(cause);
            throw new CompletionException(cause);
         }

         if (read < 0) {
            handler.recordEndOfStream();
            return fromBuffers > 0 ? fromBuffers : -1;
         }

         return fromBuffers + read;
      });
   }

   /**
    * Copy bytes from the privately owned chunk, claiming the handler's chunk
    * whenever ours runs dry.
    */
   private int readFromBuffers(final byte[] bytes, final int offset, final int length)
   {
      int copied = 0;
      while (copied < length) {
         if (buffer == null) {
            buffer = handler.claimBuffer();
            if (buffer == null) {
               break;
            }
         }

         final int read = buffer.read(bytes, offset + copied, length - copied);
         if (read > 0) {
            copied += read;
         }
         else {
            buffer.dispose();
            buffer = null;
         }
      }

      return copied;
   }

   private void ensureManualReadMode() throws IOException
   {
      switch (state.get()) {
      case UNCHECKED:
         try {
            handler.ensureManualReadMode();
         }
         catch (StreamDisposedException e) {
            throw new IOException("Stream closed", e);
         }
         state.compareAndSet(UNCHECKED, MODE_CHECKED);
         break;
      case CLOSED:
         throw new IOException("Stream closed");
      default:
         break;
      }
   }
}
