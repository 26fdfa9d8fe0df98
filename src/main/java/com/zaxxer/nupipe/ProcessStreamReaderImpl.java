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
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

import com.zaxxer.nupipe.internal.AsyncLoop;
import com.zaxxer.nupipe.internal.Futures;

/**
 * Decodes the bytes of a {@link ProcessInputStream}.  All operations are
 * built on {@link ProcessInputStream#readAsync(byte[], int, int)}.
 *
 * @author Brett Wooldridge
 */
final class ProcessStreamReaderImpl extends ProcessStreamReader
{
   private final ProcessStreamHandler handler;
   private final ProcessInputStream stream;
   private final CharsetDecoder decoder;

   // both buffers are kept flipped, ready to be drained
   private final ByteBuffer bytes;
   private final CharBuffer chars;

   private boolean endOfInput;
   private boolean flushed;
   private boolean skipLineFeed;
   private volatile boolean closed;

   ProcessStreamReaderImpl(final ProcessStreamHandler handler, final ProcessInputStream stream, final Charset charset, final int capacity)
   {
      this.handler = handler;
      this.stream = stream;
      this.decoder = charset.newDecoder()
                            .onMalformedInput(CodingErrorAction.REPLACE)
                            .onUnmappableCharacter(CodingErrorAction.REPLACE);
      this.bytes = ByteBuffer.allocate(capacity);
      this.chars = CharBuffer.allocate(capacity);
      bytes.flip();
      chars.flip();
   }

   @Override
   public ProcessInputStream getBaseStream()
   {
      return stream;
   }

   @Override
   public void discard()
   {
      handler.setMode(StreamMode.DISCARD);
   }

   @Override
   public void stopBuffering()
   {
      handler.setMode(StreamMode.MANUAL_READ);
   }

   @Override
   public CompletableFuture<Integer> peekAsync()
   {
      return whenOpen(() -> fillAsync().thenApply(available -> available ? (int) chars.get(chars.position()) : -1));
   }

   @Override
   public CompletableFuture<Integer> readAsync()
   {
      return whenOpen(() -> fillAsync().thenApply(available -> available ? (int) chars.get() : -1));
   }

   @Override
   public CompletableFuture<Integer> readAsync(final char[] cbuf, final int off, final int len)
   {
      Objects.requireNonNull(cbuf, "cbuf");
      Objects.checkFromIndexSize(off, len, cbuf.length);
      if (len == 0) {
         return CompletableFuture.completedFuture(0);
      }

      return whenOpen(() -> fillAsync().thenApply(available -> {
         if (!available) {
            return -1;
         }
         final int n = Math.min(len, chars.remaining());
         chars.get(cbuf, off, n);
         return n;
      }));
   }

   @Override
   public CompletableFuture<Integer> readBlockAsync(final char[] cbuf, final int off, final int len)
   {
      Objects.requireNonNull(cbuf, "cbuf");
      Objects.checkFromIndexSize(off, len, cbuf.length);
      if (len == 0) {
         return CompletableFuture.completedFuture(0);
      }

      final int[] total = new int[1];
      return whenOpen(() -> AsyncLoop.run(() -> readAsync(cbuf, off + total[0], len - total[0]).thenApply(n -> {
         if (n < 0) {
            return false;
         }
         total[0] += n;
         return total[0] < len;
      })).thenApply(v -> total[0] == 0 ? -1 : total[0]));
   }

   @Override
   public CompletableFuture<String> readLineAsync()
   {
      final LineScan scan = new LineScan();
      return whenOpen(() -> AsyncLoop.run(() -> fillAsync().thenApply(scan::consume))
                                     .thenApply(v -> scan.sawInput ? scan.line.toString() : null));
   }

   @Override
   public CompletableFuture<String> readToEndAsync()
   {
      final StringBuilder text = new StringBuilder();
      return whenOpen(() -> AsyncLoop.run(() -> fillAsync().thenApply(available -> {
         if (available) {
            text.append(chars);
            chars.position(chars.limit());
         }
         return available;
      })).thenApply(v -> text.toString()));
   }

   @Override
   public boolean ready() throws IOException
   {
      if (closed || handler.isDiscarded()) {
         throw new IOException("Stream closed");
      }
      return chars.hasRemaining() && !skipLineFeed;
   }

   @Override
   public void close()
   {
      if (!closed) {
         closed = true;
         stream.close();
      }
   }

   private <T> CompletableFuture<T> whenOpen(final Supplier<CompletableFuture<T>> operation)
   {
      if (closed || handler.isDiscarded()) {
         return CompletableFuture.failedFuture(new IOException("Stream closed"));
      }
      return operation.get();
   }

   /**
    * Make decoded characters available.
    *
    * @return a future completing with true once {@link #chars} has data, or
    *         false at the end of the stream
    */
   private CompletableFuture<Boolean> fillAsync()
   {
      return AsyncLoop.run(this::fillStep).thenApply(v -> chars.hasRemaining());
   }

   private CompletableFuture<Boolean> fillStep()
   {
      if (chars.hasRemaining()) {
         if (skipLineFeed) {
            // the previous line ended with '\r', swallow the '\n' of a "\r\n" pair
            skipLineFeed = false;
            if (chars.get(chars.position()) == '\n') {
               chars.get();
               return CompletableFuture.completedFuture(true);
            }
         }
         return CompletableFuture.completedFuture(false);
      }

      if (flushed) {
         return CompletableFuture.completedFuture(false);
      }

      decode();
      if (chars.hasRemaining() || flushed) {
         return CompletableFuture.completedFuture(true);
      }

      bytes.compact();
      final int position = bytes.position();
      return stream.readAsync(bytes.array(), bytes.arrayOffset() + position, bytes.remaining()).handle((read, error) -> {
         if (error == null) {
            if (read < 0) {
               endOfInput = true;
            }
            else {
               bytes.position(position + read);
            }
         }
         bytes.flip();

         if (error != null) {
            throw new CompletionException(Futures.unwrap(error));
         }
         return true;
      });
   }

   private void decode()
   {
      chars.compact();
      final CoderResult result = decoder.decode(bytes, chars, endOfInput);
      if (endOfInput && result.isUnderflow()) {
         decoder.flush(chars);
         flushed = true;
      }
      chars.flip();
   }

   /**
    * Accumulates one line across as many fills as it takes.
    */
   private final class LineScan
   {
      final StringBuilder line = new StringBuilder();
      boolean sawInput;

      /**
       * @return true if more input is needed to finish the line
       */
      boolean consume(final boolean available)
      {
         if (!available) {
            return false;
         }

         sawInput = true;
         final int start = chars.position();
         final int limit = chars.limit();
         for (int i = start; i < limit; i++) {
            final char c = chars.get(i);
            if (c == '\n' || c == '\r') {
               line.append(chars.array(), chars.arrayOffset() + start, i - start);
               chars.position(i + 1);
               skipLineFeed = c == '\r';
               return false;
            }
         }

         line.append(chars.array(), chars.arrayOffset() + start, limit - start);
         chars.position(limit);
         return true;
      }
   }
}
