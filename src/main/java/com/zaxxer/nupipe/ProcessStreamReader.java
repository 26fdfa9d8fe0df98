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
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import com.zaxxer.nupipe.internal.Futures;

/**
 * Text access to the output of a process.
 * <p>
 * Every read operation exists in a blocking form and in an asynchronous form
 * returning a {@link CompletableFuture}.  The asynchronous forms never tie up
 * a thread while waiting for the process; the blocking forms simply wait for
 * their asynchronous counterpart.
 * <p>
 * By default the output is buffered in the background as the process
 * produces it, and the reader consumes that buffer.  Call
 * {@link #stopBuffering()} before reading to consume the output directly with
 * bounded memory, or {@link #discard()} to throw it away.
 * <p>
 * A reader serves a single consumer; it is not safe to issue concurrent
 * reads.
 *
 * @author Brett Wooldridge
 */
public abstract class ProcessStreamReader extends Reader
{
   protected ProcessStreamReader()
   {
   }

   /**
    * @return the byte stream this reader decodes
    */
   public abstract ProcessInputStream getBaseStream();

   /**
    * Discard the remaining output of the process and close its pipe.
    */
   public abstract void discard();

   /**
    * Stop buffering the output in the background.  From now on the process
    * can only make progress while the consumer reads, which bounds the memory
    * used for its output.
    *
    * @throws StreamDisposedException if the output has been discarded
    */
   public abstract void stopBuffering();

   public abstract CompletableFuture<Integer> peekAsync();

   public abstract CompletableFuture<Integer> readAsync();

   public abstract CompletableFuture<Integer> readAsync(char[] cbuf, int off, int len);

   public abstract CompletableFuture<Integer> readBlockAsync(char[] cbuf, int off, int len);

   public abstract CompletableFuture<String> readLineAsync();

   public abstract CompletableFuture<String> readToEndAsync();

   /**
    * Return the next character without consuming it.
    *
    * @return the next character, or -1 at the end of the stream
    * @throws IOException if reading the output fails
    */
   public int peek() throws IOException
   {
      return Futures.await(peekAsync());
   }

   @Override
   public int read() throws IOException
   {
      return Futures.await(readAsync());
   }

   @Override
   public int read(final char[] cbuf, final int off, final int len) throws IOException
   {
      return Futures.await(readAsync(cbuf, off, len));
   }

   /**
    * Read characters until {@code len} characters have been read or the end
    * of the stream is reached.
    *
    * @return the number of characters read, or -1 if the stream was already
    *         at its end
    * @throws IOException if reading the output fails
    */
   public int readBlock(final char[] cbuf, final int off, final int len) throws IOException
   {
      return Futures.await(readBlockAsync(cbuf, off, len));
   }

   /**
    * Read a line terminated by {@code \n}, {@code \r} or {@code \r\n}.
    *
    * @return the line without its terminator, or {@code null} at the end of
    *         the stream
    * @throws IOException if reading the output fails
    */
   public String readLine() throws IOException
   {
      return Futures.await(readLineAsync());
   }

   /**
    * @return all remaining output of the process
    * @throws IOException if reading the output fails
    */
   public String readToEnd() throws IOException
   {
      return Futures.await(readToEndAsync());
   }

   /**
    * Returns a lazily populated {@code Stream} of the remaining lines, as
    * {@link java.io.BufferedReader#lines()} does.
    *
    * @return the remaining lines
    */
   public Stream<String> lines()
   {
      final Iterator<String> iterator = new Iterator<String>() {
         private String nextLine;

         @Override
         public boolean hasNext()
         {
            if (nextLine != null) {
               return true;
            }

            try {
               nextLine = readLine();
               return nextLine != null;
            }
            catch (IOException e) {
               throw new UncheckedIOException(e);
            }
         }

         @Override
         public String next()
         {
            if (nextLine != null || hasNext()) {
               final String line = nextLine;
               nextLine = null;
               return line;
            }
            throw new NoSuchElementException();
         }
      };

      return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL), false);
   }
}
