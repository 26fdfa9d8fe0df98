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
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.util.concurrent.TimeUnit;

/**
 * An in-memory stand-in for an OS pipe.  Writers block while the pipe is
 * full, readers block while it is empty, and closing the read end makes
 * pending and later writes fail the way a broken pipe does.
 */
public class BoundedPipe
{
   private final byte[] ring;
   private final InputStream source;
   private final OutputStream sink;

   private int head;
   private int count;
   private long bytesWritten;
   private int sourceCloses;
   private boolean writerClosed;
   private boolean readerClosed;
   private IOException readFailure;

   public BoundedPipe(final int capacity)
   {
      this.ring = new byte[capacity];
      this.source = new Source();
      this.sink = new Sink();
   }

   /** @return the read end, handed to the code under test */
   public InputStream source()
   {
      return source;
   }

   /** @return the write end, used by the simulated process */
   public OutputStream sink()
   {
      return sink;
   }

   public synchronized long bytesWritten()
   {
      return bytesWritten;
   }

   /** @return the number of bytes written but not yet read */
   public synchronized int buffered()
   {
      return count;
   }

   public synchronized int sourceCloses()
   {
      return sourceCloses;
   }

   /**
    * Make every following read of the source fail with {@code failure}.
    */
   public synchronized void failReads(final IOException failure)
   {
      readFailure = failure;
      notifyAll();
   }

   public synchronized boolean awaitSourceClosed(final long timeout, final TimeUnit unit) throws InterruptedException
   {
      final long deadline = System.nanoTime() + unit.toNanos(timeout);
      while (sourceCloses == 0) {
         final long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
         if (remaining <= 0) {
            return false;
         }
         wait(remaining);
      }
      return true;
   }

   public synchronized boolean awaitDrained(final long timeout, final TimeUnit unit) throws InterruptedException
   {
      final long deadline = System.nanoTime() + unit.toNanos(timeout);
      while (count > 0) {
         final long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
         if (remaining <= 0) {
            return false;
         }
         wait(remaining);
      }
      return true;
   }

   /**
    * Write {@code data} from a new thread, optionally closing the write end
    * afterwards.  A broken pipe ends the thread quietly.
    */
   public Thread startProducer(final byte[] data, final int chunkSize, final boolean closeWhenDone)
   {
      final Thread producer = new Thread(() -> {
         try {
            for (int offset = 0; offset < data.length; offset += chunkSize) {
               sink.write(data, offset, Math.min(chunkSize, data.length - offset));
            }
            if (closeWhenDone) {
               sink.close();
            }
         }
         catch (IOException e) {
            // broken pipe, the reader went away
         }
      }, "BoundedPipe producer");
      producer.setDaemon(true);
      producer.start();
      return producer;
   }

   private synchronized void write(final byte[] bytes, int offset, int length) throws IOException
   {
      if (writerClosed) {
         throw new IOException("Write end closed");
      }

      while (length > 0) {
         while (count == ring.length && !readerClosed) {
            try {
               wait();
            }
            catch (InterruptedException e) {
               Thread.currentThread().interrupt();
               throw new InterruptedIOException();
            }
         }
         if (readerClosed) {
            throw new IOException("Broken pipe");
         }

         final int tail = (head + count) % ring.length;
         final int n = Math.min(length, Math.min(ring.length - count, ring.length - tail));
         System.arraycopy(bytes, offset, ring, tail, n);
         count += n;
         bytesWritten += n;
         offset += n;
         length -= n;
         notifyAll();
      }
   }

   private synchronized int read(final byte[] bytes, final int offset, final int length) throws IOException
   {
      if (length == 0) {
         return 0;
      }

      while (count == 0 && !writerClosed && !readerClosed && readFailure == null) {
         try {
            wait();
         }
         catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException();
         }
      }

      if (readerClosed) {
         throw new IOException("Stream closed");
      }
      if (readFailure != null) {
         throw readFailure;
      }
      if (count == 0) {
         return -1;
      }

      final int n = Math.min(length, Math.min(count, ring.length - head));
      System.arraycopy(ring, head, bytes, offset, n);
      head = (head + n) % ring.length;
      count -= n;
      notifyAll();
      return n;
   }

   private synchronized void closeSource()
   {
      sourceCloses++;
      readerClosed = true;
      notifyAll();
   }

   private synchronized void closeSink()
   {
      writerClosed = true;
      notifyAll();
   }

   private class Source extends InputStream
   {
      @Override
      public int read() throws IOException
      {
         final byte[] single = new byte[1];
         final int n = read(single, 0, 1);
         return n < 0 ? -1 : single[0] & 0xff;
      }

      @Override
      public int read(final byte[] bytes, final int offset, final int length) throws IOException
      {
         return BoundedPipe.this.read(bytes, offset, length);
      }

      @Override
      public int available()
      {
         return buffered();
      }

      @Override
      public void close()
      {
         closeSource();
      }
   }

   private class Sink extends OutputStream
   {
      @Override
      public void write(final int b) throws IOException
      {
         write(new byte[] { (byte) b }, 0, 1);
      }

      @Override
      public void write(final byte[] bytes, final int offset, final int length) throws IOException
      {
         BoundedPipe.this.write(bytes, offset, length);
      }

      @Override
      public void close()
      {
         closeSink();
      }
   }
}
