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

import java.util.Arrays;

/**
 * An append-only byte region with a read cursor.  A chunk is filled by the
 * drain loop and later handed, as a whole, to the consumer stream which then
 * reads it from the start.  Instances are not thread-safe; callers guard them
 * with the handler's I/O lock.
 *
 * @author Brett Wooldridge
 */
public final class BufferChunk
{
   private static final int INITIAL_CAPACITY = 256;
   private static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;

   private byte[] data;
   private int count;
   private int position;

   public BufferChunk()
   {
      this.data = new byte[INITIAL_CAPACITY];
   }

   /**
    * Append bytes at the end of this chunk, growing it as needed.
    *
    * @param bytes the source array
    * @param offset the offset into {@code bytes}
    * @param length the number of bytes to append
    */
   public void append(final byte[] bytes, final int offset, final int length)
   {
      ensureNotDisposed();
      if (length > data.length - count) {
         final int required = count + length;
         if (required < 0) {
            throw new OutOfMemoryError("Buffered process output exceeds " + Integer.MAX_VALUE + " bytes");
         }
         final int doubled = data.length > MAX_CAPACITY / 2 ? MAX_CAPACITY : data.length << 1;
         data = Arrays.copyOf(data, Math.max(doubled, required));
      }
      System.arraycopy(bytes, offset, data, count, length);
      count += length;
   }

   /**
    * Copy unread bytes into {@code bytes}, advancing the read cursor.
    *
    * @param bytes the destination array
    * @param offset the offset into {@code bytes}
    * @param length the maximum number of bytes to copy
    * @return the number of bytes copied, 0 once the chunk is exhausted
    */
   public int read(final byte[] bytes, final int offset, final int length)
   {
      ensureNotDisposed();
      final int n = Math.min(length, count - position);
      if (n <= 0) {
         return 0;
      }
      System.arraycopy(data, position, bytes, offset, n);
      position += n;
      return n;
   }

   /** Move the read cursor back to the first byte. */
   public void rewind()
   {
      position = 0;
   }

   /** @return the total number of bytes appended so far */
   public int size()
   {
      return count;
   }

   /** @return the number of bytes between the read cursor and the end */
   public int remaining()
   {
      return data == null ? 0 : count - position;
   }

   public boolean isDisposed()
   {
      return data == null;
   }

   /**
    * Release the backing array.  Any further append or read fails.
    */
   public void dispose()
   {
      data = null;
      count = 0;
      position = 0;
   }

   private void ensureNotDisposed()
   {
      if (data == null) {
         throw new IllegalStateException("Buffer chunk has been disposed");
      }
   }
}
