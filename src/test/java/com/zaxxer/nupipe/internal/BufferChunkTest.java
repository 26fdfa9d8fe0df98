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

import static java.nio.charset.StandardCharsets.US_ASCII;

import java.util.Arrays;

import org.junit.Assert;
import org.junit.Test;

public class BufferChunkTest
{
   @Test
   public void growsPastItsInitialCapacity()
   {
      final BufferChunk chunk = new BufferChunk();
      final byte[] block = new byte[100];
      for (int i = 0; i < 50; i++) {
         Arrays.fill(block, (byte) i);
         chunk.append(block, 0, block.length);
      }
      Assert.assertEquals(5000, chunk.size());
      Assert.assertEquals(5000, chunk.remaining());

      final byte[] out = new byte[5000];
      Assert.assertEquals(5000, chunk.read(out, 0, out.length));
      for (int i = 0; i < 5000; i++) {
         Assert.assertEquals("byte " + i, (byte) (i / 100), out[i]);
      }
   }

   @Test
   public void readAdvancesTheCursorUntilExhausted()
   {
      final BufferChunk chunk = new BufferChunk();
      final byte[] text = "hello world".getBytes(US_ASCII);
      chunk.append(text, 6, 5);

      final byte[] out = new byte[3];
      Assert.assertEquals(3, chunk.read(out, 0, 3));
      Assert.assertEquals("wor", new String(out, US_ASCII));
      Assert.assertEquals(2, chunk.remaining());
      Assert.assertEquals(2, chunk.read(out, 1, 2));
      Assert.assertEquals("wld", new String(out, US_ASCII));
      Assert.assertEquals(0, chunk.read(out, 0, 3));
   }

   @Test
   public void rewindRestartsFromTheFirstByte()
   {
      final BufferChunk chunk = new BufferChunk();
      chunk.append(new byte[] { 1, 2, 3 }, 0, 3);
      chunk.read(new byte[3], 0, 3);
      Assert.assertEquals(0, chunk.remaining());

      chunk.rewind();
      final byte[] out = new byte[3];
      Assert.assertEquals(3, chunk.read(out, 0, 3));
      Assert.assertArrayEquals(new byte[] { 1, 2, 3 }, out);
   }

   @Test
   public void disposedChunkRejectsUse()
   {
      final BufferChunk chunk = new BufferChunk();
      chunk.append(new byte[] { 1 }, 0, 1);
      chunk.dispose();

      Assert.assertTrue(chunk.isDisposed());
      Assert.assertEquals(0, chunk.remaining());
      Assert.assertThrows(IllegalStateException.class, () -> chunk.read(new byte[1], 0, 1));
      Assert.assertThrows(IllegalStateException.class, () -> chunk.append(new byte[1], 0, 1));
   }
}
