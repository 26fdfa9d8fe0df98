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

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.OutputStream;
import java.util.concurrent.TimeUnit;

import org.junit.Assert;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(value = RunOnlyOnUnix.class)
public class ProcessOutputTest
{
   private static Process start(final String... command) throws Exception
   {
      return new ProcessBuilder(command).start();
   }

   @Test
   public void capturesStandardOutput() throws Exception
   {
      final ProcessOutput output = new ProcessOutput(start("sh", "-c", "printf AB; printf CD"));

      Assert.assertEquals("ABCD", output.getStandardOutput().readToEnd());
      Assert.assertEquals(0, output.waitFor());
   }

   @Test
   public void keepsStandardErrorSeparate() throws Exception
   {
      final ProcessOutput output = new ProcessOutput(start("sh", "-c", "echo out; echo err 1>&2; exit 3"));

      Assert.assertEquals("out", output.getStandardOutput().readLine());
      Assert.assertEquals("err", output.getStandardError().readLine());
      Assert.assertEquals(3, output.waitFor());
   }

   @Test
   public void unreadOutputNeverBlocksTheProcess() throws Exception
   {
      System.err.println("Starting test unreadOutputNeverBlocksTheProcess()");
      final ProcessOutput output = new ProcessOutput(start("sh", "-c", "head -c 1000000 /dev/zero"));

      // far more than an OS pipe holds, nobody reads until the process is gone
      Assert.assertEquals(0, (int) output.onExit().get(20, TimeUnit.SECONDS));
      Assert.assertEquals(1_000_000, output.getStandardOutput().getBaseStream().readAllBytes().length);
      System.err.println("Completed test unreadOutputNeverBlocksTheProcess()");
   }

   @Test
   public void discardedOutputLetsTheProcessFinish() throws Exception
   {
      final ProcessOutput output = new ProcessOutput(start("sh", "-c", "head -c 10000000 /dev/zero"));
      output.discard();

      output.onExit().get(20, TimeUnit.SECONDS);
      Assert.assertFalse(output.getProcess().isAlive());
   }

   @Test
   public void manualReadTalksToAnInteractiveProcess() throws Exception
   {
      final ProcessOutput output = new ProcessOutput(start("cat"));
      final ProcessStreamReader stdout = output.getStandardOutput();
      stdout.stopBuffering();

      final OutputStream stdin = output.getProcess().getOutputStream();
      for (int i = 0; i < 10; i++) {
         stdin.write(("ping " + i + "\n").getBytes(UTF_8));
         stdin.flush();
         Assert.assertEquals("ping " + i, stdout.readLine());
      }

      stdin.close();
      Assert.assertNull(stdout.readLine());
      Assert.assertEquals(0, output.waitFor());
   }
}
