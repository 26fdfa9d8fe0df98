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
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zaxxer.nupipe.internal.Futures;

/**
 * Attaches a {@link ProcessStreamHandler} to both output pipes of a started
 * {@link Process}, and reports the outcome of the whole invocation.
 * <p>
 * The process itself, including its standard input, remains the caller's
 * responsibility.
 *
 * <pre>
 * Process process = new ProcessBuilder("git", "status").start();
 * ProcessOutput output = new ProcessOutput(process);
 * output.getStandardError().discard();
 * String status = output.getStandardOutput().readToEnd();
 * int exitCode = output.waitFor();
 * </pre>
 *
 * @author Brett Wooldridge
 */
public class ProcessOutput
{
   private static final Logger LOGGER = LoggerFactory.getLogger(ProcessOutput.class);

   private final Process process;
   private final ProcessStreamHandler stdout;
   private final ProcessStreamHandler stderr;
   private final CompletableFuture<Integer> exit;

   public ProcessOutput(final Process process)
   {
      this(process, StandardCharsets.UTF_8);
   }

   public ProcessOutput(final Process process, final Charset charset)
   {
      this(process, new ProcessStreamHandler(process.getInputStream(), charset), new ProcessStreamHandler(process.getErrorStream(), charset));
   }

   ProcessOutput(final Process process, final ProcessStreamHandler stdout, final ProcessStreamHandler stderr)
   {
      this.process = Objects.requireNonNull(process, "process");
      this.stdout = stdout;
      this.stderr = stderr;

      final CompletableFuture<Void> drained = CompletableFuture.allOf(settled(stdout), settled(stderr));
      this.exit = process.onExit().thenCombine(drained, (p, v) -> {
         verify(stdout, "stdout");
         verify(stderr, "stderr");

         final int exitCode = p.exitValue();
         LOGGER.debug("Process exited with status {}, output drained", exitCode);
         return exitCode;
      });
   }

   public Process getProcess()
   {
      return process;
   }

   public ProcessStreamReader getStandardOutput()
   {
      return stdout.getReader();
   }

   public ProcessStreamReader getStandardError()
   {
      return stderr.getReader();
   }

   /**
    * Returns a future that completes with the exit code of the process once
    * it has exited and both of its output streams have been drained or
    * discarded.  It fails with a {@link ProcessOutputException} if reading an
    * output stream failed, unless that stream had been discarded.
    *
    * @return the outcome of the invocation
    */
   public CompletableFuture<Integer> onExit()
   {
      return exit.copy();
   }

   /**
    * Block until {@link #onExit()} completes.
    *
    * @return the exit code of the process
    * @throws IOException if an output stream failed, or the wait was interrupted
    */
   public int waitFor() throws IOException
   {
      return Futures.await(exit);
   }

   /**
    * Discard both output streams.
    */
   public void discard()
   {
      stdout.getReader().discard();
      stderr.getReader().discard();
   }

   private static CompletableFuture<Void> settled(final ProcessStreamHandler handler)
   {
      return handler.getCompletion().handle((v, error) -> null);
   }

   /**
    * A stream that failed counts against the invocation, unless the caller
    * has discarded it by the time the process is done.
    */
   private static void verify(final ProcessStreamHandler handler, final String streamName)
   {
      try {
         handler.getCompletion().join();
      }
      catch (CompletionException e) {
         if (!handler.isDiscarded()) {
            throw new CompletionException(new ProcessOutputException(streamName, Futures.unwrap(e)));
         }
      }
   }
}
