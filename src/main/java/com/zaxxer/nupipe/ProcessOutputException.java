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

/**
 * Signals that one of the output streams of a process failed while it was
 * being drained, and that its output was not deliberately discarded.
 */
public class ProcessOutputException extends IOException
{
   private static final long serialVersionUID = -2103650935311457291L;

   private final String streamName;

   public ProcessOutputException(final String streamName, final Throwable cause)
   {
      super("Reading process " + streamName + " failed: " + cause, cause);
      this.streamName = streamName;
   }

   /**
    * @return the name of the failed stream, {@code "stdout"} or {@code "stderr"}
    */
   public String getStreamName()
   {
      return streamName;
   }
}
