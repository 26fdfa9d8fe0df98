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

/**
 * Thrown when a process stream that has been set to discard its contents is
 * asked to switch to another mode.
 */
public class StreamDisposedException extends IllegalStateException
{
   private static final long serialVersionUID = 4376390285117349312L;

   public StreamDisposedException(final String message)
   {
      super(message);
   }
}
