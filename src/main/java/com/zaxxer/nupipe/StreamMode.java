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

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;

/**
 * The access discipline applied to the output of a process stream.
 *
 * @author Brett Wooldridge
 */
public enum StreamMode
{
   /**
    * The contents of the stream are buffered internally so that the process
    * never blocks on a full pipe.  This is the initial mode.
    */
   BUFFERING,

   /**
    * The contents of the stream are read manually through the
    * {@link ProcessInputStream}.  Nothing is buffered, so a process that
    * writes faster than the consumer reads will fill the pipe and block.
    */
   MANUAL_READ,

   /**
    * The contents of the stream are read manually, while a background drain
    * still buffers periodically so that the process never stays blocked.
    */
   BUFFERED_MANUAL_READ,

   /**
    * The contents of the stream are dropped and the pipe is closed.  This
    * mode is terminal.
    */
   DISCARD;

   private static final Map<StreamMode, EnumSet<StreamMode>> TRANSITIONS = new EnumMap<>(StreamMode.class);

   static {
      TRANSITIONS.put(BUFFERING, EnumSet.allOf(StreamMode.class));
      TRANSITIONS.put(MANUAL_READ, EnumSet.of(MANUAL_READ, BUFFERED_MANUAL_READ, DISCARD));
      TRANSITIONS.put(BUFFERED_MANUAL_READ, EnumSet.of(BUFFERED_MANUAL_READ, MANUAL_READ, DISCARD));
      TRANSITIONS.put(DISCARD, EnumSet.of(DISCARD));
   }

   /**
    * @return true for the two modes in which a consumer pulls bytes itself
    */
   public boolean isManual()
   {
      return this == MANUAL_READ || this == BUFFERED_MANUAL_READ;
   }

   /**
    * Test whether a handler in this mode may switch to {@code target}.
    * Requesting the current mode is always legal and has no effect.
    *
    * @param target the requested mode
    * @return true if the transition is legal
    */
   public boolean canTransitionTo(final StreamMode target)
   {
      return TRANSITIONS.get(this).contains(target);
   }
}
