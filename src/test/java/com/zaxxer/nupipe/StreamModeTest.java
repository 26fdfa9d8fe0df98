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

import static com.zaxxer.nupipe.StreamMode.BUFFERED_MANUAL_READ;
import static com.zaxxer.nupipe.StreamMode.BUFFERING;
import static com.zaxxer.nupipe.StreamMode.DISCARD;
import static com.zaxxer.nupipe.StreamMode.MANUAL_READ;

import org.junit.Assert;
import org.junit.Test;

public class StreamModeTest
{
   @Test
   public void bufferingMaySwitchToAnything()
   {
      for (StreamMode target : StreamMode.values()) {
         Assert.assertTrue(BUFFERING.canTransitionTo(target));
      }
   }

   @Test
   public void anythingMayDiscard()
   {
      for (StreamMode source : StreamMode.values()) {
         Assert.assertTrue(source.canTransitionTo(DISCARD));
      }
   }

   @Test
   public void manualModesSwitchBetweenEachOther()
   {
      Assert.assertTrue(MANUAL_READ.canTransitionTo(BUFFERED_MANUAL_READ));
      Assert.assertTrue(BUFFERED_MANUAL_READ.canTransitionTo(MANUAL_READ));
      Assert.assertFalse(MANUAL_READ.canTransitionTo(BUFFERING));
      Assert.assertFalse(BUFFERED_MANUAL_READ.canTransitionTo(BUFFERING));
   }

   @Test
   public void discardOnlyLeadsToItself()
   {
      Assert.assertFalse(DISCARD.canTransitionTo(BUFFERING));
      Assert.assertFalse(DISCARD.canTransitionTo(MANUAL_READ));
      Assert.assertFalse(DISCARD.canTransitionTo(BUFFERED_MANUAL_READ));
      Assert.assertTrue(DISCARD.canTransitionTo(DISCARD));
   }

   @Test
   public void onlyReadingModesAreManual()
   {
      Assert.assertFalse(BUFFERING.isManual());
      Assert.assertTrue(MANUAL_READ.isManual());
      Assert.assertTrue(BUFFERED_MANUAL_READ.isManual());
      Assert.assertFalse(DISCARD.isManual());
   }
}
