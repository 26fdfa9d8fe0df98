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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Constants
{
   private static final Logger LOGGER = LoggerFactory.getLogger(Constants.class);

   public static final String BUFFER_CAPACITY_PROPERTY = "com.zaxxer.nupipe.bufferCapacity";
   public static final String POLL_INTERVAL_PROPERTY = "com.zaxxer.nupipe.pollIntervalMs";

   static final int DEFAULT_BUFFER_CAPACITY = 8 * 1024;
   static final int MIN_BUFFER_CAPACITY = 512;
   static final int MAX_BUFFER_CAPACITY = 1024 * 1024;

   static final long DEFAULT_POLL_INTERVAL_MS = 100;
   static final long MIN_POLL_INTERVAL_MS = 1;
   static final long MAX_POLL_INTERVAL_MS = 10_000;

   private Constants()
   {
   }

   /**
    * The size of the scratch buffer used by the drain loop for a single read
    * from the process pipe, and of the byte buffer behind each reader.
    *
    * @return the configured capacity, clamped to the supported range
    */
   public static int getBufferCapacity()
   {
      final String bufferCapacityProperty = System.getProperty(BUFFER_CAPACITY_PROPERTY);
      if (bufferCapacityProperty == null || bufferCapacityProperty.trim().isEmpty()) {
         return DEFAULT_BUFFER_CAPACITY;
      }
      try {
         final int value = Integer.parseInt(bufferCapacityProperty.trim());
         if (value < MIN_BUFFER_CAPACITY) {
            LOGGER.warn("Requested bufferCapacity of {} is less than min, defaulting to min value of {}", value, MIN_BUFFER_CAPACITY);
            return MIN_BUFFER_CAPACITY;
         }
         else if (value > MAX_BUFFER_CAPACITY) {
            LOGGER.warn("Requested bufferCapacity of {} is more than max, defaulting to max value of {}", value, MAX_BUFFER_CAPACITY);
            return MAX_BUFFER_CAPACITY;
         }
         else {
            return value;
         }
      }
      catch (NumberFormatException e) {
         return DEFAULT_BUFFER_CAPACITY;
      }
   }

   /**
    * How long the drain loop sleeps between mode checks while a manual
    * consumer is attached.
    *
    * @return the configured interval in milliseconds, clamped to the supported range
    */
   public static long getPollIntervalMillis()
   {
      final String pollIntervalProperty = System.getProperty(POLL_INTERVAL_PROPERTY);
      if (pollIntervalProperty == null || pollIntervalProperty.trim().isEmpty()) {
         return DEFAULT_POLL_INTERVAL_MS;
      }
      try {
         final long value = Long.parseLong(pollIntervalProperty.trim());
         if (value < MIN_POLL_INTERVAL_MS) {
            LOGGER.warn("Requested pollIntervalMs of {} is less than min, defaulting to min value of {}", value, MIN_POLL_INTERVAL_MS);
            return MIN_POLL_INTERVAL_MS;
         }
         else if (value > MAX_POLL_INTERVAL_MS) {
            LOGGER.warn("Requested pollIntervalMs of {} is more than max, defaulting to max value of {}", value, MAX_POLL_INTERVAL_MS);
            return MAX_POLL_INTERVAL_MS;
         }
         else {
            return value;
         }
      }
      catch (NumberFormatException e) {
         return DEFAULT_POLL_INTERVAL_MS;
      }
   }
}
