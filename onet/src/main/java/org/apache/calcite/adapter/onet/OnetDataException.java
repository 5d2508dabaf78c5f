/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.calcite.adapter.onet;

/**
 * Exception raised for caller and configuration errors in the O*NET adapter.
 *
 * <p>Row-level data-quality problems are never reported through this exception;
 * they are tagged with a rejection reason and routed to quarantine instead.
 * This exception covers problems that make a whole run meaningless, such as an
 * unreadable configuration file or a domain tag the lookup registries do not know.
 */
public class OnetDataException extends RuntimeException {

  /**
   * Creates a new OnetDataException with the specified message.
   */
  public OnetDataException(String message) {
    super(message);
  }

  /**
   * Creates a new OnetDataException with the specified message and cause.
   */
  public OnetDataException(String message, Throwable cause) {
    super(message, cause);
  }
}
