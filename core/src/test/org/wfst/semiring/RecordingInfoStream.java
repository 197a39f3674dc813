/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.wfst.semiring;


import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.lucene.util.InfoStream;

/**
 * Collects the messages of every component.  Install it with
 * {@link InfoStream#setDefault(InfoStream)} and restore the previous
 * default when done.
 */
public final class RecordingInfoStream extends InfoStream {

  private final List<String> messages = Collections.synchronizedList(new ArrayList<>());

  @Override
  public void message(String component, String message) {
    messages.add(component + ": " + message);
  }

  @Override
  public boolean isEnabled(String component) {
    return true;
  }

  /** Messages logged under {@code component}, without the component prefix. */
  public List<String> messages(String component) {
    final String prefix = component + ": ";
    final List<String> result = new ArrayList<>();
    synchronized (messages) {
      for (String message : messages) {
        if (message.startsWith(prefix)) {
          result.add(message.substring(prefix.length()));
        }
      }
    }
    return result;
  }

  public void clear() {
    messages.clear();
  }

  @Override
  public void close() {
  }
}
