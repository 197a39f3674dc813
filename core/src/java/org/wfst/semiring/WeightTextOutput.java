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


import java.io.IOException;

/**
 * Minimal character sink for the text form of weights.  Like
 * {@link java.io.PrintWriter} it never throws: a failure (an
 * {@link IOException} from the target, or a caller calling
 * {@link #setError}) is sticky and turns every later write into a no-op
 * until {@link #clearError} is called.
 *
 * @lucene.experimental
 */
public final class WeightTextOutput {

  private final Appendable out;
  private boolean error;

  public WeightTextOutput(Appendable out) {
    this.out = out;
  }

  public void write(char c) {
    if (error) {
      return;
    }
    try {
      out.append(c);
    } catch (IOException e) {
      error = true;
    }
  }

  public void write(CharSequence s) {
    if (error) {
      return;
    }
    try {
      out.append(s);
    } catch (IOException e) {
      error = true;
    }
  }

  /** Marks this output as failed. */
  public void setError() {
    error = true;
  }

  /** Returns true if this output failed. */
  public boolean checkError() {
    return error;
  }

  public void clearError() {
    error = false;
  }
}
