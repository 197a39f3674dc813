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
import java.io.Reader;

/**
 * Character source for the text form of weights, with the failure
 * semantics of a C-style stream: once failed (a read error, or a parser
 * calling {@link #setError}) every later {@link #read} returns
 * {@link #EOF} until {@link #clearError} is called.
 *
 * @lucene.experimental
 */
public final class WeightTextInput {

  /** Returned by {@link #read} at end of input or after a failure. */
  public static final int EOF = -1;

  private final Reader in;
  private boolean error;

  public WeightTextInput(Reader in) {
    this.in = in;
  }

  /** Next character, or {@link #EOF}. */
  public int read() {
    if (error) {
      return EOF;
    }
    try {
      return in.read();
    } catch (IOException e) {
      error = true;
      return EOF;
    }
  }

  /** Marks this input as failed. */
  public void setError() {
    error = true;
  }

  /** Returns true if this input failed. */
  public boolean checkError() {
    return error;
  }

  public void clearError() {
    error = false;
  }

  /** Whitespace as understood by the weight grammar. */
  public static boolean isSpace(int c) {
    return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f' || c == 0x0B;
  }
}
