/*
 * Copyright 2018 LinkedIn Corp.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not
 * use this file except in compliance with the License. You may obtain a copy of
 * the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations under
 * the License.
 */

package strata.layout.order;

import java.util.Arrays;

/**
 * Reusable int marks over handles 0..n-1, shared by many independent queries.
 *
 * <p>{@link #clear()} only resets the entries marked since the previous clear, so the cost of a
 * query is proportional to the number of handles it touched.
 */
public class MarkBuffer {

  public static final int UNMARKED = -1;

  private int[] marks;
  private int[] touched;
  private int touchedCount;

  public MarkBuffer(final int capacity) {
    this.marks = new int[Math.max(capacity, 1)];
    Arrays.fill(this.marks, UNMARKED);
    this.touched = new int[Math.max(capacity, 1)];
  }

  /**
   * Grows the buffer so that handles below {@code capacity} can be marked.
   */
  public void ensureCapacity(final int capacity) {
    if (capacity <= this.marks.length) {
      return;
    }
    final int newLength = Math.max(capacity, this.marks.length * 2);
    final int oldLength = this.marks.length;
    this.marks = Arrays.copyOf(this.marks, newLength);
    Arrays.fill(this.marks, oldLength, newLength, UNMARKED);
    this.touched = Arrays.copyOf(this.touched, newLength);
  }

  public boolean isMarked(final int handle) {
    return this.marks[handle] != UNMARKED;
  }

  /**
   * @return the mark of the handle or {@link #UNMARKED}
   */
  public int get(final int handle) {
    return this.marks[handle];
  }

  /**
   * Marks a handle with a non negative value.
   */
  public void mark(final int handle, final int value) {
    assert value != UNMARKED;
    if (this.marks[handle] == UNMARKED) {
      this.touched[this.touchedCount++] = handle;
    }
    this.marks[handle] = value;
  }

  /**
   * @return the number of handles marked since the last clear
   */
  public int touchedCount() {
    return this.touchedCount;
  }

  /**
   * @return the i-th handle marked since the last clear
   */
  public int touched(final int i) {
    return this.touched[i];
  }

  public void clear() {
    for (int i = 0; i < this.touchedCount; ++i) {
      this.marks[this.touched[i]] = UNMARKED;
    }
    this.touchedCount = 0;
  }
}
