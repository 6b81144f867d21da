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

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.Test;

public class MarkBufferTest {

  @Test
  public void clear_resets_touched_marks() {
    // given
    final MarkBuffer buffer = new MarkBuffer(4);
    buffer.mark(1, 7);
    buffer.mark(3, 0);
    buffer.mark(1, 8);

    // when
    final int touched = buffer.touchedCount();
    buffer.clear();

    // then
    assertThat(touched).isEqualTo(2);
    assertThat(buffer.isMarked(1)).isFalse();
    assertThat(buffer.get(3)).isEqualTo(MarkBuffer.UNMARKED);
    assertThat(buffer.touchedCount()).isZero();
  }

  @Test
  public void buffer_grows_on_demand() {
    // given
    final MarkBuffer buffer = new MarkBuffer(1);

    // when
    buffer.ensureCapacity(10);
    buffer.mark(9, 2);

    // then
    assertThat(buffer.get(9)).isEqualTo(2);
    assertThat(buffer.isMarked(5)).isFalse();
    assertThat(buffer.touched(0)).isEqualTo(9);
  }
}
