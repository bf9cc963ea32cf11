/*
 * Copyright 2018 University of California, Riverside
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package cn.edu.pku.asic.h3columnar.common.utils;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import static org.assertj.core.api.Assertions.assertThat;

class BitArrayTest {

  @Test
  void setRangeSpansWords() {
    BitArray bits = new BitArray(200);
    bits.setRange(3, 150, true);
    assertThat(bits.countOnes()).isEqualTo(147);
    assertThat(bits.get(2)).isFalse();
    assertThat(bits.get(3)).isTrue();
    assertThat(bits.get(149)).isTrue();
    assertThat(bits.get(150)).isFalse();
    bits.setRange(64, 128, false);
    assertThat(bits.countOnes()).isEqualTo(147 - 64);
  }

  @Test
  void bitmapUsesArrowBitOrder() {
    BitArray bits = new BitArray(10);
    bits.set(0, true);
    bits.set(3, true);
    bits.set(9, true);
    ByteBuffer bitmap = bits.toBitmap();
    assertThat(bitmap.remaining()).isEqualTo(2);
    assertThat(bitmap.get(0)).isEqualTo((byte) 0b00001001);
    assertThat(bitmap.get(1)).isEqualTo((byte) 0b00000010);
  }

  @Test
  void fromBitmapIgnoresPaddingBits() {
    ByteBuffer bitmap = ByteBuffer.allocate(2).order(ByteOrder.LITTLE_ENDIAN);
    bitmap.put((byte) 0xff).put((byte) 0xff).flip();
    BitArray bits = BitArray.fromBitmap(bitmap, 11);
    assertThat(bits.size()).isEqualTo(11);
    assertThat(bits.countOnes()).isEqualTo(11);
    assertThat(bits).isEqualTo(BitArray.filled(11, true));
  }

  @Test
  void bitmapSurvivesSerialization() {
    BitArray bits = new BitArray(130);
    for (int $i = 0; $i < 130; $i += 3)
      bits.set($i, true);
    assertThat(BitArray.fromBitmap(bits.toBitmap(), 130)).isEqualTo(bits);
  }

  @Test
  void copyFromUnalignedOffsets() {
    BitArray source = new BitArray(100);
    source.setRange(10, 20, true);
    BitArray target = new BitArray(100);
    target.copyFrom(70, source, 5, 20);
    assertThat(target.countOnes()).isEqualTo(10);
    assertThat(target.get(74)).isFalse();
    assertThat(target.get(75)).isTrue();
    assertThat(target.get(84)).isTrue();
    assertThat(target.get(85)).isFalse();
  }
}
