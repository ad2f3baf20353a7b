// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.msgpack;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.HexFormat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BufferPackerTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  @FunctionalInterface
  interface Packing {
    int pack(Buffer buf, int index);
  }

  static String hex(Packing packing) {
    final Buffer buf = Buffer.allocate(4);
    final int written = packing.pack(buf, 0);
    return HexFormat.of().formatHex(buf.toByteArray(written));
  }

  @ParameterizedTest
  @CsvSource({
      "0, 00",
      "1, 01",
      "127, 7f",
      "128, cc80",
      "255, ccff",
      "256, cd0100",
      "65535, cdffff",
      "65536, ce00010000",
      "2147483647, ce7fffffff",
      "-1, ff",
      "-32, e0",
      "-33, d0df",
      "-128, d080",
      "-129, d1ff7f",
      "-32768, d18000",
      "-32769, d2ffff7fff",
      "-2147483648, d280000000"
  })
  void intUsesSmallestForm(int value, String expected) {
    assertThat(hex((buf, index) -> BufferPacker.packInt(buf, index, value))).isEqualTo(expected);
    assertThat(hex((buf, index) -> BufferPacker.packLong(buf, index, value))).isEqualTo(expected);
  }

  @ParameterizedTest
  @CsvSource({
      "4294967295, ceffffffff",
      "4294967296, cf0000000100000000",
      "9223372036854775807, cf7fffffffffffffff",
      "-2147483649, d3ffffffff7fffffff",
      "-9223372036854775808, d38000000000000000"
  })
  void longBeyondIntRange(long value, String expected) {
    assertThat(hex((buf, index) -> BufferPacker.packLong(buf, index, value))).isEqualTo(expected);
  }

  @Test
  void byteAndShortShareTheIntegerFamily() {
    assertThat(hex((buf, index) -> BufferPacker.packByte(buf, index, (byte) 127))).isEqualTo("7f");
    assertThat(hex((buf, index) -> BufferPacker.packByte(buf, index, (byte) -32))).isEqualTo("e0");
    assertThat(hex((buf, index) -> BufferPacker.packByte(buf, index, (byte) -33))).isEqualTo("d0df");
    assertThat(hex((buf, index) -> BufferPacker.packShort(buf, index, (short) 200))).isEqualTo("ccc8");
    assertThat(hex((buf, index) -> BufferPacker.packShort(buf, index, (short) 300))).isEqualTo("cd012c");
    assertThat(hex((buf, index) -> BufferPacker.packShort(buf, index, Short.MIN_VALUE))).isEqualTo("d18000");
  }

  @Test
  void nilAndBooleans() {
    assertThat(hex(BufferPacker::packNil)).isEqualTo("c0");
    assertThat(hex((buf, index) -> BufferPacker.packBoolean(buf, index, false))).isEqualTo("c2");
    assertThat(hex((buf, index) -> BufferPacker.packBoolean(buf, index, true))).isEqualTo("c3");
  }

  @Test
  void floatsAlwaysKeepTheirWidth() {
    assertThat(hex((buf, index) -> BufferPacker.packFloat(buf, index, 1.5f))).isEqualTo("ca3fc00000");
    assertThat(hex((buf, index) -> BufferPacker.packDouble(buf, index, 1.5d))).isEqualTo("cb3ff8000000000000");
  }

  @Test
  void bigIntegerUpToUnsigned64Bits() {
    assertThat(hex((buf, index) -> BufferPacker.packBigInteger(buf, index, BigInteger.valueOf(5)))).isEqualTo("05");
    assertThat(hex((buf, index) -> BufferPacker.packBigInteger(buf, index, BigInteger.valueOf(Long.MIN_VALUE))))
        .isEqualTo("d38000000000000000");
    final BigInteger maxUnsigned = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);
    assertThat(hex((buf, index) -> BufferPacker.packBigInteger(buf, index, maxUnsigned))).isEqualTo("cfffffffffffffffff");
  }

  @Test
  void bigIntegerTooWideIsRejected() {
    final Buffer buf = Buffer.allocate(16);
    assertThatThrownBy(() -> BufferPacker.packBigInteger(buf, 0, BigInteger.ONE.shiftLeft(64)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("2^64-1");
    final BigInteger belowLongMin = BigInteger.valueOf(Long.MIN_VALUE).subtract(BigInteger.ONE);
    assertThatThrownBy(() -> BufferPacker.packBigInteger(buf, 0, belowLongMin))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void stringHeaderBoundaries() {
    assertThat(hex((buf, index) -> BufferPacker.packString(buf, index, ""))).isEqualTo("a0");
    assertThat(hex((buf, index) -> BufferPacker.packString(buf, index, "abc"))).isEqualTo("a3616263");
    assertThat(headerOf(31, BufferPacker::packRawStringHeader)).isEqualTo("bf");
    assertThat(headerOf(32, BufferPacker::packRawStringHeader)).isEqualTo("d920");
    assertThat(headerOf(255, BufferPacker::packRawStringHeader)).isEqualTo("d9ff");
    assertThat(headerOf(256, BufferPacker::packRawStringHeader)).isEqualTo("da0100");
    assertThat(headerOf(65536, BufferPacker::packRawStringHeader)).isEqualTo("db00010000");
  }

  @Test
  void stringLengthCountsUtf8Bytes() {
    // two bytes per character in UTF-8
    final String s = "é".repeat(16);
    final Buffer buf = Buffer.allocate(8);
    final int written = BufferPacker.packString(buf, 0, s);
    assertThat(written).isEqualTo(2 + 32);
    assertThat(buf.readByte(0)).isEqualTo(Code.STR8);
    assertThat(buf.readByte(1)).isEqualTo((byte) 32);
  }

  @Test
  void arrayAndMapHeaderBoundaries() {
    assertThat(headerOf(0, BufferPacker::packArrayHeader)).isEqualTo("90");
    assertThat(headerOf(15, BufferPacker::packArrayHeader)).isEqualTo("9f");
    assertThat(headerOf(16, BufferPacker::packArrayHeader)).isEqualTo("dc0010");
    assertThat(headerOf(65535, BufferPacker::packArrayHeader)).isEqualTo("dcffff");
    assertThat(headerOf(65536, BufferPacker::packArrayHeader)).isEqualTo("dd00010000");
    assertThat(headerOf(0, BufferPacker::packMapHeader)).isEqualTo("80");
    assertThat(headerOf(15, BufferPacker::packMapHeader)).isEqualTo("8f");
    assertThat(headerOf(16, BufferPacker::packMapHeader)).isEqualTo("de0010");
    assertThat(headerOf(65536, BufferPacker::packMapHeader)).isEqualTo("df00010000");
  }

  @Test
  void binaryHeaderHasNoFixForm() {
    assertThat(headerOf(0, BufferPacker::packBinaryHeader)).isEqualTo("c400");
    assertThat(headerOf(255, BufferPacker::packBinaryHeader)).isEqualTo("c4ff");
    assertThat(headerOf(256, BufferPacker::packBinaryHeader)).isEqualTo("c50100");
    assertThat(headerOf(65536, BufferPacker::packBinaryHeader)).isEqualTo("c600010000");
  }

  @Test
  void negativeSizesWriteNothing() {
    final Buffer buf = Buffer.allocate(8);
    assertThatThrownBy(() -> BufferPacker.packArrayHeader(buf, 0, -1))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("array size must be >= 0");
    assertThatThrownBy(() -> BufferPacker.packMapHeader(buf, 0, -1))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("map size must be >= 0");
    assertThatThrownBy(() -> BufferPacker.packRawStringHeader(buf, 0, -1))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> BufferPacker.packBinaryHeader(buf, 0, -1))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(buf.readBytes(0, 8)).containsOnly((byte) 0);
  }

  @ParameterizedTest
  @CsvSource({
      "1, d4ff, 2",
      "2, d5ff, 2",
      "4, d6ff, 2",
      "8, d7ff, 2",
      "16, d8ff, 2",
      "0, c700ff, 3",
      "3, c703ff, 3",
      "255, c7ffff, 3",
      "256, c80100ff, 4",
      "65535, c8ffffff, 4",
      "65536, c900010000ff, 6",
      "4294967295, c9ffffffffff, 6"
  })
  void extensionHeaderSizes(long length, String expected, int size) {
    final Buffer buf = Buffer.allocate(2);
    final int written = BufferPacker.packExtensionTypeHeader(buf, 0, (byte) -1, length);
    assertThat(written).isEqualTo(size);
    assertThat(HexFormat.of().formatHex(buf.toByteArray(written))).isEqualTo(expected);
  }

  @Test
  void extensionLengthOutOfRange() {
    final Buffer buf = Buffer.allocate(8);
    assertThatThrownBy(() -> BufferPacker.packExtensionTypeHeader(buf, 0, (byte) 1, -1))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> BufferPacker.packExtensionTypeHeader(buf, 0, (byte) 1, BufferPacker.MAX_EXTENSION_LENGTH + 1))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void packsAtAnOffsetAndGrows() {
    final Buffer buf = Buffer.allocate(1);
    int index = 0;
    index += BufferPacker.packArrayHeader(buf, index, 3);
    index += BufferPacker.packInt(buf, index, 70000);
    index += BufferPacker.packString(buf, index, "x".repeat(40));
    index += BufferPacker.packNil(buf, index);
    assertThat(index).isEqualTo(1 + 5 + 42 + 1);
    assertThat(buf.readByte(0)).isEqualTo((byte) 0x93);
    assertThat(buf.readByte(1)).isEqualTo(Code.UINT32);
    assertThat(buf.readInt(2)).isEqualTo(70000);
    assertThat(buf.readByte(index - 1)).isEqualTo(Code.NIL);
  }

  @Test
  void writePayloadCopiesASlice() {
    final Buffer buf = Buffer.allocate(4);
    final byte[] source = {1, 2, 3, 4, 5};
    assertThat(BufferPacker.writePayload(buf, 2, source, 1, 3)).isEqualTo(3);
    assertThat(Arrays.copyOfRange(buf.toByteArray(5), 2, 5)).containsExactly(2, 3, 4);
  }

  @FunctionalInterface
  interface HeaderPacking {
    int pack(Buffer buf, int index, int size);
  }

  static String headerOf(int size, HeaderPacking packing) {
    return hex((buf, index) -> packing.pack(buf, index, size));
  }
}
