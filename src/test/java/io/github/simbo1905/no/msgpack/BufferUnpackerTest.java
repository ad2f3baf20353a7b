// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.msgpack;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigInteger;
import java.util.HexFormat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BufferUnpackerTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  static BufferUnpacker unpackerOf(String hex) {
    return BufferUnpacker.of(HexFormat.of().parseHex(hex));
  }

  static BufferUnpacker unpackerOf(Buffer buf, int written) {
    return new BufferUnpacker(buf, 0, written);
  }

  @ParameterizedTest
  @ValueSource(ints = {0, 31, 32, 255, 256, 65535, 65536})
  void stringLengthsRoundTrip(int length) {
    final String s = "z".repeat(length);
    final Buffer buf = Buffer.allocate(16);
    final int written = BufferPacker.packString(buf, 0, s);
    final BufferUnpacker unpacker = unpackerOf(buf, written);
    assertThat(unpacker.getNextFormat().getValueType()).isEqualTo(ValueType.STRING);
    assertThat(unpacker.unpackString()).isEqualTo(s);
    assertThat(unpacker.hasNext()).isFalse();
  }

  @ParameterizedTest
  @ValueSource(ints = {0, 15, 16, 65535, 65536})
  void arrayOfSizeRoundTrips(int size) {
    final Buffer buf = Buffer.allocate(16);
    int written = BufferPacker.packArrayHeader(buf, 0, size);
    for (int i = 0; i < size; i++) {
      written += BufferPacker.packInt(buf, written, i);
    }
    final BufferUnpacker unpacker = unpackerOf(buf, written);
    assertThat(unpacker.unpackArrayHeader()).isEqualTo(size);
    for (int i = 0; i < size; i++) {
      assertThat(unpacker.unpackInt()).isEqualTo(i);
    }
    assertThat(unpacker.hasNext()).isFalse();
  }

  @ParameterizedTest
  @ValueSource(ints = {0, 15, 16, 65535, 65536})
  void mapOfSizeRoundTrips(int size) {
    final Buffer buf = Buffer.allocate(16);
    int written = BufferPacker.packMapHeader(buf, 0, size);
    for (int i = 0; i < size; i++) {
      written += BufferPacker.packInt(buf, written, i);
      written += BufferPacker.packBoolean(buf, written, i % 2 == 0);
    }
    final BufferUnpacker unpacker = unpackerOf(buf, written);
    assertThat(unpacker.unpackMapHeader()).isEqualTo(size);
    for (int i = 0; i < size; i++) {
      assertThat(unpacker.unpackInt()).isEqualTo(i);
      assertThat(unpacker.unpackBoolean()).isEqualTo(i % 2 == 0);
    }
    assertThat(unpacker.hasNext()).isFalse();
  }

  @ParameterizedTest
  @ValueSource(ints = {0, 255, 256, 70000})
  void binaryRoundTrips(int length) {
    final byte[] payload = new byte[length];
    for (int i = 0; i < length; i++) {
      payload[i] = (byte) i;
    }
    final Buffer buf = Buffer.allocate(16);
    int written = BufferPacker.packBinaryHeader(buf, 0, length);
    written += BufferPacker.writePayload(buf, written, payload);
    final BufferUnpacker unpacker = unpackerOf(buf, written);
    assertThat(unpacker.getNextFormat().getValueType()).isEqualTo(ValueType.BINARY);
    final int header = unpacker.unpackBinaryHeader();
    assertThat(unpacker.readPayload(header)).isEqualTo(payload);
  }

  @Test
  void extensionHeaderRoundTrips() {
    final Buffer buf = Buffer.allocate(16);
    int written = BufferPacker.packExtensionTypeHeader(buf, 0, (byte) 42, 3);
    written += BufferPacker.writePayload(buf, written, new byte[]{7, 8, 9});
    written += BufferPacker.packExtensionTypeHeader(buf, written, (byte) -5, 16);
    written += BufferPacker.writePayload(buf, written, new byte[16]);
    final BufferUnpacker unpacker = unpackerOf(buf, written);
    final ExtensionTypeHeader first = unpacker.unpackExtensionTypeHeader();
    assertThat(first).isEqualTo(new ExtensionTypeHeader((byte) 42, 3));
    assertThat(unpacker.readPayload(first.length())).containsExactly(7, 8, 9);
    final ExtensionTypeHeader second = unpacker.unpackExtensionTypeHeader();
    assertThat(second).isEqualTo(new ExtensionTypeHeader((byte) -5, 16));
    unpacker.readPayload(second.length());
    assertThat(unpacker.hasNext()).isFalse();
  }

  @Test
  void integersWidenButDoNotNarrowSilently() {
    assertThat(unpackerOf("cc80").unpackShort()).isEqualTo((short) 128);
    assertThat(unpackerOf("ceffffffff").unpackLong()).isEqualTo(4294967295L);
    assertThatThrownBy(() -> unpackerOf("cc80").unpackByte())
        .isInstanceOf(MessageFormatException.class)
        .hasMessageContaining("byte");
    assertThatThrownBy(() -> unpackerOf("ceffffffff").unpackInt())
        .isInstanceOf(MessageFormatException.class);
    assertThatThrownBy(() -> unpackerOf("cfffffffffffffffff").unpackLong())
        .isInstanceOf(MessageFormatException.class);
  }

  @Test
  void bigIntegerReadsUnsigned64Bits() {
    assertThat(unpackerOf("cfffffffffffffffff").unpackBigInteger())
        .isEqualTo(BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE));
    assertThat(unpackerOf("d0df").unpackBigInteger()).isEqualTo(BigInteger.valueOf(-33));
  }

  @Test
  void floatsReadEitherWidth() {
    assertThat(unpackerOf("ca3fc00000").unpackDouble()).isEqualTo(1.5d);
    assertThat(unpackerOf("cb3ff8000000000000").unpackFloat()).isEqualTo(1.5f);
  }

  @Test
  void wrongTypeIsReported() {
    assertThatThrownBy(() -> unpackerOf("a161").unpackInt())
        .isInstanceOf(MessageFormatException.class)
        .hasMessageContaining("Expected Integer")
        .hasMessageContaining("STRING");
    assertThatThrownBy(() -> unpackerOf("c1").unpackNil())
        .isInstanceOf(MessageFormatException.class)
        .hasMessageContaining("NEVER_USED");
    assertThatThrownBy(() -> unpackerOf("c1").getNextFormat().getValueType())
        .isInstanceOf(MessageFormatException.class);
  }

  @Test
  void truncatedInputIsReported() {
    assertThatThrownBy(() -> unpackerOf("cd01").unpackInt())
        .isInstanceOf(MessageFormatException.class)
        .hasMessageContaining("Insufficient input");
    assertThatThrownBy(() -> unpackerOf("a5616263").unpackString())
        .isInstanceOf(MessageFormatException.class);
    assertThatThrownBy(() -> unpackerOf("").getNextFormat())
        .isInstanceOf(MessageFormatException.class);
  }

  @Test
  void oversizeLengthIsRejected() {
    assertThatThrownBy(() -> unpackerOf("dd80000000").unpackArrayHeader())
        .isInstanceOf(MessageFormatException.class)
        .hasMessageContaining("2^31-1");
  }

  @Test
  void tryUnpackNilOnlyConsumesNil() {
    final BufferUnpacker unpacker = unpackerOf("c005");
    assertThat(unpacker.tryUnpackNil()).isTrue();
    assertThat(unpacker.tryUnpackNil()).isFalse();
    assertThat(unpacker.position()).isEqualTo(1);
    assertThat(unpacker.unpackInt()).isEqualTo(5);
  }

  @Test
  void skipValuePassesNestedStructures() {
    final Buffer buf = Buffer.allocate(16);
    int written = BufferPacker.packMapHeader(buf, 0, 2);
    written += BufferPacker.packString(buf, written, "list");
    written += BufferPacker.packArrayHeader(buf, written, 3);
    written += BufferPacker.packLong(buf, written, Long.MIN_VALUE);
    written += BufferPacker.packDouble(buf, written, 2.5);
    written += BufferPacker.packArrayHeader(buf, written, 0);
    written += BufferPacker.packString(buf, written, "ext");
    written += BufferPacker.packExtensionTypeHeader(buf, written, (byte) 9, 5);
    written += BufferPacker.writePayload(buf, written, new byte[5]);
    final int end = written;
    written += BufferPacker.packString(buf, written, "after");

    final BufferUnpacker unpacker = unpackerOf(buf, written);
    unpacker.skipValue();
    assertThat(unpacker.position()).isEqualTo(end);
    assertThat(unpacker.unpackString()).isEqualTo("after");
  }

  @Test
  void skipValueRejectsCountsBeyondTheInput() {
    assertThatThrownBy(() -> unpackerOf("df40000000").skipValue())
        .isInstanceOf(MessageFormatException.class)
        .hasMessageContaining("Truncated map");
    assertThatThrownBy(() -> unpackerOf("dd7fffffff").skipValue())
        .isInstanceOf(MessageFormatException.class)
        .hasMessageContaining("Truncated array");
    assertThatThrownBy(() -> unpackerOf("9201").skipValue())
        .isInstanceOf(MessageFormatException.class);
  }

  @Test
  void headersCheckTheirCountAgainstTheRemainingInput() {
    assertThat(unpackerOf("920102").unpackArrayHeader()).isEqualTo(2);
    assertThatThrownBy(() -> unpackerOf("9301").unpackArrayHeader())
        .isInstanceOf(MessageFormatException.class);
    assertThat(unpackerOf("81a16101").unpackMapHeader()).isEqualTo(1);
    assertThatThrownBy(() -> unpackerOf("81a1").unpackMapHeader())
        .isInstanceOf(MessageFormatException.class);
  }

  @Test
  void unpackerRespectsItsRange() {
    final Buffer buf = Buffer.wrap(HexFormat.of().parseHex("0102030405"));
    final BufferUnpacker unpacker = new BufferUnpacker(buf, 1, 3);
    assertThat(unpacker.unpackInt()).isEqualTo(2);
    assertThat(unpacker.unpackInt()).isEqualTo(3);
    assertThat(unpacker.hasNext()).isFalse();
    assertThatThrownBy(() -> new BufferUnpacker(buf, 0, 6)).isInstanceOf(IllegalArgumentException.class);
  }
}
