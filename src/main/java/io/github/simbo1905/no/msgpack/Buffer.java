// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.msgpack;

/// An index addressed byte region. Writes take an explicit index, are big-endian and return the number
/// of bytes written. Capacity management is the implementation's concern: callers never size-check.
public interface Buffer {

  /// Allocate a growable heap buffer
  static Buffer allocate(int initialCapacity) {
    return new ByteBufferBuffer(initialCapacity);
  }

  /// Wrap existing bytes. The array is written in place until a write passes its end, after which the
  /// buffer continues in a larger copy and the array keeps the bytes written up to that point.
  static Buffer wrap(byte[] bytes) {
    return new ByteBufferBuffer(bytes);
  }

  /// @return the current capacity in bytes
  int size();

  byte readByte(int index);

  short readShort(int index);

  int readInt(int index);

  long readLong(int index);

  float readFloat(int index);

  double readDouble(int index);

  byte[] readBytes(int index, int length);

  int writeByte(int index, byte v);

  int writeBytes(int index, byte[] v);

  int writeBytes(int index, byte[] v, int vOffset, int length);

  int writeShort(int index, short v);

  int writeInt(int index, int v);

  int writeLong(int index, long v);

  int writeFloat(int index, float v);

  int writeDouble(int index, double v);

  default int writeByteAndByte(int index, byte b, byte v) {
    return writeByte(index, b) + writeByte(index + 1, v);
  }

  default int writeByteAndShort(int index, byte b, short v) {
    return writeByte(index, b) + writeShort(index + 1, v);
  }

  default int writeByteAndInt(int index, byte b, int v) {
    return writeByte(index, b) + writeInt(index + 1, v);
  }

  default int writeByteAndLong(int index, byte b, long v) {
    return writeByte(index, b) + writeLong(index + 1, v);
  }

  default int writeByteAndFloat(int index, byte b, float v) {
    return writeByte(index, b) + writeFloat(index + 1, v);
  }

  default int writeByteAndDouble(int index, byte b, double v) {
    return writeByte(index, b) + writeDouble(index + 1, v);
  }

  /// Copy out the first `length` bytes
  default byte[] toByteArray(int length) {
    return readBytes(0, length);
  }
}
