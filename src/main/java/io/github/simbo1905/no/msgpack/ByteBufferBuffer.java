// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.msgpack;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import static io.github.simbo1905.no.msgpack.BufferPacker.LOGGER;

/// Heap [Buffer] over a [ByteBuffer] using absolute get and put so the position is never touched.
/// When a write would pass the end the backing buffer is replaced by one at least twice the size.
final class ByteBufferBuffer implements Buffer {

  static final int MIN_CAPACITY = 16;

  private ByteBuffer buffer;
  private boolean wrapsCallerArray;

  ByteBufferBuffer(int initialCapacity) {
    if (initialCapacity < 0) {
      throw new IllegalArgumentException("Initial capacity must be >= 0, got: " + initialCapacity);
    }
    this.buffer = ByteBuffer.allocate(initialCapacity).order(ByteOrder.BIG_ENDIAN);
  }

  ByteBufferBuffer(byte[] bytes) {
    this.buffer = ByteBuffer.wrap(bytes).order(ByteOrder.BIG_ENDIAN);
    this.wrapsCallerArray = true;
  }

  @Override
  public int size() {
    return buffer.capacity();
  }

  private void ensureCapacity(int index, int numBytes) {
    if (index < 0) {
      throw new IndexOutOfBoundsException("Negative buffer index: " + index);
    }
    final long required = (long) index + numBytes;
    if (required <= buffer.capacity()) {
      return;
    }
    if (required > Integer.MAX_VALUE) {
      throw new IllegalArgumentException("Buffer cannot grow beyond " + Integer.MAX_VALUE + " bytes, required " + required);
    }
    final int newCapacity = (int) Math.min(Integer.MAX_VALUE,
        Math.max(required, Math.max(MIN_CAPACITY, (long) buffer.capacity() * 2)));
    LOGGER.finer(() -> "Growing buffer from " + buffer.capacity() + " to " + newCapacity + " bytes");
    final ByteBuffer grown = ByteBuffer.allocate(newCapacity).order(ByteOrder.BIG_ENDIAN);
    final int outgrown = buffer.capacity();
    grown.put(0, buffer, 0, outgrown);
    buffer = grown;
    if (wrapsCallerArray) {
      wrapsCallerArray = false;
      LOGGER.fine(() -> "Wrapped array of " + outgrown + " bytes outgrown, later writes no longer reach it");
    }
  }

  /// @return true while writes still land in the array given to [Buffer#wrap(byte[])]
  boolean wrapsCallerArray() {
    return wrapsCallerArray;
  }

  @Override
  public byte readByte(int index) {
    return buffer.get(index);
  }

  @Override
  public short readShort(int index) {
    return buffer.getShort(index);
  }

  @Override
  public int readInt(int index) {
    return buffer.getInt(index);
  }

  @Override
  public long readLong(int index) {
    return buffer.getLong(index);
  }

  @Override
  public float readFloat(int index) {
    return buffer.getFloat(index);
  }

  @Override
  public double readDouble(int index) {
    return buffer.getDouble(index);
  }

  @Override
  public byte[] readBytes(int index, int length) {
    final byte[] out = new byte[length];
    buffer.get(index, out, 0, length);
    return out;
  }

  @Override
  public int writeByte(int index, byte v) {
    ensureCapacity(index, Byte.BYTES);
    buffer.put(index, v);
    return Byte.BYTES;
  }

  @Override
  public int writeBytes(int index, byte[] v) {
    return writeBytes(index, v, 0, v.length);
  }

  @Override
  public int writeBytes(int index, byte[] v, int vOffset, int length) {
    ensureCapacity(index, length);
    buffer.put(index, v, vOffset, length);
    return length;
  }

  @Override
  public int writeShort(int index, short v) {
    ensureCapacity(index, Short.BYTES);
    buffer.putShort(index, v);
    return Short.BYTES;
  }

  @Override
  public int writeInt(int index, int v) {
    ensureCapacity(index, Integer.BYTES);
    buffer.putInt(index, v);
    return Integer.BYTES;
  }

  @Override
  public int writeLong(int index, long v) {
    ensureCapacity(index, Long.BYTES);
    buffer.putLong(index, v);
    return Long.BYTES;
  }

  @Override
  public int writeFloat(int index, float v) {
    ensureCapacity(index, Float.BYTES);
    buffer.putFloat(index, v);
    return Float.BYTES;
  }

  @Override
  public int writeDouble(int index, double v) {
    ensureCapacity(index, Double.BYTES);
    buffer.putDouble(index, v);
    return Double.BYTES;
  }

  @Override
  public String toString() {
    return "ByteBufferBuffer{capacity=" + buffer.capacity() + "}";
  }
}
