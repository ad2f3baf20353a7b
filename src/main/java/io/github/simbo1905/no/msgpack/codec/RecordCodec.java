// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.msgpack.codec;

import io.github.simbo1905.no.msgpack.Buffer;
import io.github.simbo1905.no.msgpack.BufferPacker;
import io.github.simbo1905.no.msgpack.BufferUnpacker;
import io.github.simbo1905.no.msgpack.MessageFormatException;
import io.github.simbo1905.no.msgpack.ValueType;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Array;
import java.lang.reflect.Constructor;
import java.lang.reflect.Method;
import java.lang.reflect.RecordComponent;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static io.github.simbo1905.no.msgpack.codec.MessageCodec.LOGGER;

/// Codec for a Java record built from its descriptor and one codec per field.
/// Accessors and the canonical constructor are looked up once here, never during encode or decode.
final class RecordCodec implements MessageCodec<Record> {
  final TypeDescriptor.RecordType descriptor;
  final List<TypeDescriptor.Field> fields;
  final List<MessageCodec<?>> fieldCodecs;
  final RecordFormat format;
  final MethodHandle recordConstructor;
  final MethodHandle[] fieldAccessors;
  final int[] componentIndexOfField;
  final Class<?>[] componentTypes;
  final Map<String, Integer> fieldIndexByName;

  RecordCodec(TypeDescriptor.RecordType descriptor, List<TypeDescriptor.Field> fields, List<MessageCodec<?>> fieldCodecs) {
    this.descriptor = Objects.requireNonNull(descriptor);
    this.fields = List.copyOf(fields);
    this.fieldCodecs = List.copyOf(fieldCodecs);
    this.format = RecordFormat.current();
    if (this.fields.size() != this.fieldCodecs.size()) {
      throw new IllegalArgumentException("Expected " + this.fields.size() + " field codecs but got " + this.fieldCodecs.size());
    }

    final Class<?> userType = descriptor.rawType();
    if (!userType.isRecord()) {
      throw new IllegalArgumentException("Record codecs need a record class: " + userType.getName());
    }
    final RecordComponent[] components = userType.getRecordComponents();
    final Map<String, Integer> componentIndexByName = new HashMap<>();
    for (int i = 0; i < components.length; i++) {
      componentIndexByName.put(components[i].getName(), i);
    }
    componentTypes = Arrays.stream(components).map(RecordComponent::getType).toArray(Class<?>[]::new);

    componentIndexOfField = new int[this.fields.size()];
    fieldAccessors = new MethodHandle[this.fields.size()];
    for (int i = 0; i < this.fields.size(); i++) {
      final String name = this.fields.get(i).name();
      final Integer componentIndex = componentIndexByName.get(name);
      if (componentIndex == null) {
        throw new IllegalArgumentException("Record " + userType.getName() + " has no component named " + name);
      }
      componentIndexOfField[i] = componentIndex;
      fieldAccessors[i] = unreflect(components[componentIndex].getAccessor(), name);
    }
    fieldIndexByName = IntStream.range(0, this.fields.size()).boxed()
        .collect(Collectors.toUnmodifiableMap(i -> this.fields.get(i).name(), i -> i));

    try {
      final Constructor<?> constructor = userType.getDeclaredConstructor(componentTypes);
      constructor.setAccessible(true);
      this.recordConstructor = MethodHandles.lookup().unreflectConstructor(constructor);
    } catch (ReflectiveOperationException | RuntimeException e) {
      throw new IllegalArgumentException("Failed to create constructor handle for " + userType, e);
    }

    LOGGER.fine(() -> "RecordCodec " + userType.getSimpleName() + " construction complete with format " + format +
        " and fields " + this.fields.stream().map(TypeDescriptor.Field::name).collect(Collectors.joining(",")));
  }

  private static MethodHandle unreflect(Method accessor, String name) {
    try {
      accessor.setAccessible(true);
      return MethodHandles.lookup().unreflect(accessor);
    } catch (IllegalAccessException | RuntimeException e) {
      throw new IllegalArgumentException("Failed to create accessor for " + name, e);
    }
  }

  @Override
  public int pack(Buffer buf, int index, Record record) {
    if (record == null) {
      return BufferPacker.packNil(buf, index);
    }
    if (!descriptor.rawType().isInstance(record)) {
      throw new IllegalArgumentException("Expected " + descriptor.rawType() + " but got " + record.getClass());
    }
    LOGGER.finer(() -> "RecordCodec " + descriptor.rawType().getSimpleName() + " pack at index " + index);
    int written = format == RecordFormat.ARRAY
        ? BufferPacker.packArrayHeader(buf, index, fields.size())
        : BufferPacker.packMapHeader(buf, index, fields.size());
    for (int i = 0; i < fields.size(); i++) {
      if (format == RecordFormat.MAP) {
        written += BufferPacker.packString(buf, index + written, fields.get(i).name());
      }
      written += MessageCodec.packUnchecked(fieldCodecs.get(i), buf, index + written, fieldValue(i, record));
    }
    return written;
  }

  private Object fieldValue(int i, Record record) {
    try {
      return fieldAccessors[i].invoke(record);
    } catch (Throwable e) {
      throw new IllegalStateException("Failed to read field " + fields.get(i).name() + " of " + record.getClass().getName(), e);
    }
  }

  @Override
  public Record unpack(BufferUnpacker unpacker) {
    if (unpacker.tryUnpackNil()) {
      return null;
    }
    final Object[] args = new Object[componentTypes.length];
    final ValueType valueType = unpacker.getNextFormat().getValueType();
    if (valueType == ValueType.ARRAY) {
      final int size = unpacker.unpackArrayHeader();
      for (int i = 0; i < size; i++) {
        if (i < fields.size()) {
          args[componentIndexOfField[i]] = fieldCodecs.get(i).unpack(unpacker);
        } else {
          unpacker.skipValue();
        }
      }
    } else if (valueType == ValueType.MAP) {
      final int size = unpacker.unpackMapHeader();
      for (int i = 0; i < size; i++) {
        final String name = unpacker.unpackString();
        final Integer fieldIndex = fieldIndexByName.get(name);
        if (fieldIndex == null) {
          LOGGER.finer(() -> "RecordCodec " + descriptor.rawType().getSimpleName() + " skipping unknown field " + name);
          unpacker.skipValue();
        } else {
          args[componentIndexOfField[fieldIndex]] = fieldCodecs.get(fieldIndex).unpack(unpacker);
        }
      }
    } else {
      throw new MessageFormatException("Expected an array or map for " + descriptor.rawType().getName() + " but got " + valueType);
    }
    for (int i = 0; i < args.length; i++) {
      if (args[i] == null && componentTypes[i].isPrimitive()) {
        args[i] = Array.get(Array.newInstance(componentTypes[i], 1), 0);
      }
    }
    try {
      return (Record) recordConstructor.invokeWithArguments(args);
    } catch (Throwable e) {
      throw new IllegalStateException("Failed to create instance of " + descriptor.rawType().getName(), e);
    }
  }

  @Override
  public String toString() {
    return "RecordCodec{" + descriptor.toTreeString() + ", format=" + format + "}";
  }
}
