// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.msgpack.codec;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/// Immutable structural description of a type, used as the key for codec lookup.
/// The set of shapes is closed: add a shape by adding a permitted node and a [Shape] constant,
/// and the compiler will point at every dispatch that needs a new branch.
public sealed interface TypeDescriptor permits
    TypeDescriptor.PrimitiveType, TypeDescriptor.OptionType, TypeDescriptor.TupleType,
    TypeDescriptor.EnumType, TypeDescriptor.SequenceType, TypeDescriptor.JavaCollectionType,
    TypeDescriptor.MapType, TypeDescriptor.JavaMapType, TypeDescriptor.RecordType,
    TypeDescriptor.OpaqueType {

  /// Shape categories, one per permitted node
  enum Shape {
    PRIMITIVE, OPTION, TUPLE, ENUM, SEQUENCE, JAVA_COLLECTION, MAP, JAVA_MAP, RECORD, OPAQUE
  }

  /// Leaf value kinds with a standard codec
  enum PrimitiveKind {
    BOOLEAN(Boolean.class),
    BYTE(Byte.class),
    SHORT(Short.class),
    CHARACTER(Character.class),
    INTEGER(Integer.class),
    LONG(Long.class),
    FLOAT(Float.class),
    DOUBLE(Double.class),
    STRING(String.class),
    BIG_INTEGER(BigInteger.class),
    BINARY(byte[].class),
    TIMESTAMP(Instant.class);

    private final Class<?> javaType;

    PrimitiveKind(Class<?> javaType) {
      this.javaType = javaType;
    }

    public Class<?> javaType() {
      return javaType;
    }
  }

  Shape shape();

  /// Nested type arguments in declaration order
  List<TypeDescriptor> typeArgs();

  /// Example: LIST(STRING) or MAP(STRING,INTEGER)
  String toTreeString();

  static PrimitiveType of(PrimitiveKind kind) {
    return new PrimitiveType(kind);
  }

  static OptionType optionOf(TypeDescriptor element) {
    return new OptionType(element);
  }

  static TupleType tupleOf(TypeDescriptor... elements) {
    return new TupleType(List.of(elements));
  }

  static SequenceType listOf(TypeDescriptor element) {
    return new SequenceType(element, true);
  }

  static MapType mapOf(TypeDescriptor key, TypeDescriptor value) {
    return new MapType(key, value);
  }

  private static String treeOf(String name, List<TypeDescriptor> args) {
    return name + "(" + args.stream().map(TypeDescriptor::toTreeString).collect(Collectors.joining(",")) + ")";
  }

  record PrimitiveType(PrimitiveKind kind) implements TypeDescriptor {
    public PrimitiveType {
      Objects.requireNonNull(kind, "Primitive kind cannot be null");
    }

    @Override
    public Shape shape() {
      return Shape.PRIMITIVE;
    }

    @Override
    public List<TypeDescriptor> typeArgs() {
      return List.of();
    }

    @Override
    public String toTreeString() {
      return kind.name();
    }
  }

  record OptionType(TypeDescriptor element) implements TypeDescriptor {
    public OptionType {
      Objects.requireNonNull(element, "Option element type cannot be null");
    }

    @Override
    public Shape shape() {
      return Shape.OPTION;
    }

    @Override
    public List<TypeDescriptor> typeArgs() {
      return List.of(element);
    }

    @Override
    public String toTreeString() {
      return treeOf("OPTION", typeArgs());
    }
  }

  record TupleType(List<TypeDescriptor> elements) implements TypeDescriptor {
    public TupleType {
      elements = List.copyOf(elements);
      if (elements.isEmpty()) {
        throw new IllegalArgumentException("Tuple must have at least one element type");
      }
    }

    @Override
    public Shape shape() {
      return Shape.TUPLE;
    }

    @Override
    public List<TypeDescriptor> typeArgs() {
      return elements;
    }

    @Override
    public String toTreeString() {
      return treeOf("TUPLE", elements);
    }
  }

  record EnumType(Class<? extends Enum<?>> enumClass) implements TypeDescriptor {
    public EnumType {
      Objects.requireNonNull(enumClass, "Enum class cannot be null");
      if (!enumClass.isEnum()) {
        throw new IllegalArgumentException("Not an enum: " + enumClass);
      }
    }

    @Override
    public Shape shape() {
      return Shape.ENUM;
    }

    @Override
    public List<TypeDescriptor> typeArgs() {
      return List.of();
    }

    @Override
    public String toTreeString() {
      return enumClass.getSimpleName() + "[enum]";
    }
  }

  /// Ordered sequence. `indexed` only changes the collection built on decode.
  record SequenceType(TypeDescriptor element, boolean indexed) implements TypeDescriptor {
    public SequenceType {
      Objects.requireNonNull(element, "Sequence element type cannot be null");
    }

    @Override
    public Shape shape() {
      return Shape.SEQUENCE;
    }

    @Override
    public List<TypeDescriptor> typeArgs() {
      return List.of(element);
    }

    @Override
    public String toTreeString() {
      return treeOf(indexed ? "LIST" : "SEQ", typeArgs());
    }
  }

  /// A mutable java.util collection such as `ArrayList` or `Set`, rebuilt as an instance of `rawType`
  record JavaCollectionType(Class<?> rawType, TypeDescriptor element) implements TypeDescriptor {
    public JavaCollectionType {
      Objects.requireNonNull(rawType, "Collection raw type cannot be null");
      Objects.requireNonNull(element, "Collection element type cannot be null");
      if (!Collection.class.isAssignableFrom(rawType)) {
        throw new IllegalArgumentException("Not a java.util.Collection: " + rawType);
      }
    }

    @Override
    public Shape shape() {
      return Shape.JAVA_COLLECTION;
    }

    @Override
    public List<TypeDescriptor> typeArgs() {
      return List.of(element);
    }

    @Override
    public String toTreeString() {
      return treeOf(rawType.getSimpleName(), typeArgs());
    }
  }

  record MapType(TypeDescriptor key, TypeDescriptor value) implements TypeDescriptor {
    public MapType {
      Objects.requireNonNull(key, "Map key type cannot be null");
      Objects.requireNonNull(value, "Map value type cannot be null");
    }

    @Override
    public Shape shape() {
      return Shape.MAP;
    }

    @Override
    public List<TypeDescriptor> typeArgs() {
      return List.of(key, value);
    }

    @Override
    public String toTreeString() {
      return treeOf("MAP", typeArgs());
    }
  }

  /// A mutable java.util map such as `HashMap` or `TreeMap`, rebuilt as an instance of `rawType`
  record JavaMapType(Class<?> rawType, TypeDescriptor key, TypeDescriptor value) implements TypeDescriptor {
    public JavaMapType {
      Objects.requireNonNull(rawType, "Map raw type cannot be null");
      Objects.requireNonNull(key, "Map key type cannot be null");
      Objects.requireNonNull(value, "Map value type cannot be null");
      if (!Map.class.isAssignableFrom(rawType)) {
        throw new IllegalArgumentException("Not a java.util.Map: " + rawType);
      }
    }

    @Override
    public Shape shape() {
      return Shape.JAVA_MAP;
    }

    @Override
    public List<TypeDescriptor> typeArgs() {
      return List.of(key, value);
    }

    @Override
    public String toTreeString() {
      return treeOf(rawType.getSimpleName(), typeArgs());
    }
  }

  /// A named field of a record in declaration order
  record Field(String name, TypeDescriptor type) {
    public Field {
      Objects.requireNonNull(name, "Field name cannot be null");
      Objects.requireNonNull(type, "Field type cannot be null");
    }
  }

  /// A record. Identity is the raw class and its type arguments. The fields come from a supplier that
  /// is asked on every call to [#fields()] so that a record may describe a field of its own type.
  final class RecordType implements TypeDescriptor {
    private final Class<?> rawType;
    private final List<TypeDescriptor> typeArgs;
    private final Supplier<List<Field>> fieldSupplier;

    public RecordType(Class<?> rawType, List<TypeDescriptor> typeArgs, Supplier<List<Field>> fieldSupplier) {
      this.rawType = Objects.requireNonNull(rawType, "Record raw type cannot be null");
      this.typeArgs = List.copyOf(typeArgs);
      this.fieldSupplier = Objects.requireNonNull(fieldSupplier, "Field supplier cannot be null");
    }

    public RecordType(Class<?> rawType, List<Field> fields) {
      this(rawType, List.of(), constant(fields));
    }

    private static Supplier<List<Field>> constant(List<Field> fields) {
      final List<Field> copy = List.copyOf(fields);
      return () -> copy;
    }

    public Class<?> rawType() {
      return rawType;
    }

    @Override
    public List<TypeDescriptor> typeArgs() {
      return typeArgs;
    }

    public List<Field> fields() {
      return List.copyOf(fieldSupplier.get());
    }

    @Override
    public Shape shape() {
      return Shape.RECORD;
    }

    @Override
    public String toTreeString() {
      return typeArgs.isEmpty() ? rawType.getSimpleName() + "[record]" : treeOf(rawType.getSimpleName(), typeArgs);
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof RecordType other)) {
        return false;
      }
      return rawType.equals(other.rawType) && typeArgs.equals(other.typeArgs);
    }

    @Override
    public int hashCode() {
      return Objects.hash(rawType, typeArgs);
    }

    @Override
    public String toString() {
      return "RecordType[" + toTreeString() + "]";
    }
  }

  /// A type known only by its class. It has no structure to derive from so it needs a known codec.
  record OpaqueType(Class<?> rawType) implements TypeDescriptor {
    public OpaqueType {
      Objects.requireNonNull(rawType, "Opaque raw type cannot be null");
    }

    @Override
    public Shape shape() {
      return Shape.OPAQUE;
    }

    @Override
    public List<TypeDescriptor> typeArgs() {
      return List.of();
    }

    @Override
    public String toTreeString() {
      return rawType.getSimpleName() + "[opaque]";
    }
  }
}
