// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.msgpack.codec;

import java.lang.reflect.Type;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import static io.github.simbo1905.no.msgpack.codec.MessageCodec.LOGGER;

/// Finds the [MessageCodec] for a [TypeDescriptor]. Known codecs given at construction always win.
/// Anything else is derived by recursing over the descriptor's structure and cached, so each
/// descriptor is derived at most once per factory in the absence of a race.
///
/// A descriptor that refers back to itself before its derivation completes is rejected.
/// Derivation of the same descriptor always gives an equivalent codec, so concurrent first use needs no
/// lock: a racing thread may derive twice, and the first codec stored is the one every caller sees.
public final class MessageCodecFactory {

  private final Map<TypeDescriptor, MessageCodec<?>> knownCodecs;
  private final TypeIntrospector introspector;
  private final ConcurrentHashMap<TypeDescriptor, MessageCodec<?>> cache = new ConcurrentHashMap<>();

  public MessageCodecFactory(Map<TypeDescriptor, MessageCodec<?>> knownCodecs) {
    this(knownCodecs, TypeIntrospector.none());
  }

  public MessageCodecFactory(Map<TypeDescriptor, MessageCodec<?>> knownCodecs, TypeIntrospector introspector) {
    this.knownCodecs = Map.copyOf(Objects.requireNonNull(knownCodecs, "knownCodecs must not be null"));
    this.introspector = Objects.requireNonNull(introspector, "introspector must not be null");
  }

  /// Factory with the standard codec of every primitive kind registered
  public static MessageCodecFactory defaultFactory() {
    return new MessageCodecFactory(StandardCodec.standardCodecs());
  }

  /// Factory with the standard codecs and the given introspector for the class and type entry points
  public static MessageCodecFactory defaultFactory(TypeIntrospector introspector) {
    return new MessageCodecFactory(StandardCodec.standardCodecs(), introspector);
  }

  /// A new factory whose known codecs are these plus the additional ones, the additional ones winning
  /// on collision. The new factory starts with an empty cache.
  public MessageCodecFactory withCodecs(Map<TypeDescriptor, MessageCodec<?>> additionalCodecs) {
    final Map<TypeDescriptor, MessageCodec<?>> merged = new HashMap<>(knownCodecs);
    merged.putAll(additionalCodecs);
    return new MessageCodecFactory(merged, introspector);
  }

  /// A new factory sharing these known codecs but describing types with another introspector
  public MessageCodecFactory withIntrospector(TypeIntrospector introspector) {
    return new MessageCodecFactory(knownCodecs, introspector);
  }

  public MessageCodec<?> of(TypeDescriptor descriptor) {
    Objects.requireNonNull(descriptor, "descriptor must not be null");
    return ofDescriptor(descriptor, Set.of());
  }

  @SuppressWarnings("unchecked")
  public <A> MessageCodec<A> of(Class<A> type) {
    Objects.requireNonNull(type, "type must not be null");
    return (MessageCodec<A>) ofDescriptor(introspector.describe(type), Set.of());
  }

  public MessageCodec<?> ofType(Type type) {
    Objects.requireNonNull(type, "type must not be null");
    return ofDescriptor(introspector.describe(type), Set.of());
  }

  /// @return true once a codec for the descriptor has been derived and cached
  boolean isCached(TypeDescriptor descriptor) {
    return cache.containsKey(descriptor);
  }

  private MessageCodec<?> ofDescriptor(TypeDescriptor descriptor, Set<TypeDescriptor> seen) {
    final MessageCodec<?> known = knownCodecs.get(descriptor);
    if (known != null) {
      return known;
    }
    final MessageCodec<?> cached = cache.get(descriptor);
    if (cached != null) {
      LOGGER.finer(() -> "Cached MessageCodec for " + descriptor.toTreeString());
      return cached;
    }
    if (seen.contains(descriptor)) {
      throw new IllegalArgumentException("Codec for recursive types is not supported: " + descriptor.toTreeString());
    }
    final Set<TypeDescriptor> seenSet = extend(seen, descriptor);
    LOGGER.fine(() -> "Deriving MessageCodec for " + descriptor.toTreeString());
    final MessageCodec<?> codec = derive(descriptor, seenSet);
    final MessageCodec<?> raced = cache.putIfAbsent(descriptor, codec);
    return raced != null ? raced : codec;
  }

  private static Set<TypeDescriptor> extend(Set<TypeDescriptor> seen, TypeDescriptor descriptor) {
    final Set<TypeDescriptor> extended = new HashSet<>(seen);
    extended.add(descriptor);
    return Set.copyOf(extended);
  }

  private MessageCodec<?> derive(TypeDescriptor descriptor, Set<TypeDescriptor> seenSet) {
    return switch (descriptor.shape()) {
      case OPTION -> new OptionCodec<>(ofDescriptor(((TypeDescriptor.OptionType) descriptor).element(), seenSet));
      case TUPLE -> new TupleCodec(((TypeDescriptor.TupleType) descriptor).elements().stream()
          .map(element -> ofDescriptor(element, seenSet))
          .collect(Collectors.toList()));
      case ENUM -> new EnumCodec(((TypeDescriptor.EnumType) descriptor).enumClass());
      case SEQUENCE -> {
        final TypeDescriptor.SequenceType sequence = (TypeDescriptor.SequenceType) descriptor;
        final MessageCodec<?> element = ofDescriptor(sequence.element(), seenSet);
        yield sequence.indexed()
            ? new SequenceCodec.IndexedSeqCodec(sequence.element(), element)
            : new SequenceCodec.SeqCodec(sequence.element(), element);
      }
      case JAVA_COLLECTION -> {
        final TypeDescriptor.JavaCollectionType collection = (TypeDescriptor.JavaCollectionType) descriptor;
        yield new JavaCollectionCodec(collection.rawType(), ofDescriptor(collection.element(), seenSet));
      }
      case MAP -> {
        final TypeDescriptor.MapType map = (TypeDescriptor.MapType) descriptor;
        yield new MapCodec(ofDescriptor(map.key(), seenSet), ofDescriptor(map.value(), seenSet));
      }
      case JAVA_MAP -> {
        final TypeDescriptor.JavaMapType map = (TypeDescriptor.JavaMapType) descriptor;
        yield new JavaMapCodec(map.rawType(), ofDescriptor(map.key(), seenSet), ofDescriptor(map.value(), seenSet));
      }
      case RECORD -> {
        final TypeDescriptor.RecordType record = (TypeDescriptor.RecordType) descriptor;
        final List<TypeDescriptor.Field> fields = record.fields();
        final List<MessageCodec<?>> fieldCodecs = fields.stream()
            .<MessageCodec<?>>map(field -> ofDescriptor(field.type(), seenSet))
            .collect(Collectors.toList());
        yield new RecordCodec(record, fields, fieldCodecs);
      }
      case PRIMITIVE -> StandardCodec.of(((TypeDescriptor.PrimitiveType) descriptor).kind());
      case OPAQUE -> throw new UnsupportedOperationException("No codec is registered for " + descriptor.toTreeString() +
          " and it has no structure to derive one from");
    };
  }

  @Override
  public String toString() {
    return "MessageCodecFactory{knownCodecs=" + knownCodecs.size() + ", cached=" + cache.size() + "}";
  }
}
