/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.recdec.compile;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.recdec.il.IlBuilder.il;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;
import net.hydromatic.recdec.il.Il;
import net.hydromatic.recdec.il.Variable;
import net.hydromatic.recdec.type.Accessibility;
import net.hydromatic.recdec.type.Attribute;
import net.hydromatic.recdec.type.Field;
import net.hydromatic.recdec.type.KnownType;
import net.hydromatic.recdec.type.Method;
import net.hydromatic.recdec.type.Modifier;
import net.hydromatic.recdec.type.Parameter;
import net.hydromatic.recdec.type.ParameterizedType;
import net.hydromatic.recdec.type.Property;
import net.hydromatic.recdec.type.Type;
import net.hydromatic.recdec.type.TypeDef;
import net.hydromatic.recdec.type.TypeKind;
import net.hydromatic.recdec.type.TypeSystem;
import net.hydromatic.recdec.util.CancellationToken;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A record type with the members and method bodies that the C# compiler
 * generates for it, as they look after decompilation.
 *
 * <p>Also serves as the {@link BodyDecompiler} for those bodies, and counts
 * how many times each method is decompiled. A test may edit a body before
 * it creates an analyzer, to see how a hand-written variant is classified.
 *
 * <p>For example, {@code builder("Point").property("X", INT32)
 * .property("Y", INT32).build()} corresponds to
 * "{@code record Point(int X, int Y);}".
 */
class RecordFixture implements BodyDecompiler {
  final TypeSystem typeSystem;
  final TypeDef record;
  private final Map<Method, Il.Function> bodies;
  private final Map<Method, Integer> decompileCounts = new HashMap<>();

  private RecordFixture(TypeSystem typeSystem, TypeDef record,
      ImmutableMap<Method, Il.Function> bodies) {
    this.typeSystem = requireNonNull(typeSystem);
    this.record = requireNonNull(record);
    this.bodies = new HashMap<>(bodies);
  }

  /** Creates a builder of a record with the given name and type
   * parameters. */
  static Builder builder(String name, String... typeParameterNames) {
    return new Builder(name, Arrays.asList(typeParameterNames));
  }

  @Override
  public Il.@Nullable Function decompile(Method method,
      CancellationToken cancellationToken) {
    decompileCounts.merge(method, 1, Integer::sum);
    return bodies.get(method);
  }

  /** Returns the number of times a method has been decompiled. */
  int decompileCount(Method method) {
    return decompileCounts.getOrDefault(method, 0);
  }

  /** Returns the body of a method, without counting a decompilation. */
  Il.@Nullable Function body(Method method) {
    return bodies.get(method);
  }

  /** Replaces the body of a method with an edited copy of its
   * instructions. */
  void editBody(Method method, Consumer<List<Il.Inst>> editor) {
    final Il.Function function = requireNonNull(bodies.get(method));
    final List<Il.Inst> instructions =
        new ArrayList<>(function.body.instructions);
    editor.accept(instructions);
    bodies.put(method,
        il.function(method, function.variables, il.block(instructions)));
  }

  /** Edits the conditions of the "{@code return a && b && ...}" that is the
   * body of {@code Equals(R)}. */
  void editEqualsConditions(Consumer<List<Il.Inst>> editor) {
    editBody(method("Equals", self()), instructions -> {
      final Il.Return return_ = (Il.Return) instructions.get(0);
      final List<Il.Inst> conditions =
          new ArrayList<>(Patterns.unpackLogicAndChain(return_.value));
      editor.accept(conditions);
      instructions.set(0, il.ret(il.logicAnd(conditions)));
    });
  }

  /** Creates an analyzer with default properties and no tracing. */
  RecordAnalyzer analyzer() {
    return new RecordAnalyzer(typeSystem, this, record,
        CancellationToken.NONE);
  }

  RecordAnalyzer analyzer(CancellationToken cancellationToken,
      Map<Prop, Object> props, Tracer tracer) {
    return new RecordAnalyzer(typeSystem, this, record, cancellationToken,
        props, tracer);
  }

  Type type(KnownType knownType) {
    return typeSystem.lookup(knownType);
  }

  /** Returns the record type as it appears in signatures; "{@code Box<T>}"
   * for a generic record. */
  Type self() {
    return selfType(typeSystem, record);
  }

  /** Returns the method with a given name and parameter types. */
  Method method(String name, Type... parameterTypes) {
    final List<Type> types = Arrays.asList(parameterTypes);
    for (Method method : record.methods()) {
      if (method.name.equals(name)
          && types.equals(
              method.parameters.stream().map(p -> p.type)
                  .collect(ImmutableList.toImmutableList()))) {
        return method;
      }
    }
    throw new IllegalArgumentException("no method " + name + types);
  }

  Property property(String name) {
    for (Property property : record.properties()) {
      if (property.name.equals(name)) {
        return property;
      }
    }
    throw new IllegalArgumentException("no property " + name);
  }

  Field field(String name) {
    for (Field field : record.fields()) {
      if (field.name.equals(name)) {
        return field;
      }
    }
    throw new IllegalArgumentException("no field " + name);
  }

  private static Type selfType(TypeSystem typeSystem, TypeDef record) {
    return record.typeParameters.isEmpty()
        ? record
        : typeSystem.parameterize(record,
            record.typeParameters.toArray(new Type[0]));
  }

  /** How a property is implemented. */
  private enum PropertyKind {
    /** "{@code int X { get; init; }}" */
    AUTO,
    /** "{@code static int X { get; set; }}" */
    STATIC_AUTO,
    /** "{@code int X => 0;}" */
    COMPUTED,
    /** Reads and writes a field "{@code _x}" that the user declared. */
    MANUAL_FIELD
  }

  /** Declaration of a property. */
  private static class PropertySpec {
    final String name;
    final Type type;
    final PropertyKind kind;

    PropertySpec(String name, Type type, PropertyKind kind) {
      this.name = name;
      this.type = type;
      this.kind = kind;
    }
  }

  /** Builder of {@link RecordFixture}. */
  static class Builder {
    private final TypeSystem ts = new TypeSystem();
    private final TypeDef record;
    private final List<PropertySpec> properties = new ArrayList<>();
    private final List<Field> fields = new ArrayList<>();
    private @Nullable TypeDef baseRecord;
    private @Nullable Method basePrintMembers;
    private @Nullable Type userOperatorType;
    private String separator = ", ";
    private boolean collapsedToString;
    private boolean baseCall = true;
    private Accessibility equalityContractAccessibility =
        Accessibility.PROTECTED;
    private @Nullable List<Type> equalityContractAttributes;
    private boolean sealedMembers;

    Builder(String name, List<String> typeParameterNames) {
      this.record =
          new TypeDef("Fixtures", name, TypeKind.CLASS, typeParameterNames);
    }

    TypeSystem typeSystem() {
      return ts;
    }

    TypeDef record() {
      return record;
    }

    Type typeParameter(int i) {
      return record.typeParameter(i);
    }

    /** Adds a positional parameter, which becomes an automatic
     * property. */
    Builder property(String name, KnownType type) {
      return property(name, ts.lookup(type));
    }

    Builder property(String name, Type type) {
      properties.add(new PropertySpec(name, type, PropertyKind.AUTO));
      return this;
    }

    Builder staticProperty(String name, KnownType type) {
      properties.add(
          new PropertySpec(name, ts.lookup(type), PropertyKind.STATIC_AUTO));
      return this;
    }

    Builder computedProperty(String name, KnownType type) {
      properties.add(
          new PropertySpec(name, ts.lookup(type), PropertyKind.COMPUTED));
      return this;
    }

    /** Adds a property whose accessors use a field with a name the compiler
     * would not choose. */
    Builder manualFieldProperty(String name, KnownType type) {
      properties.add(
          new PropertySpec(name, ts.lookup(type), PropertyKind.MANUAL_FIELD));
      return this;
    }

    /** Adds a public field that the user declared. */
    Builder field(String name, KnownType type) {
      fields.add(
          new Field(record, name, ts.lookup(type), Accessibility.PUBLIC,
              ImmutableList.of(), ImmutableList.of()));
      return this;
    }

    /** Makes the record derive from another record. */
    Builder baseRecord(String name) {
      final TypeDef base =
          new TypeDef("Fixtures", name, TypeKind.CLASS, ImmutableList.of());
      basePrintMembers =
          Method.builder(base, RecordAnalyzer.PRINT_MEMBERS,
                  ts.lookup(KnownType.BOOLEAN))
              .parameter("builder", ts.lookup(KnownType.STRING_BUILDER))
              .accessibility(Accessibility.PROTECTED)
              .modifiers(Modifier.VIRTUAL)
              .build();
      baseRecord =
          TypeDef.builder(base)
              .baseType(ts.lookup(KnownType.OBJECT))
              .method(basePrintMembers)
              .build();
      return this;
    }

    /** Adds a user-defined "{@code operator ==(R, T)}". */
    Builder userOperator(Type rightType) {
      userOperatorType = rightType;
      return this;
    }

    /** Uses a different separator between members in
     * {@code PrintMembers}. */
    Builder separator(String separator) {
      this.separator = separator;
      return this;
    }

    /** Omits the call to {@code PrintMembers} from {@code ToString}. */
    Builder collapsedToString() {
      this.collapsedToString = true;
      return this;
    }

    /** Omits the call to the base {@code PrintMembers} from
     * {@code PrintMembers} in a derived record. */
    Builder withoutBaseCall() {
      this.baseCall = false;
      return this;
    }

    Builder equalityContractAccessibility(Accessibility accessibility) {
      this.equalityContractAccessibility = accessibility;
      return this;
    }

    /** Gives the getter of {@code EqualityContract} these attributes
     * instead of {@code [CompilerGenerated]}. */
    Builder equalityContractAttributes(Type... attributeTypes) {
      this.equalityContractAttributes = Arrays.asList(attributeTypes);
      return this;
    }

    /** Declares {@code EqualityContract} and {@code ToString} as
     * "{@code sealed override}". */
    Builder sealedMembers() {
      this.sealedMembers = true;
      return this;
    }

    RecordFixture build() {
      return new Generator().generate();
    }

    /** Generates the members of the record and their bodies. */
    private class Generator {
      final Type self = selfType(ts, record);
      final boolean inherited = baseRecord != null;
      final Modifier virtualOrOverride =
          inherited ? Modifier.OVERRIDE : Modifier.VIRTUAL;
      final Type object = ts.lookup(KnownType.OBJECT);
      final Type bool = ts.lookup(KnownType.BOOLEAN);
      final Type int32 = ts.lookup(KnownType.INT32);
      final Type string = ts.lookup(KnownType.STRING);
      final Type voidType = ts.lookup(KnownType.VOID);
      final Type typeType = ts.lookup(KnownType.TYPE);
      final Type sb = ts.lookup(KnownType.STRING_BUILDER);
      final Type compilerGenerated =
          ts.lookup(KnownType.COMPILER_GENERATED_ATTRIBUTE);

      final Method appendString =
          Method.builder(sb, "Append", sb).parameter("value", string).build();
      final Method appendObject =
          Method.builder(sb, "Append", sb).parameter("value", object).build();
      final Method objectToString =
          Method.builder(object, "ToString", string)
              .modifiers(Modifier.VIRTUAL)
              .build();

      final Variable thisVar = il.thisParameter(self);
      final Map<Method, Il.Function> bodies = new HashMap<>();
      final TypeDef.Builder typeBuilder = TypeDef.builder(record);

      /** Getters of properties that {@code PrintMembers} prints. */
      final Map<String, Method> printed = new LinkedHashMap<>();
      /** Fields that {@code Equals} compares. */
      final List<Field> compared = new ArrayList<>();

      RecordFixture generate() {
        final TypeDef iEquatable =
            new TypeDef("System", "IEquatable", TypeKind.INTERFACE,
                ImmutableList.of("T"));
        typeBuilder.baseType(baseRecord != null ? baseRecord : object)
            .baseType(ts.parameterize(iEquatable, self));

        final Method getEqualityContract = equalityContract();
        properties.forEach(this::property);
        fields.forEach(field -> {
          typeBuilder.field(field);
          compared.add(ref(field));
        });

        final Method printMembers = printMembers();
        final Method toString = toStringMethod(printMembers);
        final Method opInequality = operator("op_Inequality", self);
        final Method opEquality = operator("op_Equality", self);
        final Method getHashCode =
            Method.builder(record, "GetHashCode", int32)
                .modifiers(Modifier.OVERRIDE)
                .build();
        bodies.put(getHashCode,
            function(getHashCode, il.block(il.ret(il.ldcI4(0)))));
        final Method equalsObject =
            Method.builder(record, "Equals", bool)
                .parameter("obj", object)
                .modifiers(Modifier.OVERRIDE)
                .build();
        final Method equalsRecord = equalsRecord(getEqualityContract);
        final Method clone =
            Method.builder(record, RecordAnalyzer.CLONE, self)
                .modifiers(virtualOrOverride)
                .build();

        typeBuilder.method(toString)
            .method(printMembers)
            .method(opInequality)
            .method(opEquality)
            .method(getHashCode)
            .method(equalsObject)
            .method(equalsRecord)
            .method(clone);
        if (userOperatorType != null) {
          typeBuilder.method(operator("op_Equality", userOperatorType));
        }
        typeBuilder.build();
        return new RecordFixture(ts, record, ImmutableMap.copyOf(bodies));
      }

      /** Returns a reference to a field, via "{@code Box<T>}" if the record
       * is generic. */
      Field ref(Field field) {
        return self == record
            ? field
            : new Field(self, field.name, field.type, field.accessibility,
                field.modifiers, field.attributes);
      }

      Method ref(Method method) {
        return self == record
            ? method
            : new Method(self, method.name, method.returnType,
                method.parameters, method.accessibility, method.modifiers,
                method.attributes, method.returnTypeAttributes);
      }

      Il.Function function(Method method, Il.Block body,
          Variable... parameters) {
        final ImmutableList.Builder<Variable> variables =
            ImmutableList.builder();
        if (!method.isStatic()) {
          variables.add(thisVar);
        }
        variables.add(parameters);
        return il.function(method, variables.build(), body);
      }

      Il.Inst ldThis() {
        return il.ldLoc(thisVar);
      }

      Il.Inst append(Variable builder, String text) {
        return il.callVirt(appendString, il.ldLoc(builder), il.ldStr(text));
      }

      Method equalityContract() {
        final List<Modifier> modifiers = sealedMembers
            ? ImmutableList.of(Modifier.OVERRIDE, Modifier.SEALED)
            : ImmutableList.of(virtualOrOverride);
        final Method.Builder getterBuilder =
            Method.builder(record, "get_" + RecordAnalyzer.EQUALITY_CONTRACT,
                    typeType)
                .accessibility(equalityContractAccessibility)
                .modifiers(modifiers.toArray(new Modifier[0]));
        if (equalityContractAttributes == null) {
          getterBuilder.attribute(compilerGenerated);
        } else {
          equalityContractAttributes.forEach(getterBuilder::attribute);
        }
        final Method getter = getterBuilder.build();
        final Method getTypeFromHandle =
            Method.builder(typeType, "GetTypeFromHandle", typeType)
                .parameter("handle", ts.lookup(KnownType.RUNTIME_TYPE_HANDLE))
                .modifiers(Modifier.STATIC)
                .build();
        bodies.put(getter,
            function(getter,
                il.block(
                    il.ret(
                        il.call(getTypeFromHandle, il.ldTypeToken(self))))));
        typeBuilder.property(
            new Property(record, RecordAnalyzer.EQUALITY_CONTRACT, typeType,
                getter, null, ImmutableList.of(),
                equalityContractAccessibility, modifiers, ImmutableList.of()));
        return getter;
      }

      void property(PropertySpec spec) {
        final boolean isStatic = spec.kind == PropertyKind.STATIC_AUTO;
        final List<Modifier> modifiers =
            isStatic ? ImmutableList.of(Modifier.STATIC) : ImmutableList.of();
        final Method getter =
            new Method(record, "get_" + spec.name, spec.type,
                ImmutableList.of(), Accessibility.PUBLIC, modifiers,
                ImmutableList.of(new Attribute(compilerGenerated)),
                ImmutableList.of());
        @Nullable Method setter = null;
        if (spec.kind == PropertyKind.COMPUTED) {
          bodies.put(getter, function(getter, il.block(il.ret(il.ldcI4(0)))));
        } else {
          final String fieldName = spec.kind == PropertyKind.MANUAL_FIELD
              ? "_" + spec.name.toLowerCase(Locale.ROOT)
              : AutoPropertyDetector.backingFieldName(spec.name);
          final Field field =
              new Field(record, fieldName, spec.type, Accessibility.PRIVATE,
                  modifiers, ImmutableList.of());
          typeBuilder.field(field);
          final Field fieldRef = ref(field);
          setter =
              new Method(record, "set_" + spec.name, voidType,
                  ImmutableList.of(new Parameter("value", spec.type)),
                  Accessibility.PUBLIC, modifiers,
                  ImmutableList.of(new Attribute(compilerGenerated)),
                  ImmutableList.of());
          final Variable value = il.parameter(0, "value", spec.type);
          if (isStatic) {
            bodies.put(getter,
                function(getter, il.block(il.ret(il.ldsFld(fieldRef)))));
            bodies.put(setter,
                function(setter,
                    il.block(il.stsFld(fieldRef, il.ldLoc(value)), il.ret()),
                    value));
          } else {
            bodies.put(getter,
                function(getter,
                    il.block(il.ret(il.ldFld(ldThis(), fieldRef)))));
            bodies.put(setter,
                function(setter,
                    il.block(il.stFld(ldThis(), fieldRef, il.ldLoc(value)),
                        il.ret()),
                    value));
            compared.add(fieldRef);
          }
        }
        if (!isStatic) {
          printed.put(spec.name, ref(getter));
        }
        typeBuilder.property(
            new Property(record, spec.name, spec.type, getter, setter,
                ImmutableList.of(), Accessibility.PUBLIC, modifiers,
                ImmutableList.of()));
      }

      Method printMembers() {
        final Method method =
            Method.builder(record, RecordAnalyzer.PRINT_MEMBERS, bool)
                .parameter("builder", sb)
                .accessibility(Accessibility.PROTECTED)
                .modifiers(virtualOrOverride)
                .build();
        final Variable builder = il.parameter(0, "builder", sb);
        final List<Il.Inst> instructions = new ArrayList<>();
        final boolean callBase = basePrintMembers != null && baseCall;
        if (callBase) {
          instructions.add(
              il.ifThen(
                  il.call(basePrintMembers, ldThis(), il.ldLoc(builder)),
                  append(builder, ", ")));
        }
        printed.forEach((name, getter) -> {
          if (instructions.size() > (callBase ? 1 : 0)) {
            instructions.add(append(builder, separator));
          }
          instructions.add(append(builder, name + " = "));
          final Il.Inst value = il.call(getter, ldThis());
          final Type type = getter.returnType;
          instructions.add(
              il.callVirt(appendObject, il.ldLoc(builder),
                  type.kind() == TypeKind.STRUCT
                      ? il.constrainedCallVirt(type, objectToString,
                          il.addressOf(value, type))
                      : value));
        });
        instructions.add(il.ret(il.ldcBool(!printed.isEmpty())));
        bodies.put(method, function(method, il.block(instructions), builder));
        return method;
      }

      Method toStringMethod(Method printMembers) {
        final Method.Builder methodBuilder =
            Method.builder(record, "ToString", string)
                .modifiers(Modifier.OVERRIDE);
        if (sealedMembers) {
          methodBuilder.modifiers(Modifier.SEALED);
        }
        final Method method = methodBuilder.build();
        final Method sbCtor = Method.builder(sb, ".ctor", voidType).build();
        final Method sbToString =
            Method.builder(sb, "ToString", string)
                .modifiers(Modifier.OVERRIDE)
                .build();
        final Variable builder = il.local(0, "builder", sb);
        final List<Il.Inst> instructions = new ArrayList<>();
        instructions.add(il.stLoc(builder, il.newObj(sbCtor)));
        instructions.add(append(builder, record.name));
        instructions.add(append(builder, " { "));
        if (!collapsedToString) {
          instructions.add(
              il.ifThen(
                  il.callVirt(ref(printMembers), ldThis(), il.ldLoc(builder)),
                  append(builder, " ")));
        }
        instructions.add(append(builder, "}"));
        instructions.add(il.ret(il.callVirt(sbToString, il.ldLoc(builder))));
        bodies.put(method,
            il.function(method, ImmutableList.of(thisVar, builder),
                il.block(instructions)));
        return method;
      }

      Method operator(String name, Type rightType) {
        return Method.builder(record, name, bool)
            .parameter("left", self)
            .parameter("right", rightType)
            .modifiers(Modifier.STATIC)
            .build();
      }

      Method equalsRecord(Method getEqualityContract) {
        final Method method =
            Method.builder(record, "Equals", bool)
                .parameter("other", self)
                .modifiers(virtualOrOverride)
                .build();
        final Variable other = il.parameter(0, "other", self);
        final Method typeEquality =
            Method.builder(typeType, "op_Equality", bool)
                .parameter("left", typeType)
                .parameter("right", typeType)
                .modifiers(Modifier.STATIC)
                .build();
        final Method contract = ref(getEqualityContract);
        final List<Il.Inst> conditions = new ArrayList<>();
        conditions.add(il.compNotEqualsNull(il.ldLoc(other)));
        conditions.add(
            il.call(typeEquality, il.callVirt(contract, ldThis()),
                il.callVirt(contract, il.ldLoc(other))));
        for (Field field : compared) {
          final ParameterizedType comparer = ts.equalityComparer(field.type);
          final Method getDefault =
              Method.builder(comparer, "get_Default", comparer)
                  .modifiers(Modifier.STATIC)
                  .build();
          final Method comparerEquals =
              Method.builder(comparer, "Equals", bool)
                  .parameter("x", field.type)
                  .parameter("y", field.type)
                  .modifiers(Modifier.VIRTUAL)
                  .build();
          conditions.add(
              il.callVirt(comparerEquals, il.call(getDefault),
                  il.ldFld(ldThis(), field),
                  il.ldFld(il.ldLoc(other), field)));
        }
        bodies.put(method,
            function(method, il.block(il.ret(il.logicAnd(conditions))),
                other));
        return method;
      }
    }
  }
}

// End RecordFixture.java
