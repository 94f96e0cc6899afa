package io.tabula.path;

import io.tabula.core.ColumnSpecException;
import io.tabula.core.ColumnSpecException.Reason;
import io.tabula.core.TabulaConfiguration;
import io.tabula.core.TabulaConfiguration.MemberVisibility;
import io.tabula.core.TypeClassifier;
import io.tabula.core.ValueKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.lang.reflect.Field;
import java.lang.reflect.Member;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;

/**
 * Compiles dotted column specifications like {@code "order.customer.name"} into
 * {@link CompiledPath compiled paths}.
 * <p>
 * Each segment resolves against the current class, fields first, then zero-argument accessors.
 * All reflection and type validation happens here, once per column; a path that compiles can
 * only yield values of its kind or absent cells afterwards.
 */
public final class PathCompiler {

    private static final Logger LOGGER = LoggerFactory.getLogger(PathCompiler.class);

    private static final MethodType READER_TYPE = MethodType.methodType(Object.class, Object.class);

    private final TabulaConfiguration configuration;

    public PathCompiler() {
        this(TabulaConfiguration.defaults());
    }

    public PathCompiler(TabulaConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("configuration required");
        }
        this.configuration = configuration;
    }

    /**
     * Compile a column specification against a record type.
     *
     * @param rootType the record class every row is an instance of
     * @param spec     dot-separated field and accessor names
     * @return the compiled path
     * @throws ColumnSpecException if a segment does not resolve or the last type has no value kind
     */
    public CompiledPath compile(Class<?> rootType, String spec) {
        if (rootType == null) {
            throw new IllegalArgumentException("rootType required");
        }
        if (spec == null || spec.isBlank()) {
            throw new ColumnSpecException(rootType, spec, null, Reason.MALFORMED_SPEC, "Empty column specification");
        }

        String[] segments = spec.split("\\.", -1);
        List<AccessStep> steps = new ArrayList<>(segments.length + 1);
        List<MethodHandle> readers = new ArrayList<>(segments.length + 1);
        Class<?> current = rootType;

        for (String segment : segments) {
            if (segment.isEmpty()) {
                throw new ColumnSpecException(rootType, spec, null, Reason.MALFORMED_SPEC,
                        "Empty segment in column specification");
            }
            Field field = findField(current, segment);
            if (field != null) {
                ResolvedType resolved = resolve(field.getGenericType(), rootType, spec, segment);
                steps.add(new AccessStep.FieldStep(
                        segment,
                        field,
                        !field.getType().isPrimitive(),
                        resolved.layers(),
                        resolved.type()));
                readers.add(unreflectGetter(field, rootType, spec));
                current = resolved.type();
                continue;
            }

            Method accessor = findAccessor(current, segment, rootType, spec);
            ResolvedType resolved = resolve(accessor.getGenericReturnType(), rootType, spec, segment);
            steps.add(new AccessStep.CallStep(
                    segment,
                    accessor,
                    !accessor.getReturnType().isPrimitive(),
                    accessor.getExceptionTypes().length > 0,
                    false,
                    resolved.layers(),
                    resolved.type()));
            readers.add(unreflect(accessor, rootType, spec));
            current = resolved.type();
        }

        ValueKind kind = TypeClassifier.classify(current);
        if (kind == ValueKind.UNAVAILABLE) {
            if (!configuration.stringFallback() || !TypeClassifier.hasStringConversion(current)) {
                throw new ColumnSpecException(rootType, spec, segments[segments.length - 1],
                        Reason.UNSUPPORTED_TERMINAL_TYPE,
                        "Cannot use type " + current.getTypeName() + " as final element");
            }
            Method toString = stringConversion(current);
            steps.add(new AccessStep.CallStep("toString", toString, true, false, true, List.of(), String.class));
            readers.add(unreflect(toString, rootType, spec));
            LOGGER.debug("Column '{}' on {} falls back to {}.toString()", spec, rootType.getName(),
                    current.getName());
            current = String.class;
            kind = ValueKind.TEXT;
        }

        boolean unsigned = kind == ValueKind.INTEGER && TypeClassifier.isUnsigned(current);
        CompiledPath path = new CompiledPath(
                rootType,
                spec,
                steps,
                readers.toArray(new MethodHandle[0]),
                kind,
                unsigned,
                LeafConverter.forType(current, kind));
        LOGGER.debug("Compiled {}", path);
        return path;
    }

    /**
     * Find the field a segment names. Fields that cannot be read from here, such as private
     * fields of JDK classes in packages not open to us, count as missing so that a same-named
     * accessor is tried next.
     */
    private Field findField(Class<?> type, String name) {
        if (configuration.memberVisibility() == MemberVisibility.PUBLIC) {
            try {
                Field field = type.getField(name);
                return Modifier.isStatic(field.getModifiers()) || !isReadable(field) ? null : field;
            } catch (NoSuchFieldException e) {
                return null;
            }
        }
        Class<?> current = type;
        while (current != null && current != Object.class) {
            try {
                Field field = current.getDeclaredField(name);
                if (!Modifier.isStatic(field.getModifiers()) && !field.isSynthetic() && isReadable(field)) {
                    return field;
                }
            } catch (NoSuchFieldException ignored) {
                // keep looking in the superclass
            }
            current = current.getSuperclass();
        }
        return null;
    }

    private Method findAccessor(Class<?> type, String name, Class<?> rootType, String spec) {
        List<Method> candidates = new ArrayList<>();
        for (Method method : type.getMethods()) {
            if (isCandidate(method, name)) {
                candidates.add(method);
            }
        }
        if (configuration.memberVisibility() == MemberVisibility.ALL) {
            Class<?> current = type;
            while (current != null && current != Object.class) {
                for (Method method : current.getDeclaredMethods()) {
                    if (isCandidate(method, name) && isReadable(method)) {
                        candidates.add(method);
                    }
                }
                current = current.getSuperclass();
            }
        }

        if (candidates.isEmpty()) {
            throw new ColumnSpecException(rootType, spec, name, Reason.NO_SUCH_MEMBER,
                    "No field or accessor " + name + " in " + type.getTypeName());
        }
        for (Method method : candidates) {
            if (method.getParameterCount() != 0) {
                continue;
            }
            if (method.getReturnType() == void.class) {
                throw new ColumnSpecException(rootType, spec, name, Reason.ACCESSOR_SIGNATURE,
                        "Accessor " + type.getSimpleName() + "." + name + "() returns no value");
            }
            return method;
        }
        throw new ColumnSpecException(rootType, spec, name, Reason.ACCESSOR_SIGNATURE,
                "Accessor " + type.getSimpleName() + "." + name + " must not take arguments, takes "
                        + candidates.get(0).getParameterCount());
    }

    private static boolean isCandidate(Method method, String name) {
        return method.getName().equals(name)
                && !Modifier.isStatic(method.getModifiers())
                && !method.isBridge()
                && !method.isSynthetic();
    }

    /**
     * Whether a handle for the member can be obtained: either it is public in a public class, or
     * its package is open to this module.
     */
    private static boolean isReadable(Member member) {
        Class<?> owner = member.getDeclaringClass();
        if (Modifier.isPublic(owner.getModifiers()) && Modifier.isPublic(member.getModifiers())) {
            return true;
        }
        return owner.getModule().isOpen(owner.getPackageName(), PathCompiler.class.getModule());
    }

    private static Method stringConversion(Class<?> type) {
        try {
            return type.getMethod("toString");
        } catch (NoSuchMethodException e) {
            throw new IllegalStateException("toString() vanished from " + type.getName(), e);
        }
    }

    private static ResolvedType resolve(Type genericType, Class<?> rootType, String spec, String segment) {
        return ResolvedType.resolve(genericType)
                .orElseThrow(() -> new ColumnSpecException(rootType, spec, segment, Reason.UNRESOLVABLE_TYPE,
                        "Cannot resolve type " + genericType.getTypeName() + " of " + segment));
    }

    private static MethodHandle unreflectGetter(Field field, Class<?> rootType, String spec) {
        try {
            return lookupFor(field.getDeclaringClass(), field.getModifiers())
                    .unreflectGetter(field)
                    .asType(READER_TYPE);
        } catch (IllegalAccessException e) {
            throw new ColumnSpecException(rootType, spec, field.getName(), Reason.NO_SUCH_MEMBER,
                    "Field " + field.getName() + " is not accessible: " + e.getMessage());
        }
    }

    private static MethodHandle unreflect(Method method, Class<?> rootType, String spec) {
        try {
            return lookupFor(method.getDeclaringClass(), method.getModifiers())
                    .unreflect(method)
                    .asType(READER_TYPE);
        } catch (IllegalAccessException e) {
            throw new ColumnSpecException(rootType, spec, method.getName(), Reason.NO_SUCH_MEMBER,
                    "Accessor " + method.getName() + " is not accessible: " + e.getMessage());
        }
    }

    /**
     * Public members of public classes go through the public lookup, which also covers classes of
     * modules that are not open to us; everything else needs a private lookup in the declaring class.
     */
    private static MethodHandles.Lookup lookupFor(Class<?> declaringClass, int memberModifiers)
            throws IllegalAccessException {
        if (Modifier.isPublic(declaringClass.getModifiers()) && Modifier.isPublic(memberModifiers)) {
            return MethodHandles.publicLookup();
        }
        return MethodHandles.privateLookupIn(declaringClass, MethodHandles.lookup());
    }
}
