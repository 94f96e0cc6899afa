package io.tabula.path;

import io.tabula.core.Cell;
import io.tabula.core.ValueKind;

import java.lang.invoke.MethodHandle;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Immutable, pre-compiled access path from a record type to a typed leaf value.
 * <p>
 * Paths are compiled once by {@link PathCompiler} and reused for every row of every collection
 * bound afterwards. The step list and the per-step invokers are parallel: {@code readers[i]}
 * performs the raw read of {@code steps.get(i)}.
 */
public final class CompiledPath {

    private final Class<?> rootType;
    private final String spec;
    private final List<AccessStep> steps;
    private final MethodHandle[] readers;
    private final ValueKind kind;
    private final boolean unsigned;
    private final LeafConverter leafConverter;

    CompiledPath(
            Class<?> rootType,
            String spec,
            List<AccessStep> steps,
            MethodHandle[] readers,
            ValueKind kind,
            boolean unsigned,
            LeafConverter leafConverter) {
        if (steps.isEmpty()) {
            throw new IllegalArgumentException("steps required");
        }
        if (steps.size() != readers.length) {
            throw new IllegalArgumentException("one reader per step required");
        }
        this.rootType = rootType;
        this.spec = spec;
        this.steps = List.copyOf(steps);
        this.readers = readers.clone();
        this.kind = kind;
        this.unsigned = unsigned;
        this.leafConverter = leafConverter;
    }

    public Class<?> rootType() {
        return rootType;
    }

    /**
     * The specification text this path was compiled from.
     */
    public String spec() {
        return spec;
    }

    public List<AccessStep> steps() {
        return steps;
    }

    public ValueKind kind() {
        return kind;
    }

    /**
     * Whether integer values of this path carry an unsigned magnitude.
     */
    public boolean unsigned() {
        return unsigned;
    }

    /**
     * The class of the last step's result.
     */
    public Class<?> terminalType() {
        return steps.get(steps.size() - 1).resultType();
    }

    /**
     * Default column name: the segment names joined by {@code '.'}, compiler-added steps excluded.
     */
    public String name() {
        return steps.stream()
                .filter(step -> !step.synthetic())
                .map(AccessStep::name)
                .collect(Collectors.joining("."));
    }

    /**
     * Whether some row may come out absent: a step reads a nullable reference, unwraps an
     * optional or calls an accessor that may fail.
     */
    public boolean mayBeAbsent() {
        for (AccessStep step : steps) {
            if (step.mayBeAbsent()) {
                return true;
            }
        }
        return false;
    }

    MethodHandle reader(int index) {
        return readers[index];
    }

    LeafConverter leafConverter() {
        return leafConverter;
    }

    Cell convertLeaf(Object value) {
        return leafConverter.convert(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CompiledPath other)) {
            return false;
        }
        return unsigned == other.unsigned
                && rootType.equals(other.rootType)
                && spec.equals(other.spec)
                && steps.equals(other.steps)
                && kind == other.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(rootType, spec, steps, kind, unsigned);
    }

    @Override
    public String toString() {
        return "CompiledPath[" + rootType.getSimpleName() + "#" + spec
                + " -> " + kind + (unsigned ? " unsigned" : "")
                + ", steps=" + steps.stream().map(CompiledPath::describe).collect(Collectors.joining(", "))
                + "]";
    }

    static String describe(AccessStep step) {
        StringBuilder sb = new StringBuilder();
        if (step instanceof AccessStep.CallStep) {
            sb.append(step.name()).append("()");
        } else {
            sb.append(step.name());
        }
        for (int i = 0; i < step.indirection(); i++) {
            sb.append('?');
        }
        if (step.mayFail()) {
            sb.append('!');
        }
        return sb.toString();
    }
}
