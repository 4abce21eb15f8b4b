package dumb.kleis.solver;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dumb.kleis.util.Json;
import org.jetbrains.annotations.Nullable;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * What a solver backend declares it can do: theories, operations (native or
 * uninterpreted), features and performance limits. Loaded from
 * {@code /capabilities/<name>.json} on the classpath.
 */
public record Capabilities(@JsonProperty("solver") SolverInfo solver,
                           @JsonProperty("capabilities") Declared capabilities) {

    public Capabilities {
        requireNonNull(solver);
        requireNonNull(capabilities);
    }

    public static Capabilities load(String name) throws IOException {
        var path = "/capabilities/" + name + ".json";
        try (var in = Capabilities.class.getResourceAsStream(path)) {
            if (in == null) throw new FileNotFoundException("Capability declaration not found: " + path);
            return Json.obj(in, Capabilities.class);
        }
    }

    public boolean hasOperation(String name) {
        return capabilities.operations().containsKey(name);
    }

    public Optional<OperationSpec> operation(String name) {
        return Optional.ofNullable(capabilities.operations().get(name));
    }

    /** Operation names with native support, sorted. */
    public List<String> nativeOperations() {
        return capabilities.operations().entrySet().stream()
                .filter(e -> e.getValue().nativeSupport())
                .map(Map.Entry::getKey).sorted().toList();
    }

    public List<String> allOperations() {
        return capabilities.operations().keySet().stream().sorted().toList();
    }

    public boolean hasTheory(String theory) {
        return capabilities.theories().contains(theory);
    }

    public record SolverInfo(@JsonProperty("name") String name,
                             @JsonProperty("version") String version,
                             @JsonProperty("type") String type,
                             @JsonProperty("description") String description) {
    }

    public record Declared(@JsonProperty("theories") Set<String> theories,
                           @JsonProperty("operations") Map<String, OperationSpec> operations,
                           @JsonProperty("features") Features features,
                           @JsonProperty("performance") Performance performance) {
        @JsonCreator
        public Declared {
            theories = theories == null ? Set.of() : Set.copyOf(theories);
            operations = operations == null ? Map.of() : Map.copyOf(operations);
            features = features == null ? new Features(false, false, false, false, false, false) : features;
            performance = performance == null ? new Performance(null, null) : performance;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record OperationSpec(@JsonProperty("arity") int arity,
                                @JsonProperty("theory") String theory,
                                @JsonProperty("native") boolean nativeSupport,
                                @JsonProperty("reason") @Nullable String reason,
                                @JsonProperty("alternatives") @Nullable List<String> alternatives) {
    }

    public record Features(@JsonProperty("quantifiers") boolean quantifiers,
                           @JsonProperty("uninterpreted_functions") boolean uninterpretedFunctions,
                           @JsonProperty("recursive_functions") boolean recursiveFunctions,
                           @JsonProperty("evaluation") boolean evaluation,
                           @JsonProperty("simplification") boolean simplification,
                           @JsonProperty("proof_generation") boolean proofGeneration) {
    }

    public record Performance(@JsonProperty("max_axioms") int maxAxioms,
                              @JsonProperty("timeout_ms") int timeoutMs) {

        public static final int DEFAULT_MAX_AXIOMS = 10_000;
        public static final int DEFAULT_TIMEOUT_MS = 5_000;

        @JsonCreator
        public Performance(@JsonProperty("max_axioms") Integer maxAxioms,
                           @JsonProperty("timeout_ms") Integer timeoutMs) {
            this(maxAxioms != null ? maxAxioms : DEFAULT_MAX_AXIOMS,
                    timeoutMs != null ? timeoutMs : DEFAULT_TIMEOUT_MS);
        }
    }
}
