package org.databridge.hierarchy.compiler;

import org.databridge.hierarchy.FormulaEngineException;
import org.databridge.hierarchy.model.NodeFormula;
import org.databridge.hierarchy.model.ProjectSnapshot;
import org.databridge.hierarchy.plan.Expression;
import org.databridge.hierarchy.resolve.EvaluationOrder;
import org.databridge.hierarchy.validation.FormulaValidator;
import org.databridge.hierarchy.validation.InvalidFormulaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Compiles every formula node of a project into an expression over the source row.
 *
 * <p>A node whose dependencies are all base nodes compiles inline. A node depending on
 * other formula nodes compiles to a {@link LayerPlan} of its dependency closure, so shared
 * dependencies are written once and the SQL stays proportional to the closure.
 *
 * <p>Stored formulas are validated against the project's nodes before compiling. Each
 * connected component of the dependency graph compiles sequentially in evaluation order on
 * the configured executor; different components share nothing but the read-only snapshot
 * and may run concurrently. A node with dangling references or an invalid formula
 * fails alone, along with the nodes depending on it; the rest of the project still compiles.
 */
public final class ProjectCompiler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProjectCompiler.class);

    private final SourceMapping mapping;
    private final ExpressionCompiler compiler;
    private final Executor executor;
    private final FormulaValidator validator = new FormulaValidator();

    public ProjectCompiler(SourceMapping mapping) {
        this(mapping, Runnable::run);
    }

    public ProjectCompiler(SourceMapping mapping, Executor executor) {
        this.mapping = Objects.requireNonNull(mapping, "Source mapping cannot be null");
        this.compiler = new ExpressionCompiler(mapping);
        this.executor = Objects.requireNonNull(executor, "Executor cannot be null");
    }

    public SourceMapping mapping() {
        return mapping;
    }

    public CompiledProject compile(ProjectSnapshot snapshot, EvaluationOrder order) {
        List<CompletableFuture<CompiledProject>> futures = new ArrayList<>();
        for (List<String> component : order.components()) {
            futures.add(CompletableFuture.supplyAsync(() -> compileComponent(snapshot, order, component), executor));
        }

        Map<String, Expression> expressions = new HashMap<>();
        Map<String, Expression> layerValues = new HashMap<>();
        Map<String, FormulaEngineException> failures = new HashMap<>();
        for (CompletableFuture<CompiledProject> future : futures) {
            CompiledProject part = join(future);
            expressions.putAll(part.expressions());
            layerValues.putAll(part.layerValues());
            failures.putAll(part.failures());
        }
        return new CompiledProject(expressions, layerValues, failures);
    }

    private CompiledProject compileComponent(ProjectSnapshot snapshot, EvaluationOrder order, List<String> component) {
        Map<String, Expression> expressions = new HashMap<>();
        Map<String, Expression> layerValues = new HashMap<>();
        Map<String, FormulaEngineException> failures = new HashMap<>();
        OperandResolver inline = new InlineOperandResolver(mapping);
        OperandResolver layered = new LayeredOperandResolver(LayerPlan.LAYER_ALIAS);
        Set<String> projectNodes = snapshot.nodes().keySet();

        for (String nodeId : component) {
            NodeFormula formula = snapshot.formulaOf(nodeId);
            FormulaEngineException failure = failureOf(nodeId, formula, order, failures);
            if (failure == null) {
                try {
                    formula = validator.validate(nodeId, formula, projectNodes);
                } catch (InvalidFormulaException e) {
                    failure = e;
                }
            }
            if (failure != null) {
                LOGGER.warn("Skipping hierarchy {} of project {}: {}", nodeId, snapshot.projectId(), failure.getMessage());
                failures.put(nodeId, failure);
                continue;
            }

            layerValues.put(nodeId, compiler.compile(formula, layered));
            Expression expression;
            if (dependsOnFormulaNodes(snapshot, formula)) {
                Set<String> closure = snapshot.dependencyClosure(List.of(nodeId));
                expression = LayerPlan.build(snapshot, order, closure, List.of(), mapping, layerValues::get)
                        .valueOf(nodeId);
            } else {
                expression = compiler.compile(formula, inline);
            }
            expressions.put(nodeId, expression);
            LOGGER.debug("Compiled hierarchy {}: {}", nodeId, expression);
        }
        return new CompiledProject(expressions, layerValues, failures);
    }

    private static boolean dependsOnFormulaNodes(ProjectSnapshot snapshot, NodeFormula formula) {
        for (String dependency : formula.referencedHierarchyIds()) {
            if (snapshot.formulaOf(dependency) != null) {
                return true;
            }
        }
        return false;
    }

    private static FormulaEngineException failureOf(String nodeId, NodeFormula formula, EvaluationOrder order,
                                                    Map<String, FormulaEngineException> failures) {
        List<String> missing = order.danglingReferencesOf(nodeId);
        if (!missing.isEmpty()) {
            return new DanglingReferenceException(nodeId, missing);
        }
        for (String dependency : formula.referencedHierarchyIds()) {
            FormulaEngineException upstream = failures.get(dependency);
            if (upstream instanceof DanglingReferenceException dangling) {
                return new DanglingReferenceException(nodeId, dangling.missingIds(), dependency);
            }
            if (upstream != null) {
                return new FailedDependencyException(nodeId, dependency, upstream);
            }
        }
        return null;
    }

    private static CompiledProject join(CompletableFuture<CompiledProject> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw new FormulaEngineException("Compilation failed", e.getCause());
        }
    }
}
