package org.databridge.hierarchy.server;

import org.databridge.hierarchy.NotFoundException;
import org.databridge.hierarchy.compiler.CompilationCache;
import org.databridge.hierarchy.compiler.CompiledProject;
import org.databridge.hierarchy.compiler.ProjectCompiler;
import org.databridge.hierarchy.compiler.RenderedProject;
import org.databridge.hierarchy.compiler.SourceMapping;
import org.databridge.hierarchy.model.FormulaKind;
import org.databridge.hierarchy.model.HierarchyNode;
import org.databridge.hierarchy.model.NodeFormula;
import org.databridge.hierarchy.model.ProjectSnapshot;
import org.databridge.hierarchy.plan.ColumnReference;
import org.databridge.hierarchy.resolve.DependencyResolver;
import org.databridge.hierarchy.resolve.EvaluationOrder;
import org.databridge.hierarchy.script.ArtifactKind;
import org.databridge.hierarchy.script.NodeSelection;
import org.databridge.hierarchy.script.ScriptAssembler;
import org.databridge.hierarchy.script.ScriptBundle;
import org.databridge.hierarchy.script.ScriptOptions;
import org.databridge.hierarchy.serialization.FormulaJson;
import org.databridge.hierarchy.store.HierarchyStore;
import org.databridge.hierarchy.store.SnapshotLoader;
import org.databridge.hierarchy.transpiler.SQLDialect;
import org.databridge.hierarchy.transpiler.SQLGenerator;
import org.databridge.hierarchy.validation.FormulaValidator;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Executor;

/**
 * Entry point of the formula engine for API callers: validation, evaluation order,
 * per-node SQL and deployable scripts, each computed from a fresh snapshot of the store.
 */
public final class FormulaEngineService {

    private final HierarchyStore store;
    private final SnapshotLoader loader;
    private final SourceMapping mapping;
    private final FormulaValidator validator = new FormulaValidator();
    private final DependencyResolver resolver = new DependencyResolver();
    private final ProjectCompiler compiler;
    private final ScriptAssembler assembler;
    private final CompilationCache cache;

    public FormulaEngineService(HierarchyStore store) {
        this(store, SourceMapping.DEFAULT, ScriptOptions.DEFAULT, Runnable::run, new CompilationCache());
    }

    /**
     * @param executor Runs the compilation of independent dependency components
     * @param cache    Holds compiled and rendered projects between calls
     */
    public FormulaEngineService(HierarchyStore store, SourceMapping mapping, ScriptOptions options, Executor executor,
                                CompilationCache cache) {
        this.store = store;
        this.cache = cache;
        this.loader = new SnapshotLoader(store);
        this.mapping = mapping;
        this.compiler = new ProjectCompiler(mapping, executor);
        this.assembler = new ScriptAssembler(mapping, options);
    }

    /**
     * Validates a formula payload against the current nodes of a project.
     *
     * @return The normalized formula
     * @throws org.databridge.hierarchy.validation.InvalidFormulaException if the payload is invalid
     */
    public NodeFormula validateFormula(String projectId, String hierarchyId, NodeFormula formula) {
        Set<String> projectNodes = new TreeSet<>();
        for (HierarchyNode node : store.listHierarchies(projectId)) {
            projectNodes.add(node.id());
        }
        return validator.validate(hierarchyId, formula, projectNodes);
    }

    /**
     * Parses and validates a JSON formula payload.
     */
    public NodeFormula validateFormula(String projectId, String hierarchyId, FormulaKind kind, String payloadJson) {
        return validateFormula(projectId, hierarchyId, FormulaJson.readFormula(kind, hierarchyId, payloadJson));
    }

    /**
     * @throws org.databridge.hierarchy.resolve.CircularDependencyException if formulas form a cycle
     */
    public EvaluationOrder resolveEvaluationOrder(String projectId) {
        return resolver.resolve(loader.load(projectId));
    }

    /**
     * Renders the SQL expression computing one node's value from the mapped source row.
     *
     * @throws org.databridge.hierarchy.compiler.DanglingReferenceException if the node's
     *         formula depends on deleted nodes
     * @throws org.databridge.hierarchy.validation.InvalidFormulaException if the node's stored
     *         formula is invalid
     * @throws org.databridge.hierarchy.compiler.FailedDependencyException if a node it depends
     *         on failed for another reason
     */
    public String compileNode(String projectId, String hierarchyId, SQLDialect dialect) {
        ProjectSnapshot snapshot = loader.load(projectId);
        if (!snapshot.hasNode(hierarchyId)) {
            throw new NotFoundException("Unknown hierarchy '" + hierarchyId + "' in project " + projectId);
        }
        EvaluationOrder order = resolver.resolve(snapshot);
        if (snapshot.formulaOf(hierarchyId) == null) {
            return new SQLGenerator(dialect).generateExpression(
                    ColumnReference.of(mapping.sourceAlias(), mapping.valueColumn(hierarchyId)));
        }
        RenderedProject rendered = cache.rendered(snapshot, mapping, dialect,
                () -> compile(snapshot, order).render(new SQLGenerator(dialect)));
        return rendered.sqlOf(hierarchyId);
    }

    /**
     * Generates scripts for one dialect.
     *
     * @throws org.databridge.hierarchy.transpiler.UnsupportedDialectOperationException if a
     *         requested kind has no rendering for the dialect
     */
    public ScriptBundle generateScripts(String projectId, NodeSelection selection, Set<ArtifactKind> kinds,
                                        SQLDialect dialect) {
        ProjectSnapshot snapshot = loader.load(projectId);
        EvaluationOrder order = resolver.resolve(snapshot);
        return assembler.generate(snapshot, order, compile(snapshot, order), selection, kinds, dialect, false);
    }

    /**
     * Generates scripts for every supported dialect, skipping the kinds a dialect cannot
     * render and listing them in its bundle.
     */
    public Map<SQLDialect, ScriptBundle> generateScriptsForAllDialects(String projectId, NodeSelection selection,
                                                                     Set<ArtifactKind> kinds) {
        ProjectSnapshot snapshot = loader.load(projectId);
        EvaluationOrder order = resolver.resolve(snapshot);
        CompiledProject compiled = compile(snapshot, order);
        Map<SQLDialect, ScriptBundle> bundles = new LinkedHashMap<>();
        for (SQLDialect dialect : SQLDialect.all()) {
            bundles.put(dialect, assembler.generate(snapshot, order, compiled, selection, kinds, dialect, true));
        }
        return bundles;
    }

    public CompilationCache cache() {
        return cache;
    }

    private CompiledProject compile(ProjectSnapshot snapshot, EvaluationOrder order) {
        return cache.compiled(snapshot, mapping, () -> compiler.compile(snapshot, order));
    }
}
