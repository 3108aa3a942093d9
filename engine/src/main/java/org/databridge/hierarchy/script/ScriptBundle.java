package org.databridge.hierarchy.script;

import org.databridge.hierarchy.transpiler.SQLDialect;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Scripts generated for one dialect, with the partial-failure details of the batch.
 *
 * @param dialect          Target dialect
 * @param scripts          One script per requested and supported artifact kind
 * @param emittedNodeIds   Nodes present in the scripts, in emission order
 * @param errors           Nodes left out, with the reason
 * @param unsupportedKinds Requested kinds the dialect has no rendering for
 */
public record ScriptBundle(
        SQLDialect dialect,
        Map<ArtifactKind, String> scripts,
        List<String> emittedNodeIds,
        List<NodeError> errors,
        List<ArtifactKind> unsupportedKinds) {

    public ScriptBundle {
        scripts = scripts.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(scripts));
        emittedNodeIds = List.copyOf(emittedNodeIds);
        errors = List.copyOf(errors);
        unsupportedKinds = List.copyOf(unsupportedKinds);
    }

    /**
     * @return The script of a kind, or null when it was not generated
     */
    public String script(ArtifactKind kind) {
        return scripts.get(kind);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
