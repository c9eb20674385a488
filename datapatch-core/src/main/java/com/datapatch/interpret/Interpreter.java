package com.datapatch.interpret;

import com.datapatch.ast.Patch;
import com.datapatch.diagnostics.DiagnosticSink;
import com.datapatch.diagnostics.LoggingDiagnosticSink;
import com.datapatch.diagnostics.PatchRuntimeException;
import com.datapatch.host.Selectable;
import com.datapatch.select.SelectorEngine;
import org.apache.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Executes patches against a host element tree.
 *
 * <p>Each run gets its own scopes and per-patch tables, so an interpreter can run independent
 * patches on several threads provided they edit independent trees. A runtime error aborts the
 * patch it happened in and is reported to the {@link DiagnosticSink}; it never escapes
 * {@link #run} and never stops the other patches of {@link #runAll}.</p>
 *
 * <p>Patches containing error nodes from transformation should not be run. If one is run anyway,
 * reaching an error node aborts it with a syntax error.</p>
 */
public class Interpreter {

    private static final Logger log = Logger.getLogger(Interpreter.class);

    private final PatchEnvironment environment;
    private final SelectorEngine engine;
    private final DiagnosticSink sink;

    public Interpreter(PatchEnvironment environment, DiagnosticSink sink) {
        this.environment = environment;
        this.engine = new SelectorEngine(environment.rulesets());
        this.sink = sink;
    }

    public Interpreter(PatchEnvironment environment) {
        this(environment, new LoggingDiagnosticSink());
    }

    public PatchEnvironment environment() {
        return environment;
    }

    /**
     * Runs the default pass: only blocks without a stage attribute.
     */
    public PatchResult run(Patch patch, List<Selectable> roots) {
        return run(patch, roots, null);
    }

    /**
     * Runs one pass of a patch. Top-level blocks run only when their stage attribute names
     * {@code stage}, or, for a null {@code stage}, when they have none.
     */
    public PatchResult run(Patch patch, List<Selectable> roots, String stage) {
        String name = patch.coordinate().file();
        log.info("Running " + name + (stage == null ? "" : " at stage '" + stage + "'"));
        Execution execution = new Execution(environment, engine, roots, stage);
        try {
            execution.run(patch);
        } catch (PatchRuntimeException e) {
            e.locate(patch.coordinate());
            log.warn("Patch " + name + " failed: " + e);
            sink.report(e.toDiagnostic());
            return execution.result(e);
        }
        PatchResult result = execution.result(null);
        log.info("Finished " + name + ", " + result.modifiedElements() + " element(s) modified");
        return result;
    }

    /**
     * Runs patches in order against the same roots. A failing patch does not stop the others.
     */
    public List<PatchResult> runAll(List<Patch> patches, List<Selectable> roots, String stage) {
        return runAll(patches, () -> roots, stage);
    }

    /**
     * Runs patches in order, asking {@code roots} for the top-level elements before each one so a
     * patch sees the elements earlier patches created and not the ones they deleted.
     */
    public List<PatchResult> runAll(List<Patch> patches, Supplier<List<Selectable>> roots, String stage) {
        List<PatchResult> results = new ArrayList<>(patches.size());
        for (Patch patch : patches) {
            results.add(run(patch, roots.get(), stage));
        }
        return results;
    }
}
