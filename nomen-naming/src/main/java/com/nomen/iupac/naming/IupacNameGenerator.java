/*
 * Copyright (c) 2025 Nomen IUPAC Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.nomen.iupac.naming;

import com.nomen.iupac.api.INameGenerator;
import com.nomen.iupac.api.model.Molecule;
import com.nomen.iupac.api.model.NamingResult;
import com.nomen.iupac.api.model.NamingTrace;
import com.nomen.iupac.api.model.TraceLevel;
import com.nomen.iupac.graph.Graph;
import com.nomen.iupac.graph.Traversal;
import com.nomen.iupac.infra.config.NamingConfig;
import com.nomen.iupac.infra.metrics.MetricsRegistry;
import com.nomen.iupac.naming.parent.StandardParentNamers;
import com.nomen.iupac.rules.AuditEntry;
import com.nomen.iupac.rules.NamingState;
import com.nomen.iupac.rules.RuleScheduler;
import com.nomen.iupac.rules.standard.StandardRuleSet;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import it.unimi.dsi.fastutil.ints.IntList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * IUPAC substitutive name generator.
 *
 * <h2>Pipeline</h2>
 * <p>Ring perception, functional-group detection and chain enumeration feed the
 * rule scheduler, which fixes the parent structure. Substituents are named
 * (recursively where needed), the numbering is chosen by the lowest-locant
 * rules and the name is assembled. See {@link NamingPipeline}.
 *
 * <h2>Errors</h2>
 * <p>Parse diagnostics carried by the molecule are copied into the result.
 * Disconnected input is named by its largest component. When no parent can be
 * fixed, or naming fails unexpectedly, the name degrades to
 * {@code polycyclic_C<n>} and a diagnostic is added; nothing is thrown for
 * malformed chemistry.
 *
 * <h2>Observability</h2>
 * <p>One span {@code iupac.name} per call, with the rule scheduler's
 * {@code iupac.rules} span nested inside. Counters and the duration timer go
 * to {@link MetricsRegistry#getInstance()}.
 *
 * <h2>Thread Safety</h2>
 * <p>Stateless between calls; one instance can name molecules concurrently.
 */
public final class IupacNameGenerator implements INameGenerator {

    private static final Logger logger = LoggerFactory.getLogger(IupacNameGenerator.class);

    private final NamingConfig config;
    private final Tracer tracer;
    private final NamingPipeline pipeline;
    private final NamingMetrics metrics;

    /**
     * Creates a generator with full configuration.
     *
     * @param config naming configuration
     * @param tracer OpenTelemetry tracer for observability
     */
    public IupacNameGenerator(NamingConfig config, Tracer tracer) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        RuleScheduler scheduler = new RuleScheduler(StandardRuleSet.create(StandardParentNamers.create()), tracer);
        this.pipeline = new NamingPipeline(config, scheduler);
        this.metrics = new NamingMetrics(MetricsRegistry.getInstance());
        logger.info("IupacNameGenerator initialized with {}", config);
    }

    public IupacNameGenerator(NamingConfig config) {
        this(config, OpenTelemetry.noop().getTracer("nomen-naming"));
    }

    /**
     * Creates a generator configured from system properties and environment variables.
     */
    public IupacNameGenerator() {
        this(NamingConfig.fromEnvironment());
    }

    public NamingConfig config() {
        return config;
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // INameGenerator INTERFACE IMPLEMENTATION
    // ════════════════════════════════════════════════════════════════════════════════

    /**
     * {@inheritDoc}
     *
     * <p>The trace is surfaced at the configured {@link NamingConfig#traceLevel()}.
     */
    @Override
    public NamingResult name(Molecule molecule) {
        return nameWithTrace(molecule, config.traceLevel());
    }

    @Override
    public NamingResult nameWithTrace(Molecule molecule, TraceLevel level) {
        Objects.requireNonNull(molecule, "molecule must not be null");
        Objects.requireNonNull(level, "level must not be null");
        return metrics.time(() -> doName(molecule, level));
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // CORE NAMING LOGIC
    // ════════════════════════════════════════════════════════════════════════════════

    private NamingResult doName(Molecule molecule, TraceLevel level) {
        long start = System.nanoTime();
        Span span = tracer.spanBuilder("iupac.name").startSpan();
        try (Scope ignored = span.makeCurrent()) {
            span.setAttribute("molecule.atoms", molecule.atomCount());
            List<String> errors = new ArrayList<>(molecule.errors());
            if (molecule.atomCount() > config.maxAtoms()) {
                errors.add("molecule has " + molecule.atomCount() + " atoms, above the configured limit of "
                    + config.maxAtoms());
            }
            if (NamingPipeline.heavyAtoms(molecule) == 0) {
                errors.add("molecule has no heavy atoms to name");
                metrics.recordFallback();
                return new NamingResult("", errors, emptyTrace(level, start));
            }
            Molecule target = largestComponent(molecule, errors);

            NamingPipeline.Outcome outcome;
            try {
                outcome = pipeline.name(target);
            } catch (RuntimeException e) {
                logger.warn("Naming failed for {}: {}", molecule, e.getMessage(), e);
                span.recordException(e);
                span.setStatus(StatusCode.ERROR, "naming failed");
                errors.add("naming failed: " + e.getMessage());
                metrics.recordFallback();
                return new NamingResult("polycyclic_C" + NamingPipeline.heavyAtoms(target), errors,
                    emptyTrace(level, start));
            }

            metrics.recordConflicts(outcome.state().conflicts().size());
            if (outcome.fallback()) {
                errors.add("no parent structure could be fixed; fallback name used");
                metrics.recordFallback();
            }
            metrics.recordName();
            span.setAttribute("iupac.name", outcome.name());
            return new NamingResult(outcome.name(), errors, trace(level, outcome, System.nanoTime() - start));
        } finally {
            span.end();
        }
    }

    /**
     * The largest connected component, with a diagnostic when the input has
     * more than one. Ranked by heavy atoms, then carbons, then lowest atom index.
     */
    private static Molecule largestComponent(Molecule molecule, List<String> errors) {
        List<IntList> components = Traversal.connectedComponents(Graph.fromMolecule(molecule));
        List<IntList> heavy = new ArrayList<>();
        for (IntList component : components) {
            if (heavyCount(molecule, component) > 0) {
                heavy.add(component);
            }
        }
        if (heavy.size() <= 1) {
            return molecule;
        }
        Comparator<IntList> ranking = Comparator
            .<IntList>comparingLong(component -> heavyCount(molecule, component)).reversed()
            .thenComparing(Comparator.<IntList>comparingLong(component -> carbonCount(molecule, component)).reversed())
            .thenComparingInt(component -> component.intStream().min().orElse(Integer.MAX_VALUE));
        heavy.sort(ranking);
        IntList largest = heavy.get(0);
        IntList runnerUp = heavy.get(1);
        String diagnostic = "disconnected input: named the largest of " + heavy.size() + " components";
        if (heavyCount(molecule, runnerUp) == heavyCount(molecule, largest)
                && carbonCount(molecule, runnerUp) == carbonCount(molecule, largest)) {
            diagnostic += " (tie on size, chose the component with the lowest atom index)";
        }
        errors.add(diagnostic);
        int[] atoms = largest.toIntArray();
        Arrays.sort(atoms);
        return molecule.subMolecule(atoms);
    }

    private static long heavyCount(Molecule molecule, IntList atoms) {
        return atoms.intStream().filter(atom -> !molecule.atom(atom).isHydrogen()).count();
    }

    private static long carbonCount(Molecule molecule, IntList atoms) {
        return atoms.intStream().filter(atom -> molecule.atom(atom).isCarbon()).count();
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // TRACE
    // ════════════════════════════════════════════════════════════════════════════════

    private static NamingTrace trace(TraceLevel level, NamingPipeline.Outcome outcome, long durationNanos) {
        if (level == TraceLevel.NONE) {
            return null;
        }
        NamingState state = outcome.state();
        boolean detailed = level == TraceLevel.STANDARD || level == TraceLevel.FULL;
        List<NamingTrace.AppliedRule> applied = new ArrayList<>();
        for (AuditEntry entry : state.auditTrail()) {
            applied.add(new NamingTrace.AppliedRule(entry.ruleId(), entry.blueBookReference(), entry.phase().name(),
                detailed ? entry.rationale() : null));
        }
        List<String> conflicts = detailed
            ? state.conflicts().stream().map(c -> c.ruleId() + ": " + c.description()).toList()
            : List.of();
        List<String> candidates = new ArrayList<>();
        if (level == TraceLevel.FULL) {
            candidates.addAll(state.candidateSummaries());
            if (outcome.numbering() != null) {
                candidates.add("numbering " + outcome.numbering());
            }
        }
        String parentKind = state.parentStructure().map(parent -> parent.kind().name()).orElse(null);
        return new NamingTrace(level, durationNanos, applied, conflicts, parentKind, outcome.parentName(), candidates);
    }

    private static NamingTrace emptyTrace(TraceLevel level, long start) {
        if (level == TraceLevel.NONE) {
            return null;
        }
        return new NamingTrace(level, System.nanoTime() - start, List.of(), List.of(), null, null, List.of());
    }
}
