/*
 * Copyright (c) 2025 Nomen IUPAC Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.nomen.iupac.api;

import com.nomen.iupac.api.model.Molecule;
import com.nomen.iupac.api.model.NamingResult;
import com.nomen.iupac.api.model.TraceLevel;

import java.util.List;

/**
 * Contract for turning a molecular graph into a systematic name.
 *
 * <p>This is the primary interface for consumers of the naming engine.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * INameGenerator generator = new IupacNameGenerator();
 *
 * NamingResult result = generator.name(molecule);
 * if (!result.hasErrors()) {
 *     System.out.println(result.name());
 * }
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>Implementations are stateless between calls. The same instance can be
 * used concurrently from multiple threads; naming the same molecule twice
 * yields the same name and the same rule sequence.
 */
public interface INameGenerator {

    /**
     * Names a molecule.
     *
     * <p>Never throws for malformed chemistry: problems are reported in
     * {@link NamingResult#errors()} and the name degrades to a placeholder.
     *
     * @param molecule the molecule to name (must not be null)
     * @return the name and diagnostics
     * @throws NullPointerException if molecule is null
     */
    NamingResult name(Molecule molecule);

    /**
     * Names a molecule and surfaces the audit trail at the requested level.
     *
     * @param molecule the molecule to name (must not be null)
     * @param level    detail of the returned trace
     * @return the name, diagnostics and trace
     */
    default NamingResult nameWithTrace(Molecule molecule, TraceLevel level) {
        // Default implementation: name without trace
        NamingResult result = name(molecule);
        return new NamingResult(result.name(), result.errors(), null);
    }

    /**
     * Names several molecules. Results are in input order.
     *
     * @param molecules molecules to name
     * @return one result per molecule
     * @throws NullPointerException if molecules is null
     */
    default List<NamingResult> nameBatch(List<Molecule> molecules) {
        return molecules.stream()
            .map(this::name)
            .toList();
    }
}
