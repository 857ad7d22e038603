/*
 * Copyright (c) 2025 Nomen IUPAC Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.nomen.iupac.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * Name produced for one molecule, with ordered diagnostics and an optional trace.
 *
 * <h2>Usage</h2>
 * <pre>
 * NamingResult result = generator.nameWithTrace(molecule, TraceLevel.STANDARD);
 * System.out.println(result.name());
 * result.trace().appliedRules().forEach(r -&gt; System.out.println(r.describe()));
 * </pre>
 */
public record NamingResult(
    @JsonProperty("name") String name,
    @JsonProperty("errors") List<String> errors,
    @JsonProperty("trace") NamingTrace trace
) implements Serializable {

    public NamingResult {
        name = name == null ? "" : name;
        errors = List.copyOf(Objects.requireNonNull(errors, "errors must not be null"));
    }

    public NamingResult(String name, List<String> errors) {
        this(name, errors, null);
    }

    /**
     * Returns true if any diagnostic was recorded.
     */
    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean hasTrace() {
        return trace != null;
    }
}
