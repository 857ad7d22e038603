/*
 * Copyright (c) 2025 Nomen IUPAC Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.nomen.iupac.naming.stem;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Hantzsch-Widman names of heteromonocycles with 3 to 10 ring atoms (P-22.2.2).
 *
 * <p>The name is the replacement prefixes in seniority order, each multiplied,
 * followed by a stem chosen by ring size and hydrogenation state. For
 * six-membered rings the stem also depends on the heteroatom cited last. The
 * final {@code a} of a prefix is elided before a vowel
 * ({@code oxa + aza + ole = oxazole}).
 */
public final class HantzschWidman {

    private static final List<String> SIX_A = List.of("O", "S", "Se", "Te", "Bi");
    private static final List<String> SIX_B = List.of("N", "Si", "Ge", "Sn", "Pb");

    private HantzschWidman() {
    }

    public static boolean supports(int ringSize, List<String> heteroatoms) {
        return ringSize >= 3 && ringSize <= 10 && !heteroatoms.isEmpty()
            && heteroatoms.size() < ringSize
            && heteroatoms.stream().allMatch(s -> ReplacementPrefix.forSymbol(s).isPresent());
    }

    /**
     * Name without locants, e.g. {@code oxadiazole}, {@code dioxane}, {@code azepine}.
     *
     * @param heteroatoms element symbols of the ring heteroatoms, any order, repeated per atom
     * @param mancude     true for the maximum number of non-cumulative double bonds,
     *                    false for the saturated ring
     */
    public static String name(int ringSize, List<String> heteroatoms, boolean mancude) {
        if (!supports(ringSize, heteroatoms)) {
            throw new IllegalArgumentException("No Hantzsch-Widman name for size " + ringSize + " with " + heteroatoms);
        }
        return elide(prefixes(heteroatoms), stem(ringSize, heteroatoms, mancude));
    }

    /**
     * Multiplied replacement prefixes in seniority order: {@code oxadiaza}.
     */
    public static String prefixes(List<String> heteroatoms) {
        Map<String, Integer> counts = new TreeMap<>(ReplacementPrefix.SENIORITY);
        for (String symbol : heteroatoms) {
            counts.merge(symbol, 1, Integer::sum);
        }
        String result = "";
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            String prefix = ReplacementPrefix.forSymbol(entry.getKey()).orElseThrow().prefix();
            result = elide(result, AlkaneStems.multiplier(entry.getValue()) + prefix);
        }
        return result;
    }

    static String stem(int size, List<String> heteroatoms, boolean mancude) {
        boolean nitrogen = heteroatoms.contains("N");
        switch (size) {
            case 3:
                return mancude ? (nitrogen ? "irine" : "irene") : (nitrogen ? "iridine" : "irane");
            case 4:
                return mancude ? "ete" : (nitrogen ? "etidine" : "etane");
            case 5:
                return mancude ? "ole" : (nitrogen ? "olidine" : "olane");
            case 6:
                return sixMembered(lastCited(heteroatoms), mancude);
            case 7:
                return mancude ? "epine" : "epane";
            case 8:
                return mancude ? "ocine" : "ocane";
            case 9:
                return mancude ? "onine" : "onane";
            case 10:
                return mancude ? "ecine" : "ecane";
            default:
                throw new IllegalArgumentException("Unsupported ring size " + size);
        }
    }

    private static String sixMembered(String lastCited, boolean mancude) {
        if (SIX_A.contains(lastCited)) {
            return mancude ? "ine" : "ane";
        }
        if (SIX_B.contains(lastCited)) {
            return mancude ? "ine" : "inane";
        }
        return mancude ? "inine" : "inane";
    }

    private static String lastCited(List<String> heteroatoms) {
        return heteroatoms.stream().max(ReplacementPrefix.SENIORITY).orElseThrow();
    }

    /**
     * Joins two name parts, dropping a final {@code a} of {@code head} before a vowel.
     */
    public static String elide(String head, String tail) {
        if (head.endsWith("a") && !tail.isEmpty() && isVowel(tail.charAt(0))) {
            return head.substring(0, head.length() - 1) + tail;
        }
        return head + tail;
    }

    static boolean isVowel(char c) {
        return "aeiou".indexOf(Character.toLowerCase(c)) >= 0;
    }
}
