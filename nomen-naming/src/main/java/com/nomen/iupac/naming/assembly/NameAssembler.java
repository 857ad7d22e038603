/*
 * Copyright (c) 2025 Nomen IUPAC Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.nomen.iupac.naming.assembly;

import com.nomen.iupac.api.model.BondOrder;
import com.nomen.iupac.naming.parent.Locants;
import com.nomen.iupac.naming.stem.AlkaneStems;
import com.nomen.iupac.naming.substituent.SubstituentName;
import com.nomen.iupac.rules.group.FunctionalGroupType;
import com.nomen.iupac.rules.parent.HeteroatomHydride;
import com.nomen.iupac.rules.parent.Locant;
import com.nomen.iupac.rules.parent.NamedParent;
import com.nomen.iupac.rules.parent.Numbering;
import com.nomen.iupac.rules.parent.ParentKind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Writes the final name from a numbered parent, its prefixes and its suffix.
 *
 * <h2>Layout</h2>
 * <pre>
 *   prefixes (alphanumerical)  parent hydride  suffix
 *   2-chloro-3-methyl          pentan          -2-ol
 * </pre>
 * Identical prefixes are collected and multiplied ({@code 2,2-dimethyl},
 * {@code bis(2-chloroethyl)}). The final {@code e} of the parent is elided
 * before a suffix starting with a vowel.
 *
 * <h2>Locant omission</h2>
 * Locants are left out for mononuclear heteroatom parents, one-carbon
 * chains, homogeneous monocycles and two-carbon chains carrying a single
 * group, and for suffixes of carbon-bearing groups on chains (always terminal).
 *
 * <h2>Esters</h2>
 * Esters get functional class names: the alkyl groups of the ester oxygens
 * come first as separate words, then the anion name,
 * {@code methyl ethanoate}, {@code ethyl methyl butanedioate}.
 *
 * <p>Stateless.
 */
public final class NameAssembler {

    private static final Comparator<List<Prefix>> ALPHANUMERICAL = Comparator
        .comparing((List<Prefix> group) -> group.get(0).name().alphaKey())
        .thenComparing(group -> group.get(0).name().text());

    /**
     * Name of a whole molecule.
     */
    public String assemble(NamedParent parent, Numbering numbering, List<Prefix> prefixes, Optional<Suffix> suffix) {
        Objects.requireNonNull(parent, "parent must not be null");
        Objects.requireNonNull(numbering, "numbering must not be null");
        Objects.requireNonNull(prefixes, "prefixes must not be null");
        Objects.requireNonNull(suffix, "suffix must not be null");

        int attachments = prefixes.size() + suffix.map(Suffix::count).orElse(0);
        String parentText = parent.render(numbering, attachments);
        boolean omit = omitLocants(parent, attachments, false);

        String body = parentText;
        if (suffix.isPresent()) {
            Suffix s = suffix.get();
            String retained = retainedBenzeneName(parentText, s);
            body = retained != null ? retained : withSuffix(parentText, s, omit || terminalOnly(parent, s));
        }
        return join(prefixText(prefixes, omit), body);
    }

    /**
     * Functional class name of an ester: {@code alkyls} are the groups on the
     * ester oxygens, one per ester group expressed by {@code suffix}.
     */
    public String assembleEster(NamedParent parent, Numbering numbering, List<Prefix> prefixes, Suffix suffix,
                                List<SubstituentName> alkyls) {
        Objects.requireNonNull(alkyls, "alkyls must not be null");
        if (suffix.type() != FunctionalGroupType.ESTER) {
            throw new IllegalArgumentException("Not an ester suffix: " + suffix.type());
        }
        if (alkyls.isEmpty()) {
            throw new IllegalArgumentException("An ester needs at least one alkyl group");
        }
        return alkylWords(alkyls) + " " + assemble(parent, numbering, prefixes, Optional.of(suffix));
    }

    /**
     * Name of a fragment with a free valence at {@code attachment}:
     * {@code propan-2-yl}, {@code 2-hydroxyethyl}, {@code pyridin-3-yl}.
     */
    public SubstituentName assembleSubstituent(NamedParent parent, Numbering numbering, List<Prefix> prefixes,
                                               int attachment, BondOrder order) {
        Objects.requireNonNull(parent, "parent must not be null");
        Objects.requireNonNull(numbering, "numbering must not be null");
        Objects.requireNonNull(prefixes, "prefixes must not be null");
        Locant freeValence = numbering.locantOf(attachment);
        if (freeValence == null) {
            throw new IllegalArgumentException("Attachment atom " + attachment + " is not numbered by " + numbering);
        }
        String ending = switch (order) {
            case DOUBLE -> "ylidene";
            case TRIPLE -> "ylidyne";
            default -> "yl";
        };
        int attachments = prefixes.size() + 1;
        String parentText = parent.render(numbering, attachments);
        String base;
        if (parent.kind() == ParentKind.HETEROATOM_HYDRIDE) {
            base = hydridePrefix(parentText) + ending.substring(2);
        } else if (parentText.equals("benzene") && order == BondOrder.SINGLE) {
            base = "phenyl";
        } else if (parentText.endsWith("ane") && isLocantOne(freeValence)
                && (parent.kind() == ParentKind.CHAIN || parent.homogeneous())) {
            base = parentText.substring(0, parentText.length() - 3) + ending;
        } else if (parent.kind() == ParentKind.CHAIN && parent.atoms().size() <= 2) {
            base = dropFinalE(parentText) + ending;
        } else {
            base = dropFinalE(parentText) + "-" + freeValence + "-" + ending;
        }
        String text = join(prefixText(prefixes, omitLocants(parent, attachments, true)), base);
        return new SubstituentName(text, !prefixes.isEmpty());
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // PREFIXES
    // ════════════════════════════════════════════════════════════════════════════════

    static String prefixText(List<Prefix> prefixes, boolean omitLocants) {
        Map<String, List<Prefix>> byName = new LinkedHashMap<>();
        for (Prefix prefix : prefixes) {
            byName.computeIfAbsent(prefix.name().text(), k -> new ArrayList<>()).add(prefix);
        }
        List<List<Prefix>> groups = new ArrayList<>(byName.values());
        groups.sort(ALPHANUMERICAL);

        StringBuilder text = new StringBuilder();
        for (List<Prefix> group : groups) {
            SubstituentName name = group.get(0).name();
            List<Locant> locants = group.stream().map(Prefix::locant).sorted().toList();
            String term = multiplied(name, locants.size());
            String part = omitLocants ? term : Locants.join(locants) + "-" + term;
            if (text.length() > 0 && Character.isDigit(part.charAt(0))) {
                text.append('-');
            }
            text.append(part);
        }
        return text.toString();
    }

    private static String multiplied(SubstituentName name, int count) {
        if (name.compound()) {
            return AlkaneStems.compoundMultiplier(count) + name.enclosed();
        }
        if (name.needsEnclosure()) {
            return AlkaneStems.multiplier(count) + name.enclosed();
        }
        boolean italic = name.text().startsWith("tert-") || name.text().startsWith("sec-");
        return AlkaneStems.multiplier(count) + (count > 1 && italic ? "-" : "") + name.text();
    }

    /**
     * Identical groups are multiplied, different ones cited alphanumerically
     * as separate words: {@code dimethyl}, {@code ethyl methyl}.
     */
    static String alkylWords(List<SubstituentName> alkyls) {
        Map<String, List<SubstituentName>> byName = new LinkedHashMap<>();
        for (SubstituentName alkyl : alkyls) {
            byName.computeIfAbsent(alkyl.text(), k -> new ArrayList<>()).add(alkyl);
        }
        return byName.values().stream()
            .sorted(Comparator.comparing((List<SubstituentName> group) -> group.get(0).alphaKey())
                .thenComparing(group -> group.get(0).text()))
            .map(group -> group.size() == 1 ? group.get(0).text() : multiplied(group.get(0), group.size()))
            .reduce((a, b) -> a + " " + b)
            .orElseThrow();
    }

    static boolean omitLocants(NamedParent parent, int attachments, boolean substituent) {
        if (parent.kind() == ParentKind.HETEROATOM_HYDRIDE) {
            return true;
        }
        int size = parent.atoms().size();
        if (parent.kind() == ParentKind.CHAIN && size == 1) {
            return true;
        }
        if (substituent || attachments != 1) {
            return false;
        }
        return parent.homogeneous() || (parent.kind() == ParentKind.CHAIN && size == 2);
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // SUFFIX
    // ════════════════════════════════════════════════════════════════════════════════

    private static String withSuffix(String parentText, Suffix suffix, boolean omitLocants) {
        String word = suffix.attached() ? suffix.type().attachedSuffix() : suffix.type().suffix();
        String core = AlkaneStems.multiplier(suffix.count()) + word;
        String stem = startsWithVowel(core) ? dropFinalE(parentText) : parentText;
        if (omitLocants) {
            return stem + core;
        }
        return stem + "-" + Locants.join(suffix.locants()) + "-" + core;
    }

    private static boolean terminalOnly(NamedParent parent, Suffix suffix) {
        return parent.kind() == ParentKind.CHAIN && suffix.type().carbonInGroup() && !suffix.attached();
    }

    /**
     * Retained names of monosubstituted benzenes that are preferred IUPAC names (P-22.1.3).
     */
    private static String retainedBenzeneName(String parentText, Suffix suffix) {
        if (!parentText.equals("benzene") || suffix.count() != 1) {
            return null;
        }
        FunctionalGroupType type = suffix.type();
        if (type == FunctionalGroupType.ACID && suffix.attached()) {
            return "benzoic acid";
        }
        if (type == FunctionalGroupType.ESTER && suffix.attached()) {
            return "benzoate";
        }
        if (type == FunctionalGroupType.AMIDE && suffix.attached()) {
            return "benzamide";
        }
        if (type == FunctionalGroupType.NITRILE && suffix.attached()) {
            return "benzonitrile";
        }
        if (type == FunctionalGroupType.ALDEHYDE && suffix.attached()) {
            return "benzaldehyde";
        }
        if (type == FunctionalGroupType.ALCOHOL) {
            return "phenol";
        }
        if (type == FunctionalGroupType.AMINE) {
            return "aniline";
        }
        return null;
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // TEXT HELPERS
    // ════════════════════════════════════════════════════════════════════════════════

    private static String hydridePrefix(String parentText) {
        return Arrays.stream(HeteroatomHydride.values())
            .filter(hydride -> hydride.parentName().equals(parentText))
            .map(HeteroatomHydride::prefixName)
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("Unknown parent hydride " + parentText));
    }

    private static String join(String prefixes, String body) {
        if (prefixes.isEmpty()) {
            return body;
        }
        return Character.isDigit(body.charAt(0)) ? prefixes + "-" + body : prefixes + body;
    }

    private static boolean isLocantOne(Locant locant) {
        return locant.number() == 1 && !locant.hasLetter();
    }

    private static boolean startsWithVowel(String text) {
        return !text.isEmpty() && "aeiouy".indexOf(text.charAt(0)) >= 0;
    }

    private static String dropFinalE(String text) {
        return text.endsWith("e") ? text.substring(0, text.length() - 1) : text;
    }
}
