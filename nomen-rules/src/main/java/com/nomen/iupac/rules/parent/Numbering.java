package com.nomen.iupac.rules.parent;

import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Assignment of locants to the atoms of a parent structure.
 *
 * <p>Atoms are kept in numbering order; {@link #locantOf(int)} returns
 * {@code null} for atoms outside the parent.
 */
public final class Numbering {

    private final IntList order;
    private final List<Locant> labels;
    private final Int2ObjectOpenHashMap<Locant> byAtom;

    private Numbering(IntList order, List<Locant> labels) {
        if (order.size() != labels.size()) {
            throw new IllegalArgumentException(
                "Expected " + order.size() + " locants, got " + labels.size());
        }
        this.order = IntLists.unmodifiable(new IntArrayList(order));
        this.labels = List.copyOf(labels);
        this.byAtom = new Int2ObjectOpenHashMap<>(order.size());
        for (int i = 0; i < order.size(); i++) {
            if (byAtom.put(order.getInt(i), labels.get(i)) != null) {
                throw new IllegalArgumentException("Atom " + order.getInt(i) + " numbered twice");
            }
        }
    }

    /**
     * Numbers {@code atoms} 1, 2, 3, ... in the given order.
     */
    public static Numbering sequential(IntList atoms) {
        List<Locant> labels = new ArrayList<>(atoms.size());
        for (int i = 1; i <= atoms.size(); i++) {
            labels.add(Locant.of(i));
        }
        return new Numbering(atoms, labels);
    }

    public static Numbering of(IntList atoms, List<Locant> labels) {
        Objects.requireNonNull(atoms, "atoms must not be null");
        Objects.requireNonNull(labels, "labels must not be null");
        return new Numbering(atoms, labels);
    }

    public Locant locantOf(int atom) {
        return byAtom.get(atom);
    }

    public boolean numbers(int atom) {
        return byAtom.containsKey(atom);
    }

    /**
     * Atoms in locant order.
     */
    public IntList order() {
        return order;
    }

    public List<Locant> labels() {
        return labels;
    }

    /**
     * Atom carrying {@code locant}, or -1.
     */
    public int atomAt(Locant locant) {
        int index = labels.indexOf(locant);
        return index < 0 ? -1 : order.getInt(index);
    }

    /**
     * Sorted locants of the given atoms, skipping atoms this numbering does not cover.
     */
    public List<Locant> locantsOf(IntList atoms) {
        List<Locant> result = new ArrayList<>(atoms.size());
        for (int atom : atoms) {
            Locant locant = byAtom.get(atom);
            if (locant != null) {
                result.add(locant);
            }
        }
        Collections.sort(result);
        return result;
    }

    public int size() {
        return order.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Numbering other)) {
            return false;
        }
        return order.equals(other.order) && labels.equals(other.labels);
    }

    @Override
    public int hashCode() {
        return Objects.hash(order, labels);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Numbering{");
        for (int i = 0; i < order.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(order.getInt(i)).append('=').append(labels.get(i));
        }
        return sb.append('}').toString();
    }
}
