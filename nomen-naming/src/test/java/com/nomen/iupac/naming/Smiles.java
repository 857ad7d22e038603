package com.nomen.iupac.naming;

import com.nomen.iupac.api.model.Atom;
import com.nomen.iupac.api.model.BondOrder;
import com.nomen.iupac.api.model.Molecule;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Minimal SMILES reader for tests: organic subset, bracket atoms with
 * hydrogen count and charge, branches, ring closures, {@code - = # :} bonds and
 * {@code .} between disconnected parts.
 * Implicit hydrogens fill the lowest default valence.
 */
public final class Smiles {

    private static final Map<String, int[]> VALENCES = Map.of(
        "B", new int[]{3}, "C", new int[]{4}, "N", new int[]{3, 5}, "O", new int[]{2},
        "P", new int[]{3, 5}, "S", new int[]{2, 4, 6}, "F", new int[]{1}, "Cl", new int[]{1},
        "Br", new int[]{1}, "I", new int[]{1});

    private record Pending(String symbol, boolean aromatic, int hydrogens, int charge, boolean bracket) {
    }

    private record Edge(int a, int b, BondOrder order) {
    }

    private Smiles() {
    }

    public static Molecule parse(String smiles) {
        List<Pending> atoms = new ArrayList<>();
        List<Edge> edges = new ArrayList<>();
        Map<Integer, int[]> openRings = new HashMap<>();
        Deque<Integer> branches = new ArrayDeque<>();
        int previous = -1;
        BondOrder bond = null;

        int i = 0;
        while (i < smiles.length()) {
            char c = smiles.charAt(i);
            if (c == '(') {
                branches.push(previous);
                i++;
            } else if (c == ')') {
                previous = branches.pop();
                i++;
            } else if (c == '.') {
                previous = -1;
                bond = null;
                i++;
            } else if (c == '-' || c == '=' || c == '#' || c == ':') {
                bond = switch (c) {
                    case '=' -> BondOrder.DOUBLE;
                    case '#' -> BondOrder.TRIPLE;
                    case ':' -> BondOrder.AROMATIC;
                    default -> BondOrder.SINGLE;
                };
                i++;
            } else if (Character.isDigit(c) || c == '%') {
                int number;
                if (c == '%') {
                    number = Integer.parseInt(smiles.substring(i + 1, i + 3));
                    i += 3;
                } else {
                    number = c - '0';
                    i++;
                }
                int[] open = openRings.remove(number);
                if (open == null) {
                    openRings.put(number, new int[]{previous, bond == null ? -1 : bond.ordinal()});
                } else {
                    BondOrder order = bond != null ? bond
                        : open[1] >= 0 ? BondOrder.values()[open[1]]
                        : defaultOrder(atoms.get(open[0]), atoms.get(previous));
                    edges.add(new Edge(open[0], previous, order));
                }
                bond = null;
            } else {
                int start = i;
                Pending atom;
                if (c == '[') {
                    int end = smiles.indexOf(']', i);
                    atom = bracket(smiles.substring(i + 1, end));
                    i = end + 1;
                } else {
                    String symbol = smiles.startsWith("Cl", i) || smiles.startsWith("Br", i)
                        ? smiles.substring(i, i + 2)
                        : String.valueOf(c);
                    i += symbol.length();
                    boolean aromatic = Character.isLowerCase(symbol.charAt(0));
                    atom = new Pending(capitalize(symbol), aromatic, -1, 0, false);
                }
                if (start == i) {
                    throw new IllegalArgumentException("Unexpected character '" + c + "' in " + smiles);
                }
                atoms.add(atom);
                int index = atoms.size() - 1;
                if (previous >= 0) {
                    BondOrder order = bond != null ? bond : defaultOrder(atoms.get(previous), atom);
                    edges.add(new Edge(previous, index, order));
                }
                previous = index;
                bond = null;
            }
        }
        if (!openRings.isEmpty()) {
            throw new IllegalArgumentException("Unclosed ring bond in " + smiles);
        }
        return build(atoms, edges);
    }

    private static Molecule build(List<Pending> atoms, List<Edge> edges) {
        Molecule.Builder builder = Molecule.builder();
        int[] explicitValence = new int[atoms.size()];
        for (Edge edge : edges) {
            int v = edge.order() == BondOrder.AROMATIC ? 1 : (int) edge.order().valence();
            explicitValence[edge.a()] += v;
            explicitValence[edge.b()] += v;
        }
        for (int i = 0; i < atoms.size(); i++) {
            Pending p = atoms.get(i);
            int hydrogens = p.bracket() ? p.hydrogens() : implicitHydrogens(p, explicitValence[i]);
            Atom atom = p.aromatic() ? Atom.aromatic(p.symbol(), hydrogens) : Atom.of(p.symbol(), hydrogens);
            builder.addAtom(p.charge() == 0 ? atom : atom.withCharge(p.charge()));
        }
        for (Edge edge : edges) {
            builder.addBond(edge.a(), edge.b(), edge.order());
        }
        return builder.build();
    }

    private static int implicitHydrogens(Pending atom, int used) {
        int[] valences = VALENCES.get(atom.symbol());
        if (valences == null) {
            return 0;
        }
        int demand = used + (atom.aromatic() ? 1 : 0);
        for (int valence : valences) {
            if (valence >= demand) {
                return valence - demand;
            }
        }
        return 0;
    }

    private static Pending bracket(String body) {
        int i = 0;
        while (i < body.length() && Character.isDigit(body.charAt(i))) {
            i++;
        }
        int symbolEnd = i + 1;
        if (symbolEnd < body.length() && Character.isLowerCase(body.charAt(symbolEnd))
                && Character.isUpperCase(body.charAt(i))) {
            symbolEnd++;
        }
        String symbol = body.substring(i, symbolEnd);
        boolean aromatic = Character.isLowerCase(symbol.charAt(0));
        i = symbolEnd;
        while (i < body.length() && body.charAt(i) == '@') {
            i++;
        }
        int hydrogens = 0;
        if (i < body.length() && body.charAt(i) == 'H') {
            i++;
            hydrogens = 1;
            if (i < body.length() && Character.isDigit(body.charAt(i))) {
                hydrogens = body.charAt(i) - '0';
                i++;
            }
        }
        int charge = 0;
        while (i < body.length()) {
            char c = body.charAt(i++);
            if (c == '+') {
                charge++;
            } else if (c == '-') {
                charge--;
            } else if (Character.isDigit(c)) {
                charge = Integer.signum(charge) * (c - '0');
            }
        }
        return new Pending(capitalize(symbol), aromatic, hydrogens, charge, true);
    }

    private static BondOrder defaultOrder(Pending a, Pending b) {
        return a.aromatic() && b.aromatic() ? BondOrder.AROMATIC : BondOrder.SINGLE;
    }

    private static String capitalize(String symbol) {
        return Character.toUpperCase(symbol.charAt(0)) + symbol.substring(1);
    }
}
