package com.nomen.iupac.rules.parent;

import java.util.Comparator;

/**
 * Position label of a parent atom: a number optionally followed by a letter,
 * as in {@code 4a} for fusion atoms.
 */
public record Locant(int number, String letter) implements Comparable<Locant> {

    private static final Comparator<Locant> ORDER =
        Comparator.comparingInt(Locant::number).thenComparing(Locant::letter);

    public Locant {
        if (number < 1) {
            throw new IllegalArgumentException("Locant must be >= 1, was " + number);
        }
        letter = letter == null ? "" : letter;
    }

    public static Locant of(int number) {
        return new Locant(number, "");
    }

    /**
     * Parses {@code "7"} or {@code "4a"}.
     */
    public static Locant parse(String text) {
        int split = 0;
        while (split < text.length() && Character.isDigit(text.charAt(split))) {
            split++;
        }
        if (split == 0) {
            throw new IllegalArgumentException("Not a locant: " + text);
        }
        return new Locant(Integer.parseInt(text.substring(0, split)), text.substring(split));
    }

    public boolean hasLetter() {
        return !letter.isEmpty();
    }

    @Override
    public int compareTo(Locant other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return number + letter;
    }
}
