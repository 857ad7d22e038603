package com.nomen.iupac.naming.assembly;

import com.nomen.iupac.rules.group.FunctionalGroupType;
import com.nomen.iupac.rules.parent.Locant;

import java.util.List;
import java.util.Objects;

/**
 * The principal characteristic group expressed as a suffix.
 *
 * @param type     group class
 * @param locants  one locant per group, sorted
 * @param attached true when the group carbon lies outside the parent
 *                 ({@code -carboxylic acid}, {@code -carbonitrile})
 */
public record Suffix(FunctionalGroupType type, List<Locant> locants, boolean attached) {

    public Suffix {
        Objects.requireNonNull(type, "type must not be null");
        locants = locants.stream().sorted().toList();
        if (locants.isEmpty()) {
            throw new IllegalArgumentException("Suffix needs at least one locant");
        }
    }

    public int count() {
        return locants.size();
    }
}
