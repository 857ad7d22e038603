package com.nomen.iupac.naming.assembly;

import com.nomen.iupac.naming.substituent.SubstituentName;
import com.nomen.iupac.rules.parent.Locant;

import java.util.Objects;

/**
 * One occurrence of a detachable prefix at a parent locant.
 */
public record Prefix(Locant locant, SubstituentName name) {

    public Prefix {
        Objects.requireNonNull(locant, "locant must not be null");
        Objects.requireNonNull(name, "name must not be null");
    }
}
