package com.nomen.iupac.rules.chain;

import com.nomen.iupac.api.model.Molecule;
import com.nomen.iupac.ring.RingClassifier;
import com.nomen.iupac.rules.TestStructures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ChainFinderTest {

    private final ChainFinder finder = new ChainFinder();

    private List<Chain> chains(Molecule molecule) {
        return finder.find(molecule, new RingClassifier().analyze(molecule));
    }

    @Test
    @DisplayName("Unbranched alkane yields a single end-to-end chain")
    void unbranched() {
        assertThat(chains(TestStructures.alkane(5)))
            .singleElement()
            .satisfies(chain -> assertThat(chain.atoms().toIntArray()).containsExactly(0, 1, 2, 3, 4));
    }

    @Test
    @DisplayName("Methane yields a one-atom chain")
    void singleCarbon() {
        assertThat(chains(TestStructures.alkane(1))).containsExactly(Chain.of(0));
    }

    @Test
    @DisplayName("Branched skeleton yields every leaf-to-leaf path")
    void branched() {
        // 2-methylbutane: 0-1-2-3 with 4 on 1
        Molecule molecule = TestStructures.molecule(new String[]{"C", "C", "C", "C", "C"},
            new int[][]{{0, 1}, {1, 2}, {2, 3}, {1, 4}});

        List<Chain> chains = chains(molecule);

        assertThat(chains).hasSize(3);
        assertThat(chains).extracting(Chain::length).containsExactlyInAnyOrder(4, 4, 3);
    }

    @Test
    @DisplayName("Ring atoms and heteroatoms are not chain atoms")
    void excludesRingsAndHeteroatoms() {
        List<Chain> chains = chains(TestStructures.alkylbenzene(2));

        assertThat(chains).singleElement().satisfies(chain -> assertThat(chain.atoms().toIntArray()).containsExactly(6, 7));

        Molecule ether = TestStructures.molecule(new String[]{"C", "O", "C"}, new int[][]{{0, 1}, {1, 2}});
        assertThat(chains(ether)).extracting(Chain::length).containsExactly(1, 1);
    }

    @Test
    @DisplayName("Reversal keeps the atoms and flips the order")
    void reversed() {
        Chain chain = Chain.of(3, 4, 7);

        assertThat(chain.reversed().atoms().toIntArray()).containsExactly(7, 4, 3);
        assertThat(chain.first()).isEqualTo(3);
        assertThat(chain.last()).isEqualTo(7);
    }
}
