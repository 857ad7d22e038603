package com.nomen.iupac.naming;

import com.nomen.iupac.api.model.Atom;
import com.nomen.iupac.api.model.BondOrder;
import com.nomen.iupac.api.model.Molecule;
import com.nomen.iupac.api.model.NamingResult;
import com.nomen.iupac.api.model.NamingTrace;
import com.nomen.iupac.api.model.TraceLevel;
import com.nomen.iupac.infra.config.NamingConfig;
import com.nomen.iupac.infra.metrics.MetricsRegistry;
import com.nomen.iupac.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.nomen.iupac.naming.stem.AlkaneStems;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("IupacNameGenerator")
class IupacNameGeneratorTest {

    private static final Pattern PARA_ALKYL_PHENOL = Pattern.compile("4-([a-z]+)ylphenol");

    private static final Map<String, Integer> ALKYL_STEMS = Map.ofEntries(
        Map.entry("meth", 1), Map.entry("eth", 2), Map.entry("prop", 3), Map.entry("but", 4),
        Map.entry("pent", 5), Map.entry("hex", 6), Map.entry("hept", 7), Map.entry("oct", 8),
        Map.entry("non", 9), Map.entry("dec", 10), Map.entry("undec", 11), Map.entry("dodec", 12),
        Map.entry("tridec", 13), Map.entry("tetradec", 14), Map.entry("pentadec", 15),
        Map.entry("hexadec", 16), Map.entry("heptadec", 17), Map.entry("octadec", 18),
        Map.entry("nonadec", 19), Map.entry("icos", 20));

    private IupacNameGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new IupacNameGenerator(NamingConfig.builder().build());
    }

    private String name(String smiles) {
        return generator.name(Smiles.parse(smiles)).name();
    }

    @Nested
    @DisplayName("Names")
    class Names {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource(delimiter = '|', value = {
            "CC(C)C                  | 2-methylpropane",
            "CCC(C)C                 | 2-methylbutane",
            "CC(C)(C)C               | 2,2-dimethylpropane",
            "CCC(C)CC(C)C            | 2,4-dimethylhexane",
            "CC(Cl)CC                | 2-chlorobutane",
            "ClCCCl                  | 1,2-dichloroethane",
            "CCO                     | ethanol",
            "CO                      | methanol",
            "CC(O)C                  | propan-2-ol",
            "OCCO                    | ethane-1,2-diol",
            "OCC(O)CO                | propane-1,2,3-triol",
            "CN                      | methanamine",
            "CCC(=O)C                | butan-2-one",
            "CC=O                    | ethanal",
            "CCCC=O                  | butanal",
            "CC(=O)O                 | ethanoic acid",
            "CCC(=O)O                | propanoic acid",
            "C=C                     | ethene",
            "C#C                     | ethyne",
            "C=CCC                   | but-1-ene",
            "C=CC=C                  | buta-1,3-diene",
            "C#CC                    | prop-1-yne",
            "CCOCC                   | ethoxyethane",
            "OCCc1ccccc1             | 2-phenylethan-1-ol",
            "C[Si](C)(C)C            | tetramethylsilane"
        })
        @DisplayName("Should name acyclic structures")
        void shouldNameAcyclic(String smiles, String expected) {
            assertThat(name(smiles)).isEqualTo(expected);
        }

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource(delimiter = '|', value = {
            "c1ccccc1                | benzene",
            "Cc1ccccc1               | methylbenzene",
            "Clc1ccccc1              | chlorobenzene",
            "Clc1ccccc1Cl            | 1,2-dichlorobenzene",
            "Cc1ccccc1C              | 1,2-dimethylbenzene",
            "CC(C)(C)c1ccccc1        | tert-butylbenzene",
            "CC(C)Cc1ccccc1          | (2-methylpropyl)benzene",
            "CC(C)c1ccccc1           | (propan-2-yl)benzene",
            "COc1ccccc1              | methoxybenzene",
            "[O-][N+](=O)c1ccccc1    | nitrobenzene",
            "Oc1ccccc1               | phenol",
            "Nc1ccccc1               | aniline",
            "OC(=O)c1ccccc1          | benzoic acid",
            "O=Cc1ccccc1             | benzaldehyde",
            "C1CCCCC1                | cyclohexane",
            "CC1CCCCC1               | methylcyclohexane",
            "CC1CCCC(C)C1            | 1,3-dimethylcyclohexane",
            "OC1CCCCC1               | cyclohexanol",
            "C1=CCCCC1               | cyclohexene",
            "C1CC2CC1C2              | bicyclo[2.1.1]hexane",
            "C1CCC2(C1)CCCCC2        | spiro[4.5]decane",
            "c1ccc2ccccc2c1          | naphthalene",
            "c1ccc(cc1)-c1ccccc1     | 1,1'-biphenyl",
            "c1ccncc1                | pyridine",
            "Cc1ccncc1               | 4-methylpyridine"
        })
        @DisplayName("Should name cyclic structures")
        void shouldNameCyclic(String smiles, String expected) {
            assertThat(name(smiles)).isEqualTo(expected);
        }

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource(delimiter = '|', value = {
            "CC(=O)OC                | methyl ethanoate",
            "CCOC(=O)C               | ethyl ethanoate",
            "O=COC                   | methyl methanoate",
            "CC(=O)OC(C)C            | propan-2-yl ethanoate",
            "CC(=O)Oc1ccccc1         | phenyl ethanoate",
            "COC(=O)CCC(=O)OC        | dimethyl butanedioate",
            "CCOC(=O)CCC(=O)OC       | ethyl methyl butanedioate",
            "COC(=O)c1ccccc1         | methyl benzoate",
            "CC(=O)N                 | ethanamide",
            "NC(=O)CCCC(N)=O         | pentanediamide",
            "NC(=O)c1ccccc1          | benzamide",
            "CC#N                    | ethanenitrile",
            "N#CCC#N                 | propanedinitrile",
            "N#Cc1ccccc1             | benzonitrile",
            "N#CCC(=O)O              | 2-cyanoethanoic acid",
            "N#Cc1ccc(cc1)C(=O)O     | 4-cyanobenzoic acid"
        })
        @DisplayName("Should name esters, amides and nitriles")
        void shouldNameAcidDerivatives(String smiles, String expected) {
            assertThat(name(smiles)).isEqualTo(expected);
        }

        @Test
        @DisplayName("Should name straight chains up to twenty carbons")
        void shouldNameStraightChains() {
            for (int n = 1; n <= 20; n++) {
                assertThat(name("C".repeat(n))).as("C%d", n).isEqualTo(AlkaneStems.alkane(n));
            }
        }

        @ParameterizedTest(name = "C{0} on phenol")
        @ValueSource(ints = {1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14, 15, 16, 17, 18, 19, 20})
        @DisplayName("Should name straight alkyl substituents whose stem gives back the carbon count")
        void shouldRoundTripAlkylSubstituents(int carbons) {
            String name = name("Oc1ccc(" + "C".repeat(carbons) + ")cc1");

            Matcher matcher = PARA_ALKYL_PHENOL.matcher(name);
            assertThat(matcher.matches()).as(name).isTrue();
            assertThat(ALKYL_STEMS).containsKey(matcher.group(1));
            assertThat(ALKYL_STEMS.get(matcher.group(1))).isEqualTo(carbons);
        }

        @Test
        @DisplayName("Should use retained alkyl prefixes when configured")
        void shouldUseRetainedAlkylNames() {
            IupacNameGenerator retained = new IupacNameGenerator(
                NamingConfig.builder().retainedAlkylNames(true).build());

            assertThat(retained.name(Smiles.parse("CC(C)c1ccccc1")).name()).isEqualTo("isopropylbenzene");
            assertThat(name("CC(C)c1ccccc1")).isEqualTo("(propan-2-yl)benzene");
        }

        @Test
        @DisplayName("Should report no errors for well-formed input")
        void shouldReportNoErrors() {
            NamingResult result = generator.name(Smiles.parse("CCO"));

            assertThat(result.hasErrors()).isFalse();
            assertThat(result.hasTrace()).isFalse();
        }

        @Test
        @DisplayName("Should be deterministic")
        void shouldBeDeterministic() {
            Molecule molecule = Smiles.parse("CC(C)Cc1ccccc1");
            NamingResult first = generator.nameWithTrace(molecule, TraceLevel.BASIC);
            NamingResult second = generator.nameWithTrace(molecule, TraceLevel.BASIC);

            assertThat(second.name()).isEqualTo(first.name());
            assertThat(second.trace().ruleIds()).isEqualTo(first.trace().ruleIds());
        }
    }

    @Nested
    @DisplayName("Diagnostics")
    class Diagnostics {

        @Test
        @DisplayName("Should copy parse errors into the result")
        void shouldCopyParseErrors() {
            Molecule molecule = Molecule.builder()
                .addAtom(Atom.of("C", 3))
                .addAtom(Atom.of("C", 3))
                .addBond(0, 1, BondOrder.SINGLE)
                .addError("unsupported stereo marker at 4")
                .build();

            NamingResult result = generator.name(molecule);

            assertThat(result.name()).isEqualTo("ethane");
            assertThat(result.errors()).containsExactly("unsupported stereo marker at 4");
        }

        @Test
        @DisplayName("Should name the largest component of disconnected input")
        void shouldNameLargestComponent() {
            NamingResult result = generator.name(Smiles.parse("C.CCCO"));

            assertThat(result.name()).isEqualTo("propan-1-ol");
            assertThat(result.errors()).singleElement().asString()
                .startsWith("disconnected input")
                .contains("2 components");
        }

        @Test
        @DisplayName("Should prefer the component with more carbons when heavy-atom counts tie")
        void shouldPreferCarbonRichComponent() {
            NamingResult result = generator.name(Smiles.parse("CO.CC"));

            assertThat(result.name()).isEqualTo("ethane");
            assertThat(result.errors()).singleElement().asString().doesNotContain("tie");
        }

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource(delimiter = '|', value = {
            "CCN.CCO | ethanamine",
            "CCO.CCN | ethanol"
        })
        @DisplayName("Should break full ties by lowest atom index and say so")
        void shouldBreakTiesByAtomIndex(String smiles, String expected) {
            NamingResult result = generator.name(Smiles.parse(smiles));

            assertThat(result.name()).isEqualTo(expected);
            assertThat(result.errors()).singleElement().asString()
                .startsWith("disconnected input")
                .contains("tie on size");
        }

        @Test
        @DisplayName("Should return an empty name for a molecule without heavy atoms")
        void shouldRejectEmptyMolecule() {
            NamingResult result = generator.name(Molecule.builder().build());

            assertThat(result.name()).isEmpty();
            assertThat(result.errors()).containsExactly("molecule has no heavy atoms to name");
        }

        @Test
        @DisplayName("Should fall back when no parent structure can be fixed")
        void shouldFallBackWithoutParent() {
            NamingResult result = generator.nameWithTrace(Smiles.parse("OO"), TraceLevel.STANDARD);

            assertThat(result.name()).isEqualTo("polycyclic_C2");
            assertThat(result.errors()).contains("no parent structure could be fixed; fallback name used");
            assertThat(result.trace().conflicts())
                .anyMatch(conflict -> conflict.contains("no rule could fix a parent structure"));
        }

        @Test
        @DisplayName("Should flag molecules above the configured size limit and still name them")
        void shouldFlagOversizedMolecules() {
            IupacNameGenerator small = new IupacNameGenerator(NamingConfig.builder().maxAtoms(2).build());

            NamingResult result = small.name(Smiles.parse("CCC"));

            assertThat(result.name()).isEqualTo("propane");
            assertThat(result.errors()).singleElement().asString().contains("configured limit of 2");
        }

        @Test
        @DisplayName("Should reject null arguments")
        void shouldRejectNulls() {
            assertThatThrownBy(() -> generator.name(null)).isInstanceOf(NullPointerException.class);
            assertThatThrownBy(() -> generator.nameWithTrace(Smiles.parse("C"), null))
                .isInstanceOf(NullPointerException.class);
        }
    }

    @Nested
    @DisplayName("Trace")
    class Trace {

        @Test
        @DisplayName("Should omit the trace at level NONE")
        void shouldOmitTrace() {
            assertThat(generator.nameWithTrace(Smiles.parse("CCO"), TraceLevel.NONE).trace()).isNull();
        }

        @Test
        @DisplayName("Should list rule ids without rationale at level BASIC")
        void shouldListRuleIds() {
            NamingTrace trace = generator.nameWithTrace(Smiles.parse("CCO"), TraceLevel.BASIC).trace();

            assertThat(trace.ruleIds()).contains("P-41-principal-group", "P-21.2-chain");
            assertThat(trace.appliedRules()).allMatch(rule -> rule.rationale() == null);
            assertThat(trace.candidateSummaries()).isEmpty();
            assertThat(trace.parentKind()).isEqualTo("CHAIN");
            assertThat(trace.parentName()).isEqualTo("ethane");
        }

        @Test
        @DisplayName("Should carry rationale at level STANDARD")
        void shouldCarryRationale() {
            NamingTrace trace = generator.nameWithTrace(Smiles.parse("c1ccccc1"), TraceLevel.STANDARD).trace();

            assertThat(trace.ruleIds()).contains("P-22.1-monocycle");
            assertThat(trace.appliedRules()).allMatch(rule -> rule.rationale() != null);
            assertThat(trace.parentKind()).isEqualTo("MONOCYCLE");
            assertThat(trace.candidateSummaries()).isEmpty();
        }

        @Test
        @DisplayName("Should add candidate summaries and the numbering at level FULL")
        void shouldAddCandidates() {
            NamingTrace trace = generator.nameWithTrace(Smiles.parse("CC(C)CC"), TraceLevel.FULL).trace();

            assertThat(trace.candidateSummaries()).isNotEmpty();
            assertThat(trace.candidateSummaries()).anyMatch(summary -> summary.startsWith("numbering "));
            assertThat(trace.totalDurationNanos()).isPositive();
        }

        @Test
        @DisplayName("Should surface the configured trace level from name()")
        void shouldUseConfiguredLevel() {
            IupacNameGenerator traced = new IupacNameGenerator(
                NamingConfig.builder().traceLevel(TraceLevel.STANDARD).build());

            NamingResult result = traced.name(Smiles.parse("CCO"));

            assertThat(result.hasTrace()).isTrue();
            assertThat(result.trace().level()).isEqualTo(TraceLevel.STANDARD);
        }
    }

    @Nested
    @DisplayName("Batch and concurrency")
    class Batch {

        @Test
        @DisplayName("Should keep input order in batch results")
        void shouldKeepOrder() {
            List<NamingResult> results = generator.nameBatch(List.of(
                Smiles.parse("CCO"), Smiles.parse("c1ccccc1"), Smiles.parse("CC(C)C")));

            assertThat(results).extracting(NamingResult::name)
                .containsExactly("ethanol", "benzene", "2-methylpropane");
        }

        @Test
        @DisplayName("Should name concurrently with one instance")
        void shouldNameConcurrently() throws Exception {
            ExecutorService executor = Executors.newFixedThreadPool(4);
            try {
                List<Future<String>> futures = new ArrayList<>();
                for (int i = 0; i < 40; i++) {
                    String smiles = i % 2 == 0 ? "CC(C)Cc1ccccc1" : "C1CC2CC1C2";
                    futures.add(executor.submit(() -> name(smiles)));
                }
                for (int i = 0; i < futures.size(); i++) {
                    assertThat(futures.get(i).get())
                        .isEqualTo(i % 2 == 0 ? "(2-methylpropyl)benzene" : "bicyclo[2.1.1]hexane");
                }
            } finally {
                executor.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("Metrics")
    class Metrics {

        private InMemoryMetricsRegistry registry() {
            return (InMemoryMetricsRegistry) MetricsRegistry.getInstance();
        }

        @Test
        @DisplayName("Should count names")
        void shouldCountNames() {
            long before = registry().counterValue(NamingMetrics.NAMES_TOTAL);

            generator.name(Smiles.parse("CCO"));
            generator.name(Smiles.parse("CCC"));

            assertThat(registry().counterValue(NamingMetrics.NAMES_TOTAL) - before).isGreaterThanOrEqualTo(2);
        }

        @ParameterizedTest
        @ValueSource(strings = {"OO", "[Xe]"})
        @DisplayName("Should count fallback names")
        void shouldCountFallbacks(String smiles) {
            long before = registry().counterValue(NamingMetrics.FALLBACK_NAMES_TOTAL);

            generator.name(Smiles.parse(smiles));

            assertThat(registry().counterValue(NamingMetrics.FALLBACK_NAMES_TOTAL) - before).isPositive();
        }
    }
}
