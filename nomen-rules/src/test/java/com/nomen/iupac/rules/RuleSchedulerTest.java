package com.nomen.iupac.rules;

import com.nomen.iupac.rules.parent.ParentKind;
import com.nomen.iupac.rules.parent.ParentStructure;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RuleSchedulerTest {

    @Mock
    private Tracer tracer;

    @Mock
    private SpanBuilder spanBuilder;

    @Mock
    private Span span;

    @Mock
    private Scope scope;

    private NamingState hexane;

    @BeforeEach
    void setUp() {
        hexane = TestStructures.initialState(TestStructures.alkane(6));
    }

    private static NamingRule rule(String id, int priority, List<String> log) {
        return new NamingRule(id, "ref", priority, ExecutionPhase.RING_SELECTION, s -> true, s -> {
            log.add(id);
            return Transition.of(s, "ran " + id);
        });
    }

    private static NamingRule naming(String id, int priority) {
        return new NamingRule(id, "ref", priority, ExecutionPhase.PARENT_NAMING, s -> true,
            s -> Transition.of(s.withParentStructure(new ParentStructure.ChainParent(
                s.candidateChains().get(0), FakeParent.of(ParentKind.CHAIN, "hexane", 0, 1, 2, 3, 4, 5))), "named"));
    }

    @Test
    @DisplayName("Rules run by priority descending, then by id")
    void executionOrder() {
        List<String> log = new ArrayList<>();
        RuleScheduler scheduler = new RuleScheduler(List.of(
            rule("b", 10, log), rule("a", 10, log), rule("c", 50, log)));

        scheduler.run(hexane);

        assertThat(log).containsExactly("c", "a", "b");
        assertThat(scheduler.rules()).extracting(NamingRule::id).containsExactly("c", "a", "b");
    }

    @Test
    @DisplayName("Rules whose condition fails are skipped and leave no audit entry")
    void skipsIneligibleRules() {
        List<String> log = new ArrayList<>();
        NamingRule never = new NamingRule("never", "ref", 100, ExecutionPhase.RING_SELECTION, s -> false, s -> {
            log.add("never");
            return Transition.of(s, "should not run");
        });

        NamingState result = new RuleScheduler(List.of(never, naming("name", 1))).run(hexane);

        assertThat(log).isEmpty();
        assertThat(result.auditTrail()).extracting(AuditEntry::ruleId).containsExactly("name");
    }

    @Test
    @DisplayName("The pass stops once a parent structure is fixed")
    void stopsAtParent() {
        List<String> log = new ArrayList<>();

        NamingState result = new RuleScheduler(List.of(naming("name", 10), rule("later", 5, log))).run(hexane);

        assertThat(result.parentStructure()).isPresent();
        assertThat(log).isEmpty();
        assertThat(result.conflicts()).isEmpty();
    }

    @Test
    @DisplayName("No parent after the last rule is logged as a scheduler conflict")
    void conflictWithoutParent() {
        NamingState result = new RuleScheduler(List.of(rule("noop", 1, new ArrayList<>()))).run(hexane);

        assertThat(result.parentStructure()).isEmpty();
        assertThat(result.conflicts()).extracting(Conflict::ruleId).containsExactly("scheduler");
    }

    @Test
    @DisplayName("Audit entries carry id, reference, phase and rationale")
    void auditEntries() {
        NamingState result = new RuleScheduler(List.of(naming("name", 10))).run(hexane);

        AuditEntry entry = result.auditTrail().get(0);
        assertThat(entry.ruleId()).isEqualTo("name");
        assertThat(entry.blueBookReference()).isEqualTo("ref");
        assertThat(entry.phase()).isEqualTo(ExecutionPhase.PARENT_NAMING);
        assertThat(entry.rationale()).isEqualTo("named");
        assertThat(hexane.auditTrail()).isEmpty();
    }

    @Test
    @DisplayName("Applied rules and conflicts are emitted as span events")
    void spanEvents() {
        when(tracer.spanBuilder(anyString())).thenReturn(spanBuilder);
        when(spanBuilder.startSpan()).thenReturn(span);
        when(span.makeCurrent()).thenReturn(scope);

        new RuleScheduler(List.of(rule("noop", 1, new ArrayList<>())), tracer).run(hexane);

        verify(tracer).spanBuilder("iupac.rules");
        verify(span).addEvent(eq("rule.applied"), any(Attributes.class));
        verify(span, atLeastOnce()).addEvent(eq("rule.conflict"), any(Attributes.class));
        verify(span).end();
    }
}
