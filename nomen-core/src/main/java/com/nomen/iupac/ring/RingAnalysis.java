package com.nomen.iupac.ring;

import java.util.List;
import java.util.Optional;

/**
 * Output of {@link RingClassifier}: the ring basis and the ring systems built from it.
 */
public record RingAnalysis(List<Ring> rings, List<RingSystem> systems) {

    public RingAnalysis {
        rings = List.copyOf(rings);
        systems = List.copyOf(systems);
    }

    public static RingAnalysis empty() {
        return new RingAnalysis(List.of(), List.of());
    }

    public boolean hasRings() {
        return !rings.isEmpty();
    }

    public Optional<RingSystem> systemOf(int atom) {
        return systems.stream().filter(system -> system.contains(atom)).findFirst();
    }

    public boolean inRing(int atom) {
        return systemOf(atom).isPresent();
    }

    public int ringMembership(int atom) {
        int count = 0;
        for (Ring ring : rings) {
            if (ring.contains(atom)) {
                count++;
            }
        }
        return count;
    }

    public List<RingSystem> isolated() {
        return systems.stream().filter(RingSystem::isIsolated).toList();
    }

    public List<RingSystem> fused() {
        return systems.stream().filter(RingSystem::fused).toList();
    }

    public List<RingSystem> bridged() {
        return systems.stream().filter(RingSystem::bridged).toList();
    }

    public List<RingSystem> spiro() {
        return systems.stream().filter(RingSystem::spiro).toList();
    }
}
