package com.riskledger.register.service;

import com.riskledger.register.domain.TrackedStep;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Keeps the {@code sequenceOrder} of a record's steps dense and zero-based.
 * Every operation returns the steps whose position changed.
 */
public final class StepSequencer {

    private StepSequencer() {
    }

    public record Reorder<S extends TrackedStep>(String fromOrder, String toOrder, List<S> moved) {
    }

    /**
     * Reorders {@code current} (ordered by position) to follow {@code requestedIds}.
     *
     * <p>Ids that do not belong to the record are skipped and show as {@code ?} in the to-order.
     * Owned steps missing from the request keep their relative order after the requested ones.
     */
    public static <S extends TrackedStep> Reorder<S> reorder(List<S> current, List<UUID> requestedIds) {
        Map<UUID, S> byId = current.stream().collect(Collectors.toMap(TrackedStep::getId, Function.identity()));

        String fromOrder = IntStream.rangeClosed(1, current.size())
            .mapToObj(String::valueOf)
            .collect(Collectors.joining(", "));
        String toOrder = requestedIds.stream()
            .map(id -> byId.containsKey(id) ? String.valueOf(current.indexOf(byId.get(id)) + 1) : "?")
            .collect(Collectors.joining(", "));

        Set<S> ordered = new LinkedHashSet<>();
        for (UUID id : requestedIds) {
            S step = byId.get(id);
            if (step != null) {
                ordered.add(step);
            }
        }
        ordered.addAll(current);

        return new Reorder<>(fromOrder, toOrder, assign(new ArrayList<>(ordered)));
    }

    /**
     * Inserts {@code step} at {@code requestedOrder} (clamped into [0, n]), or at the end when null.
     * The new step is not part of the returned list.
     */
    public static <S extends TrackedStep> List<S> insert(List<S> current, S step, Integer requestedOrder) {
        int position = requestedOrder == null
            ? current.size()
            : Math.max(0, Math.min(current.size(), requestedOrder));
        List<S> ordered = new ArrayList<>(current);
        ordered.add(position, step);
        step.setSequenceOrder(position);
        List<S> moved = assign(ordered);
        moved.remove(step);
        return moved;
    }

    /**
     * Closes the gap left by a removed step.
     */
    public static <S extends TrackedStep> List<S> compact(List<S> remaining) {
        return assign(new ArrayList<>(remaining));
    }

    private static <S extends TrackedStep> List<S> assign(List<S> ordered) {
        List<S> moved = new ArrayList<>();
        for (int i = 0; i < ordered.size(); i++) {
            S step = ordered.get(i);
            if (step.getSequenceOrder() != i) {
                step.setSequenceOrder(i);
                moved.add(step);
            }
        }
        return moved;
    }
}
