package com.complexity.inferrer.analysis;

import java.util.*;

/**
 * Call graph over the procedures of one program.
 *
 * Callee lists keep every call site in source order, duplicates included, so the number of
 * occurrences of a callee is recoverable. Calls to names that are not declared procedures
 * (built-ins, library calls) are recorded as edges but never take part in cycles.
 */
public class CallGraph {

    // Declared procedures in declaration order
    private final Set<String> procedures = new LinkedHashSet<>();

    // Call edges: caller -> callees, one entry per call site
    private final Map<String, List<String>> methodCalls = new HashMap<>();

    // Reverse call edges: callee -> set of callers
    private final Map<String, Set<String>> calledBy = new HashMap<>();

    /**
     * Registers a declared procedure.
     *
     * @param name The procedure name
     */
    public void addProcedure(String name) {
        procedures.add(name);
        methodCalls.computeIfAbsent(name, k -> new ArrayList<>());
    }

    /**
     * Records one call site from caller to callee.
     *
     * @param caller The calling procedure
     * @param callee The called name
     */
    public void addCall(String caller, String callee) {
        methodCalls.computeIfAbsent(caller, k -> new ArrayList<>()).add(callee);
        calledBy.computeIfAbsent(callee, k -> new LinkedHashSet<>()).add(caller);
    }

    /**
     * Gets every call site of a procedure, in source order.
     *
     * @param caller The procedure name
     * @return Callee names, or empty list if none
     */
    public List<String> getCallees(String caller) {
        return Collections.unmodifiableList(methodCalls.getOrDefault(caller, Collections.emptyList()));
    }

    /**
     * Gets all procedures that call a given name.
     *
     * @param callee The called name
     * @return Set of caller names, or empty set if none
     */
    public Set<String> getCallers(String callee) {
        return Collections.unmodifiableSet(calledBy.getOrDefault(callee, Collections.emptySet()));
    }

    public boolean isDeclared(String name) {
        return procedures.contains(name);
    }

    public Set<String> getProcedures() {
        return Collections.unmodifiableSet(procedures);
    }

    /**
     * Number of call sites in caller that target callee.
     */
    public int countCalls(String caller, String callee) {
        return (int) getCallees(caller).stream().filter(callee::equals).count();
    }

    /**
     * Declared procedures reachable from the given one through at least one call.
     */
    public Set<String> reachableFrom(String start) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        pending.push(start);
        while (!pending.isEmpty()) {
            String current = pending.pop();
            for (String callee : getCallees(current)) {
                if (isDeclared(callee) && visited.add(callee)) {
                    pending.push(callee);
                }
            }
        }
        return visited;
    }

    /**
     * Procedures that share a call cycle with the given one, itself included.
     * Empty when the procedure is not on any cycle.
     */
    public Set<String> getCycleMembers(String name) {
        Set<String> reachable = reachableFrom(name);
        if (!reachable.contains(name)) {
            return Collections.emptySet();
        }
        Set<String> members = new LinkedHashSet<>();
        for (String candidate : reachable) {
            if (candidate.equals(name) || reachableFrom(candidate).contains(name)) {
                members.add(candidate);
            }
        }
        return members;
    }

    public boolean isOnCycle(String name) {
        return reachableFrom(name).contains(name);
    }

    /**
     * Gets statistics about the call graph.
     */
    public String getStatistics() {
        int totalCalls = methodCalls.values().stream().mapToInt(List::size).sum();
        long internalCalls = methodCalls.values().stream()
                .flatMap(List::stream)
                .filter(this::isDeclared)
                .count();
        long recursive = procedures.stream().filter(this::isOnCycle).count();

        return String.format("CallGraph: %d procedures, %d call sites (%d to declared procedures), %d on cycles",
                procedures.size(), totalCalls, internalCalls, recursive);
    }
}
