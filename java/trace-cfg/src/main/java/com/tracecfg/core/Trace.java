package com.tracecfg.core;

import com.tracecfg.core.domain.ControlFlowGraph;
import com.tracecfg.core.domain.MidBlockTargetPolicy;
import com.tracecfg.core.domain.SequenceException;
import com.tracecfg.core.domain.ValidationException;

import java.util.Collections;
import java.util.List;

/**
 * Events read from a trace file, in execution order.
 */
public class Trace {
    private final Long declaredEntry;
    private final List<TraceEvent> events;

    public Trace(Long declaredEntry, List<TraceEvent> events) {
        this.declaredEntry = declaredEntry;
        this.events = Collections.unmodifiableList(events);
    }

    /**
     * Entry address from the {@code entry} line, else the first event's address.
     *
     * @throws ValidationException if the trace has neither
     */
    public long getEntryAddress() {
        if (declaredEntry != null) {
            return declaredEntry;
        }
        if (events.isEmpty()) {
            throw ValidationException.invalid("entry", "trace has no entry line and no events");
        }
        return events.get(0).getAddress();
    }

    public boolean hasDeclaredEntry() {
        return declaredEntry != null;
    }

    public List<TraceEvent> getEvents() {
        return events;
    }

    /**
     * Feeds every event into a fresh graph.
     *
     * @param entryOverride entry address to use instead of {@link #getEntryAddress()}, may be null
     * @throws SequenceException with the offending line number in its message
     */
    public ControlFlowGraph replay(Long entryOverride, MidBlockTargetPolicy policy) {
        long entry = entryOverride != null ? entryOverride : getEntryAddress();
        ControlFlowGraph graph = new ControlFlowGraph(entry, policy);
        for (TraceEvent event : events) {
            try {
                graph.execute(event.getAddress(), event.getRecord());
            } catch (SequenceException e) {
                SequenceException located = new SequenceException(e.getAddress(),
                    "line " + event.getLineNumber() + ": " + e.getMessage());
                located.initCause(e);
                throw located;
            }
        }
        return graph;
    }

    public ControlFlowGraph replay() {
        return replay(null, MidBlockTargetPolicy.ALLOW);
    }
}
