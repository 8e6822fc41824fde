package org.n3x.universe.node;

import com.google.common.collect.ImmutableList;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * State machine of a single node, with the history of every transition it went through.
 */
@Slf4j
public class NodeLifecycle {

    @Getter
    private final String nodeName;

    private final List<Transition> history = new ArrayList<>();

    private NodeState state;

    public NodeLifecycle(@NonNull String nodeName) {
        this.nodeName = nodeName;
        this.state = NodeState.BOOTING;
        history.add(new Transition(NodeState.BOOTING, Instant.now(), "created"));
    }

    public synchronized NodeState getState() {
        return state;
    }

    /**
     * Move the node to the next state.
     *
     * @param next   new state
     * @param reason short description of what happened
     * @throws NodeException if the transition skips a state or leaves a terminal one
     */
    public synchronized void transition(NodeState next, String reason) {
        if (!state.canTransitionTo(next)) {
            throw new NodeException(String.format(
                    "Illegal state transition. Node: %s, %s -> %s", nodeName, state, next
            ));
        }

        log.debug("Node {}: {} -> {} ({})", nodeName, state, next, reason);
        state = next;
        history.add(new Transition(next, Instant.now(), reason));
    }

    /**
     * Mark the node failed. A node that already failed keeps its first failure.
     */
    public synchronized void fail(String reason) {
        if (state == NodeState.FAILED) {
            return;
        }
        transition(NodeState.FAILED, reason);
    }

    public synchronized ImmutableList<Transition> getHistory() {
        return ImmutableList.copyOf(history);
    }

    /**
     * True if the node went through every given state, in the given order.
     */
    public synchronized boolean passedThrough(NodeState... states) {
        int idx = 0;
        for (Transition transition : history) {
            if (idx < states.length && transition.getState() == states[idx]) {
                idx++;
            }
        }
        return idx == states.length;
    }

    @AllArgsConstructor
    @Getter
    @ToString
    @EqualsAndHashCode
    public static class Transition {
        private final NodeState state;
        private final Instant timestamp;
        private final String reason;
    }
}
