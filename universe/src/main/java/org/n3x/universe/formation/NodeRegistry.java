package org.n3x.universe.formation;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Snapshot of the cluster's own membership list, parsed from {@code kubectl get nodes --no-headers}:
 * <pre>
 * server-1   Ready    control-plane,etcd,master   5m    v1.28.4+k3s1
 * agent-1    NotReady &lt;none&gt;                      10s   v1.28.4+k3s1
 * </pre>
 */
@EqualsAndHashCode
@ToString
public class NodeRegistry {
    private static final String READY = "Ready";

    private final ImmutableMap<String, String> statuses;

    private NodeRegistry(ImmutableMap<String, String> statuses) {
        this.statuses = statuses;
    }

    public static NodeRegistry parse(String output) {
        Map<String, String> statuses = new LinkedHashMap<>();
        for (String line : Splitter.on('\n').trimResults().omitEmptyStrings().split(output)) {
            List<String> columns = Splitter.onPattern("\\s+").splitToList(line);
            if (columns.size() < 2) {
                continue;
            }
            statuses.put(columns.get(0), columns.get(1));
        }
        return new NodeRegistry(ImmutableMap.copyOf(statuses));
    }

    public boolean contains(String nodeName) {
        return statuses.containsKey(nodeName);
    }

    public Optional<String> status(String nodeName) {
        return Optional.ofNullable(statuses.get(nodeName));
    }

    /**
     * Ready, possibly with extra conditions such as {@code Ready,SchedulingDisabled}
     */
    public boolean isReady(String nodeName) {
        return status(nodeName)
                .map(status -> Splitter.on(',').splitToList(status).get(0).equals(READY))
                .orElse(false);
    }

    public long readyCount() {
        return statuses.keySet().stream().filter(this::isReady).count();
    }

    public int size() {
        return statuses.size();
    }
}
