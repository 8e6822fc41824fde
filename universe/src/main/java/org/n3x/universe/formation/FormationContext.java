package org.n3x.universe.formation;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.n3x.universe.diagnostics.DiagnosticsBundle;
import org.n3x.universe.fleet.CommandTranscript;
import org.n3x.universe.node.Node;
import org.n3x.universe.node.NodeSpec;
import org.n3x.universe.node.NodeSpecs;
import org.n3x.universe.topology.TopologyProfile;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * State shared by the phases of one formation run: the booted nodes, the join token,
 * the abort flag, the global deadline and the timeline.
 */
@Slf4j
public class FormationContext {

    @Getter
    @NonNull
    private final TopologyProfile profile;

    /**
     * Formation order: primary, servers, agents
     */
    @Getter
    @NonNull
    private final ImmutableList<NodeSpec> nodeSpecs;

    private final Map<String, Node> nodes = new LinkedHashMap<>();

    private final Map<String, CommandTranscript> transcripts = new LinkedHashMap<>();

    private final List<DiagnosticsBundle> diagnostics = new ArrayList<>();

    /**
     * Written once by the token retrieval, read by every join
     */
    private final AtomicReference<ClusterToken> token = new AtomicReference<>();

    private final AtomicBoolean aborted = new AtomicBoolean(false);

    @Getter
    private final Deadline deadline;

    @Getter
    private final PhaseTimeline timeline = new PhaseTimeline();

    public FormationContext(@NonNull TopologyProfile profile, @NonNull List<NodeSpec> nodeSpecs,
                            @NonNull Duration globalTimeout) {
        this.profile = profile;
        this.nodeSpecs = ImmutableList.sortedCopyOf(nodeSpecs);
        this.deadline = Deadline.after(globalTimeout);
    }

    public NodeSpec primarySpec() {
        return NodeSpecs.primary(nodeSpecs);
    }

    public ImmutableList<NodeSpec> secondaryServerSpecs() {
        return NodeSpecs.secondaryServers(nodeSpecs);
    }

    public ImmutableList<NodeSpec> agentSpecs() {
        return NodeSpecs.agents(nodeSpecs);
    }

    public synchronized void addNode(Node node) {
        nodes.put(node.getName(), node);
    }

    public synchronized Optional<Node> node(String name) {
        return Optional.ofNullable(nodes.get(name));
    }

    /**
     * @throws IllegalStateException if the node was never booted
     */
    public synchronized Node requireNode(String name) {
        return node(name).orElseThrow(() -> new IllegalStateException("Node is not booted: " + name));
    }

    public Node primaryNode() {
        return requireNode(primarySpec().getName());
    }

    /**
     * Booted nodes in formation order
     */
    public synchronized ImmutableList<Node> getNodes() {
        return nodeSpecs.stream()
                .map(spec -> nodes.get(spec.getName()))
                .filter(node -> node != null)
                .collect(ImmutableList.toImmutableList());
    }

    public synchronized void addTranscript(CommandTranscript transcript) {
        transcripts.put(transcript.getNodeName(), transcript);
    }

    public synchronized Optional<CommandTranscript> transcript(String nodeName) {
        return Optional.ofNullable(transcripts.get(nodeName));
    }

    public synchronized ImmutableMap<String, CommandTranscript> getTranscripts() {
        return ImmutableMap.copyOf(transcripts);
    }

    public synchronized void addDiagnostics(DiagnosticsBundle bundle) {
        if (bundle != null) {
            diagnostics.add(bundle);
        }
    }

    public synchronized ImmutableList<DiagnosticsBundle> getDiagnostics() {
        return ImmutableList.copyOf(diagnostics);
    }

    /**
     * Store the join token. The token is created once, a second write is a bug.
     */
    public void setToken(@NonNull ClusterToken clusterToken) {
        if (!token.compareAndSet(null, clusterToken)) {
            throw new IllegalStateException("Cluster token is already set");
        }
    }

    public Optional<ClusterToken> token() {
        return Optional.ofNullable(token.get());
    }

    public ClusterToken requireToken() {
        return token().orElseThrow(() -> new IllegalStateException("Cluster token is not retrieved yet"));
    }

    public void abort(String reason) {
        if (aborted.compareAndSet(false, true)) {
            log.error("Formation aborted: {}", reason);
        }
    }

    public boolean isAborted() {
        return aborted.get();
    }

    /**
     * A phase timeout cut down to the global deadline
     */
    public Duration bound(Duration timeout) {
        return deadline.bound(timeout);
    }
}
