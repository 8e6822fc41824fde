package org.n3x.universe.universe;

import com.google.common.collect.ImmutableList;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;
import org.n3x.universe.action.TestScriptTask.ScriptLine;
import org.n3x.universe.formation.FormationParams;
import org.n3x.universe.formation.ServiceParams;
import org.n3x.universe.logging.LoggingParams;
import org.n3x.universe.node.NodeSpec;
import org.n3x.universe.topology.TopologyProfile;

import java.util.Optional;
import java.util.UUID;

@Builder(toBuilder = true, builderMethodName = "universeBuilder")
@Getter
@EqualsAndHashCode
@ToString
public class UniverseParams {
    private static final String RUN_PREFIX = "n3x-";

    @Default
    @NonNull
    private final String runId = RUN_PREFIX + UUID.randomUUID().toString().substring(0, 8);

    @NonNull
    private final TopologyProfile profile;

    @NonNull
    private final ImmutableList<NodeSpec> nodes;

    @Default
    @NonNull
    private final FormationParams formationParams = FormationParams.defaults();

    @Default
    @NonNull
    private final ServiceParams serviceParams = ServiceParams.defaults();

    @Default
    @NonNull
    private final LoggingParams loggingParams = LoggingParams.builder().testName("n3x").build();

    /**
     * Post-formation test script, empty for none
     */
    @Default
    @NonNull
    private final ImmutableList<ScriptLine> testScript = ImmutableList.of();

    /**
     * Bond member to take down after formation, on the primary. Bonded topologies only.
     */
    private final String failBondMember;

    @Default
    private final boolean cleanUpEnabled = true;

    public Optional<String> failBondMember() {
        return Optional.ofNullable(failBondMember);
    }
}
