package org.n3x.universe.formation;

import com.google.common.collect.ImmutableList;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * Fixed locations and names of the clustered service on a node
 */
@Builder
@Getter
@EqualsAndHashCode
@ToString
public class ServiceParams {

    @Default
    private final int apiPort = 6443;

    @Default
    @NonNull
    private final String tokenPath = "/var/lib/rancher/k3s/server/token";

    @Default
    @NonNull
    private final String serverEnvFile = "/etc/default/k3s-server";

    @Default
    @NonNull
    private final String agentEnvFile = "/etc/default/k3s-agent";

    @Default
    @NonNull
    private final String serverUnit = "k3s-server.service";

    @Default
    @NonNull
    private final String agentUnit = "k3s-agent.service";

    @Default
    @NonNull
    private final ImmutableList<String> kubectl = ImmutableList.of("k3s", "kubectl");

    @Default
    @NonNull
    private final ImmutableList<String> disabledComponents = ImmutableList.of("traefik", "servicelb");

    @Default
    @NonNull
    private final String kubeconfigMode = "0644";

    public static ServiceParams defaults() {
        return ServiceParams.builder().build();
    }

    public ImmutableList<String> units() {
        return ImmutableList.of(serverUnit, agentUnit);
    }

    public ImmutableList<String> envFiles() {
        return ImmutableList.of(serverEnvFile, agentEnvFile);
    }
}
