package org.n3x.universe.formation;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.time.Duration;

/**
 * Formation timeouts. Image extraction and consensus warm-up dominate, so they are in minutes.
 */
@Builder(toBuilder = true)
@Getter
@EqualsAndHashCode
@ToString
public class FormationParams {

    @Default
    @NonNull
    private final Duration bootTimeout = Duration.ofMinutes(5);

    @Default
    @NonNull
    private final Duration apiPortTimeout = Duration.ofMinutes(5);

    @Default
    @NonNull
    private final Duration readyzTimeout = Duration.ofMinutes(5);

    @Default
    @NonNull
    private final Duration primaryReadyTimeout = Duration.ofMinutes(4);

    @Default
    @NonNull
    private final Duration tokenTimeout = Duration.ofMinutes(1);

    /**
     * Per joining node
     */
    @Default
    @NonNull
    private final Duration joinTimeout = Duration.ofMinutes(5);

    @Default
    @NonNull
    private final Duration clusterReadyTimeout = Duration.ofMinutes(1);

    /**
     * Bound of the whole run
     */
    @Default
    @NonNull
    private final Duration globalTimeout = Duration.ofMinutes(60);

    @Default
    private final int bootParallelism = 4;

    public static FormationParams defaults() {
        return FormationParams.builder().build();
    }
}
