package org.n3x.universe.diagnostics;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;

/**
 * Everything known about a failed node: the failure, the network transcript, and the probe outputs.
 */
@Builder
@Getter
@ToString
@EqualsAndHashCode
public class DiagnosticsBundle {

    @NonNull
    private final String nodeName;

    @NonNull
    private final String failure;

    /**
     * ISO-8601 collection time
     */
    @NonNull
    private final String collectedAt;

    /**
     * Network configuration transcript, empty if no command ran
     */
    @Builder.Default
    @NonNull
    private final String transcript = "";

    @Singular
    private final ImmutableMap<String, String> sections;

    /**
     * Probes that could not be collected
     */
    @Singular
    private final ImmutableList<String> notes;

    public boolean isPartial() {
        return !notes.isEmpty();
    }

    public String render() {
        StringBuilder out = new StringBuilder();
        out.append(banner("DIAGNOSTICS: " + nodeName));
        out.append("failure: ").append(failure).append('\n');
        out.append("collected at: ").append(collectedAt).append('\n');

        if (!transcript.isEmpty()) {
            out.append(banner("network transcript")).append(transcript);
        }

        sections.forEach((name, output) -> out.append(banner(name)).append(output.trim()).append('\n'));

        if (isPartial()) {
            out.append(banner("collection failures"));
            notes.forEach(note -> out.append("- ").append(note).append('\n'));
        }
        return out.toString();
    }

    /**
     * @return A json representation of the bundle
     */
    public String asJson() {
        Gson gson = new GsonBuilder().setPrettyPrinting().create();
        return gson.toJson(this);
    }

    private static String banner(String title) {
        return "\n" + Strings.repeat("=", 8) + " " + title + " " + Strings.repeat("=", 8) + "\n";
    }
}
