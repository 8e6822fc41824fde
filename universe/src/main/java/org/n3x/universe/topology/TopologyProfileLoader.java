package org.n3x.universe.topology;

import com.google.common.collect.ImmutableList;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.n3x.universe.universe.ConfigurationException;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads a {@link TopologyProfile} from a json file.
 * <pre>
 * {
 *   "kind": "vlan",
 *   "trunkInterface": "eth1",
 *   "interfaces": {"cluster": "eth1.200", "storage": "eth1.100"},
 *   "vlanIds": {"cluster": 200, "storage": 100},
 *   "addresses": {"server-1": {"cluster": "192.168.200.1", "storage": "192.168.100.1"}}
 * }
 * </pre>
 */
@Slf4j
public class TopologyProfileLoader {

    private static final ImmutableList<String> SEGMENT_KEYS = Arrays.stream(Segment.values())
            .map(segment -> segment.name().toLowerCase(Locale.ROOT))
            .collect(ImmutableList.toImmutableList());

    private final Gson gson = new GsonBuilder().create();

    public TopologyProfile load(File profileFile) {
        log.info("Loading topology profile: {}", profileFile);

        final String json;
        try {
            json = FileUtils.readFileToString(profileFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("Can't read topology profile: " + profileFile, e);
        }

        return parse(json);
    }

    public TopologyProfile parse(String json) {
        final ProfileDocument doc;
        try {
            JsonElement tree = JsonParser.parseString(json);
            checkSegmentMaps(tree);
            doc = gson.fromJson(tree, ProfileDocument.class);
        } catch (JsonParseException e) {
            throw new ConfigurationException("Malformed topology profile", e);
        }

        if (doc == null || doc.kind == null) {
            throw new ConfigurationException("Topology profile must declare its kind");
        }

        return TopologyProfile.builder()
                .kind(doc.kind)
                .managementInterface(doc.managementInterface)
                .trunkInterface(doc.trunkInterface)
                .interfaces(doc.interfaces)
                .addresses(doc.addresses)
                .vlanIds(doc.vlanIds)
                .bondSpec(doc.bond == null ? null : doc.bond.toBondSpec())
                .prefixLength(doc.prefixLength)
                .gateway(doc.gateway)
                .clusterCidr(doc.clusterCidr)
                .serviceCidr(doc.serviceCidr)
                .build();
    }

    /**
     * Gson maps an unknown segment key to a null key, so segment keyed objects are checked on the raw tree.
     */
    private static void checkSegmentMaps(JsonElement tree) {
        if (!tree.isJsonObject()) {
            return;
        }
        JsonObject root = tree.getAsJsonObject();
        checkSegments("interfaces", root.get("interfaces"));
        checkSegments("vlanIds", root.get("vlanIds"));

        JsonElement addresses = root.get("addresses");
        if (addresses == null || addresses.isJsonNull()) {
            return;
        }
        if (!addresses.isJsonObject()) {
            throw new ConfigurationException("Topology profile field addresses must be an object");
        }
        for (Map.Entry<String, JsonElement> node : addresses.getAsJsonObject().entrySet()) {
            String where = "addresses." + node.getKey();
            if (node.getValue().isJsonNull()) {
                throw new ConfigurationException("Topology profile field " + where + " has no value");
            }
            checkSegments(where, node.getValue());
        }
    }

    private static void checkSegments(String where, JsonElement element) {
        if (element == null || element.isJsonNull()) {
            return;
        }
        if (!element.isJsonObject()) {
            throw new ConfigurationException("Topology profile field " + where + " must be an object");
        }
        for (Map.Entry<String, JsonElement> entry : element.getAsJsonObject().entrySet()) {
            if (!SEGMENT_KEYS.contains(entry.getKey())) {
                throw new ConfigurationException(String.format(
                        "Unknown segment '%s' in %s, expected one of %s", entry.getKey(), where, SEGMENT_KEYS
                ));
            }
            if (entry.getValue().isJsonNull()) {
                throw new ConfigurationException(String.format(
                        "Topology profile field %s.%s has no value", where, entry.getKey()
                ));
            }
        }
    }

    private static class ProfileDocument {
        TopologyKind kind;
        String managementInterface;
        String trunkInterface;
        Map<Segment, String> interfaces;
        Map<String, Map<Segment, String>> addresses;
        Map<Segment, Integer> vlanIds;
        BondDocument bond;
        Integer prefixLength;
        String gateway;
        String clusterCidr;
        String serviceCidr;
    }

    private static class BondDocument {
        String name;
        BondSpec.BondMode mode;
        List<String> members;
        String primary;
        Integer monitorIntervalMs;
        Integer upDelayMs;
        Integer downDelayMs;

        BondSpec toBondSpec() {
            BondSpec.BondSpecBuilder builder = BondSpec.builder();
            if (name != null) {
                builder.name(name);
            }
            if (mode != null) {
                builder.mode(mode);
            }
            if (members != null) {
                builder.members(members);
            }
            if (monitorIntervalMs != null) {
                builder.monitorIntervalMs(monitorIntervalMs);
            }
            if (upDelayMs != null) {
                builder.upDelayMs(upDelayMs);
            }
            if (downDelayMs != null) {
                builder.downDelayMs(downDelayMs);
            }
            return builder.primary(primary).build();
        }
    }
}
