package org.n3x.universe.health;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Parsed {@code /proc/net/bonding/<bond>}
 */
@Getter
@EqualsAndHashCode
@ToString
public class BondStatus {
    public static final String ACTIVE_BACKUP_MODE = "fault-tolerance (active-backup)";

    private static final String MODE = "Bonding Mode:";
    private static final String ACTIVE = "Currently Active Slave:";
    private static final String SLAVE = "Slave Interface:";
    private static final String MII = "MII Status:";

    private final String mode;
    private final String activeMember;

    /**
     * Member name to MII status (up/down)
     */
    private final ImmutableMap<String, String> members;

    private BondStatus(String mode, String activeMember, ImmutableMap<String, String> members) {
        this.mode = mode;
        this.activeMember = activeMember;
        this.members = members;
    }

    public static BondStatus parse(String procOutput) {
        String mode = null;
        String active = null;
        Map<String, String> members = new LinkedHashMap<>();
        String currentMember = null;

        for (String line : Splitter.on('\n').trimResults().omitEmptyStrings().split(procOutput)) {
            if (line.startsWith(MODE)) {
                mode = value(line, MODE);
            } else if (line.startsWith(ACTIVE)) {
                active = value(line, ACTIVE);
            } else if (line.startsWith(SLAVE)) {
                currentMember = value(line, SLAVE);
                members.put(currentMember, "unknown");
            } else if (line.startsWith(MII) && currentMember != null) {
                members.put(currentMember, value(line, MII));
            }
        }

        return new BondStatus(mode, "None".equals(active) ? null : active, ImmutableMap.copyOf(members));
    }

    private static String value(String line, String key) {
        return line.substring(key.length()).trim();
    }

    public boolean isActiveBackup() {
        return ACTIVE_BACKUP_MODE.equals(mode);
    }

    public Optional<String> activeMember() {
        return Optional.ofNullable(activeMember);
    }

    public boolean isUp(String member) {
        return "up".equals(members.get(member));
    }
}
