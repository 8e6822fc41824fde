package org.n3x.universe.fleet;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.n3x.universe.node.Node;
import org.n3x.universe.node.NodeSpec;
import org.n3x.universe.node.VmNode;
import org.n3x.universe.topology.TopologyProfile;
import org.n3x.util.retry.Sleeper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * In-memory fleet that interprets the commands the orchestrator emits: iproute2 link, address, vlan and bond
 * manipulation, systemd units, env files and a shared k3s node registry.
 * <p>
 * Every VM starts with a configured management link {@code eth0} and two unconfigured data links
 * {@code eth1}, {@code eth2}.
 */
@Slf4j
public class SimulatedFleet extends AbstractFleetManager {
    public static final String MANAGEMENT_NETWORK = "10.0.2";
    public static final String TOKEN = "K10c0ffee::server:s3cr3t";
    public static final String SERVER_UNIT = "k3s-server.service";
    public static final String AGENT_UNIT = "k3s-agent.service";
    public static final String TOKEN_PATH = "/var/lib/rancher/k3s/server/token";
    public static final int PREFIX = 24;

    private static final Pattern WRITE_TARGET = Pattern.compile("> (\\S+)$");
    private static final Pattern PORT_PROBE = Pattern.compile("ss -tln \\| grep -q ':(\\d+) '");
    private static final Pattern ENDPOINT = Pattern.compile("https://([0-9.]+):(\\d+)");

    private final Map<String, SimVm> vms = new ConcurrentHashMap<>();

    /**
     * Node name to registration state, in registration order
     */
    private final Map<String, Registration> registry = new LinkedHashMap<>();

    @Getter
    private final List<Executed> commandLog = new CopyOnWriteArrayList<>();

    private final List<Injected> injected = new CopyOnWriteArrayList<>();
    private final Set<String> bootFailures = ConcurrentHashMap.newKeySet();
    private final Set<String> unreachable = ConcurrentHashMap.newKeySet();
    private final Set<String> neverReady = ConcurrentHashMap.newKeySet();

    @Getter
    private final List<String> booted = new CopyOnWriteArrayList<>();

    @Getter
    private final List<String> destroyed = new CopyOnWriteArrayList<>();

    private final AtomicInteger instances = new AtomicInteger();

    @Getter
    private final AtomicInteger setUps = new AtomicInteger();

    @Getter
    private final AtomicInteger tearDowns = new AtomicInteger();

    private String advertisedEndpoint;

    public SimulatedFleet() {
        super(Duration.ofMillis(1), Sleeper.THREAD_SLEEP);
    }

    // ---------------------------------------------------------------- fault injection

    /**
     * Boot of the node throws
     */
    public SimulatedFleet failBoot(String node) {
        bootFailures.add(node);
        return this;
    }

    /**
     * The exec channel of the node throws
     */
    public SimulatedFleet disconnect(String node) {
        unreachable.add(node);
        return this;
    }

    /**
     * The node registers but never turns Ready
     */
    public SimulatedFleet neverReady(String node) {
        neverReady.add(node);
        return this;
    }

    /**
     * Commands of the node matching the predicate return the given result instead of being interpreted
     */
    public SimulatedFleet respond(String node, Predicate<ShellCommand> command, ExecResult result) {
        injected.add(new Injected(node, command, result));
        return this;
    }

    // ---------------------------------------------------------------- FleetManager

    @Override
    public void setUp() {
        setUps.incrementAndGet();
    }

    @Override
    public void tearDown() {
        tearDowns.incrementAndGet();
    }

    @Override
    public synchronized Node boot(NodeSpec spec) {
        if (bootFailures.contains(spec.getName())) {
            throw new FleetException("Can't create VM " + spec.getName() + ": out of memory");
        }

        int index = instances.incrementAndGet();
        vms.put(spec.getName(), new SimVm(spec, MANAGEMENT_NETWORK + "." + (10 + index)));
        booted.add(spec.getName());
        log.info("Simulated VM {} booted", spec.getName());
        return VmNode.of(spec, "sim-" + index);
    }

    @Override
    public synchronized ExecResult exec(Node node, ShellCommand command) {
        if (unreachable.contains(node.getName())) {
            throw new FleetException("Exec channel to " + node.getName() + " is closed");
        }

        SimVm vm = vms.get(node.getName());
        if (vm == null || destroyed.contains(node.getName())) {
            throw new FleetException("No such VM: " + node.getName());
        }

        ExecResult result = injected.stream()
                .filter(injection -> injection.node.equals(node.getName()) && injection.command.test(command))
                .map(injection -> injection.result)
                .findFirst()
                .orElseGet(() -> interpret(vm, command.getArgv()));

        commandLog.add(new Executed(node.getName(), command, result));
        return result;
    }

    @Override
    public synchronized void destroy(Node node) {
        destroyed.add(node.getName());
        registry.remove(node.getName());
    }

    // ---------------------------------------------------------------- introspection

    public List<ShellCommand> commandsOn(String node) {
        List<ShellCommand> commands = new ArrayList<>();
        commandLog.stream().filter(e -> e.node.equals(node)).forEach(e -> commands.add(e.command));
        return commands;
    }

    public List<String> renderedCommandsOn(String node) {
        List<String> commands = new ArrayList<>();
        commandsOn(node).forEach(c -> commands.add(c.render()));
        return commands;
    }

    public synchronized Set<String> addressesOf(String node, String device) {
        Link link = vms.get(node).links.get(device);
        return link == null ? new LinkedHashSet<>() : new LinkedHashSet<>(link.addresses);
    }

    public synchronized Optional<Integer> vlanTagOf(String node, String device) {
        Link link = vms.get(node).links.get(device);
        return link == null ? Optional.empty() : Optional.ofNullable(link.vlanTag);
    }

    public synchronized Optional<String> fileOf(String node, String path) {
        return Optional.ofNullable(vms.get(node).files.get(path));
    }

    public synchronized boolean isMasked(String node, String unit) {
        return vms.get(node).masked.contains(unit);
    }

    public synchronized Optional<String> activeBondMember(String node, String bond) {
        return Optional.ofNullable(vms.get(node).activeMember(bond));
    }

    /**
     * Registry as the primary's API would render it
     */
    public synchronized String registrySnapshot() {
        return renderRegistry(false);
    }

    /**
     * Put an address on a link behind the configurator's back
     */
    public synchronized void addStrayAddress(String node, String device, String cidr) {
        vms.get(node).links.get(device).addresses.add(cidr);
    }

    public synchronized void setLink(String node, String device, boolean up) {
        vms.get(node).links.get(device).up = up;
    }

    // ---------------------------------------------------------------- interpreter

    private ExecResult interpret(SimVm vm, ImmutableList<String> argv) {
        String program = argv.get(0);
        switch (program) {
            case "systemctl":
                return systemctl(vm, argv);
            case "hostname":
                vm.hostname = argv.get(1);
                return ExecResult.ok("");
            case "modprobe":
                vm.modules.add(argv.get(1));
                return ExecResult.ok("");
            case "ip":
                return ip(vm, argv);
            case "cat":
                return cat(vm, argv.get(1));
            case "test":
                return "-s".equals(argv.get(1)) && !vm.files.getOrDefault(argv.get(2), "").isEmpty()
                        ? ExecResult.ok("")
                        : ExecResult.failed(1, "");
            case "k3s":
                return kubectl(vm, argv.subList(2, argv.size()));
            case "sh":
                return shell(vm, argv);
            case "journalctl":
                return ExecResult.ok("-- Logs begin --\n" + vm.spec.getName() + " simulated journal of " + argv.get(2));
            case "ss":
                return ExecResult.ok("State  Recv-Q Send-Q Local Address:Port\n"
                        + (vm.apiUp ? "LISTEN 0      4096   *:6443\n" : ""));
            case "iptables":
                return ExecResult.ok("Chain INPUT (policy ACCEPT)\nChain FORWARD (policy ACCEPT)\nChain OUTPUT (policy ACCEPT)");
            case "df":
                return ExecResult.ok("Filesystem Size Used Avail Use% Mounted on\n/dev/vda1 20G 4.1G 15G 22% /");
            default:
                return ExecResult.failed(127, program + ": command not found");
        }
    }

    private ExecResult systemctl(SimVm vm, List<String> argv) {
        String verb = argv.get(1);
        switch (verb) {
            case "mask":
                vm.masked.addAll(argv.subList(2, argv.size()));
                return ExecResult.ok("Created symlink /etc/systemd/system/" + argv.get(2) + " -> /dev/null.");
            case "stop":
            case "daemon-reload":
                return ExecResult.ok("");
            case "is-system-running":
                return ExecResult.ok("running");
            case "is-active":
                return vm.activeUnits.contains(argv.get(2)) ? ExecResult.ok("active") : ExecResult.failed(3, "inactive");
            case "status":
                return vm.activeUnits.contains(argv.get(2))
                        ? ExecResult.ok(argv.get(2) + " - Lightweight Kubernetes\n   Active: active (running)")
                        : ExecResult.failed(3, argv.get(2) + " - Lightweight Kubernetes\n   Active: inactive (dead)");
            case "start":
                return start(vm, argv.get(2));
            default:
                return ExecResult.failed(1, "Unknown command verb " + verb);
        }
    }

    private ExecResult start(SimVm vm, String unit) {
        String env = vm.files.get(unit.equals(SERVER_UNIT) ? "/etc/default/k3s-server" : "/etc/default/k3s-agent");
        if (env == null) {
            return ExecResult.failed(1, "Job for " + unit + " failed: missing environment file");
        }
        vm.activeUnits.add(unit);

        if (env.contains("--cluster-init")) {
            String nodeIp = flag(env, "--node-ip").orElse("");
            if (!vm.hasOperationalAddress(nodeIp)) {
                vm.activeUnits.remove(unit);
                return ExecResult.failed(1, "Job for " + unit + " failed: can't bind " + nodeIp);
            }
            vm.apiUp = true;
            vm.files.put(TOKEN_PATH, TOKEN + "\n");
            advertisedEndpoint = "https://" + flag(env, "--advertise-address").orElse(nodeIp) + ":6443";
            register(vm.spec.getName(), true);
            return ExecResult.ok("");
        }

        // joining node: the service starts and keeps retrying until it can register
        Optional<String> endpoint = unit.equals(SERVER_UNIT) ? flag(env, "--server") : value(env, "K3S_URL");
        Optional<String> token = value(env, "K3S_TOKEN");
        if (endpoint.isPresent() && endpoint.get().equals(advertisedEndpoint)
                && token.isPresent() && TOKEN.equals(token.get())
                && vm.reaches(endpointHost(endpoint.get()))) {
            if (unit.equals(SERVER_UNIT)) {
                vm.apiUp = true;
            }
            register(vm.spec.getName(), unit.equals(SERVER_UNIT));
        } else {
            log.warn("Simulated {} can't join via {}", vm.spec.getName(), endpoint.orElse("nothing"));
        }
        return ExecResult.ok("");
    }

    private void register(String node, boolean server) {
        registry.put(node, new Registration(server));
    }

    private ExecResult kubectl(SimVm vm, List<String> args) {
        if (!vm.apiUp) {
            return ExecResult.failed(1, "The connection to the server 127.0.0.1:6443 was refused");
        }
        String joined = Joiner.on(' ').join(args);
        if (joined.equals("get --raw /readyz")) {
            return ExecResult.ok("ok");
        }
        if (joined.equals("get nodes --no-headers")) {
            return ExecResult.ok(renderRegistry(true));
        }
        return ExecResult.failed(1, "error: unknown command " + joined);
    }

    private String renderRegistry(boolean tick) {
        StringBuilder out = new StringBuilder();
        registry.forEach((name, registration) -> {
            String status = registration.polls > 0 && isHealthy(name) ? "Ready" : "NotReady";
            if (tick) {
                registration.polls++;
            }
            out.append(String.format("%-10s %-9s %-28s %-5s %s%n", name, status,
                    registration.server ? "control-plane,etcd,master" : "<none>", "5m", "v1.28.4+k3s1"));
        });
        return out.toString();
    }

    private boolean isHealthy(String node) {
        SimVm vm = vms.get(node);
        return vm != null && !neverReady.contains(node) && advertisedEndpoint != null
                && vm.reaches(endpointHost(advertisedEndpoint));
    }

    private ExecResult shell(SimVm vm, List<String> argv) {
        String script = argv.get(2);

        if (argv.size() == 5 && script.startsWith("printf")) {
            Matcher target = WRITE_TARGET.matcher(script);
            if (!target.find()) {
                return ExecResult.failed(2, "sh: syntax error");
            }
            vm.files.put(target.group(1), argv.get(4));
            return ExecResult.ok("");
        }

        Matcher port = PORT_PROBE.matcher(script);
        if (port.find()) {
            return vm.apiUp && port.group(1).equals("6443") ? ExecResult.ok("") : ExecResult.failed(1, "");
        }

        if (script.startsWith("ps aux")) {
            return vm.activeUnits.isEmpty()
                    ? ExecResult.failed(1, "")
                    : ExecResult.ok("root 812 12.0 9.1 k3s " + (vm.activeUnits.contains(SERVER_UNIT) ? "server" : "agent"));
        }

        if (script.equals("true")) {
            return ExecResult.ok("");
        }
        if (script.startsWith("exit ")) {
            int code = Integer.parseInt(script.substring("exit ".length()).trim());
            return new ExecResult(code, "");
        }
        if (script.startsWith("echo ")) {
            return ExecResult.ok(script.substring("echo ".length()));
        }
        return ExecResult.failed(127, "sh: 1: " + Splitter.on(' ').split(script).iterator().next() + ": not found");
    }

    private ExecResult cat(SimVm vm, String path) {
        if (path.startsWith("/proc/net/bonding/")) {
            String bond = path.substring("/proc/net/bonding/".length());
            Link link = vm.links.get(bond);
            if (link == null || !link.bond) {
                return ExecResult.failed(1, "cat: " + path + ": No such file or directory");
            }
            return ExecResult.ok(vm.bondStatus(link));
        }

        String content = vm.files.get(path);
        return content == null
                ? ExecResult.failed(1, "cat: " + path + ": No such file or directory")
                : ExecResult.ok(content);
    }

    private ExecResult ip(SimVm vm, List<String> argv) {
        List<String> args = new ArrayList<>(argv.subList(1, argv.size()));
        boolean oneline = args.remove("-o");
        boolean details = args.remove("-d");
        boolean brief = args.remove("-br");
        args.remove("-4");

        String object = args.get(0);
        String verb = args.size() > 1 ? args.get(1) : "show";

        if (object.equals("link")) {
            switch (verb) {
                case "show":
                    return linkShow(vm, args.get(args.size() - 1), details);
                case "add":
                    return linkAdd(vm, args);
                case "set":
                    return linkSet(vm, args);
                default:
                    return ExecResult.failed(255, "Command \"" + verb + "\" is unknown");
            }
        }

        if (object.equals("addr")) {
            switch (verb) {
                case "flush":
                    return withLink(vm, args.get(3), link -> {
                        link.addresses.clear();
                        return ExecResult.ok("");
                    });
                case "add":
                    return withLink(vm, args.get(4), link -> {
                        if (!link.addresses.add(args.get(2))) {
                            return ExecResult.failed(2, "RTNETLINK answers: File exists");
                        }
                        return ExecResult.ok("");
                    });
                case "show":
                    if (brief) {
                        return ExecResult.ok(vm.briefAddresses());
                    }
                    if (args.size() > 3 && oneline) {
                        return withLink(vm, args.get(3), link -> ExecResult.ok(vm.inetLines(link)));
                    }
                    return ExecResult.ok(vm.allAddresses());
                default:
                    return ExecResult.failed(255, "Command \"" + verb + "\" is unknown");
            }
        }

        if (object.equals("route")) {
            if (verb.equals("replace")) {
                String gateway = args.get(4);
                String device = args.get(6);
                Link link = vm.links.get(device);
                if (link == null || !vm.isOperational(link) || link.addresses.stream()
                        .noneMatch(cidr -> sameNetwork(address(cidr), gateway))) {
                    return ExecResult.failed(2, "Error: Nexthop has invalid gateway.");
                }
                vm.defaultRoute = "default via " + gateway + " dev " + device;
                return ExecResult.ok("");
            }
            return ExecResult.ok(vm.routes());
        }

        return ExecResult.failed(255, "Object \"" + object + "\" is unknown");
    }

    private ExecResult linkShow(SimVm vm, String device, boolean details) {
        Link link = vm.links.get(device);
        if (link == null) {
            return ExecResult.failed(1, "Device \"" + device + "\" does not exist.");
        }
        StringBuilder out = new StringBuilder(vm.linkLine(link));
        if (details) {
            out.append("\n    link/ether 52:54:00:12:34:56 brd ff:ff:ff:ff:ff:ff promiscuity 0");
            if (link.vlanTag != null) {
                out.append("\n    vlan protocol 802.1Q id ").append(link.vlanTag).append(" <REORDER_HDR>");
            }
            if (link.bond) {
                out.append("\n    bond mode ").append(link.bondMode).append(" miimon 100");
            }
        }
        return ExecResult.ok(out.toString());
    }

    private ExecResult linkAdd(SimVm vm, List<String> args) {
        // ip link add link <trunk> name <dev> type vlan id <tag>
        if (args.get(2).equals("link")) {
            String trunk = args.get(3);
            String device = args.get(5);
            if (!vm.modules.contains("8021q")) {
                return ExecResult.failed(2, "Error: Unknown device type.");
            }
            if (!vm.links.containsKey(trunk)) {
                return ExecResult.failed(1, "Cannot find device \"" + trunk + "\"");
            }
            if (vm.links.containsKey(device)) {
                return ExecResult.failed(2, "RTNETLINK answers: File exists");
            }
            Link vlan = new Link(device);
            vlan.vlanParent = trunk;
            vlan.vlanTag = Integer.valueOf(args.get(9));
            vm.links.put(device, vlan);
            return ExecResult.ok("");
        }

        // ip link add <bond> type bond mode <mode> ...
        String device = args.get(2);
        if (!vm.modules.contains("bonding")) {
            return ExecResult.failed(2, "Error: Unknown device type.");
        }
        if (vm.links.containsKey(device)) {
            return ExecResult.failed(2, "RTNETLINK answers: File exists");
        }
        Link bond = new Link(device);
        bond.bond = true;
        bond.bondMode = args.get(args.indexOf("mode") + 1);
        vm.links.put(device, bond);
        return ExecResult.ok("");
    }

    private ExecResult linkSet(SimVm vm, List<String> args) {
        String device = args.get(2);
        String action = args.get(3);
        return withLink(vm, device, link -> {
            switch (action) {
                case "up":
                    link.up = true;
                    return ExecResult.ok("");
                case "down":
                    link.up = false;
                    return ExecResult.ok("");
                case "master":
                    Link bond = vm.links.get(args.get(4));
                    if (bond == null || !bond.bond) {
                        return ExecResult.failed(1, "Cannot find device \"" + args.get(4) + "\"");
                    }
                    if (link.up) {
                        return ExecResult.failed(2, "RTNETLINK answers: Device or resource busy");
                    }
                    link.master = bond.name;
                    vm.enslaveOrder.add(link.name);
                    return ExecResult.ok("");
                case "type":
                    link.bondPrimary = args.get(args.indexOf("primary") + 1);
                    return ExecResult.ok("");
                default:
                    return ExecResult.failed(255, "Garbage instead of arguments \"" + action + "\"");
            }
        });
    }

    private static ExecResult withLink(SimVm vm, String device, Function<Link, ExecResult> action) {
        Link link = vm.links.get(device);
        if (link == null) {
            return ExecResult.failed(1, "Cannot find device \"" + device + "\"");
        }
        return action.apply(link);
    }

    private static Optional<String> flag(String env, String name) {
        Matcher matcher = Pattern.compile(Pattern.quote(name) + "=(\\S+?)[\"\\s]").matcher(env);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    private static Optional<String> value(String env, String key) {
        for (String line : Splitter.on('\n').trimResults().split(env)) {
            if (line.startsWith(key + "=")) {
                return Optional.of(line.substring(key.length() + 1).replace("\"", ""));
            }
        }
        return Optional.empty();
    }

    private static String endpointHost(String endpoint) {
        Matcher matcher = ENDPOINT.matcher(endpoint);
        return matcher.find() ? matcher.group(1) : "";
    }

    private static String address(String cidr) {
        return cidr.substring(0, cidr.indexOf('/'));
    }

    private static boolean sameNetwork(String a, String b) {
        return TopologyProfile.network(a, PREFIX).equals(TopologyProfile.network(b, PREFIX));
    }

    // ---------------------------------------------------------------- model

    private static class SimVm {
        final NodeSpec spec;
        final Map<String, Link> links = new LinkedHashMap<>();
        final Set<String> modules = new LinkedHashSet<>();
        final Set<String> masked = new LinkedHashSet<>();
        final Map<String, String> files = new LinkedHashMap<>();
        final Set<String> activeUnits = new LinkedHashSet<>();
        final List<String> enslaveOrder = new ArrayList<>();
        String hostname;
        String defaultRoute;
        boolean apiUp;

        SimVm(NodeSpec spec, String managementIp) {
            this.spec = spec;
            this.hostname = "localhost";

            Link mgmt = new Link("eth0");
            mgmt.up = true;
            mgmt.addresses.add(managementIp + "/" + PREFIX);
            links.put(mgmt.name, mgmt);
            links.put("eth1", new Link("eth1"));
            links.put("eth2", new Link("eth2"));
        }

        boolean isOperational(Link link) {
            if (!link.up) {
                return false;
            }
            if (link.vlanParent != null) {
                Link parent = links.get(link.vlanParent);
                return parent != null && isOperational(parent);
            }
            if (link.bond) {
                return activeMember(link.name) != null;
            }
            return true;
        }

        String activeMember(String bond) {
            Link bondLink = links.get(bond);
            if (bondLink == null || !bondLink.up) {
                return null;
            }
            if (bondLink.bondPrimary != null) {
                Link primary = links.get(bondLink.bondPrimary);
                if (primary != null && bond.equals(primary.master) && primary.up) {
                    return primary.name;
                }
            }
            return enslaveOrder.stream()
                    .map(links::get)
                    .filter(member -> bond.equals(member.master) && member.up)
                    .map(member -> member.name)
                    .findFirst()
                    .orElse(null);
        }

        boolean hasOperationalAddress(String ip) {
            return links.values().stream()
                    .anyMatch(link -> isOperational(link) && link.addresses.stream().anyMatch(c -> address(c).equals(ip)));
        }

        /**
         * An operational link carries an address in the target's network, management excluded
         */
        boolean reaches(String ip) {
            return links.values().stream()
                    .filter(link -> !link.name.equals("eth0"))
                    .anyMatch(link -> isOperational(link)
                            && link.addresses.stream().anyMatch(c -> sameNetwork(address(c), ip)));
        }

        String displayName(Link link) {
            return link.vlanParent == null ? link.name : link.name + "@" + link.vlanParent;
        }

        String linkLine(Link link) {
            String flags = link.up ? "<BROADCAST,MULTICAST,UP,LOWER_UP>" : "<BROADCAST,MULTICAST>";
            String master = link.master == null ? "" : " master " + link.master;
            return String.format("%d: %s: %s mtu 1500 qdisc noqueue%s state %s mode DEFAULT group default qlen 1000",
                    new ArrayList<>(links.keySet()).indexOf(link.name) + 2, displayName(link), flags, master,
                    isOperational(link) ? "UP" : "DOWN");
        }

        String inetLines(Link link) {
            StringBuilder out = new StringBuilder();
            int index = new ArrayList<>(links.keySet()).indexOf(link.name) + 2;
            for (String cidr : link.addresses) {
                out.append(String.format("%d: %s    inet %s scope global %s\\       valid_lft forever%n",
                        index, link.name, cidr, link.name));
            }
            return out.toString();
        }

        String allAddresses() {
            StringBuilder out = new StringBuilder();
            for (Link link : links.values()) {
                out.append(linkLine(link)).append('\n');
                link.addresses.forEach(cidr -> out.append("    inet ").append(cidr).append(" scope global\n"));
            }
            return out.toString();
        }

        String briefAddresses() {
            StringBuilder out = new StringBuilder();
            for (Link link : links.values()) {
                out.append(String.format("%-16s %-8s %s%n", displayName(link), isOperational(link) ? "UP" : "DOWN",
                        Joiner.on(' ').join(link.addresses)));
            }
            return out.toString();
        }

        String routes() {
            StringBuilder out = new StringBuilder();
            if (defaultRoute != null) {
                out.append(defaultRoute).append('\n');
            }
            for (Link link : links.values()) {
                if (!isOperational(link)) {
                    continue;
                }
                for (String cidr : link.addresses) {
                    out.append(String.format("%s/%d dev %s proto kernel scope link src %s%n",
                            TopologyProfile.network(address(cidr), PREFIX), PREFIX, link.name, address(cidr)));
                }
            }
            return out.toString();
        }

        String bondStatus(Link bond) {
            String active = activeMember(bond.name);
            StringBuilder out = new StringBuilder();
            out.append("Ethernet Channel Bonding Driver: v5.15.0\n\n");
            out.append("Bonding Mode: ").append(modeDescription(bond.bondMode)).append('\n');
            if (bond.bondPrimary != null) {
                out.append("Primary Slave: ").append(bond.bondPrimary).append(" (primary_reselect always)\n");
            }
            out.append("Currently Active Slave: ").append(active == null ? "None" : active).append('\n');
            out.append("MII Status: ").append(active == null ? "down" : "up").append('\n');
            out.append("MII Polling Interval (ms): 100\n");
            for (String member : enslaveOrder) {
                Link link = links.get(member);
                if (!bond.name.equals(link.master)) {
                    continue;
                }
                out.append('\n');
                out.append("Slave Interface: ").append(member).append('\n');
                out.append("MII Status: ").append(link.up ? "up" : "down").append('\n');
                out.append("Link Failure Count: 0\n");
            }
            return out.toString();
        }

        private static String modeDescription(String mode) {
            switch (mode) {
                case "active-backup":
                    return "fault-tolerance (active-backup)";
                case "802.3ad":
                    return "IEEE 802.3ad Dynamic link aggregation";
                default:
                    return "load balancing (" + mode + ")";
            }
        }
    }

    private static class Link {
        final String name;
        final Set<String> addresses = new LinkedHashSet<>();
        boolean up;
        String master;
        String vlanParent;
        Integer vlanTag;
        boolean bond;
        String bondMode;
        String bondPrimary;

        Link(String name) {
            this.name = name;
        }
    }

    private static class Registration {
        final boolean server;
        int polls;

        Registration(boolean server) {
            this.server = server;
        }
    }

    @AllArgsConstructor
    private static class Injected {
        final String node;
        final Predicate<ShellCommand> command;
        final ExecResult result;
    }

    /**
     * One command run on a node, in execution order across the fleet
     */
    @AllArgsConstructor
    @Getter
    public static class Executed {
        private final String node;
        private final ShellCommand command;
        private final ExecResult result;
    }
}
