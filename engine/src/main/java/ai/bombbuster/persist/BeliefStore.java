package ai.bombbuster.persist;

import ai.bombbuster.belief.BeliefState;
import ai.bombbuster.belief.FilterSettings;
import ai.bombbuster.game.AdjacentConstraint;
import ai.bombbuster.game.CandidateSet;
import ai.bombbuster.game.CopyCountConstraint;
import ai.bombbuster.game.GameConfig;
import ai.bombbuster.game.SlotKey;
import ai.bombbuster.game.ValueDomain;
import ai.bombbuster.game.ValueTracker;
import ai.bombbuster.solver.GlobalConsistencySolver;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Saves and loads one player's belief state as a pair of JSON files.
 * <p>
 * Layout: {@code <base>/player_<id>/belief.json} and {@code <base>/player_<id>/value_tracker.json}.
 * <pre>{@code
 * belief.json:
 * { "my_player_id": 0,
 *   "beliefs": { "0_Alice": { "0": [1], "1": [2] }, "1": { "0": [1, 2], "1": [2, 3] } },
 *   "player_names": { "0": "Alice" },
 *   "slot_constraints": { "1": { "copy_count": [ {"position": 0, "copies": 2} ],
 *                                "adjacent": [ {"left": 0, "right": 1, "equal": true} ] } } }
 *
 * value_tracker.json:
 * { "1": { "revealed": [["Alice", 0]], "certain": [[1, 0]], "called": [2], "uncertain": "1/4" } }
 * }</pre>
 * Player keys may be plain ids or {@code id_name}; tracker entries may use ids or names, resolved
 * through the name table. {@code player_names} and {@code slot_constraints} are optional on load.
 * Loading never re-runs the filters, so the loaded state is set-equal to the saved one.
 */
public class BeliefStore {
    private static final Logger log = LoggerFactory.getLogger(BeliefStore.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    public static final String BELIEF_FILE = "belief.json";
    public static final String TRACKER_FILE = "value_tracker.json";

    /** Directory holding the files of one player. */
    public static Path playerDirectory(Path baseDir, int player) {
        return baseDir.resolve("player_" + player);
    }

    /**
     * Writes both files for the owner of {@code state}.
     *
     * @return the player directory
     * @throws BeliefStoreException on I/O failure
     */
    public Path save(BeliefState state, Path baseDir, PlayerNames names) {
        Path dir = playerDirectory(baseDir, state.getOwner());
        try {
            Files.createDirectories(dir);
            OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(dir.resolve(BELIEF_FILE).toFile(),
                    beliefJson(state, names));
            OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(dir.resolve(TRACKER_FILE).toFile(),
                    trackerJson(state, names));
        } catch (IOException e) {
            throw new BeliefStoreException("Could not save beliefs of player " + state.getOwner() + " to " + dir, e);
        }
        log.debug("Saved beliefs of player {} to {}", state.getOwner(), dir);
        return dir;
    }

    public Path save(BeliefState state, Path baseDir) {
        return save(state, baseDir, PlayerNames.empty());
    }

    /**
     * Reads the files of {@code player} and rebuilds the belief state.
     *
     * @param names extra name table; names stored in belief.json are used as well
     * @throws BeliefStoreException if a file is missing or malformed
     */
    public BeliefState load(Path baseDir, int player, GameConfig config, PlayerNames names, FilterSettings settings,
                            GlobalConsistencySolver solver) {
        Path dir = playerDirectory(baseDir, player);
        JsonNode belief = read(dir.resolve(BELIEF_FILE));
        JsonNode trackers = read(dir.resolve(TRACKER_FILE));
        try {
            int owner = requireField(belief, "my_player_id").asInt();
            if (owner != player) {
                throw new BeliefStoreException("File in " + dir + " belongs to player " + owner + ", expected " + player);
            }
            PlayerNames table = readNames(belief.get("player_names")).merge(names);
            List<List<CandidateSet>> beliefs = readBeliefs(requireField(belief, "beliefs"), config);
            List<ValueTracker> valueTrackers = readTrackers(trackers, config, table);
            Map<Integer, List<CopyCountConstraint>> copyCounts = new TreeMap<>();
            Map<Integer, List<AdjacentConstraint>> adjacents = new TreeMap<>();
            readConstraints(belief.get("slot_constraints"), config, copyCounts, adjacents);
            return BeliefState.restore(config, owner, beliefs, valueTrackers, copyCounts, adjacents, settings, solver);
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new BeliefStoreException("Malformed belief files in " + dir + ": " + e.getMessage(), e);
        }
    }

    public BeliefState load(Path baseDir, int player, GameConfig config) {
        return load(baseDir, player, config, PlayerNames.empty(), FilterSettings.DEFAULTS, null);
    }

    // ---------------------------------------------------------------------------------------------
    // Writing
    // ---------------------------------------------------------------------------------------------

    private static ObjectNode beliefJson(BeliefState state, PlayerNames names) {
        ObjectNode root = OBJECT_MAPPER.createObjectNode();
        root.put("my_player_id", state.getOwner());
        ObjectNode beliefs = root.putObject("beliefs");
        GameConfig config = state.getConfig();
        for (int player = 0; player < config.getPlayers(); player++) {
            String key = names.name(player).map(name -> name.isEmpty() ? "" : "_" + name).orElse("");
            ObjectNode hand = beliefs.putObject(player + key);
            for (int pos = 0; pos < config.getHandSize(); pos++) {
                ArrayNode values = hand.putArray(Integer.toString(pos));
                for (double value : state.candidates(player, pos)) {
                    addValue(values, value);
                }
            }
        }
        if (!names.isEmpty()) {
            ObjectNode nameNode = root.putObject("player_names");
            names.asMap().forEach((id, name) -> nameNode.put(Integer.toString(id), name));
        }
        Map<Integer, List<CopyCountConstraint>> copyCounts = state.getCopyCountConstraints();
        Map<Integer, List<AdjacentConstraint>> adjacents = state.getAdjacentConstraints();
        if (!copyCounts.isEmpty() || !adjacents.isEmpty()) {
            ObjectNode constraints = root.putObject("slot_constraints");
            for (int player = 0; player < config.getPlayers(); player++) {
                List<CopyCountConstraint> counts = copyCounts.getOrDefault(player, List.of());
                List<AdjacentConstraint> pairs = adjacents.getOrDefault(player, List.of());
                if (counts.isEmpty() && pairs.isEmpty()) {
                    continue;
                }
                ObjectNode playerNode = constraints.putObject(Integer.toString(player));
                ArrayNode countArray = playerNode.putArray("copy_count");
                for (CopyCountConstraint constraint : counts) {
                    countArray.addObject().put("position", constraint.position()).put("copies", constraint.copyCount());
                }
                ArrayNode pairArray = playerNode.putArray("adjacent");
                for (AdjacentConstraint constraint : pairs) {
                    pairArray.addObject().put("left", constraint.left()).put("right", constraint.right())
                            .put("equal", constraint.equal());
                }
            }
        }
        return root;
    }

    private static ObjectNode trackerJson(BeliefState state, PlayerNames names) {
        ObjectNode root = OBJECT_MAPPER.createObjectNode();
        for (ValueTracker tracker : state.trackers()) {
            ObjectNode node = root.putObject(ValueDomain.format(tracker.getValue()));
            writeSlots(node.putArray("revealed"), tracker.getRevealed(), names);
            writeSlots(node.putArray("certain"), tracker.getCertain(), names);
            ArrayNode called = node.putArray("called");
            for (int player : tracker.getCalled()) {
                addPlayer(called, player, names);
            }
            node.put("uncertain", tracker.uncertain() + "/" + tracker.getTotal());
        }
        return root;
    }

    private static void writeSlots(ArrayNode array, Set<SlotKey> slots, PlayerNames names) {
        for (SlotKey slot : slots) {
            ArrayNode pair = array.addArray();
            addPlayer(pair, slot.player(), names);
            pair.add(slot.position());
        }
    }

    private static void addPlayer(ArrayNode array, int player, PlayerNames names) {
        names.name(player).ifPresentOrElse(array::add, () -> array.add(player));
    }

    private static void addValue(ArrayNode array, double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            array.add((long) value);
        } else {
            array.add(value);
        }
    }

    // ---------------------------------------------------------------------------------------------
    // Reading
    // ---------------------------------------------------------------------------------------------

    private static JsonNode read(Path file) {
        try {
            return OBJECT_MAPPER.readTree(file.toFile());
        } catch (NoSuchFileException e) {
            throw new BeliefStoreException("Missing belief file " + file, e);
        } catch (IOException e) {
            if (!Files.exists(file)) {
                throw new BeliefStoreException("Missing belief file " + file, new NoSuchFileException(file.toString()));
            }
            throw new BeliefStoreException("Could not read " + file, e);
        }
    }

    private static JsonNode requireField(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("Missing field '" + field + "'");
        }
        return value;
    }

    private static PlayerNames readNames(JsonNode node) {
        if (node == null || node.isNull()) {
            return PlayerNames.empty();
        }
        Map<Integer, String> names = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            names.put(Integer.parseInt(entry.getKey()), entry.getValue().asText());
        }
        return PlayerNames.of(names);
    }

    private static List<List<CandidateSet>> readBeliefs(JsonNode node, GameConfig config) {
        ValueDomain domain = config.getDomain();
        List<List<CandidateSet>> beliefs = new ArrayList<>();
        for (int player = 0; player < config.getPlayers(); player++) {
            beliefs.add(null);
        }
        Iterator<Map.Entry<String, JsonNode>> players = node.fields();
        while (players.hasNext()) {
            Map.Entry<String, JsonNode> entry = players.next();
            int player = playerInRange(entry.getKey(), config);
            List<CandidateSet> hand = new ArrayList<>();
            for (int pos = 0; pos < config.getHandSize(); pos++) {
                JsonNode values = entry.getValue().get(Integer.toString(pos));
                if (values == null || !values.isArray()) {
                    throw new IllegalArgumentException("Player " + player + " has no candidates for position " + pos);
                }
                long mask = 0L;
                for (JsonNode value : values) {
                    mask |= 1L << domain.requireRank(value.asDouble());
                }
                hand.add(new CandidateSet(domain, mask));
            }
            beliefs.set(player, hand);
        }
        return beliefs;
    }

    /** {@code "3"} or {@code "3_Carol"} → 3. */
    static int parsePlayerKey(String key) {
        int underscore = key.indexOf('_');
        String id = underscore >= 0 ? key.substring(0, underscore) : key;
        try {
            return Integer.parseInt(id);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Player key '" + key + "' does not start with an id", e);
        }
    }

    private static int playerInRange(String key, GameConfig config) {
        int player = parsePlayerKey(key);
        if (player < 0 || player >= config.getPlayers()) {
            throw new IllegalArgumentException("Player key '" + key + "' is out of range");
        }
        return player;
    }

    private static List<ValueTracker> readTrackers(JsonNode root, GameConfig config, PlayerNames names) {
        ValueDomain domain = config.getDomain();
        List<ValueTracker> trackers = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> values = root.fields();
        while (values.hasNext()) {
            Map.Entry<String, JsonNode> entry = values.next();
            double value = parseValue(entry.getKey());
            int rank = domain.requireRank(value);
            JsonNode node = entry.getValue();
            ValueTracker tracker = new ValueTracker(value, domain.copies(rank));
            Set<Integer> called = new LinkedHashSet<>();
            JsonNode calledNode = node.get("called");
            if (calledNode != null) {
                for (JsonNode player : calledNode) {
                    called.add(readPlayer(player, names));
                }
            }
            tracker.restore(readSlots(node.get("revealed"), names), readSlots(node.get("certain"), names), called);
            checkUncertain(node.get("uncertain"), tracker);
            trackers.add(tracker);
        }
        return trackers;
    }

    private static double parseValue(String key) {
        try {
            return Double.parseDouble(key);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Value key '" + key + "' is not a number", e);
        }
    }

    private static Set<SlotKey> readSlots(JsonNode node, PlayerNames names) {
        Set<SlotKey> slots = new LinkedHashSet<>();
        if (node == null) {
            return slots;
        }
        for (JsonNode pair : node) {
            if (!pair.isArray() || pair.size() != 2) {
                throw new IllegalArgumentException("Tracker slot must be [player, position], got " + pair);
            }
            slots.add(new SlotKey(readPlayer(pair.get(0), names), pair.get(1).asInt()));
        }
        return slots;
    }

    private static int readPlayer(JsonNode node, PlayerNames names) {
        return node.isNumber() ? node.asInt() : names.resolve(node.asText());
    }

    private static void checkUncertain(JsonNode node, ValueTracker tracker) {
        if (node == null) {
            return;
        }
        String[] parts = node.asText().split("/");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Uncertain count must look like '<count>/<total>', got '"
                    + node.asText() + "'");
        }
        int uncertain = Integer.parseInt(parts[0].trim());
        int total = Integer.parseInt(parts[1].trim());
        if (total != tracker.getTotal() || uncertain != tracker.uncertain()) {
            log.warn("Saved uncertain count {} for value {} disagrees with the recomputed {}/{}", node.asText(),
                    ValueDomain.format(tracker.getValue()), tracker.uncertain(), tracker.getTotal());
        }
    }

    private static void readConstraints(JsonNode node, GameConfig config,
                                        Map<Integer, List<CopyCountConstraint>> copyCounts,
                                        Map<Integer, List<AdjacentConstraint>> adjacents) {
        if (node == null || node.isNull()) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> players = node.fields();
        while (players.hasNext()) {
            Map.Entry<String, JsonNode> entry = players.next();
            int player = playerInRange(entry.getKey(), config);
            JsonNode counts = entry.getValue().get("copy_count");
            if (counts != null) {
                for (JsonNode count : counts) {
                    copyCounts.computeIfAbsent(player, p -> new ArrayList<>())
                            .add(new CopyCountConstraint(count.get("position").asInt(), count.get("copies").asInt()));
                }
            }
            JsonNode pairs = entry.getValue().get("adjacent");
            if (pairs != null) {
                for (JsonNode pair : pairs) {
                    adjacents.computeIfAbsent(player, p -> new ArrayList<>())
                            .add(new AdjacentConstraint(pair.get("left").asInt(), pair.get("right").asInt(),
                                    pair.get("equal").asBoolean()));
                }
            }
        }
    }
}
