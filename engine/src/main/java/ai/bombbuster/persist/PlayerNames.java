package ai.bombbuster.persist;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Player id ↔ display name table. Only used at the persistence boundary; the live model always
 * addresses players by id.
 */
public final class PlayerNames {
    private static final PlayerNames EMPTY = new PlayerNames(Map.of());

    private final Map<Integer, String> namesById;
    private final Map<String, Integer> idsByName;

    private PlayerNames(Map<Integer, String> names) {
        this.namesById = Collections.unmodifiableMap(new TreeMap<>(names));
        Map<String, Integer> reverse = new HashMap<>();
        names.forEach((id, name) -> {
            Objects.requireNonNull(name, "name");
            if (reverse.put(name, id) != null) {
                throw new IllegalArgumentException("Duplicate player name '" + name + "'");
            }
        });
        this.idsByName = Collections.unmodifiableMap(reverse);
    }

    public static PlayerNames of(Map<Integer, String> names) {
        return names.isEmpty() ? EMPTY : new PlayerNames(names);
    }

    public static PlayerNames empty() {
        return EMPTY;
    }

    public Optional<String> name(int player) {
        return Optional.ofNullable(namesById.get(player));
    }

    public Map<Integer, String> asMap() {
        return namesById;
    }

    public boolean isEmpty() {
        return namesById.isEmpty();
    }

    /** Table holding the entries of both; {@code other} wins on conflicting ids. */
    public PlayerNames merge(PlayerNames other) {
        if (other.isEmpty()) {
            return this;
        }
        Map<Integer, String> merged = new TreeMap<>(namesById);
        merged.putAll(other.namesById);
        return new PlayerNames(merged);
    }

    /**
     * Resolves a name or a numeric id.
     *
     * @throws IllegalArgumentException if the token is neither a known name nor a number
     */
    public int resolve(String token) {
        Integer id = idsByName.get(token);
        if (id != null) {
            return id;
        }
        try {
            return Integer.parseInt(token.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Unknown player name '" + token + "'", e);
        }
    }
}
