package ai.bombbuster.game;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bookkeeping of where the copies of one value are known to be.
 * <p>
 * Every copy of a value is in exactly one of four states from the observer's point of view:
 * <ul>
 *   <li><b>revealed:</b> publicly confirmed at a slot (successful call, reveal).</li>
 *   <li><b>certain:</b> deduced at a slot but not publicly confirmed (the owner's own hand,
 *       singleton candidate sets).</li>
 *   <li><b>called:</b> a player is known to hold one copy at an unknown position (failed call,
 *       announcement).</li>
 *   <li><b>uncertain:</b> nothing is known; {@code total - revealed - certain - called}.</li>
 * </ul>
 * Transitions only move copies towards more knowledge ({@code called → certain → revealed}).
 * Additions that would push {@link #uncertain()} below zero are refused and logged, so the
 * count is never negative. The tracker never touches the candidate grid.
 */
public class ValueTracker {
    private static final Logger log = LoggerFactory.getLogger(ValueTracker.class);

    private final double value;
    private final int total;
    private final Set<SlotKey> revealed = new LinkedHashSet<>();
    private final Set<SlotKey> certain = new LinkedHashSet<>();
    private final Set<Integer> called = new LinkedHashSet<>();

    public ValueTracker(double value, int total) {
        if (total <= 0) {
            throw new IllegalArgumentException("Copy count must be positive, got " + total);
        }
        this.value = value;
        this.total = total;
    }

    /**
     * Records a publicly confirmed copy at {@code (player, position)}.
     * <p>
     * A matching {@code certain} entry is upgraded and the player leaves {@code called}.
     *
     * @return {@code true} if the slot was newly recorded
     */
    public boolean addRevealed(int player, int position) {
        SlotKey slot = new SlotKey(player, position);
        if (revealed.contains(slot)) {
            log.warn("Value {} already revealed at {}", ValueDomain.format(value), slot);
            return false;
        }
        boolean wasCertain = certain.contains(slot);
        boolean wasCalled = called.contains(player);
        if (!wasCertain && !wasCalled && uncertain() <= 0) {
            log.warn("Refusing to reveal value {} at {}: all {} copies are already accounted for",
                    ValueDomain.format(value), slot, total);
            return false;
        }
        certain.remove(slot);
        called.remove(player);
        revealed.add(slot);
        return true;
    }

    /**
     * Records a deduced (not publicly confirmed) copy at {@code (player, position)}.
     * <p>
     * No-op when the slot is already revealed or certain; otherwise the player leaves {@code called}.
     *
     * @return {@code true} if the slot was newly recorded
     */
    public boolean addCertain(int player, int position) {
        SlotKey slot = new SlotKey(player, position);
        if (revealed.contains(slot) || certain.contains(slot)) {
            return false;
        }
        boolean wasCalled = called.contains(player);
        if (!wasCalled && uncertain() <= 0) {
            log.warn("Refusing to mark value {} certain at {}: all {} copies are already accounted for",
                    ValueDomain.format(value), slot, total);
            return false;
        }
        called.remove(player);
        certain.add(slot);
        return true;
    }

    /**
     * Records that {@code player} holds a copy at an unknown position.
     * <p>
     * Skipped when the player already has a {@code certain} copy (that copy explains the call)
     * or is already called.
     *
     * @return {@code true} if the player was newly recorded
     */
    public boolean addCalled(int player) {
        if (called.contains(player) || hasCertain(player)) {
            return false;
        }
        if (uncertain() <= 0) {
            log.warn("Refusing to mark player {} as holding value {}: all {} copies are already accounted for",
                    player, ValueDomain.format(value), total);
            return false;
        }
        called.add(player);
        return true;
    }

    /** Drops a player from {@code called} (used when a swap moves the called copy away). */
    public boolean removeCalled(int player) {
        return called.remove(player);
    }

    /** Drops a {@code certain} entry (used when a swap moves the copy). */
    public boolean removeCertain(SlotKey slot) {
        return certain.remove(slot);
    }

    /**
     * Puts back a {@code certain} copy that a swap moved to another hand. Unlike
     * {@link #addCertain(int, int)} this leaves {@code called} alone: the copy is the same one,
     * only its location changed.
     *
     * @return {@code true} if the slot was recorded
     */
    public boolean placeCertain(SlotKey slot) {
        if (revealed.contains(slot) || certain.contains(slot)) {
            return false;
        }
        if (uncertain() <= 0) {
            log.warn("Refusing to place value {} at {}: all {} copies are already accounted for",
                    ValueDomain.format(value), slot, total);
            return false;
        }
        certain.add(slot);
        return true;
    }

    /**
     * Rewrites every revealed and certain slot through {@code remap}. Used by swaps, where slots of
     * the two swapping players shift index.
     */
    public void remapSlots(Function<SlotKey, SlotKey> remap) {
        Set<SlotKey> newRevealed = new LinkedHashSet<>();
        for (SlotKey slot : revealed) {
            newRevealed.add(remap.apply(slot));
        }
        Set<SlotKey> newCertain = new LinkedHashSet<>();
        for (SlotKey slot : certain) {
            newCertain.add(remap.apply(slot));
        }
        revealed.clear();
        revealed.addAll(newRevealed);
        certain.clear();
        certain.addAll(newCertain);
    }

    /** Copies whose location is completely unknown. */
    public int uncertain() {
        return total - revealed.size() - certain.size() - called.size();
    }

    public boolean isFullyAccounted() {
        return uncertain() == 0;
    }

    public boolean isRevealed(int player, int position) {
        return revealed.contains(new SlotKey(player, position));
    }

    public boolean isCertain(int player, int position) {
        return certain.contains(new SlotKey(player, position));
    }

    public boolean isCalled(int player) {
        return called.contains(player);
    }

    public boolean hasCertain(int player) {
        for (SlotKey slot : certain) {
            if (slot.player() == player) {
                return true;
            }
        }
        return false;
    }

    /** Revealed plus certain copies located in {@code player}'s hand. */
    public int pinnedCount(int player) {
        int count = 0;
        for (SlotKey slot : revealed) {
            if (slot.player() == player) {
                count++;
            }
        }
        for (SlotKey slot : certain) {
            if (slot.player() == player) {
                count++;
            }
        }
        return count;
    }

    public double getValue() {
        return value;
    }

    public int getTotal() {
        return total;
    }

    public Set<SlotKey> getRevealed() {
        return Collections.unmodifiableSet(revealed);
    }

    public Set<SlotKey> getCertain() {
        return Collections.unmodifiableSet(certain);
    }

    public Set<Integer> getCalled() {
        return Collections.unmodifiableSet(called);
    }

    /** Deep copy for simulation clones. */
    public ValueTracker copy() {
        ValueTracker clone = new ValueTracker(value, total);
        clone.revealed.addAll(revealed);
        clone.certain.addAll(certain);
        clone.called.addAll(called);
        return clone;
    }

    /**
     * Restores raw state without transition rules. Used when loading persisted trackers, where the
     * saved sets are taken as-is.
     *
     * @throws IllegalStateException if the restored sets overflow the copy count
     */
    public void restore(Set<SlotKey> revealedSlots, Set<SlotKey> certainSlots, Set<Integer> calledPlayers) {
        revealed.clear();
        certain.clear();
        called.clear();
        revealed.addAll(revealedSlots);
        certain.addAll(certainSlots);
        called.addAll(calledPlayers);
        if (uncertain() < 0) {
            throw new IllegalStateException("Tracker for value " + ValueDomain.format(value) + " accounts for "
                    + (total - uncertain()) + " copies but only " + total + " exist");
        }
    }

    @Override
    public String toString() {
        return "ValueTracker{value=" + ValueDomain.format(value)
                + ", revealed=" + revealed
                + ", certain=" + certain
                + ", called=" + called
                + ", uncertain=" + uncertain() + "/" + total + '}';
    }
}
