package lazor.simulation;

import lazor.domain.Point;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Union of all lasers' trajectories under one configuration and the
 * resulting hit/miss status of every target.
 */
public final class Coverage {

    private final List<Trajectory> trajectories;
    private final Set<Point> litPoints;
    private final Map<Point, Boolean> targetHits;
    private final int hitCount;

    Coverage(List<Trajectory> trajectories, List<Point> targets) {
        this.trajectories = List.copyOf(trajectories);
        LinkedHashSet<Point> union = new LinkedHashSet<>();
        for (Trajectory t : trajectories) {
            union.addAll(t.getPoints());
        }
        this.litPoints = Collections.unmodifiableSet(union);

        Map<Point, Boolean> hits = new LinkedHashMap<>();
        int count = 0;
        for (Point target : targets) {
            boolean hit = union.contains(target);
            if (hits.put(target, hit) == null && hit) {
                count++;
            }
        }
        this.targetHits = Collections.unmodifiableMap(hits);
        this.hitCount = count;
    }

    /**
     * @return per-laser trajectories, in laser declaration order
     */
    public List<Trajectory> getTrajectories() {
        return trajectories;
    }

    /**
     * @return every lit lattice point across all lasers
     */
    public Set<Point> getLitPoints() {
        return litPoints;
    }

    /**
     * @return hit status per target, in target declaration order
     */
    public Map<Point, Boolean> getTargetHits() {
        return targetHits;
    }

    public boolean isHit(Point target) {
        return litPoints.contains(target);
    }

    public int getHitCount() {
        return hitCount;
    }

    public int getTargetCount() {
        return targetHits.size();
    }

    public boolean allHit() {
        return hitCount == targetHits.size();
    }

    @Override
    public String toString() {
        return "Coverage{hit=" + hitCount + "/" + targetHits.size() + ", lit=" + litPoints.size() + "}";
    }
}
