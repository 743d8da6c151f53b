package lazor.simulation;

import lazor.domain.Laser;
import lazor.domain.Point;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Result of tracing one laser: the deduplicated lattice points lit by the laser
 * and all beams forked from it, plus counters describing how the beams ended.
 *
 * Every beam ends either absorbed by an Opaque block or cut off by cycle
 * detection, so {@code raysSpawned == absorbed + cycleTerminations}.
 */
public final class Trajectory {

    private final Laser laser;

    /** Insertion-ordered, so iteration follows discovery order */
    private final Set<Point> points;

    private final int forks;
    private final int absorbed;
    private final int cycleTerminations;

    Trajectory(Laser laser, LinkedHashSet<Point> points, int forks, int absorbed, int cycleTerminations) {
        this.laser = laser;
        this.points = Collections.unmodifiableSet(points);
        this.forks = forks;
        this.absorbed = absorbed;
        this.cycleTerminations = cycleTerminations;
    }

    public Laser getLaser() {
        return laser;
    }

    /**
     * @return lit points in discovery order (unmodifiable)
     */
    public Set<Point> getPoints() {
        return points;
    }

    /**
     * @return lit points as a list, in discovery order
     */
    public List<Point> toList() {
        return List.copyOf(points);
    }

    public boolean contains(Point p) {
        return points.contains(p);
    }

    public int size() {
        return points.size();
    }

    /**
     * @return number of Refract interactions, each of which added one beam
     */
    public int getForks() {
        return forks;
    }

    /**
     * @return number of beams traced: the laser itself plus one per fork
     */
    public int getRaysSpawned() {
        return 1 + forks;
    }

    /**
     * @return number of beams that ended on an Opaque block
     */
    public int getAbsorbed() {
        return absorbed;
    }

    /**
     * @return number of beams that ended by repeating a (position, direction) state
     */
    public int getCycleTerminations() {
        return cycleTerminations;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Trajectory other = (Trajectory) obj;
        return laser.equals(other.laser)
                && List.copyOf(points).equals(List.copyOf(other.points))
                && forks == other.forks
                && absorbed == other.absorbed
                && cycleTerminations == other.cycleTerminations;
    }

    @Override
    public int hashCode() {
        return 31 * laser.hashCode() + points.hashCode();
    }

    @Override
    public String toString() {
        return "Trajectory{" + laser + ", points=" + points.size() + ", rays=" + getRaysSpawned()
                + ", absorbed=" + absorbed + ", cycles=" + cycleTerminations + "}";
    }
}
