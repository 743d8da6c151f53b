package lazor.simulation;

import lazor.domain.Configuration;
import lazor.domain.Laser;

/**
 * Computes the lattice points lit by one laser in a given configuration.
 *
 * Implementations must be pure: the same configuration and laser always yield
 * an equal Trajectory, and tracing always terminates. They hold no per-call
 * state and may be shared between threads.
 */
public interface RayTracer {

    /**
     * Traces a laser and every beam forked from it.
     *
     * @param configuration fixed and placed blocks to trace against
     * @param laser the laser source
     * @return every lattice point visited, in discovery order
     */
    Trajectory trace(Configuration configuration, Laser laser);

    /**
     * @return the collision convention this tracer implements
     */
    CollisionModel getCollisionModel();
}
