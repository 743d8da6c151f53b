package lazor.simulation;

import lazor.domain.Configuration;
import lazor.domain.Laser;

import java.util.ArrayList;
import java.util.List;

/**
 * Traces every laser of a board against a configuration and scores the targets.
 * Stateless apart from the tracer, so one instance may be shared across threads.
 */
public class CoverageEvaluator {

    private final RayTracer tracer;

    public CoverageEvaluator(RayTracer tracer) {
        this.tracer = tracer;
    }

    public CoverageEvaluator(CollisionModel model) {
        this(model.createTracer());
    }

    public Coverage evaluate(Configuration configuration) {
        List<Laser> lasers = configuration.getBoard().getLasers();
        List<Trajectory> trajectories = new ArrayList<>(lasers.size());
        for (Laser laser : lasers) {
            trajectories.add(tracer.trace(configuration, laser));
        }
        return new Coverage(trajectories, configuration.getBoard().getTargets());
    }
}
