package eddyflux.physics.solver;

public interface SolverComponent {
    String getName();
}
