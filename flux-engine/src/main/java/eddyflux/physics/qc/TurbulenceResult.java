package eddyflux.physics.qc;

public record TurbulenceResult(
        boolean sufficient,
        double sigmaURatio,
        double sigmaVRatio,
        double sigmaWRatio
) {}
