package eddyflux.config;

public enum TerrainType {
    FLAT,
    ROLLING,
    COMPLEX,
    URBAN
}
