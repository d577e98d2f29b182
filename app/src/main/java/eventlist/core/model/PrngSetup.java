package eventlist.core.model;

/** Seed and range of the pseudo-random generator owned by a section. */
public record PrngSetup(int range, int seed) {}
