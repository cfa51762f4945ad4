package fr.lapetina.genrouter.infrastructure.health;

/**
 * Answer of {@link HealthTracker#acquire} for one provider.
 */
public enum Admission {
    /** Circuit closed; attempt normally */
    ADMITTED,

    /** Caller now holds the single HALF_OPEN trial slot and must report an outcome or release it */
    TRIAL,

    /** Circuit open, or the trial slot is taken */
    REJECTED;

    public boolean isAdmitted() {
        return this != REJECTED;
    }
}
