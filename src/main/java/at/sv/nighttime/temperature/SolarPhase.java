package at.sv.nighttime.temperature;

public enum SolarPhase {
    NIGHT,
    MORNING_TWILIGHT,
    MIDDAY,
    NIGHT_TWILIGHT;

    /**
     * @return true for the twilight phases, in which the temperature is interpolated
     */
    public boolean isTransitional() {
        return this == MORNING_TWILIGHT || this == NIGHT_TWILIGHT;
    }
}
