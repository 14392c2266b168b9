package at.sv.nighttime.time;

/**
 * The four sun events a timeline is built from.
 */
public enum SunEvent {
    SUNRISE("sunrise"),
    SUNSET("sunset"),
    MORNING_TWILIGHT("morning-twilight"),
    NIGHT_TWILIGHT("night-twilight");

    private final String eventName;

    SunEvent(String eventName) {
        this.eventName = eventName;
    }

    public String getEventName() {
        return eventName;
    }

    @Override
    public String toString() {
        return eventName;
    }
}
