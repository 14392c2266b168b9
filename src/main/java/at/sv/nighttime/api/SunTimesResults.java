package at.sv.nighttime.api;

import lombok.Data;

@Data
final class SunTimesResults {
    String sunrise;
    String sunset;
    String civil_twilight_begin;
    String civil_twilight_end;
}
