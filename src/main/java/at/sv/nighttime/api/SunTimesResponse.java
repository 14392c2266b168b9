package at.sv.nighttime.api;

import lombok.Data;

@Data
final class SunTimesResponse {
    String status;
    SunTimesResults results;

    boolean isOk() {
        return "OK".equalsIgnoreCase(status);
    }
}
