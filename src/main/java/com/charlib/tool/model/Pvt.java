package com.charlib.tool.model;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Process/voltage/temperature operating point of one library scope.
 */
@Value
@Builder(toBuilder = true)
public class Pvt {

    double voltage;

    int temperature;

    /**
     * Corner encoding: SS=[1], TT=[2], FF=[3], unknown=[].
     */
    @Singular("processValue")
    List<Integer> process;

    public static Pvt of(double voltage, int temperature, ProcessCorner corner) {
        return Pvt.builder()
                .voltage(voltage)
                .temperature(temperature)
                .process(corner.getEncoding())
                .build();
    }
}
