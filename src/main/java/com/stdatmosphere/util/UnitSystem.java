package com.stdatmosphere.util;

/**
 * Shorthand for the default unit tokens of an entry point.
 */
public enum UnitSystem {
    ENGLISH("ft", "ft/s", "psf", "slug/ft^3", "R", "(lbf*s)/ft^2", "ft^2/s", "1/ft"),
    SI     ("m",  "m/s",  "Pa",  "kg/m^3",    "K", "(N*s)/m^2",    "m^2/s",  "1/m");

    private final String altitude;
    private final String velocity;
    private final String pressure;
    private final String density;
    private final String temperature;
    private final String dynamicViscosity;
    private final String kinematicViscosity;
    private final String reciprocalLength;

    UnitSystem(String altitude, String velocity, String pressure, String density, String temperature,
               String dynamicViscosity, String kinematicViscosity, String reciprocalLength) {
        this.altitude = altitude;
        this.velocity = velocity;
        this.pressure = pressure;
        this.density = density;
        this.temperature = temperature;
        this.dynamicViscosity = dynamicViscosity;
        this.kinematicViscosity = kinematicViscosity;
        this.reciprocalLength = reciprocalLength;
    }

    public String altitude()           { return altitude; }
    public String velocity()           { return velocity; }
    public String pressure()           { return pressure; }
    public String density()            { return density; }
    public String temperature()        { return temperature; }
    public String dynamicViscosity()   { return dynamicViscosity; }
    public String kinematicViscosity() { return kinematicViscosity; }
    public String reciprocalLength()   { return reciprocalLength; }

    /** Maps the boolean "SI" flag used by some entry points. */
    public static UnitSystem of(boolean si) {
        return si ? SI : ENGLISH;
    }
}
